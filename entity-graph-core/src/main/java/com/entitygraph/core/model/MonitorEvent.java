package com.entitygraph.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Event emitted by the consistency monitor.
 *
 * <p>{@code data} depends on the type: an {@link IntegrityReport} for check events, a
 * {@link RepairResult} for repair-complete, a {@link DriftResult}, a {@link StateSnapshot},
 * a {@link StatusChange} or an error message.
 *
 * @param type event kind
 * @param timestamp emission time, epoch milliseconds
 * @param data payload, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MonitorEvent(
    MonitorEventType type,
    long timestamp,
    Object data
) {
    /**
     * Compact constructor with validation.
     */
    public MonitorEvent {
        Objects.requireNonNull(type, "type must not be null");
    }

    /**
     * Payload of a {@link MonitorEventType#STATUS_CHANGE} event.
     *
     * @param from previous status
     * @param to new status
     */
    public record StatusChange(MonitorStatus from, MonitorStatus to) {
    }
}

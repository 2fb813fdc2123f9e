package com.entitygraph.core.integrity;

import com.entitygraph.core.model.ViolationType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Options for {@link IntegrityChecker#repair}.
 *
 * @param errorsOnly repair only error-severity violations
 * @param dryRun decide repairs without changing anything; the original store is returned
 * @param handlers per violation type, a handler that replaces the built-in repair
 */
public record RepairOptions(
    boolean errorsOnly,
    boolean dryRun,
    Map<ViolationType, RepairHandler> handlers
) {
    private static final RepairOptions DEFAULTS = new RepairOptions(false, false, Map.of());

    /**
     * Compact constructor with defaults.
     */
    public RepairOptions {
        handlers = handlers != null ? Map.copyOf(handlers) : Map.of();
    }

    public static RepairOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for RepairOptions.
     */
    public static class Builder {
        private boolean errorsOnly;
        private boolean dryRun;
        private final Map<ViolationType, RepairHandler> handlers = new EnumMap<>(ViolationType.class);

        public Builder errorsOnly(boolean enabled) {
            this.errorsOnly = enabled;
            return this;
        }

        public Builder dryRun(boolean enabled) {
            this.dryRun = enabled;
            return this;
        }

        public Builder handler(ViolationType type, RepairHandler handler) {
            handlers.put(type, handler);
            return this;
        }

        public RepairOptions build() {
            return new RepairOptions(errorsOnly, dryRun, handlers);
        }
    }
}

package com.entitygraph.core.monitor;

import com.entitygraph.core.model.MonitorEvent;

/**
 * Receives consistency monitor events. Exceptions thrown by a listener are logged and
 * do not reach the monitor or other listeners.
 */
@FunctionalInterface
public interface MonitorEventListener {

    void onEvent(MonitorEvent event);
}

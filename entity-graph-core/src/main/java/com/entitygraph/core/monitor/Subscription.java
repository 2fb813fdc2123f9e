package com.entitygraph.core.monitor;

/**
 * Handle returned by {@link ConsistencyMonitor#subscribe}. Unsubscribing twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}

package net.vortexdevelopment.tiercache.driver.memory;

import net.vortexdevelopment.tiercache.driver.DynamicStore;

/**
 * Fast, non-durable memory tier backend. Data is lost when the backend restarts, expired entries
 * are collected by the backend itself.
 */
public interface VolatileDriver extends DynamicStore, AutoCloseable {

    /**
     * Identifier under which the driver's provider is registered.
     */
    String id();

    /**
     * Releases connections held by the driver.
     */
    @Override
    default void close() {
    }
}

package net.vortexdevelopment.tiercache.driver.memory;

import net.vortexdevelopment.tiercache.TierCacheConfig;

import java.time.Clock;

/**
 * Describes a memory driver: how to detect that the host can run it and how to create it.
 */
public interface VolatileDriverProvider {

    String id();

    /**
     * Probes the host for the capability the driver needs.
     */
    boolean isAvailable(TierCacheConfig config);

    VolatileDriver create(TierCacheConfig config, Clock clock);

    /**
     * Checks whether a class can be loaded without initializing it.
     */
    static boolean isClassPresent(String className) {
        try {
            Class.forName(className, false, VolatileDriverProvider.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }
}

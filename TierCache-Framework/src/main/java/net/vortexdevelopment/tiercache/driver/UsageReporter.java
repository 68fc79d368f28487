package net.vortexdevelopment.tiercache.driver;

/**
 * Reports how much memory a backend uses.
 */
public interface UsageReporter {

    MemoryUsage getInfo();
}

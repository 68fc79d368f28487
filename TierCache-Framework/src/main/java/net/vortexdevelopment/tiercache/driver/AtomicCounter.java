package net.vortexdevelopment.tiercache.driver;

import org.jetbrains.annotations.NotNull;

/**
 * Numeric counters kept as cache entries. A missing counter counts as zero.
 */
public interface AtomicCounter {

    long inc(@NotNull String id, @NotNull String realm, long delta);

    long dec(@NotNull String id, @NotNull String realm, long delta);
}

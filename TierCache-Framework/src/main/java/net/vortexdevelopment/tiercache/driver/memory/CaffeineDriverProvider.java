package net.vortexdevelopment.tiercache.driver.memory;

import net.vortexdevelopment.tiercache.TierCacheConfig;

import java.time.Clock;

public class CaffeineDriverProvider implements VolatileDriverProvider {

    @Override
    public String id() {
        return CaffeineMemoryDriver.ID;
    }

    @Override
    public boolean isAvailable(TierCacheConfig config) {
        return VolatileDriverProvider.isClassPresent("com.github.benmanes.caffeine.cache.Caffeine");
    }

    @Override
    public VolatileDriver create(TierCacheConfig config, Clock clock) {
        return new CaffeineMemoryDriver(config.getMemoryMaxSize(), clock);
    }
}

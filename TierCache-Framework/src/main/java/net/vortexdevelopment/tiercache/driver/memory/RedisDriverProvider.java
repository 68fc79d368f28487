package net.vortexdevelopment.tiercache.driver.memory;

import net.vortexdevelopment.tiercache.TierCacheConfig;
import net.vortexdevelopment.tiercache.debug.DebugLogger;
import net.vortexdevelopment.tiercache.exception.CacheConfigurationException;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;

import java.time.Clock;

/**
 * Offers the Redis driver when a server address is configured. The connection is opened by
 * {@link #create}, so an unreachable server surfaces there rather than during probing.
 */
public class RedisDriverProvider implements VolatileDriverProvider {

    @Override
    public String id() {
        return RedisMemoryDriver.ID;
    }

    @Override
    public boolean isAvailable(TierCacheConfig config) {
        return config.getRedisAddress() != null && !config.getRedisAddress().isBlank()
                && VolatileDriverProvider.isClassPresent("org.redisson.Redisson");
    }

    @Override
    public VolatileDriver create(TierCacheConfig config, Clock clock) {
        Config redisConfig = new Config();
        redisConfig.useSingleServer().setAddress(config.getRedisAddress());
        try {
            RedissonClient client = Redisson.create(redisConfig);
            DebugLogger.log(RedisDriverProvider.class, "Connected to Redis at %s", config.getRedisAddress());
            return new RedisMemoryDriver(client, config.isRedisCompression(), true);
        } catch (RuntimeException e) {
            throw new CacheConfigurationException("Could not connect to Redis at " + config.getRedisAddress(), e);
        }
    }
}

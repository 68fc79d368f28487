package net.vortexdevelopment.tiercache;

import lombok.Builder;
import lombok.Getter;
import net.vortexdevelopment.tiercache.config.Environment;
import net.vortexdevelopment.tiercache.debug.DebugLogger;
import net.vortexdevelopment.tiercache.driver.DynamicStore;
import net.vortexdevelopment.tiercache.driver.MemoryUsage;

import java.nio.file.Path;
import java.util.List;

/**
 * Settings of a {@link TierCache}.
 * Built directly or read from an {@link Environment}.
 */
@Getter
@Builder(toBuilder = true)
public class TierCacheConfig {

    /**
     * Root directory of the disk tier. Must exist and be writable.
     */
    @Builder.Default
    private Path cacheDir = Path.of("cache");

    /**
     * Identifier of the memory driver to use when it is available, empty for the first available.
     */
    @Builder.Default
    private String preferredDriver = "";

    /**
     * Realms loaded from the db tier at startup in addition to the system and default realms.
     */
    @Builder.Default
    private List<String> autoloadRealms = List.of();

    /**
     * Time to live of memory tier entries stored without an explicit one.
     */
    @Builder.Default
    private long defaultTtlSeconds = DynamicStore.DEFAULT_TTL;

    @Builder.Default
    private String tablePrefix = "tc_";

    /**
     * Upper bound for the in-process memory driver in bytes, {@link MemoryUsage#UNKNOWN} for none.
     */
    @Builder.Default
    private long memoryMaxSize = MemoryUsage.UNKNOWN;

    /**
     * Redis address such as {@code redis://127.0.0.1:6379}, empty to disable the Redis driver.
     */
    @Builder.Default
    private String redisAddress = "";

    /**
     * Compress Redis payloads. Counters then fall back to read-modify-write.
     */
    @Builder.Default
    private boolean redisCompression = true;

    public static TierCacheConfig defaults() {
        return TierCacheConfig.builder().build();
    }

    /**
     * Reads the {@code tiercache.*} settings.
     */
    public static TierCacheConfig fromEnvironment(Environment environment) {
        TierCacheConfig config = TierCacheConfig.builder()
                .cacheDir(Path.of(environment.getProperty("tiercache.cache-dir", "cache")))
                .preferredDriver(environment.getProperty("tiercache.memory.driver", ""))
                .memoryMaxSize(MemoryUsage.parseSize(environment.getProperty("tiercache.memory.max-size")))
                .autoloadRealms(List.copyOf(environment.getPropertyAsList("tiercache.autoload")))
                .defaultTtlSeconds(environment.getPropertyAsLong("tiercache.default-ttl", DynamicStore.DEFAULT_TTL))
                .tablePrefix(environment.getProperty("tiercache.table-prefix", "tc_"))
                .redisAddress(environment.getProperty("tiercache.redis.address", ""))
                .redisCompression(environment.getPropertyAsBoolean("tiercache.redis.compress", true))
                .build();
        DebugLogger.log(TierCacheConfig.class, "Loaded config: cacheDir=%s, driver=%s, autoload=%s",
                config.cacheDir, config.preferredDriver, config.autoloadRealms);
        return config;
    }
}

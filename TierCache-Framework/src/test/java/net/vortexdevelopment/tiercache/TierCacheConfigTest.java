package net.vortexdevelopment.tiercache;

import net.vortexdevelopment.tiercache.config.Environment;
import net.vortexdevelopment.tiercache.driver.MemoryUsage;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class TierCacheConfigTest {

    @Test
    void defaultsMatchTheDocumentedValues() {
        TierCacheConfig config = TierCacheConfig.defaults();

        assertThat(config.getCacheDir()).isEqualTo(Path.of("cache"));
        assertThat(config.getPreferredDriver()).isEmpty();
        assertThat(config.getAutoloadRealms()).isEmpty();
        assertThat(config.getDefaultTtlSeconds()).isEqualTo(3600);
        assertThat(config.getTablePrefix()).isEqualTo("tc_");
        assertThat(config.getMemoryMaxSize()).isEqualTo(MemoryUsage.UNKNOWN);
        assertThat(config.getRedisAddress()).isEmpty();
        assertThat(config.isRedisCompression()).isTrue();
    }

    @Test
    void readsSettingsFromTheEnvironment() {
        // Arrange
        Properties properties = new Properties();
        properties.setProperty("tiercache.cache-dir", "/var/cache/app");
        properties.setProperty("tiercache.memory.driver", "redis");
        properties.setProperty("tiercache.memory.max-size", "64M");
        properties.setProperty("tiercache.autoload", "users, settings");
        properties.setProperty("tiercache.default-ttl", "120");
        properties.setProperty("tiercache.table-prefix", "app_");
        properties.setProperty("tiercache.redis.address", "redis://cache:6379");
        properties.setProperty("tiercache.redis.compress", "false");

        // Act
        TierCacheConfig config = TierCacheConfig.fromEnvironment(new Environment(properties));

        // Assert
        assertThat(config.getCacheDir()).isEqualTo(Path.of("/var/cache/app"));
        assertThat(config.getPreferredDriver()).isEqualTo("redis");
        assertThat(config.getMemoryMaxSize()).isEqualTo(64L * 1024 * 1024);
        assertThat(config.getAutoloadRealms()).containsExactly("users", "settings");
        assertThat(config.getDefaultTtlSeconds()).isEqualTo(120);
        assertThat(config.getTablePrefix()).isEqualTo("app_");
        assertThat(config.getRedisAddress()).isEqualTo("redis://cache:6379");
        assertThat(config.isRedisCompression()).isFalse();
    }

    @Test
    void missingSettingsFallBackToDefaults() {
        TierCacheConfig config = TierCacheConfig.fromEnvironment(new Environment(new Properties()));

        assertThat(config.getCacheDir()).isEqualTo(Path.of("cache"));
        assertThat(config.getDefaultTtlSeconds()).isEqualTo(3600);
        assertThat(config.getAutoloadRealms()).isEmpty();
    }

    @Test
    void tierCodesRoundTrip() {
        for (CacheTier tier : CacheTier.values()) {
            assertThat(CacheTier.fromCode(tier.getCode())).isSameAs(tier);
        }
    }
}

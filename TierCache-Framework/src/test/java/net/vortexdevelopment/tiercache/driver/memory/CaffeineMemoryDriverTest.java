package net.vortexdevelopment.tiercache.driver.memory;

import net.vortexdevelopment.tiercache.driver.MemoryUsage;
import net.vortexdevelopment.tiercache.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaffeineMemoryDriverTest {

    private MutableClock clock;
    private CaffeineMemoryDriver driver;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        driver = new CaffeineMemoryDriver(MemoryUsage.UNKNOWN, clock);
    }

    @Test
    void storedValueIsReadBack() {
        driver.store("k", "value", "cot", 60);

        assertThat(driver.exists("k", "cot")).isTrue();
        assertThat(driver.get("k", "cot")).contains("value");
    }

    @Test
    void entryExpiresAfterItsTtl() {
        // Arrange
        driver.store("short", "value", "cot", 10);

        // Act
        clock.advanceSeconds(11);

        // Assert
        assertThat(driver.exists("short", "cot")).isFalse();
        assertThat(driver.get("short", "cot")).isEmpty();
    }

    @Test
    void zeroTtlNeverExpires() {
        driver.store("forever", "value", "cot", 0);

        clock.advanceSeconds(365L * 24 * 3600);

        assertThat(driver.get("forever", "cot")).contains("value");
    }

    @Test
    void incrementThenDecrement() {
        driver.inc("counter", "cot", 5);
        long value = driver.dec("counter", "cot", 2);

        assertThat(value).isEqualTo(3);
        assertThat(driver.get("counter", "cot")).contains(3L);
    }

    @Test
    void counterKeepsTheTtlOfTheStoredValue() {
        driver.store("counter", 10L, "cot", 10);

        clock.advanceSeconds(5);
        driver.inc("counter", "cot", 1);
        clock.advanceSeconds(6);

        assertThat(driver.exists("counter", "cot")).isFalse();
    }

    @Test
    void incrementOfNonNumberFails() {
        driver.store("text", "abc", "cot", 0);

        assertThatThrownBy(() -> driver.inc("text", "cot", 1))
                .isInstanceOf(IllegalStateException.class);
        assertThat(driver.get("text", "cot")).contains("abc");
    }

    @Test
    void clearRealmLeavesOtherRealmsAlone() {
        driver.store("x", 1, "A", 0);
        driver.store("x", 2, "B", 0);

        driver.clear("A");

        assertThat(driver.exists("x", "A")).isFalse();
        assertThat(driver.get("x", "B")).contains(2);
    }

    @Test
    void clearAllEmptiesEveryRealm() {
        driver.store("x", 1, "A", 0);
        driver.store("y", 2, "B", 0);

        driver.clear("");

        assertThat(driver.exists("x", "A")).isFalse();
        assertThat(driver.exists("y", "B")).isFalse();
    }

    @Test
    void removeReportsWhetherAnEntryExisted() {
        driver.store("k", "v", "cot", 0);

        assertThat(driver.remove("k", "cot")).isTrue();
        assertThat(driver.remove("k", "cot")).isFalse();
    }

    @Test
    void unboundedCacheReportsUnknownMaximum() {
        driver.store("k", "v", "cot", 0);

        MemoryUsage usage = driver.getInfo();

        assertThat(usage.getMax()).isEqualTo(MemoryUsage.UNKNOWN);
        assertThat(usage.getAvailable()).isEqualTo(MemoryUsage.UNKNOWN);
        assertThat(usage.getOccupied()).isPositive();
    }

    @Test
    void boundedCacheReportsAvailableMemory() {
        CaffeineMemoryDriver bounded = new CaffeineMemoryDriver(1024 * 1024, clock);
        bounded.store("k", "v", "cot", 0);

        MemoryUsage usage = bounded.getInfo();

        assertThat(usage.getMax()).isEqualTo(1024 * 1024);
        assertThat(usage.getOccupied()).isPositive();
        assertThat(usage.getAvailable()).isEqualTo(usage.getMax() - usage.getOccupied());
    }
}

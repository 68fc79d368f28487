package net.vortexdevelopment.tiercache.driver;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MemoryUsageTest {

    @Test
    void availableIsDerivedFromMaxAndOccupied() {
        MemoryUsage usage = MemoryUsage.of(1000, 250);

        assertThat(usage.getAvailable()).isEqualTo(750);
        assertThat(usage.getOccupied()).isEqualTo(250);
        assertThat(usage.getMax()).isEqualTo(1000);
    }

    @Test
    void unknownMaximumLeavesAvailableUnknown() {
        MemoryUsage usage = MemoryUsage.of(MemoryUsage.UNKNOWN, 250);

        assertThat(usage.getAvailable()).isEqualTo(MemoryUsage.UNKNOWN);
        assertThat(usage.getOccupied()).isEqualTo(250);
    }

    @Test
    void sizesAcceptUnitSuffixes() {
        assertThat(MemoryUsage.parseSize("512")).isEqualTo(512);
        assertThat(MemoryUsage.parseSize("64k")).isEqualTo(64L * 1024);
        assertThat(MemoryUsage.parseSize("32M")).isEqualTo(32L * 1024 * 1024);
        assertThat(MemoryUsage.parseSize("1G")).isEqualTo(1024L * 1024 * 1024);
    }

    @Test
    void blankOrMalformedSizeIsUnknown() {
        assertThat(MemoryUsage.parseSize(null)).isEqualTo(MemoryUsage.UNKNOWN);
        assertThat(MemoryUsage.parseSize(" ")).isEqualTo(MemoryUsage.UNKNOWN);
        assertThat(MemoryUsage.parseSize("lots")).isEqualTo(MemoryUsage.UNKNOWN);
    }
}

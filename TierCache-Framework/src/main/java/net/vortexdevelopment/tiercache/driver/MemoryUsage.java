package net.vortexdevelopment.tiercache.driver;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Locale;

/**
 * Memory figures reported by a backend, in bytes. Figures the backend cannot provide are -1.
 */
@Getter
@Builder
@ToString
public class MemoryUsage {

    public static final long UNKNOWN = -1;

    private final long available;
    private final long occupied;
    private final long max;

    public static MemoryUsage unknown() {
        return new MemoryUsage(UNKNOWN, UNKNOWN, UNKNOWN);
    }

    /**
     * Builds usage figures from a maximum and the occupied amount, deriving the available amount.
     * Either input may be {@link #UNKNOWN}.
     */
    public static MemoryUsage of(long max, long occupied) {
        long available = max >= 0 && occupied >= 0 ? Math.max(0, max - occupied) : UNKNOWN;
        return new MemoryUsage(available, occupied, max);
    }

    /**
     * Parses a size such as {@code 512}, {@code 64K}, {@code 32M} or {@code 1G} into bytes.
     *
     * @return the size in bytes, or {@link #UNKNOWN} for blank or malformed input
     */
    public static long parseSize(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String trimmed = value.trim().toUpperCase(Locale.ENGLISH);
        char suffix = trimmed.charAt(trimmed.length() - 1);
        long multiplier;
        switch (suffix) {
            case 'K' -> multiplier = 1024L;
            case 'M' -> multiplier = 1024L * 1024L;
            case 'G' -> multiplier = 1024L * 1024L * 1024L;
            default -> multiplier = 1L;
        }
        String digits = multiplier == 1L ? trimmed : trimmed.substring(0, trimmed.length() - 1);
        try {
            return Long.parseLong(digits.trim()) * multiplier;
        } catch (NumberFormatException e) {
            return UNKNOWN;
        }
    }
}

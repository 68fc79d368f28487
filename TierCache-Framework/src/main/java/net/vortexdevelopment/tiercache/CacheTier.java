package net.vortexdevelopment.tiercache;

/**
 * Storage tier addressed by a binding or a clear operation. The code is what the binding table
 * stores.
 */
public enum CacheTier {

    /**
     * Every tier: memory, then disk, then db when invalidating.
     */
    ALL(0),
    DISK(1),
    DB(2),
    MEMORY(3);

    private final int code;

    CacheTier(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static CacheTier fromCode(int code) {
        for (CacheTier tier : values()) {
            if (tier.code == code) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown cache tier code: " + code);
    }
}

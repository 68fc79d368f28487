package net.vortexdevelopment.tiercache;

/**
 * Well known realm names.
 */
public final class CacheRealms {

    /**
     * Realm used when the caller does not name one.
     */
    public static final String DEFAULT = "cot";

    /**
     * Realm holding the cache's own bookkeeping, always autoloaded.
     */
    public static final String SYSTEM = "system";

    /**
     * Passed to {@code clear} to address every realm of a tier.
     */
    public static final String ALL = "";

    private CacheRealms() {
    }
}

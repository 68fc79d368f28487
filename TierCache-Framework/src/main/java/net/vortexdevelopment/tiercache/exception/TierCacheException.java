package net.vortexdevelopment.tiercache.exception;

/**
 * Base class of all cache failures. Cache misses are never reported as exceptions.
 */
public class TierCacheException extends RuntimeException {

    public TierCacheException(String message) {
        super(message);
    }

    public TierCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}

package net.vortexdevelopment.tiercache.exception;

/**
 * Thrown while building a tier when its environment is unusable, for example a cache
 * directory that does not exist or cannot be written.
 */
public class CacheConfigurationException extends TierCacheException {

    public CacheConfigurationException(String message) {
        super(message);
    }

    public CacheConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

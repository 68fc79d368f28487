package net.vortexdevelopment.tiercache.exception;

/**
 * Thrown when a durable tier fails to read or write its medium.
 */
public class CacheStorageException extends TierCacheException {

    public CacheStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

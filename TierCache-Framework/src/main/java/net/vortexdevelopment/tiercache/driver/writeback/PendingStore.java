package net.vortexdevelopment.tiercache.driver.writeback;

import lombok.Getter;
import net.vortexdevelopment.tiercache.driver.EntryKey;

import java.io.Serializable;

/**
 * A store operation waiting in a write-back buffer. The expiration instant is fixed when the
 * operation is queued, so flushing late does not extend the entry's life.
 */
@Getter
public class PendingStore {

    private final EntryKey key;
    private final Serializable data;
    private final long ttlSeconds;
    /**
     * Absolute expiration in epoch seconds, 0 for never.
     */
    private final long expiresAt;

    public PendingStore(EntryKey key, Serializable data, long ttlSeconds, long queuedAtEpochSecond) {
        this.key = key;
        this.data = data;
        this.ttlSeconds = ttlSeconds;
        this.expiresAt = ttlSeconds > 0 ? queuedAtEpochSecond + ttlSeconds : 0;
    }

    public boolean isExpired(long nowEpochSecond) {
        return expiresAt > 0 && nowEpochSecond > expiresAt;
    }

    /**
     * Time to live left at the given instant, 0 meaning unlimited. An expired entry keeps one second.
     */
    public long remainingTtl(long nowEpochSecond) {
        if (expiresAt == 0) {
            return 0;
        }
        return Math.max(1, expiresAt - nowEpochSecond);
    }
}

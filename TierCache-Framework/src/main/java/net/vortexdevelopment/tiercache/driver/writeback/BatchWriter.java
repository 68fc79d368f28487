package net.vortexdevelopment.tiercache.driver.writeback;

import net.vortexdevelopment.tiercache.driver.EntryKey;

import java.util.List;

/**
 * Implemented by stores that can apply many writes in one round trip.
 */
public interface BatchWriter {

    /**
     * Deletes all given keys as one batch.
     *
     * @return number of rows removed
     */
    int removeAll(List<EntryKey> keys);

    /**
     * Inserts or updates all given entries as one batch.
     *
     * @return number of entries written
     */
    int storeAll(List<PendingStore> entries);
}

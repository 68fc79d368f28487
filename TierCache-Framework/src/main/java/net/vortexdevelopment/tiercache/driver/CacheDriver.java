package net.vortexdevelopment.tiercache.driver;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;

/**
 * Operations shared by every cache tier. Entries are addressed by an identifier inside a realm.
 */
public interface CacheDriver {

    /**
     * Removes all entries of a realm, or of every realm when {@code realm} is empty.
     *
     * @param realm realm name, empty for all realms
     * @return false if the underlying medium could not be read
     */
    boolean clear(@NotNull String realm);

    /**
     * Checks if a live entry is stored under the key.
     */
    boolean exists(@NotNull String id, @NotNull String realm);

    /**
     * Returns the stored value.
     *
     * @return the value, or an empty optional if nothing live is stored under the key
     */
    Optional<Object> get(@NotNull String id, @NotNull String realm);

    /**
     * Removes an entry. Removing an absent entry is not an error.
     *
     * @return true if an entry was removed
     */
    boolean remove(@NotNull String id, @NotNull String realm);
}

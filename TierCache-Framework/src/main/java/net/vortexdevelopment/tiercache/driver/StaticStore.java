package net.vortexdevelopment.tiercache.driver;

import org.jetbrains.annotations.NotNull;

import java.io.Serializable;

/**
 * Durable store for large, rarely modified data. Entries never expire.
 */
public interface StaticStore extends CacheDriver {

    /**
     * Stores a value, overwriting any previous one and creating the realm if needed.
     */
    boolean store(@NotNull String id, @NotNull Serializable data, @NotNull String realm);
}

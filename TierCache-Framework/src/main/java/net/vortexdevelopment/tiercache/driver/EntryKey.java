package net.vortexdevelopment.tiercache.driver;

import java.util.Objects;

/**
 * Identifier of a cache entry within its realm.
 */
public final class EntryKey {

    /**
     * Separator between realm and id in flat keys.
     */
    public static final String SEPARATOR = "/";

    private final String id;
    private final String realm;

    public EntryKey(String id, String realm) {
        this.id = Objects.requireNonNull(id, "id");
        this.realm = Objects.requireNonNull(realm, "realm");
    }

    public static EntryKey of(String id, String realm) {
        return new EntryKey(id, realm);
    }

    public String id() {
        return id;
    }

    public String realm() {
        return realm;
    }

    /**
     * Single string key for backends without namespaces.
     */
    public String flatKey() {
        return realm + SEPARATOR + id;
    }

    /**
     * Prefix shared by the flat keys of a realm.
     */
    public static String realmPrefix(String realm) {
        return realm + SEPARATOR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntryKey other)) return false;
        return id.equals(other.id) && realm.equals(other.realm);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, realm);
    }

    @Override
    public String toString() {
        return flatKey();
    }
}

package net.vortexdevelopment.tiercache.driver.disk;

import net.vortexdevelopment.tiercache.debug.DebugLogger;
import net.vortexdevelopment.tiercache.driver.StaticStore;
import net.vortexdevelopment.tiercache.driver.ValueCodec;
import net.vortexdevelopment.tiercache.exception.CacheConfigurationException;
import net.vortexdevelopment.tiercache.exception.CacheStorageException;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.Serializable;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Persistent cache on the local file system. Each realm is a subdirectory of the cache root
 * and each entry a file holding the serialized value. The tree is flat, so lookups stay cheap
 * but very large realms slow down listing based operations such as {@link #clear}.
 */
public class FileCacheDriver implements StaticStore {

    private final Path root;

    /**
     * @param root cache root directory, must exist and be writable
     * @throws CacheConfigurationException if the directory is missing or not writable
     */
    public FileCacheDriver(@NotNull Path root) {
        if (!Files.isDirectory(root) || !Files.isWritable(root)) {
            throw new CacheConfigurationException("Cache directory " + root.toAbsolutePath() + " is not writable");
        }
        this.root = root;
        DebugLogger.log("Disk cache rooted at %s", root.toAbsolutePath());
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public boolean clear(@NotNull String realm) {
        if (realm.isEmpty()) {
            boolean cleared = true;
            try (DirectoryStream<Path> realms = Files.newDirectoryStream(root, Files::isDirectory)) {
                for (Path dir : realms) {
                    if (!dir.getFileName().toString().startsWith(".")) {
                        cleared &= clearDirectory(dir);
                    }
                }
            } catch (IOException e) {
                DebugLogger.warn(FileCacheDriver.class, "Could not list cache root %s: %s", root, e.getMessage());
                return false;
            }
            return cleared;
        }
        return clearDirectory(realmDir(realm));
    }

    private boolean clearDirectory(Path dir) {
        if (!Files.exists(dir)) {
            return true;
        }
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, Files::isRegularFile)) {
            for (Path file : files) {
                Files.deleteIfExists(file);
                removed++;
            }
        } catch (IOException e) {
            DebugLogger.warn(FileCacheDriver.class, "Could not clear %s: %s", dir, e.getMessage());
            return false;
        }
        DebugLogger.log("Cleared %d entries from %s", removed, dir.getFileName());
        return true;
    }

    @Override
    public boolean exists(@NotNull String id, @NotNull String realm) {
        return Files.isRegularFile(entryFile(id, realm));
    }

    @Override
    public Optional<Object> get(@NotNull String id, @NotNull String realm) {
        Path file = entryFile(id, realm);
        try {
            return Optional.of(ValueCodec.decode(Files.readAllBytes(file)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CacheStorageException("Could not read cache file " + file, e);
        }
    }

    @Override
    public boolean remove(@NotNull String id, @NotNull String realm) {
        try {
            return Files.deleteIfExists(entryFile(id, realm));
        } catch (IOException e) {
            throw new CacheStorageException("Could not remove cache entry " + realm + "/" + id, e);
        }
    }

    @Override
    public boolean store(@NotNull String id, @NotNull Serializable data, @NotNull String realm) {
        if (id.isEmpty() || realm.isEmpty()) {
            throw new IllegalArgumentException("Disk cache entries need a non-empty id and realm");
        }
        Path dir = realmDir(realm);
        try {
            Files.createDirectories(dir);
            Files.write(dir.resolve(encode(id)), ValueCodec.encode(data));
        } catch (IOException e) {
            throw new CacheStorageException("Could not write cache entry " + realm + "/" + id, e);
        }
        DebugLogger.log("Stored %s/%s on disk", realm, id);
        return true;
    }

    private Path realmDir(String realm) {
        return root.resolve(encode(realm));
    }

    private Path entryFile(String id, String realm) {
        return realmDir(realm).resolve(encode(id));
    }

    /**
     * Maps an arbitrary id or realm to a safe file name.
     */
    static String encode(String name) {
        String encoded = URLEncoder.encode(name, StandardCharsets.UTF_8);
        // URLEncoder leaves these untouched but they are not safe as whole path segments
        if (encoded.equals(".") || encoded.equals("..")) {
            return encoded.replace(".", "%2E");
        }
        return encoded;
    }
}

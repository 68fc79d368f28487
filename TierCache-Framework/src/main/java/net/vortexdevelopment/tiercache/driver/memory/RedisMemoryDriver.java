package net.vortexdevelopment.tiercache.driver.memory;

import net.vortexdevelopment.tiercache.debug.DebugLogger;
import net.vortexdevelopment.tiercache.driver.DynamicStore;
import net.vortexdevelopment.tiercache.driver.EntryKey;
import net.vortexdevelopment.tiercache.driver.MemoryUsage;
import net.vortexdevelopment.tiercache.driver.ValueCodec;
import net.vortexdevelopment.tiercache.exception.CacheStorageException;
import org.jetbrains.annotations.NotNull;
import org.redisson.api.RBucket;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.client.codec.StringCodec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Networked memory tier on a Redis server, accessed through Redisson.
 *
 * <p>Entries live under {@code realm/id} keys. With compression enabled every payload is gzipped
 * and counters are updated by read-modify-write. Without it, integral numbers are stored as
 * decimal text so that counters use the server's atomic {@code INCRBY}; a counter created that
 * way gets the default time to live.
 */
public class RedisMemoryDriver implements VolatileDriver {

    public static final String ID = "redis";

    private static final int GZIP_MAGIC_0 = 0x1F;
    private static final int GZIP_MAGIC_1 = 0x8B;
    private static final String MEMORY_INFO_SCRIPT = "return redis.call('INFO', 'memory')";
    /**
     * INCRBY that gives a counter created by the call the TTL in ARGV[2].
     */
    private static final String INCREMENT_SCRIPT =
            "local existed = redis.call('EXISTS', KEYS[1]) "
                    + "local value = redis.call('INCRBY', KEYS[1], ARGV[1]) "
                    + "if existed == 0 then redis.call('EXPIRE', KEYS[1], ARGV[2]) end "
                    + "return value";

    private final RedissonClient redisson;
    private final boolean compressed;
    private final boolean ownsClient;

    /**
     * @param ownsClient shut the client down when the driver is closed
     */
    public RedisMemoryDriver(@NotNull RedissonClient redisson, boolean compressed, boolean ownsClient) {
        this.redisson = redisson;
        this.compressed = compressed;
        this.ownsClient = ownsClient;
    }

    @Override
    public String id() {
        return ID;
    }

    public boolean isCompressed() {
        return compressed;
    }

    @Override
    public boolean clear(@NotNull String realm) {
        if (realm.isEmpty()) {
            redisson.getKeys().flushdb();
        } else {
            long removed = redisson.getKeys().deleteByPattern(escapePattern(EntryKey.realmPrefix(realm)) + "*");
            DebugLogger.log(RedisMemoryDriver.class, "Cleared %d keys of realm %s", removed, realm);
        }
        return true;
    }

    @Override
    public boolean exists(@NotNull String id, @NotNull String realm) {
        return bucket(id, realm).isExists();
    }

    @Override
    public Optional<Object> get(@NotNull String id, @NotNull String realm) {
        byte[] raw = bucket(id, realm).get();
        return raw == null ? Optional.empty() : Optional.of(decodePayload(raw));
    }

    @Override
    public boolean remove(@NotNull String id, @NotNull String realm) {
        return bucket(id, realm).delete();
    }

    @Override
    public boolean store(@NotNull String id, @NotNull Serializable data, @NotNull String realm, long ttlSeconds) {
        RBucket<byte[]> bucket = bucket(id, realm);
        byte[] payload = encodePayload(data);
        if (ttlSeconds > 0) {
            bucket.set(payload, ttlSeconds, TimeUnit.SECONDS);
        } else {
            bucket.set(payload);
        }
        return true;
    }

    @Override
    public long inc(@NotNull String id, @NotNull String realm, long delta) {
        if (compressed) {
            return DynamicStore.addAndStore(this, id, realm, delta);
        }
        Long value = redisson.getScript(StringCodec.INSTANCE).eval(RScript.Mode.READ_WRITE, INCREMENT_SCRIPT,
                RScript.ReturnType.INTEGER, List.of(EntryKey.of(id, realm).flatKey()), delta, DEFAULT_TTL);
        return value;
    }

    /**
     * Reads {@code used_memory} and {@code maxmemory} from the server. A server without a memory
     * limit reports an unknown maximum.
     */
    @Override
    public MemoryUsage getInfo() {
        try {
            String info = redisson.getScript(StringCodec.INSTANCE)
                    .eval(RScript.Mode.READ_ONLY, MEMORY_INFO_SCRIPT, RScript.ReturnType.VALUE);
            return parseMemoryInfo(info);
        } catch (RuntimeException e) {
            DebugLogger.warn(RedisMemoryDriver.class, "Could not read Redis memory info: %s", e.getMessage());
            return MemoryUsage.unknown();
        }
    }

    @Override
    public void close() {
        if (ownsClient && !redisson.isShutdown()) {
            redisson.shutdown();
            DebugLogger.log(RedisMemoryDriver.class, "Redis client shut down");
        }
    }

    static MemoryUsage parseMemoryInfo(String info) {
        if (info == null) {
            return MemoryUsage.unknown();
        }
        long used = MemoryUsage.UNKNOWN;
        long max = MemoryUsage.UNKNOWN;
        for (String line : info.split("\r?\n")) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String name = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();
            if (name.equals("used_memory")) {
                used = parseLong(value);
            } else if (name.equals("maxmemory")) {
                max = parseLong(value);
            }
        }
        return MemoryUsage.of(max > 0 ? max : MemoryUsage.UNKNOWN, used);
    }

    private RBucket<byte[]> bucket(String id, String realm) {
        return redisson.getBucket(EntryKey.of(id, realm).flatKey(), ByteArrayCodec.INSTANCE);
    }

    private byte[] encodePayload(Serializable data) {
        if (compressed) {
            return gzip(ValueCodec.encode(data));
        }
        if (data instanceof Long || data instanceof Integer || data instanceof Short || data instanceof Byte) {
            return data.toString().getBytes(StandardCharsets.US_ASCII);
        }
        return ValueCodec.encode(data);
    }

    private static Object decodePayload(byte[] raw) {
        if (isGzipped(raw)) {
            return ValueCodec.decode(gunzip(raw));
        }
        if (ValueCodec.isSerialized(raw)) {
            return ValueCodec.decode(raw);
        }
        String text = new String(raw, StandardCharsets.US_ASCII).trim();
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new CacheStorageException("Unrecognized Redis payload", e);
        }
    }

    private static boolean isGzipped(byte[] raw) {
        return raw.length >= 2 && (raw[0] & 0xFF) == GZIP_MAGIC_0 && (raw[1] & 0xFF) == GZIP_MAGIC_1;
    }

    private static byte[] gzip(byte[] data) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream out = new GZIPOutputStream(bytes)) {
            out.write(data);
        } catch (IOException e) {
            throw new CacheStorageException("Could not compress cached value", e);
        }
        return bytes.toByteArray();
    }

    private static byte[] gunzip(byte[] data) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new CacheStorageException("Could not decompress cached value", e);
        }
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return MemoryUsage.UNKNOWN;
        }
    }

    private static String escapePattern(String prefix) {
        return prefix.replaceAll("([*?\\[\\]\\\\])", "\\\\$1");
    }
}

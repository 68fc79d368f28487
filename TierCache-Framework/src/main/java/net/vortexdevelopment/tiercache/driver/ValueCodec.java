package net.vortexdevelopment.tiercache.driver;

import net.vortexdevelopment.tiercache.exception.CacheStorageException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;

/**
 * Converts cached values to and from bytes using Java object serialization.
 */
public final class ValueCodec {

    private static final int STREAM_MAGIC_0 = 0xAC;
    private static final int STREAM_MAGIC_1 = 0xED;

    private ValueCodec() {
    }

    public static byte[] encode(Serializable value) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        } catch (IOException e) {
            throw new CacheStorageException("Could not serialize " + value.getClass().getName(), e);
        }
        return bytes.toByteArray();
    }

    public static Object decode(byte[] data) {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(data))) {
            return in.readObject();
        } catch (IOException | ClassNotFoundException e) {
            throw new CacheStorageException("Could not deserialize cached value", e);
        }
    }

    /**
     * Checks whether the bytes start with the Java serialization stream header.
     */
    public static boolean isSerialized(byte[] data) {
        return data != null && data.length >= 2
                && (data[0] & 0xFF) == STREAM_MAGIC_0
                && (data[1] & 0xFF) == STREAM_MAGIC_1;
    }
}

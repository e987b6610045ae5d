package tb.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Opaque bucket identifier with value semantics over its bytes.
 * The backing array is copied in and never handed out.
 */
public final class BucketKey {

    private final byte[] bytes;
    private final int hash;

    private BucketKey(byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    public static BucketKey of(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return new BucketKey(bytes.clone());
    }

    public static BucketKey of(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return new BucketKey(key.getBytes(StandardCharsets.UTF_8));
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BucketKey)) return false;
        return Arrays.equals(bytes, ((BucketKey) o).bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}

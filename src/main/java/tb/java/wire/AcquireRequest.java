package tb.java.wire;

import tb.core.model.BucketKey;

/**
 * Request to take {@code amount} tokens from bucket {@code key}.
 *
 * <p>{@code correlationId} and {@code amount} are u64 on the wire and are
 * carried bit-for-bit in a long. An empty key is representable here so the
 * server can answer it with an error instead of dropping the connection.
 *
 * @param correlationId Id unique among in-flight requests of a connection
 * @param key Bucket identifier, at most {@link #MAX_KEY_LENGTH} bytes
 * @param amount Tokens requested
 */
public record AcquireRequest(
    long correlationId,
    BucketKey key,
    long amount
) implements Message {

    /** Keys are length-prefixed with a u16. */
    public static final int MAX_KEY_LENGTH = 0xFFFF;

    public AcquireRequest {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (key.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException(
                "key must be at most " + MAX_KEY_LENGTH + " bytes, got: " + key.length());
        }
    }

    @Override
    public MessageType type() {
        return MessageType.ACQUIRE_REQUEST;
    }
}

package tb.java.wire;

/**
 * One-byte tag that opens every frame payload.
 */
public enum MessageType {
    ACQUIRE_REQUEST(0x01),
    ACQUIRE_RESPONSE(0x02);

    private final int tag;

    MessageType(int tag) {
        this.tag = tag;
    }

    public int tag() {
        return tag;
    }

    public static MessageType fromTag(int tag) {
        for (MessageType type : values()) {
            if (type.tag == tag) {
                return type;
            }
        }
        throw new MalformedFrameException("unknown message type tag: 0x" + Integer.toHexString(tag));
    }
}

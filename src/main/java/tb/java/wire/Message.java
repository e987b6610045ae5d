package tb.java.wire;

/**
 * A logical message carried by exactly one frame.
 */
public interface Message {

    MessageType type();

    /**
     * Client-assigned id matching a response to its request.
     */
    long correlationId();
}

package tb.java.wire;

/**
 * The byte stream no longer carries valid frames. The connection it was read
 * from is desynchronized and must be closed; nothing is resynchronized.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }
}

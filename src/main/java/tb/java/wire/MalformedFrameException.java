package tb.java.wire;

public class MalformedFrameException extends ProtocolException {

    public MalformedFrameException(String message) {
        super(message);
    }
}

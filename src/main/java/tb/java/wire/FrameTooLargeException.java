package tb.java.wire;

public class FrameTooLargeException extends ProtocolException {

    public FrameTooLargeException(long frameLength, int maxFrameLength) {
        super("frame length " + frameLength + " exceeds maximum of " + maxFrameLength);
    }
}

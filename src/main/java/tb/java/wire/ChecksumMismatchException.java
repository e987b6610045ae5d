package tb.java.wire;

public class ChecksumMismatchException extends ProtocolException {

    private final long expected;
    private final long actual;

    public ChecksumMismatchException(long expected, long actual) {
        super(String.format("checksum does not match: declared = %#010x computed = %#010x", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    /** Checksum carried in the frame header. */
    public long expected() {
        return expected;
    }

    /** Checksum computed over the received payload. */
    public long actual() {
        return actual;
    }
}

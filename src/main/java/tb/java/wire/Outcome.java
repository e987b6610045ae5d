package tb.java.wire;

/**
 * Outcome tag of an AcquireResponse.
 */
public enum Outcome {
    GRANTED(0),
    DENIED(1),
    ERROR(2);

    private final int code;

    Outcome(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Outcome fromCode(int code) {
        return switch (code) {
            case 0 -> GRANTED;
            case 1 -> DENIED;
            case 2 -> ERROR;
            default -> throw new MalformedFrameException("unknown outcome tag: " + code);
        };
    }
}

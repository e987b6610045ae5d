package tb.core.error;

/**
 * Logical failure kinds. The numeric code is the u8 carried by an ERROR
 * response on the wire; {@link #UNAVAILABLE} never leaves the client.
 */
public enum ErrorKind {
    INVALID_AMOUNT(1),
    UNKNOWN_KEY(2),
    INVALID_KEY(3),
    INTERNAL(4),
    UNAVAILABLE(5);

    private final int code;

    ErrorKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @return the kind for a wire code, or null if the code is unknown
     */
    public static ErrorKind fromCode(int code) {
        for (ErrorKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        return null;
    }
}

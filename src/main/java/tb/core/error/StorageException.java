package tb.core.error;

/**
 * Failure of a storage call. Denials are not exceptions; this type covers
 * requests that are invalid or could not be answered at all.
 */
public class StorageException extends Exception {

    private final ErrorKind kind;

    public StorageException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StorageException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Rebuilds the exception matching a kind reported by a remote peer.
     */
    public static StorageException of(ErrorKind kind, String message) {
        return switch (kind) {
            case INVALID_AMOUNT -> new InvalidAmountException(message);
            case UNKNOWN_KEY -> new UnknownKeyException(message);
            case INVALID_KEY -> new InvalidKeyException(message);
            case UNAVAILABLE -> new StorageUnavailableException(message, null);
            case INTERNAL -> new StorageException(kind, message);
        };
    }
}

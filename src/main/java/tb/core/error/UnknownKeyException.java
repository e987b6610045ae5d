package tb.core.error;

public class UnknownKeyException extends StorageException {

    public UnknownKeyException(String message) {
        super(ErrorKind.UNKNOWN_KEY, message);
    }
}

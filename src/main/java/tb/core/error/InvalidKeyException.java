package tb.core.error;

public class InvalidKeyException extends StorageException {

    public InvalidKeyException(String message) {
        super(ErrorKind.INVALID_KEY, message);
    }
}

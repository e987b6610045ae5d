package tb.core.error;

/**
 * The backend could not be reached after all retry attempts.
 * The cause is the failure of the last attempt.
 */
public class StorageUnavailableException extends StorageException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorKind.UNAVAILABLE, message, cause);
    }
}

package tb.core.error;

/**
 * Amount is zero, negative, or larger than the bucket capacity.
 * Such a request can never be granted, so it is never retried.
 */
public class InvalidAmountException extends StorageException {

    public InvalidAmountException(String message) {
        super(ErrorKind.INVALID_AMOUNT, message);
    }

    public static InvalidAmountException of(long amount, long capacity) {
        return new InvalidAmountException(
            "amount must be in [1, " + capacity + "], got: " + Long.toUnsignedString(amount));
    }
}

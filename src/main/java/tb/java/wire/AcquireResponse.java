package tb.java.wire;

import tb.core.error.ErrorKind;

/**
 * Answer to an AcquireRequest.
 *
 * @param correlationId Echo of the request's id
 * @param outcome GRANTED, DENIED or ERROR
 * @param retryAfterMillis Wait hint, meaningful only for DENIED (u64 on the wire)
 * @param errorKind Failure kind, non-null only for ERROR
 */
public record AcquireResponse(
    long correlationId,
    Outcome outcome,
    long retryAfterMillis,
    ErrorKind errorKind
) implements Message {

    public AcquireResponse {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if ((outcome == Outcome.ERROR) != (errorKind != null)) {
            throw new IllegalArgumentException("errorKind must be set exactly for ERROR outcomes");
        }
        if (outcome != Outcome.DENIED && retryAfterMillis != 0) {
            throw new IllegalArgumentException("retryAfterMillis only applies to DENIED outcomes");
        }
    }

    public static AcquireResponse granted(long correlationId) {
        return new AcquireResponse(correlationId, Outcome.GRANTED, 0L, null);
    }

    public static AcquireResponse denied(long correlationId, long retryAfterMillis) {
        return new AcquireResponse(correlationId, Outcome.DENIED, retryAfterMillis, null);
    }

    public static AcquireResponse error(long correlationId, ErrorKind errorKind) {
        if (errorKind == null) {
            throw new IllegalArgumentException("errorKind cannot be null");
        }
        return new AcquireResponse(correlationId, Outcome.ERROR, 0L, errorKind);
    }

    @Override
    public MessageType type() {
        return MessageType.ACQUIRE_RESPONSE;
    }
}

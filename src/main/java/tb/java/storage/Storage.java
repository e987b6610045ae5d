package tb.java.storage;

import tb.core.error.StorageException;
import tb.core.model.AcquireResult;
import tb.core.model.BucketKey;

/**
 * Where bucket state lives.
 *
 * <p>Contract:
 * <ul>
 *   <li>Calls on distinct keys never interfere.</li>
 *   <li>Concurrent calls on the same key are linearizable: granted amounts
 *       never exceed what one continuously refilling bucket would allow.</li>
 *   <li>A denial is returned, not thrown.</li>
 * </ul>
 */
public interface Storage {

    /**
     * Attempts to take {@code amount} tokens from the bucket named {@code key}.
     *
     * @param key Bucket identifier (non-empty)
     * @param amount Tokens requested (1..capacity)
     * @param nowNanos Caller's clock reading; backends with their own
     *                 authoritative clock may ignore it
     * @return GRANTED, or DENIED with a retry-after hint
     * @throws StorageException if the request is invalid or the backend cannot answer
     */
    AcquireResult tryAcquire(BucketKey key, long amount, long nowNanos) throws StorageException;
}

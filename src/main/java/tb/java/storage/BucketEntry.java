package tb.java.storage;

import tb.core.bucket.Bucket;

import java.util.concurrent.locks.ReentrantLock;

/**
 * A bucket bundled with the lock that guards it.
 * The lock must be held for any access to the bucket.
 */
final class BucketEntry {

    private final Bucket bucket;
    private final ReentrantLock lock;

    BucketEntry(Bucket bucket) {
        if (bucket == null) {
            throw new IllegalArgumentException("bucket cannot be null");
        }
        this.bucket = bucket;
        this.lock = new ReentrantLock(); // Non-fair for better throughput
    }

    /**
     * MUST be called while holding the lock.
     */
    Bucket bucket() {
        return bucket;
    }

    ReentrantLock lock() {
        return lock;
    }
}

package tb.java.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tb.core.bucket.Bucket;
import tb.core.bucket.BucketConfig;
import tb.core.error.InvalidAmountException;
import tb.core.error.InvalidKeyException;
import tb.core.error.UnknownKeyException;
import tb.core.model.AcquireResult;
import tb.core.model.BucketKey;

import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local storage: one exclusively owned bucket per key.
 *
 * <p>Each key maps to a {@link BucketEntry} whose lock is taken for exactly
 * one refill+acquire computation, so contention only happens within a key.
 * There is no global lock and no eviction: keys live as long as the storage.
 *
 * <p>Unknown keys: with a default config, a full bucket is created on first
 * contact; without one ({@link #withoutAutoProvisioning()}), only keys added
 * through {@link #register} are served and others fail with
 * {@link UnknownKeyException}.
 */
public final class InMemoryStorage implements Storage {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStorage.class);

    private final BucketConfig defaultConfig;
    private final ConcurrentHashMap<BucketKey, BucketEntry> buckets = new ConcurrentHashMap<>();

    /**
     * Creates a storage that auto-provisions unknown keys with {@code defaultConfig}.
     *
     * @throws IllegalArgumentException if defaultConfig is null
     */
    public InMemoryStorage(BucketConfig defaultConfig) {
        if (defaultConfig == null) {
            throw new IllegalArgumentException("defaultConfig cannot be null");
        }
        this.defaultConfig = defaultConfig;
    }

    private InMemoryStorage() {
        this.defaultConfig = null;
    }

    /**
     * Creates a storage that only serves registered keys.
     */
    public static InMemoryStorage withoutAutoProvisioning() {
        return new InMemoryStorage();
    }

    /**
     * Registers a full bucket for {@code key}.
     *
     * @return false if the key already had a bucket (the existing one is kept)
     */
    public boolean register(BucketKey key, BucketConfig config, long nowNanos) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return buckets.putIfAbsent(key, new BucketEntry(new Bucket(config, nowNanos))) == null;
    }

    @Override
    public AcquireResult tryAcquire(BucketKey key, long amount, long nowNanos)
        throws InvalidKeyException, InvalidAmountException, UnknownKeyException {
        if (key == null || key.isEmpty()) {
            throw new InvalidKeyException("key must not be empty");
        }
        if (amount <= 0) {
            // Negative values are u64 amounts above Long.MAX_VALUE
            throw new InvalidAmountException("amount must be > 0, got: " + Long.toUnsignedString(amount));
        }

        BucketEntry entry = resolve(key, nowNanos);

        ReentrantLock lock = entry.lock();
        lock.lock();
        try {
            return entry.bucket().tryAcquire(nowNanos, amount);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tokens available for {@code key} at {@code nowNanos}, without consuming any.
     *
     * @return empty if the key has no bucket yet
     * @throws IllegalArgumentException if key is null
     */
    public OptionalDouble availableTokens(BucketKey key, long nowNanos) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        BucketEntry entry = buckets.get(key);
        if (entry == null) {
            return OptionalDouble.empty();
        }
        ReentrantLock lock = entry.lock();
        lock.lock();
        try {
            return OptionalDouble.of(entry.bucket().availableTokens(nowNanos));
        } finally {
            lock.unlock();
        }
    }

    public boolean autoProvisions() {
        return defaultConfig != null;
    }

    /**
     * @return Number of keys with a bucket
     */
    public int size() {
        return buckets.size();
    }

    private BucketEntry resolve(BucketKey key, long nowNanos) throws UnknownKeyException {
        // Fast path: bucket already exists
        BucketEntry entry = buckets.get(key);
        if (entry != null) {
            return entry;
        }
        if (defaultConfig == null) {
            throw new UnknownKeyException("no bucket for key: " + key);
        }
        // computeIfAbsent guarantees one entry (and one lock) per key
        return buckets.computeIfAbsent(key, k -> {
            log.debug("Provisioning bucket for key '{}' with {}", k, defaultConfig);
            return new BucketEntry(new Bucket(defaultConfig, nowNanos));
        });
    }
}

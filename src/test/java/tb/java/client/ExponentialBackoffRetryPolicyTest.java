package tb.java.client;

import org.junit.jupiter.api.Test;

import io.netty.handler.codec.EncoderException;
import tb.java.wire.FrameTooLargeException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

    @Test
    void retriesUntilMaxAttempts() {
        ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(3, 50, 1000);

        assertTrue(policy.shouldRetry(1, new IOException()));
        assertTrue(policy.shouldRetry(2, new IOException()));
        assertFalse(policy.shouldRetry(3, new IOException()));
        assertEquals(3, policy.maxAttempts());
    }

    @Test
    void singleAttemptNeverRetries() {
        assertFalse(new ExponentialBackoffRetryPolicy(1, 50, 1000).shouldRetry(1, new IOException()));
    }

    @Test
    void backoffDoublesUpToCap() {
        ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(10, 50, 300);

        assertEquals(50, policy.backoffMillis(1));
        assertEquals(100, policy.backoffMillis(2));
        assertEquals(200, policy.backoffMillis(3));
        assertEquals(300, policy.backoffMillis(4));
        assertEquals(300, policy.backoffMillis(60));
    }

    @Test
    void largeBaseSaturatesInsteadOfOverflowing() {
        ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(30, Long.MAX_VALUE / 4, Long.MAX_VALUE);

        assertEquals(Long.MAX_VALUE / 4, policy.backoffMillis(1));
        assertEquals(Long.MAX_VALUE / 4 * 2, policy.backoffMillis(2));
        assertEquals(Long.MAX_VALUE / 4 * 4, policy.backoffMillis(3));
        assertEquals(Long.MAX_VALUE, policy.backoffMillis(4));
        assertEquals(Long.MAX_VALUE, policy.backoffMillis(25));
    }

    @Test
    void backoffNeverNegative() {
        ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(30, 1L << 50, 1L << 55);

        for (int attempt = 1; attempt <= 30; attempt++) {
            long backoff = policy.backoffMillis(attempt);
            assertTrue(backoff >= 1L << 50 && backoff <= 1L << 55, "attempt " + attempt + ": " + backoff);
        }
    }

    @Test
    void localProtocolErrorsAreNotRetried() {
        ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(3, 50, 1000);

        assertFalse(policy.shouldRetry(1, new FrameTooLargeException(200, 64)));
        assertFalse(policy.shouldRetry(1, new EncoderException(new FrameTooLargeException(200, 64))));
        assertTrue(policy.shouldRetry(1, new TimeoutException()));
        assertTrue(policy.shouldRetry(1, null));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 50, 1000));
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(3, -1, 1000));
    }
}

package tb.java.client;

import tb.java.wire.FrameCodec;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * Settings for a {@link RemoteStorage}.
 *
 * @param target Server address
 * @param connectTimeout Limit for establishing one connection
 * @param requestTimeout Limit for one attempt, from send to matching response;
 *                       applies per attempt, not across retries
 * @param maxFrameLength Largest accepted frame, header included
 * @param retryPolicy Attempt count and backoff schedule
 */
public record ClientConfig(
    InetSocketAddress target,
    Duration connectTimeout,
    Duration requestTimeout,
    int maxFrameLength,
    RetryPolicy retryPolicy
) {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofMillis(500);

    public ClientConfig {
        if (target == null) throw new IllegalArgumentException("target cannot be null");
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(requestTimeout, "requestTimeout");
        if (connectTimeout.toMillis() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("connectTimeout too large: " + connectTimeout);
        }
        if (maxFrameLength <= FrameCodec.HEADER_LENGTH) {
            throw new IllegalArgumentException(
                "maxFrameLength must be > " + FrameCodec.HEADER_LENGTH + ", got: " + maxFrameLength);
        }
        if (retryPolicy == null) throw new IllegalArgumentException("retryPolicy cannot be null");
    }

    /**
     * Default timeouts and frame limit; three attempts with 50ms..1s backoff.
     */
    public static ClientConfig defaults(InetSocketAddress target) {
        return new ClientConfig(
            target,
            DEFAULT_CONNECT_TIMEOUT,
            DEFAULT_REQUEST_TIMEOUT,
            FrameCodec.DEFAULT_MAX_FRAME_LENGTH,
            new ExponentialBackoffRetryPolicy(3, 50, 1000)
        );
    }

    public ClientConfig withConnectTimeout(Duration connectTimeout) {
        return new ClientConfig(target, connectTimeout, requestTimeout, maxFrameLength, retryPolicy);
    }

    public ClientConfig withRequestTimeout(Duration requestTimeout) {
        return new ClientConfig(target, connectTimeout, requestTimeout, maxFrameLength, retryPolicy);
    }

    public ClientConfig withMaxFrameLength(int maxFrameLength) {
        return new ClientConfig(target, connectTimeout, requestTimeout, maxFrameLength, retryPolicy);
    }

    public ClientConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new ClientConfig(target, connectTimeout, requestTimeout, maxFrameLength, retryPolicy);
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }
}

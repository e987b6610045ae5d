package tb.java.client;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tb.core.error.InvalidAmountException;
import tb.core.error.InvalidKeyException;
import tb.core.error.StorageException;
import tb.core.error.StorageUnavailableException;
import tb.core.model.AcquireResult;
import tb.core.model.BucketKey;
import tb.java.storage.Storage;
import tb.java.wire.AcquireRequest;
import tb.java.wire.AcquireResponse;
import tb.java.wire.FrameCodec;
import tb.java.wire.FrameDecoder;
import tb.java.wire.FrameEncoder;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link Storage} backed by a remote {@code BucketServer}.
 *
 * <p>Requests share one lazily opened connection and are matched to
 * responses by correlation id, so many may be in flight at once and answers
 * may come back in any order.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>A connection error fails every request pending on that connection.
 *       Each one waits per the {@link RetryPolicy}, reconnects and resends
 *       under a new correlation id, spending one of its own attempts. Once
 *       attempts run out the call fails with
 *       {@link StorageUnavailableException}.</li>
 *   <li>A per-attempt timeout fails only the request that timed out, which is
 *       retried the same way. Its connection is retired: new attempts open a
 *       fresh one, and the old one closes once the requests still pending on
 *       it are answered or time out themselves.</li>
 *   <li>An ERROR response is a logical rejection and is surfaced as the
 *       matching {@link StorageException} without retrying.</li>
 * </ul>
 *
 * <p>A timed-out or cancelled request may still have been applied by the
 * server. Such a debit is not refunded, and the resend after a timeout or a
 * connection failure can debit the bucket a second time; the server's state
 * is the truth.
 *
 * <p>Thread-safety: safe for concurrent use.
 */
public final class RemoteStorage implements Storage, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RemoteStorage.class);

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final ClientConfig config;
    private final FrameCodec codec;
    private final FrameEncoder encoder;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicLong correlationIds = new AtomicLong();

    private final Object connectionLock = new Object();
    private CompletableFuture<Connection> connection; // guarded by connectionLock
    private volatile boolean closed;

    public RemoteStorage(ClientConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.codec = new FrameCodec(config.maxFrameLength());
        this.encoder = new FrameEncoder(codec);
        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap()
            .group(group)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.SO_KEEPALIVE, true)
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.connectTimeout().toMillis());
    }

    /**
     * Blocking form of {@link #tryAcquireAsync}. {@code nowNanos} is ignored:
     * the server stamps requests with its own clock.
     *
     * @throws StorageUnavailableException if the server could not be reached,
     *         or the calling thread was interrupted while waiting
     */
    @Override
    public AcquireResult tryAcquire(BucketKey key, long amount, long nowNanos) throws StorageException {
        CompletableFuture<AcquireResult> result = tryAcquireAsync(key, amount);
        try {
            return result.get();
        } catch (InterruptedException e) {
            result.cancel(false);
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("interrupted while waiting for " + config.target(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StorageException) {
                throw (StorageException) cause;
            }
            throw new StorageUnavailableException("request to " + config.target() + " failed", cause);
        }
    }

    /**
     * Sends an acquire and returns without waiting.
     *
     * <p>Cancelling the returned future stops waiting and retrying; it does
     * not undo a debit the server may already have applied.
     *
     * @return future completing with the result, or exceptionally with a
     *         {@link StorageException}
     */
    public CompletableFuture<AcquireResult> tryAcquireAsync(BucketKey key, long amount) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (key.isEmpty() || key.length() > AcquireRequest.MAX_KEY_LENGTH) {
            return CompletableFuture.failedFuture(new InvalidKeyException(
                "key must be 1.." + AcquireRequest.MAX_KEY_LENGTH + " bytes, got: " + key.length()));
        }
        if (amount <= 0) {
            return CompletableFuture.failedFuture(new InvalidAmountException(
                "amount must be > 0, got: " + Long.toUnsignedString(amount)));
        }
        if (closed) {
            return CompletableFuture.failedFuture(new StorageUnavailableException("client is closed", null));
        }

        CompletableFuture<AcquireResult> result = new CompletableFuture<>();
        attempt(key, amount, 1, result);
        return result;
    }

    /**
     * @return Requests currently awaiting a response on the open connection
     */
    public int inFlight() {
        synchronized (connectionLock) {
            Connection current = established(connection);
            return current != null ? current.inFlight() : 0;
        }
    }

    @Override
    public void close() {
        closed = true;
        synchronized (connectionLock) {
            if (connection != null) {
                connection.thenAccept(Connection::close);
                connection = null;
            }
        }
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    private void attempt(BucketKey key, long amount, int attempt, CompletableFuture<AcquireResult> result) {
        if (result.isDone()) {
            return;
        }
        connection().whenComplete((conn, connectError) -> {
            if (connectError != null) {
                retryOrFail(key, amount, attempt, result, unwrap(connectError));
                return;
            }

            long id = correlationIds.incrementAndGet();
            CompletableFuture<AcquireResponse> response = conn.send(new AcquireRequest(id, key, amount));
            ScheduledFuture<?> timeout = conn.eventLoop().schedule(
                () -> response.completeExceptionally(new TimeoutException(
                    "no response from " + config.target() + " within " + config.requestTimeout().toMillis() + "ms")),
                config.requestTimeout().toNanos(), TimeUnit.NANOSECONDS);

            result.whenComplete((r, e) -> {
                if (e instanceof CancellationException) {
                    conn.abandon(id);
                    response.cancel(false);
                }
            });

            response.whenComplete((resp, error) -> {
                timeout.cancel(false);
                if (error == null) {
                    deliver(resp, result);
                    return;
                }
                conn.abandon(id);
                if (result.isDone()) {
                    return;
                }
                Throwable cause = unwrap(error);
                if (cause instanceof TimeoutException) {
                    // Later attempts go to a fresh connection; requests still pending here keep waiting
                    retire(conn);
                }
                retryOrFail(key, amount, attempt, result, cause);
            });
        });
    }

    private void deliver(AcquireResponse response, CompletableFuture<AcquireResult> result) {
        switch (response.outcome()) {
            case GRANTED -> result.complete(AcquireResult.granted());
            case DENIED -> result.complete(AcquireResult.denied(toNanos(response.retryAfterMillis())));
            case ERROR -> result.completeExceptionally(StorageException.of(
                response.errorKind(), "server rejected request: " + response.errorKind()));
        }
    }

    private void retryOrFail(BucketKey key, long amount, int attempt,
                             CompletableFuture<AcquireResult> result, Throwable cause) {
        if (result.isDone()) {
            return;
        }
        if (closed || !config.retryPolicy().shouldRetry(attempt, cause)) {
            log.debug("Giving up on key '{}' after {} attempt(s): {}", key, attempt, cause.toString());
            result.completeExceptionally(new StorageUnavailableException(
                "storage at " + config.target() + " unavailable after " + attempt + " attempt(s)", cause));
            return;
        }

        long backoff = config.retryPolicy().backoffMillis(attempt);
        log.debug("Attempt {} for key '{}' failed ({}), retrying in {}ms", attempt, key, cause.toString(), backoff);
        try {
            group.schedule(() -> attempt(key, amount, attempt + 1, result), backoff, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new StorageUnavailableException("client is closed", cause));
        }
    }

    private CompletableFuture<Connection> connection() {
        synchronized (connectionLock) {
            if (connection == null || isBroken(connection)) {
                connection = connect();
            }
            return connection;
        }
    }

    private static boolean isBroken(CompletableFuture<Connection> connection) {
        if (!connection.isDone()) {
            return false;
        }
        Connection established = established(connection);
        return established == null || !established.isActive() || established.isRetired();
    }

    /**
     * @return the connection if the future completed normally, else null
     */
    private static Connection established(CompletableFuture<Connection> connection) {
        if (connection == null || !connection.isDone() || connection.isCompletedExceptionally()) {
            return null;
        }
        return connection.join();
    }

    private CompletableFuture<Connection> connect() {
        PendingRequests pending = new PendingRequests();
        CompletableFuture<Connection> future = new CompletableFuture<>();
        try {
            bootstrap.clone()
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                            .addLast("frame-decoder", new FrameDecoder(codec))
                            .addLast("frame-encoder", encoder)
                            .addLast("responses", new ResponseHandler(pending));
                    }
                })
                .connect(config.target())
                .addListener((ChannelFuture connect) -> {
                    if (connect.isSuccess()) {
                        log.debug("Connected to {}", config.target());
                        future.complete(new Connection(connect.channel(), pending));
                    } else {
                        future.completeExceptionally(connect.cause());
                    }
                });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    private void retire(Connection conn) {
        synchronized (connectionLock) {
            if (established(connection) == conn) {
                connection = null;
            }
        }
        conn.retire();
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
    }

    private static long toNanos(long millis) {
        if (millis < 0 || millis > Long.MAX_VALUE / NANOS_PER_MILLI) {
            return Long.MAX_VALUE;
        }
        return millis * NANOS_PER_MILLI;
    }
}

package tb.java.client;

import io.netty.channel.Channel;
import io.netty.channel.EventLoop;
import tb.java.wire.AcquireRequest;
import tb.java.wire.AcquireResponse;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * One TCP connection to the server and the requests in flight on it.
 * Requests are pipelined: any number may be outstanding at once.
 *
 * <p>A retired connection takes no new work from its owner but stays open
 * until its last pending request is answered or abandoned.
 */
final class Connection {

    private final Channel channel;
    private final PendingRequests pending;
    private volatile boolean retired;

    Connection(Channel channel, PendingRequests pending) {
        this.channel = channel;
        this.pending = pending;
    }

    /**
     * Writes {@code request}; the future completes with the response bearing
     * the same correlation id, or exceptionally if the connection fails first.
     */
    CompletableFuture<AcquireResponse> send(AcquireRequest request) {
        long id = request.correlationId();
        CompletableFuture<AcquireResponse> future = pending.register(id);
        future.whenComplete((response, error) -> closeIfRetiredAndIdle());
        // Checked after registering so a concurrent close cannot miss this entry
        if (!channel.isActive()) {
            pending.remove(id);
            future.completeExceptionally(new IOException("connection to " + channel.remoteAddress() + " is closed"));
            return future;
        }
        channel.writeAndFlush(request).addListener(write -> {
            if (!write.isSuccess()) {
                pending.remove(id);
                future.completeExceptionally(write.cause());
            }
        });
        return future;
    }

    /**
     * Forgets a request whose caller stopped waiting. If the server already
     * applied it, the debit stands.
     */
    void abandon(long correlationId) {
        pending.remove(correlationId);
        closeIfRetiredAndIdle();
    }

    /**
     * Closes the connection once nothing is pending on it. Requests already
     * sent keep waiting for their own answers.
     */
    void retire() {
        retired = true;
        closeIfRetiredAndIdle();
    }

    boolean isRetired() {
        return retired;
    }

    private void closeIfRetiredAndIdle() {
        if (retired && pending.size() == 0) {
            channel.close();
        }
    }

    boolean isActive() {
        return channel.isActive();
    }

    EventLoop eventLoop() {
        return channel.eventLoop();
    }

    int inFlight() {
        return pending.size();
    }

    void close() {
        channel.close();
    }
}

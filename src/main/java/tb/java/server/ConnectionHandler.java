package tb.java.server;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tb.core.clock.Clock;
import tb.core.error.ErrorKind;
import tb.core.error.StorageException;
import tb.core.model.AcquireResult;
import tb.java.storage.Storage;
import tb.java.wire.AcquireRequest;
import tb.java.wire.AcquireResponse;
import tb.java.wire.Message;
import tb.java.wire.MessageType;
import tb.java.wire.ProtocolException;

import java.io.IOException;

/**
 * Per-connection request loop. One instance per channel; all callbacks run on
 * the channel's event loop, so {@link #state} needs no synchronization.
 *
 * <p>The storage call is the only point of mutation and holds just the
 * bucket's own lock; nothing here blocks on I/O while holding it. A failure
 * on this connection closes this connection only.
 */
final class ConnectionHandler extends SimpleChannelInboundHandler<Message> {

    private static final Logger log = LoggerFactory.getLogger(ConnectionHandler.class);

    private final Storage storage;
    private final Clock clock;

    private ConnectionState state = ConnectionState.IDLE;

    ConnectionHandler(Storage storage, Clock clock) {
        this.storage = storage;
        this.clock = clock;
    }

    ConnectionState state() {
        return state;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        state = ConnectionState.AWAITING_FRAME;
        log.debug("Connection from {} opened", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Message message) {
        if (state == ConnectionState.CLOSED) {
            return;
        }
        state = ConnectionState.PROCESSING;

        if (message.type() != MessageType.ACQUIRE_REQUEST) {
            log.warn("Unexpected {} from {}, closing connection", message.type(), ctx.channel().remoteAddress());
            close(ctx);
            return;
        }

        AcquireResponse response = process((AcquireRequest) message);

        state = ConnectionState.RESPONDING;
        ctx.writeAndFlush(response).addListener(future -> {
            if (!future.isSuccess()) {
                log.warn("Write to {} failed, closing connection", ctx.channel().remoteAddress(), future.cause());
                close(ctx);
            }
        });

        if (ctx.channel().isWritable()) {
            state = ConnectionState.AWAITING_FRAME;
        } else {
            // Peer is not draining responses: stop reading requests until it does
            ctx.channel().config().setAutoRead(false);
        }
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (ctx.channel().isWritable() && state == ConnectionState.RESPONDING) {
            state = ConnectionState.AWAITING_FRAME;
            ctx.channel().config().setAutoRead(true);
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        state = ConnectionState.CLOSED;
        log.debug("Connection from {} closed", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Throwable root = cause instanceof DecoderException && cause.getCause() != null
            ? cause.getCause()
            : cause;
        if (root instanceof ProtocolException) {
            log.warn("Protocol error from {}, closing connection: {}",
                ctx.channel().remoteAddress(), root.getMessage());
        } else if (root instanceof IOException) {
            log.debug("Connection from {} failed: {}", ctx.channel().remoteAddress(), root.getMessage());
        } else {
            log.warn("Connection from {} failed, closing it", ctx.channel().remoteAddress(), root);
        }
        close(ctx);
    }

    private AcquireResponse process(AcquireRequest request) {
        long id = request.correlationId();
        try {
            AcquireResult result = storage.tryAcquire(request.key(), request.amount(), clock.nowNanos());
            if (result.isGranted()) {
                return AcquireResponse.granted(id);
            }
            return AcquireResponse.denied(id, toMillisRoundingUp(result.retryAfterNanos()));
        } catch (StorageException e) {
            log.debug("Request {} for key '{}' rejected: {}", id, request.key(), e.getMessage());
            // UNAVAILABLE is client-local and never goes on the wire
            ErrorKind kind = e.kind() == ErrorKind.UNAVAILABLE ? ErrorKind.INTERNAL : e.kind();
            return AcquireResponse.error(id, kind);
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing request {} for key '{}'", id, request.key(), e);
            return AcquireResponse.error(id, ErrorKind.INTERNAL);
        }
    }

    private void close(ChannelHandlerContext ctx) {
        state = ConnectionState.CLOSED;
        ctx.close();
    }

    static long toMillisRoundingUp(long nanos) {
        long millis = nanos / 1_000_000L;
        return nanos % 1_000_000L == 0 ? millis : millis + 1;
    }
}

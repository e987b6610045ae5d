package tb.java.client;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tb.java.wire.AcquireResponse;
import tb.java.wire.Message;
import tb.java.wire.MessageType;

import java.io.IOException;

/**
 * Routes decoded responses to their pending requests. When the connection
 * goes away, every request still waiting on it fails.
 */
final class ResponseHandler extends SimpleChannelInboundHandler<Message> {

    private static final Logger log = LoggerFactory.getLogger(ResponseHandler.class);

    private final PendingRequests pending;

    ResponseHandler(PendingRequests pending) {
        this.pending = pending;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Message message) {
        if (message.type() != MessageType.ACQUIRE_RESPONSE) {
            log.warn("Unexpected {} from {}, closing connection", message.type(), ctx.channel().remoteAddress());
            ctx.close();
            return;
        }
        pending.complete((AcquireResponse) message);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.debug("Connection to {} closed", ctx.channel().remoteAddress());
        pending.failAll(new IOException("connection to " + ctx.channel().remoteAddress() + " closed"));
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Throwable root = cause instanceof DecoderException && cause.getCause() != null
            ? cause.getCause()
            : cause;
        log.warn("Connection to {} failed, closing it: {}", ctx.channel().remoteAddress(), root.toString());
        ctx.close();
    }
}

package tb.java.wire;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * Netty outbound adapter for {@link FrameCodec}. Stateless, so one instance
 * may be shared by every pipeline.
 */
@ChannelHandler.Sharable
public final class FrameEncoder extends MessageToByteEncoder<Message> {

    private final FrameCodec codec;

    public FrameEncoder(FrameCodec codec) {
        super(Message.class);
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.codec = codec;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Message message, ByteBuf out) {
        codec.encode(message, out);
    }
}

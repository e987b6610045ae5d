package tb.java.wire;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * Netty inbound adapter for {@link FrameCodec}.
 *
 * <p>After the first protocol error every further byte is discarded: the
 * stream is desynchronized and the connection is expected to be closing.
 */
public final class FrameDecoder extends ByteToMessageDecoder {

    private final FrameCodec codec;
    private boolean failed;

    public FrameDecoder(FrameCodec codec) {
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.codec = codec;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }
        try {
            Message message = codec.decode(in);
            if (message != null) {
                out.add(message);
            }
        } catch (ProtocolException e) {
            failed = true;
            in.skipBytes(in.readableBytes());
            throw e;
        }
    }
}

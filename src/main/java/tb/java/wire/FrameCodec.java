package tb.java.wire;

import io.netty.buffer.ByteBuf;
import tb.core.error.ErrorKind;
import tb.core.model.BucketKey;

import java.util.zip.CRC32;

/**
 * Binary framing for {@link AcquireRequest} and {@link AcquireResponse}.
 *
 * <p>Layout (all integers big-endian):
 * <pre>
 * [0:4)  length   u32, type tag + body
 * [4:8)  checksum u32, CRC32 over bytes [8 .. 8+length)
 * [8:9)  type tag u8 (0x01 request, 0x02 response)
 * [9:..] body
 *
 * request  body: correlationId u64 | keyLen u16 | key | amount u64
 * response body: correlationId u64 | outcome u8 | retryAfterMillis u64 (DENIED)
 *                                                | errorKind u8 (ERROR)
 * </pre>
 *
 * <p>Decoding is incremental: {@link #decode(ByteBuf)} returns null and
 * consumes nothing until a whole frame is buffered. The declared length is
 * checked against the maximum as soon as the header is readable, before any
 * payload is accumulated.
 *
 * <p>Thread-safety: stateless apart from its limit; safe to share.
 */
public final class FrameCodec {

    public static final int HEADER_LENGTH = 8;
    public static final int DEFAULT_MAX_FRAME_LENGTH = 128 * 1024;

    private static final int REQUEST_FIXED_BODY = 8 + 2 + 8;
    private static final int RESPONSE_FIXED_BODY = 8 + 1;

    private final int maxFrameLength;

    /**
     * @param maxFrameLength Largest accepted frame, header included
     * @throws IllegalArgumentException if maxFrameLength leaves no room for a payload
     */
    public FrameCodec(int maxFrameLength) {
        if (maxFrameLength <= HEADER_LENGTH) {
            throw new IllegalArgumentException(
                "maxFrameLength must be > " + HEADER_LENGTH + ", got: " + maxFrameLength);
        }
        this.maxFrameLength = maxFrameLength;
    }

    public FrameCodec() {
        this(DEFAULT_MAX_FRAME_LENGTH);
    }

    public int maxFrameLength() {
        return maxFrameLength;
    }

    /**
     * Appends one frame for {@code message} to {@code out}.
     *
     * @throws FrameTooLargeException if the frame would exceed the maximum;
     *         {@code out} is left as it was
     */
    public void encode(Message message, ByteBuf out) {
        int start = out.writerIndex();
        out.writeInt(0); // length, patched below
        out.writeInt(0); // checksum, patched below

        int payloadStart = out.writerIndex();
        out.writeByte(message.type().tag());
        switch (message.type()) {
            case ACQUIRE_REQUEST -> writeRequestBody((AcquireRequest) message, out);
            case ACQUIRE_RESPONSE -> writeResponseBody((AcquireResponse) message, out);
        }

        int length = out.writerIndex() - payloadStart;
        if ((long) length + HEADER_LENGTH > maxFrameLength) {
            out.writerIndex(start);
            throw new FrameTooLargeException((long) length + HEADER_LENGTH, maxFrameLength);
        }
        out.setInt(start, length);
        out.setInt(start + 4, (int) checksum(out, payloadStart, length));
    }

    /**
     * Reads one frame from {@code in} if a complete one is buffered.
     *
     * @return the message, or null if more bytes are needed
     * @throws FrameTooLargeException if the declared length exceeds the maximum
     * @throws ChecksumMismatchException if the payload does not match its checksum
     * @throws MalformedFrameException if the payload is not a valid message
     */
    public Message decode(ByteBuf in) {
        if (in.readableBytes() < HEADER_LENGTH) {
            return null;
        }

        int base = in.readerIndex();
        long length = in.getUnsignedInt(base);
        if (length + HEADER_LENGTH > maxFrameLength) {
            throw new FrameTooLargeException(length + HEADER_LENGTH, maxFrameLength);
        }
        if (length == 0) {
            throw new MalformedFrameException("frame has no payload");
        }
        if (in.readableBytes() < HEADER_LENGTH + length) {
            return null;
        }

        int payloadLength = (int) length;
        long declared = in.getUnsignedInt(base + 4);
        long computed = checksum(in, base + HEADER_LENGTH, payloadLength);
        if (declared != computed) {
            throw new ChecksumMismatchException(declared, computed);
        }

        ByteBuf payload = in.slice(base + HEADER_LENGTH, payloadLength);
        in.skipBytes(HEADER_LENGTH + payloadLength);
        return readPayload(payload);
    }

    private static void writeRequestBody(AcquireRequest request, ByteBuf out) {
        byte[] key = request.key().toByteArray();
        out.writeLong(request.correlationId());
        out.writeShort(key.length);
        out.writeBytes(key);
        out.writeLong(request.amount());
    }

    private static void writeResponseBody(AcquireResponse response, ByteBuf out) {
        out.writeLong(response.correlationId());
        out.writeByte(response.outcome().code());
        switch (response.outcome()) {
            case DENIED -> out.writeLong(response.retryAfterMillis());
            case ERROR -> out.writeByte(response.errorKind().code());
            case GRANTED -> {
            }
        }
    }

    private static Message readPayload(ByteBuf payload) {
        MessageType type = MessageType.fromTag(payload.readUnsignedByte());
        Message message = switch (type) {
            case ACQUIRE_REQUEST -> readRequestBody(payload);
            case ACQUIRE_RESPONSE -> readResponseBody(payload);
        };
        if (payload.isReadable()) {
            throw new MalformedFrameException(
                payload.readableBytes() + " trailing bytes after " + type + " body");
        }
        return message;
    }

    private static AcquireRequest readRequestBody(ByteBuf body) {
        require(body, REQUEST_FIXED_BODY, "AcquireRequest");
        long correlationId = body.readLong();
        int keyLength = body.readUnsignedShort();
        require(body, keyLength + 8, "AcquireRequest key and amount");
        byte[] key = new byte[keyLength];
        body.readBytes(key);
        long amount = body.readLong();
        return new AcquireRequest(correlationId, BucketKey.of(key), amount);
    }

    private static AcquireResponse readResponseBody(ByteBuf body) {
        require(body, RESPONSE_FIXED_BODY, "AcquireResponse");
        long correlationId = body.readLong();
        Outcome outcome = Outcome.fromCode(body.readUnsignedByte());
        return switch (outcome) {
            case GRANTED -> AcquireResponse.granted(correlationId);
            case DENIED -> {
                require(body, 8, "DENIED retry-after");
                yield AcquireResponse.denied(correlationId, body.readLong());
            }
            case ERROR -> {
                require(body, 1, "ERROR kind");
                int code = body.readUnsignedByte();
                ErrorKind kind = ErrorKind.fromCode(code);
                if (kind == null) {
                    throw new MalformedFrameException("unknown error kind: " + code);
                }
                yield AcquireResponse.error(correlationId, kind);
            }
        };
    }

    private static void require(ByteBuf body, int bytes, String what) {
        if (body.readableBytes() < bytes) {
            throw new MalformedFrameException(
                what + " truncated: need " + bytes + " bytes, have " + body.readableBytes());
        }
    }

    static long checksum(ByteBuf buf, int index, int length) {
        CRC32 crc = new CRC32();
        crc.update(buf.nioBuffer(index, length));
        return crc.getValue();
    }
}

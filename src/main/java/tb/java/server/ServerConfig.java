package tb.java.server;

import tb.java.wire.FrameCodec;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Set;

/**
 * Network settings for a {@link BucketServer}.
 *
 * @param bindAddress Address to listen on (port 0 picks a free port)
 * @param maxFrameLength Largest accepted frame, header included
 * @param allowedPeers Client addresses allowed to connect; empty allows everyone
 */
public record ServerConfig(
    InetSocketAddress bindAddress,
    int maxFrameLength,
    Set<InetAddress> allowedPeers
) {
    public ServerConfig {
        if (bindAddress == null) {
            throw new IllegalArgumentException("bindAddress cannot be null");
        }
        if (maxFrameLength <= FrameCodec.HEADER_LENGTH) {
            throw new IllegalArgumentException(
                "maxFrameLength must be > " + FrameCodec.HEADER_LENGTH + ", got: " + maxFrameLength);
        }
        allowedPeers = allowedPeers == null ? Set.of() : Set.copyOf(allowedPeers);
    }

    /**
     * All interfaces on {@code port}, default frame limit, no allow-list.
     */
    public static ServerConfig defaults(int port) {
        return new ServerConfig(new InetSocketAddress(port), FrameCodec.DEFAULT_MAX_FRAME_LENGTH, Set.of());
    }

    public ServerConfig withMaxFrameLength(int maxFrameLength) {
        return new ServerConfig(bindAddress, maxFrameLength, allowedPeers);
    }

    public ServerConfig withAllowedPeers(Set<InetAddress> allowedPeers) {
        return new ServerConfig(bindAddress, maxFrameLength, allowedPeers);
    }
}

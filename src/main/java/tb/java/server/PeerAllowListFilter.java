package tb.java.server;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.ipfilter.AbstractRemoteAddressFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Set;

/**
 * Closes connections whose remote IP is not on the allow-list.
 */
@ChannelHandler.Sharable
final class PeerAllowListFilter extends AbstractRemoteAddressFilter<InetSocketAddress> {

    private static final Logger log = LoggerFactory.getLogger(PeerAllowListFilter.class);

    private final Set<InetAddress> allowedPeers;

    PeerAllowListFilter(Set<InetAddress> allowedPeers) {
        if (allowedPeers == null || allowedPeers.isEmpty()) {
            throw new IllegalArgumentException("allowedPeers must not be empty");
        }
        this.allowedPeers = Set.copyOf(allowedPeers);
    }

    @Override
    protected boolean accept(ChannelHandlerContext ctx, InetSocketAddress remoteAddress) {
        return allowedPeers.contains(remoteAddress.getAddress());
    }

    @Override
    protected ChannelFuture channelRejected(ChannelHandlerContext ctx, InetSocketAddress remoteAddress) {
        log.warn("Peer {} is not on the allow-list, closing connection", remoteAddress);
        return null;
    }
}

package tb.java.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tb.core.bucket.BucketConfig;
import tb.core.clock.Clock;
import tb.core.clock.SystemClock;
import tb.java.storage.InMemoryStorage;
import tb.java.storage.Storage;
import tb.java.wire.FrameCodec;
import tb.java.wire.FrameDecoder;
import tb.java.wire.FrameEncoder;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * TCP server holding the authoritative buckets.
 *
 * <p>Features:
 * <ul>
 *   <li>Netty NIO transport, one {@link ConnectionHandler} per connection</li>
 *   <li>Framed, checksummed protocol ({@link FrameCodec})</li>
 *   <li>Optional peer allow-list</li>
 *   <li>Graceful shutdown with timeout</li>
 * </ul>
 *
 * <p>Connections are independent: a protocol or write error tears down its
 * own connection and nothing else. There is no connection cap.
 *
 * <p>Usage:
 * <pre>
 * // Run with defaults (port 7070, 100 capacity, 10/sec refill)
 * java tb.java.server.BucketServer
 *
 * // Run with custom port, capacity and refill rate
 * java tb.java.server.BucketServer 8080 50 5.0
 * </pre>
 */
public final class BucketServer {

    private static final Logger log = LoggerFactory.getLogger(BucketServer.class);

    private static final int DEFAULT_PORT = 7070;
    private static final long DEFAULT_CAPACITY = 100;
    private static final double DEFAULT_REFILL_RATE = 10.0;
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ServerConfig config;
    private final Storage storage;
    private final Clock clock;
    private final FrameCodec codec;
    private final FrameEncoder encoder;
    private final PeerAllowListFilter peerFilter;

    private final ChannelGroup connections = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private EventLoopGroup boss;
    private EventLoopGroup workers;
    private Channel serverChannel;

    /**
     * Creates a server.
     *
     * @param config Network settings
     * @param storage Bucket state; must be thread-safe
     * @param clock Time source used to stamp every request; {@link SystemClock} in production
     */
    public BucketServer(ServerConfig config, Storage storage, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (storage == null) {
            throw new IllegalArgumentException("storage cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.storage = storage;
        this.clock = clock;
        this.codec = new FrameCodec(config.maxFrameLength());
        this.encoder = new FrameEncoder(codec);
        this.peerFilter = config.allowedPeers().isEmpty() ? null : new PeerAllowListFilter(config.allowedPeers());
    }

    /**
     * Binds and starts accepting connections.
     *
     * @throws IOException if the address cannot be bound
     * @throws IllegalStateException if already started
     */
    public synchronized void start() throws IOException {
        if (serverChannel != null) {
            throw new IllegalStateException("server already started");
        }
        boss = new NioEventLoopGroup(1);
        workers = new NioEventLoopGroup();

        ServerBootstrap boot = new ServerBootstrap()
            .group(boss, workers)
            .channel(NioServerSocketChannel.class)
            .option(ChannelOption.SO_BACKLOG, 128)
            .childOption(ChannelOption.SO_KEEPALIVE, true)
            .childOption(ChannelOption.TCP_NODELAY, true)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    connections.add(ch);
                    ChannelPipeline pipeline = ch.pipeline();
                    if (peerFilter != null) {
                        pipeline.addLast("peer-filter", peerFilter);
                    }
                    pipeline.addLast("frame-decoder", new FrameDecoder(codec));
                    pipeline.addLast("frame-encoder", encoder);
                    pipeline.addLast("connection", new ConnectionHandler(storage, clock));
                }
            });

        log.info("Starting bucket server on {}", config.bindAddress());
        ChannelFuture bind = boot.bind(config.bindAddress()).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            shutdownGroups();
            throw new IOException("failed to bind " + config.bindAddress(), bind.cause());
        }
        serverChannel = bind.channel();
        log.info("Bucket server started on port {}", getPort());
    }

    /**
     * Stops accepting, closes every open connection and releases threads.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public synchronized void stop() throws InterruptedException {
        if (serverChannel == null) {
            return;
        }
        log.info("Stopping bucket server");
        serverChannel.close().await(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        connections.close().await(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        shutdownGroups();
        boss.terminationFuture().await(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        workers.terminationFuture().await(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        serverChannel = null;
        log.info("Bucket server stopped");
    }

    /**
     * Blocks until the listening socket is closed.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        Channel channel;
        synchronized (this) {
            channel = serverChannel;
        }
        if (channel != null) {
            channel.closeFuture().await();
        }
    }

    /**
     * Returns the port the server is listening on.
     *
     * @return port number, or -1 if not started
     */
    public synchronized int getPort() {
        return serverChannel != null ? ((InetSocketAddress) serverChannel.localAddress()).getPort() : -1;
    }

    /**
     * @return Number of currently open client connections
     */
    public int connectionCount() {
        return connections.size();
    }

    private void shutdownGroups() {
        boss.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        workers.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * Main entry point.
     *
     * @param args Optional: port, capacity, refill tokens per second
     * @throws IOException if the server fails to start
     * @throws InterruptedException if the server is interrupted
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        int port = DEFAULT_PORT;
        long capacity = DEFAULT_CAPACITY;
        double refillRate = DEFAULT_REFILL_RATE;

        try {
            if (args.length > 0) port = Integer.parseInt(args[0]);
            if (args.length > 1) capacity = Long.parseLong(args[1]);
            if (args.length > 2) refillRate = Double.parseDouble(args[2]);
        } catch (NumberFormatException e) {
            log.error("Invalid argument: {}", e.getMessage());
            System.exit(1);
        }

        BucketServer server = new BucketServer(
            ServerConfig.defaults(port),
            new InMemoryStorage(BucketConfig.of(capacity, refillRate)),
            SystemClock.instance());
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down bucket server (JVM shutdown hook)...");
            try {
                server.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted: {}", e.getMessage());
            }
        }));

        server.blockUntilShutdown();
    }
}

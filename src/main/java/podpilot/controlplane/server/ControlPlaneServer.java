package podpilot.controlplane.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server in front of the {@link RouterHandler}.
 */
public final class ControlPlaneServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ControlPlaneServer.class);
    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private final RouterHandler router;
    private final String host;
    private final int port;

    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private volatile boolean running = false;

    public ControlPlaneServer(RouterHandler router, String host, int port) {
        this.router = router;
        this.host = host;
        this.port = port;
    }

    public synchronized void start() {
        if (running) {
            return;
        }

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                            p.addLast(new HttpServerCodec());
                            p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                            p.addLast(router);
                        }
                    });

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("Control plane listening on {}:{}", host, port());
        } catch (RuntimeException e) {
            log.error("Failed to start server on {}:{}", host, port, e);
            shutdownGroups();
            throw e;
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            shutdownGroups();
            running = false;
            log.info("Control plane server stopped");
        }
    }

    private void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int port() {
        Channel ch = serverChannel;
        if (ch != null && ch.localAddress() instanceof InetSocketAddress address) {
            return address.getPort();
        }
        return port;
    }
}

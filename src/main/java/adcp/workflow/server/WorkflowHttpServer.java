package adcp.workflow.server;

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
public final class WorkflowHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowHttpServer.class);

    private final RouterHandler router;

    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private volatile boolean running = false;

    public WorkflowHttpServer(RouterHandler router) {
        this.router = router;
    }

    /**
     * Bind and start serving.
     *
     * @param port port to bind, 0 for an ephemeral one
     * @return the bound port
     */
    public synchronized int start(String host, int port) {
        if (running) {
            return boundPort();
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
                            p.addLast(new HttpObjectAggregator(1024 * 1024));
                            p.addLast(router);
                        }
                    });

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("HTTP server listening on {}:{}", host, boundPort());
            return boundPort();
        } catch (RuntimeException e) {
            log.error("Failed to start HTTP server on {}:{}", host, port, e);
            stop();
            throw e;
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
                bossGroup = null;
            }
            if (running) {
                log.info("HTTP server stopped");
            }
            running = false;
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public int boundPort() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }
}

package taskrunner.service.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import taskrunner.service.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP server in front of the dispatcher.
 * One instance per process; start/stop are idempotent.
 */
public final class TaskNettyServer {

    private static final Logger log = LoggerFactory.getLogger(TaskNettyServer.class);

    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;

    private TaskNettyServer() {
    }

    /** HTTP pipeline: codec, aggregator, router */
    static ChannelHandler pipelineInitializer(RouterHandler router) {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(router);
            }
        };
    }

    /**
     * Bind the HTTP port configured in {@code deps.config()} and serve the registered controllers.
     *
     * @return true if the server is running after the call
     */
    public static synchronized boolean start(Dependencies deps) {
        if (running) {
            return true;
        }
        int port = deps.config().serverPort();
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(deps.routerHandler()));

            serverChannel = b.bind(deps.config().serverHost(), port).syncUninterruptibly().channel();
            running = true;
            log.info("Task service listening on port {}", boundPort());
            return true;
        } catch (Exception e) {
            log.error("Failed to start server on port {}", port, e);
            stop();
            return false;
        }
    }

    public static synchronized void stop() {
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
                log.info("Task service stopped");
            }
            running = false;
        }
    }

    public static boolean isRunning() {
        return running;
    }

    /** Actual port, useful when started with port 0 */
    public static synchronized int boundPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }
}

package com.assettrack.setracker.service;

import com.assettrack.setracker.network.TrackerPipelineFactory;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * TCP listener for SeTracker devices. Each accepted connection is served by one
 * worker event loop, so frames of a connection are handled in order.
 */
@Component
@ConditionalOnProperty(name = "gps.server.enabled", havingValue = "true", matchIfMissing = true)
public class SeTrackerServer {
    private static final Logger logger = LoggerFactory.getLogger(SeTrackerServer.class);
    private static final Logger trafficLogger = LoggerFactory.getLogger("TRAFFIC");

    @Value("${gps.server.tcp.port:9001}")
    private int tcpPort;

    @Value("${gps.server.host:0.0.0.0}")
    private String host;

    @Value("${gps.server.worker.threads:0}") // 0 = auto-detect
    private int workerThreads;

    @Value("${gps.server.so.backlog:128}")
    private int soBacklog;

    @Value("${gps.server.so.linger:10}")
    private int soLinger;

    @Value("${gps.server.shutdown.timeout:5000}")
    private long shutdownTimeout;

    private final TrackerPipelineFactory pipelineFactory;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public SeTrackerServer(TrackerPipelineFactory pipelineFactory) {
        this.pipelineFactory = pipelineFactory;
    }

    @PostConstruct
    public void start() {
        logger.info("Configuration - Host: {}, TCP Port: {}, Worker Threads: {}, Backlog: {}",
                host, tcpPort, workerThreads, soBacklog);

        int actualWorkerThreads = workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors() * 2;
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(actualWorkerThreads);

        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .handler(new LoggingHandler(LogLevel.DEBUG))
                    .childHandler(pipelineFactory)
                    .option(ChannelOption.SO_BACKLOG, soBacklog)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_LINGER, soLinger);

            ChannelFuture f = b.bind(host, tcpPort).sync();
            serverChannel = f.channel();
            running.set(true);
            logger.info("Netty TCP server started successfully on port {}", getLocalPort());
            trafficLogger.info("SERVER_STARTED port={}", getLocalPort());
        } catch (InterruptedException e) {
            logger.error("Netty server startup interrupted", e);
            shutdownGroups();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while binding port " + tcpPort, e);
        } catch (Exception e) {
            logger.error("Failed to start Netty TCP server on port {}", tcpPort, e);
            shutdownGroups();
            throw new IllegalStateException("Failed to bind port " + tcpPort, e);
        }
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Shutting down SeTracker server...");
        trafficLogger.info("SERVER_SHUTDOWN_INITIATED");
        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly(shutdownTimeout, TimeUnit.MILLISECONDS);
        }
        shutdownGroups();
        logger.info("SeTracker server shutdown complete");
        trafficLogger.info("SERVER_SHUTDOWN_COMPLETED");
    }

    private void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, shutdownTimeout, TimeUnit.MILLISECONDS).awaitUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, shutdownTimeout, TimeUnit.MILLISECONDS).awaitUninterruptibly();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Port actually bound, which differs from the configured one when that is 0.
     */
    public int getLocalPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }
}

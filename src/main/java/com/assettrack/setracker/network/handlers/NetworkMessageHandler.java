package com.assettrack.setracker.network.handlers;

import com.assettrack.setracker.service.FrameProcessingService;
import com.assettrack.setracker.service.FrameProcessingService.ProcessedFrame;
import com.assettrack.setracker.session.SessionManager;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Last inbound handler: feeds each decoded frame to the processing service,
 * binds the device to the channel and writes the reply. A bad frame is logged
 * and the connection stays open.
 */
@Component
@ChannelHandler.Sharable
public class NetworkMessageHandler extends SimpleChannelInboundHandler<String> {

    private static final Logger logger = LoggerFactory.getLogger(NetworkMessageHandler.class);
    private static final Logger trafficLogger = LoggerFactory.getLogger("TRAFFIC");

    private final FrameProcessingService frameProcessingService;
    private final SessionManager sessionManager;

    public NetworkMessageHandler(FrameProcessingService frameProcessingService, SessionManager sessionManager) {
        this.frameProcessingService = frameProcessingService;
        this.sessionManager = sessionManager;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String frame) {
        if (frame.isEmpty()) {
            return;
        }
        trafficLogger.info("IN {} {}", ctx.channel().remoteAddress(), frame);

        try {
            Optional<ProcessedFrame> processed = frameProcessingService.process(frame);
            if (processed.isEmpty()) {
                return;
            }

            ProcessedFrame result = processed.get();
            sessionManager.register(result.getDeviceId(), result.getMessage().getManufacturer(), ctx.channel());
            result.getReply().ifPresent(reply -> {
                ctx.writeAndFlush(reply);
                logger.info("Sent response to {}: {}", result.getDeviceId(), reply);
            });
        } catch (RuntimeException e) {
            logger.error("Error processing frame from {}: {}", ctx.channel().remoteAddress(), frame, e);
        }
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        logger.info("Channel opened: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        logger.info("Channel closed: {}", ctx.channel().remoteAddress());
        sessionManager.unregister(ctx.channel());
        super.channelInactive(ctx);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            logger.info("Channel {} idle, closing connection", ctx.channel().remoteAddress());
            ctx.close();
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof TooLongFrameException) {
            // decoder already discarded the oversized frame
            logger.warn("Dropped oversized frame from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
            return;
        }
        logger.error("Channel error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage(), cause);
        ctx.close();
    }
}

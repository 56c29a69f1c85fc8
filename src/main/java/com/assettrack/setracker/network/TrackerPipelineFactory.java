package com.assettrack.setracker.network;

import com.assettrack.setracker.network.handlers.NetworkMessageHandler;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.DelimiterBasedFrameDecoder;
import io.netty.handler.codec.Delimiters;
import io.netty.handler.codec.string.LineEncoder;
import io.netty.handler.codec.string.LineSeparator;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.timeout.IdleStateHandler;
import org.apache.commons.codec.binary.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Builds the pipeline of each device connection: CRLF framing, byte-to-char
 * decoding, and the frame handler. Outgoing strings get a CRLF terminator.
 */
@Component
public class TrackerPipelineFactory extends ChannelInitializer<Channel> {
    private static final Logger logger = LoggerFactory.getLogger(TrackerPipelineFactory.class);

    // one byte per char, so binary snapshot bytes survive and lengths count bytes
    static final Charset FRAME_CHARSET = StandardCharsets.ISO_8859_1;

    private final NetworkMessageHandler messageHandler;
    private final int idleTimeoutSeconds;
    private final int maxFrameLength;

    @Autowired
    public TrackerPipelineFactory(
            NetworkMessageHandler messageHandler,
            @Value("${gps.server.idle.timeout:0}") int idleTimeoutSeconds,
            @Value("${gps.server.max.frame.length:65536}") int maxFrameLength
    ) {
        this.messageHandler = messageHandler;
        this.idleTimeoutSeconds = idleTimeoutSeconds;
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    protected void initChannel(Channel channel) {
        ChannelPipeline pipeline = channel.pipeline();

        // 1. Optional timeout handler
        if (idleTimeoutSeconds > 0) {
            pipeline.addLast("idleHandler", new IdleStateHandler(idleTimeoutSeconds, 0, 0));
        }

        // 2. Log raw incoming data
        pipeline.addLast("rawLogger", new LoggingHandler("Raw-Inbound", LogLevel.DEBUG) {
            @Override
            public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
                if (msg instanceof ByteBuf && logger.isDebugEnabled()) {
                    ByteBuf buf = (ByteBuf) msg;
                    byte[] bytes = new byte[buf.readableBytes()];
                    buf.getBytes(buf.readerIndex(), bytes);
                    logger.debug("Raw message ({} bytes): {}", bytes.length, Hex.encodeHexString(bytes));
                }
                ctx.fireChannelRead(msg);
            }
        });

        // 3. Framing: one protocol frame per line, delimiter stripped
        pipeline.addLast("frameDecoder", new DelimiterBasedFrameDecoder(maxFrameLength, Delimiters.lineDelimiter()));
        pipeline.addLast("stringDecoder", new StringDecoder(FRAME_CHARSET));
        pipeline.addLast("lineEncoder", new LineEncoder(LineSeparator.WINDOWS, FRAME_CHARSET));

        // 4. Protocol handling
        pipeline.addLast("messageHandler", messageHandler);
    }
}

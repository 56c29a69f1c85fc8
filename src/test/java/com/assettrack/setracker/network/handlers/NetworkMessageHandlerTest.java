package com.assettrack.setracker.network.handlers;

import com.assettrack.setracker.exception.StoreException;
import com.assettrack.setracker.model.CommandRecord;
import com.assettrack.setracker.network.TrackerPipelineFactory;
import com.assettrack.setracker.protocol.CommandDispatcher;
import com.assettrack.setracker.protocol.SeTrackerMessageParser;
import com.assettrack.setracker.protocol.SeTrackerResponseFormatter;
import com.assettrack.setracker.protocol.extractor.AlarmExtractor;
import com.assettrack.setracker.protocol.extractor.ImageExtractor;
import com.assettrack.setracker.protocol.extractor.PositionExtractor;
import com.assettrack.setracker.service.CommandRecordService;
import com.assettrack.setracker.service.FrameProcessingService;
import com.assettrack.setracker.session.SessionManager;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.timeout.IdleStateEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NetworkMessageHandlerTest {
    private static final int MAX_FRAME_LENGTH = 256;

    @Mock
    private CommandRecordService commandRecordService;

    private SessionManager sessionManager;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        lenient().when(commandRecordService.save(any(CommandRecord.class))).thenReturn(1L);

        CommandDispatcher dispatcher = new CommandDispatcher(new SeTrackerResponseFormatter(),
                new PositionExtractor(), new AlarmExtractor(), new ImageExtractor(), Clock.systemUTC());
        FrameProcessingService processingService =
                new FrameProcessingService(new SeTrackerMessageParser(), dispatcher, commandRecordService);
        sessionManager = new SessionManager();
        NetworkMessageHandler handler = new NetworkMessageHandler(processingService, sessionManager);
        channel = new EmbeddedChannel(new TrackerPipelineFactory(handler, 0, MAX_FRAME_LENGTH));
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private void send(String data) {
        channel.writeInbound(Unpooled.copiedBuffer(data, StandardCharsets.ISO_8859_1));
    }

    private String readReply() {
        ByteBuf buf = channel.readOutbound();
        if (buf == null) {
            return null;
        }
        try {
            return buf.toString(StandardCharsets.ISO_8859_1);
        } finally {
            buf.release();
        }
    }

    @Test
    void heartbeatGetsCrlfTerminatedReply() {
        send("[3G*8800000015*000D*LK,50,100,100]\r\n");

        assertThat(readReply()).isEqualTo("[3G*8800000015*0002*LK]\r\n");
        assertThat(channel.isActive()).isTrue();
    }

    @Test
    void framesSplitAcrossReadsAreReassembled() {
        send("[3G*8800000015*000D*LK,5");
        assertThat(readReply()).isNull();

        send("0,100,100]\r\n");
        assertThat(readReply()).isEqualTo("[3G*8800000015*0002*LK]\r\n");
    }

    @Test
    void severalFramesInOneReadAreAnsweredInOrder() {
        send("[3G*8800000015*0002*LK]\r\n[3G*8800000015*0003*APN]\n");

        assertThat(readReply()).isEqualTo("[3G*8800000015*0002*LK]\r\n");
        assertThat(readReply()).isEqualTo("[3G*8800000015*0004*APN]\r\n");
    }

    @Test
    void frameWithoutReplyWritesNothing() {
        send("[3G*8800000015*0006*UD,1,2]\r\n");

        assertThat(readReply()).isNull();
        verify(commandRecordService).save(any(CommandRecord.class));
    }

    @Test
    void badFrameIsDroppedAndConnectionStaysOpen() {
        send("garbage\r\n");
        send("[3G*8800000015*0009*LK]\r\n");
        send("\r\n");

        assertThat(readReply()).isNull();
        assertThat(channel.isActive()).isTrue();
        verify(commandRecordService, never()).save(any(CommandRecord.class));

        send("[3G*8800000015*0002*LK]\r\n");
        assertThat(readReply()).isEqualTo("[3G*8800000015*0002*LK]\r\n");
    }

    @Test
    void storeFailureStillProducesReply() {
        when(commandRecordService.save(any(CommandRecord.class)))
                .thenThrow(new StoreException("8800000015", "LK", new DataIntegrityViolationException("down")));

        send("[3G*8800000015*0002*LK]\r\n");

        assertThat(readReply()).isEqualTo("[3G*8800000015*0002*LK]\r\n");
    }

    @Test
    void oversizedFrameIsDiscardedWithoutClosing() {
        StringBuilder huge = new StringBuilder("[3G*8800000015*0400*");
        for (int i = 0; i < 400; i++) {
            huge.append('x');
        }
        send(huge.append("]\r\n").toString());

        assertThat(readReply()).isNull();
        assertThat(channel.isActive()).isTrue();

        send("[3G*8800000015*0002*LK]\r\n");
        assertThat(readReply()).isEqualTo("[3G*8800000015*0002*LK]\r\n");
    }

    @Test
    void validFrameBindsDeviceAndCloseUnbindsIt() {
        send("[3G*8800000015*0002*LK]\r\n");

        assertThat(sessionManager.getSession("8800000015")).isPresent();
        assertThat(sessionManager.getSessionByChannel(channel)).isPresent();

        channel.close();

        assertThat(sessionManager.getSession("8800000015")).isEmpty();
    }

    @Test
    void rejectedFrameDoesNotBindDevice() {
        send("[3G*8800000015*0009*LK]\r\n");

        assertThat(sessionManager.getSession("8800000015")).isEmpty();
    }

    @Test
    void idleEventClosesConnection() {
        channel.pipeline().fireUserEventTriggered(IdleStateEvent.READER_IDLE_STATE_EVENT);

        assertThat(channel.isActive()).isFalse();
    }
}

package com.assettrack.setracker;

import com.assettrack.setracker.model.CommandRecord;
import com.assettrack.setracker.service.CommandRecordService;
import com.assettrack.setracker.service.CommandService;
import com.assettrack.setracker.service.CommandService.CommandDispatch;
import com.assettrack.setracker.service.SeTrackerServer;
import com.assettrack.setracker.session.SessionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "gps.server.tcp.port=0",
                "gps.server.host=127.0.0.1",
                "gps.server.worker.threads=2"
        })
@Import(TestConfig.class)
class SeTrackerServerIntegrationTest {
    private static final String DEVICE_ID = "8800000015";

    @Autowired
    private SeTrackerServer server;

    @Autowired
    private CommandService commandService;

    @Autowired
    private CommandRecordService commandRecordService;

    @Autowired
    private SessionManager sessionManager;

    private Socket socket;
    private BufferedReader reader;
    private OutputStream out;

    @BeforeEach
    void connect() throws Exception {
        assertThat(server.isRunning()).isTrue();
        socket = new Socket("127.0.0.1", server.getLocalPort());
        socket.setSoTimeout(5000);
        reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.ISO_8859_1));
        out = socket.getOutputStream();
    }

    @AfterEach
    void disconnect() throws Exception {
        socket.close();
    }

    private void send(String frame) throws Exception {
        out.write((frame + "\r\n").getBytes(StandardCharsets.ISO_8859_1));
        out.flush();
    }

    @Test
    void heartbeatIsAnsweredAndStored() throws Exception {
        send("[3G*8800000015*000D*LK,50,100,100]");

        assertThat(reader.readLine()).isEqualTo("[3G*8800000015*0002*LK]");

        List<CommandRecord> records = commandRecordService.getRecords(DEVICE_ID, "LK");
        assertThat(records).isNotEmpty();
        assertThat(records.get(0).getRawContent()).isEqualTo("LK,50,100,100");
        assertThat(records.get(0).getReceivedAt())
                .isEqualTo(LocalDateTime.ofInstant(TestConfig.FIXED_NOW, ZoneOffset.UTC));
    }

    @Test
    void badFrameKeepsConnectionUsable() throws Exception {
        send("this is not a frame");
        send("[3G*8800000015*0002*LK]");

        assertThat(reader.readLine()).isEqualTo("[3G*8800000015*0002*LK]");
    }

    @Test
    void commandReachesConnectedDevice() throws Exception {
        send("[3G*8800000015*0002*LK]");
        assertThat(reader.readLine()).isEqualTo("[3G*8800000015*0002*LK]");
        assertThat(sessionManager.getSession(DEVICE_ID)).isPresent();

        CommandDispatch dispatch = commandService.sendCommand(DEVICE_ID, "CR", "");

        assertThat(dispatch.isDelivered()).isTrue();
        assertThat(reader.readLine()).isEqualTo("[3G*8800000015*0002*CR]");
    }

    @Test
    void commandToOfflineDeviceIsNotDelivered() {
        CommandDispatch dispatch = commandService.sendCommand("3000000001", "CR", "");

        assertThat(dispatch.isDelivered()).isFalse();
        assertThat(dispatch.getFrame()).isEqualTo("[3G*3000000001*0002*CR]");
    }
}

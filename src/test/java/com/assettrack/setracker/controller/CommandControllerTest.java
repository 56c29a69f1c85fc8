package com.assettrack.setracker.controller;

import com.assettrack.setracker.service.CommandService;
import com.assettrack.setracker.service.CommandService.CommandDispatch;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CommandController.class)
class CommandControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CommandService commandService;

    @Test
    void deliveredCommandReturnsFrame() throws Exception {
        when(commandService.sendCommand("8800000015", "APN", ",cmnet,,,20634"))
                .thenReturn(new CommandDispatch("[3G*8800000015*0017*APN,cmnet,,,20634]", true));

        mockMvc.perform(post("/gps/command/8800000015/APN").param("content", ",cmnet,,,20634"))
                .andExpect(status().isOk())
                .andExpect(content().string("[3G*8800000015*0017*APN,cmnet,,,20634]"));
    }

    @Test
    void missingContentDefaultsToEmpty() throws Exception {
        when(commandService.sendCommand("8800000015", "CR", ""))
                .thenReturn(new CommandDispatch("[3G*8800000015*0002*CR]", true));

        mockMvc.perform(post("/gps/command/8800000015/CR"))
                .andExpect(status().isOk())
                .andExpect(content().string("[3G*8800000015*0002*CR]"));
    }

    @Test
    void contentMayComeInPath() throws Exception {
        when(commandService.sendCommand("8800000015", "UPLOAD", "600"))
                .thenReturn(new CommandDispatch("[3G*8800000015*0009*UPLOAD600]", true));

        mockMvc.perform(post("/gps/command/8800000015/UPLOAD/600"))
                .andExpect(status().isOk())
                .andExpect(content().string("[3G*8800000015*0009*UPLOAD600]"));
    }

    @Test
    void offlineDeviceIsAccepted() throws Exception {
        when(commandService.sendCommand(eq("3000000001"), eq("CR"), any()))
                .thenReturn(new CommandDispatch("[3G*3000000001*0002*CR]", false));

        mockMvc.perform(post("/gps/command/3000000001/CR"))
                .andExpect(status().isAccepted())
                .andExpect(content().string("[3G*3000000001*0002*CR]"));
    }

    @Test
    void invalidArgumentsAreBadRequest() throws Exception {
        when(commandService.sendCommand(any(), any(), any()))
                .thenThrow(new IllegalArgumentException("Device ID cannot be empty"));

        mockMvc.perform(post("/gps/command/8800000015/CR"))
                .andExpect(status().isBadRequest());
    }
}

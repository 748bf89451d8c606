package com.rah.notification.whatsapp.controller;

import com.rah.notification.whatsapp.enums.DisconnectReason;
import com.rah.notification.whatsapp.enums.SessionState;
import com.rah.notification.whatsapp.model.SessionStatus;
import com.rah.notification.whatsapp.session.WhatsAppSessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class WhatsAppSessionControllerTest {

    private static final Instant SINCE = Instant.parse("2026-02-09T12:00:00Z");

    @Mock
    private WhatsAppSessionManager sessionManager;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new WhatsAppSessionController(sessionManager)).build();
    }

    @Test
    void testGetStatus_ReturnsStateAndReason() throws Exception {
        when(sessionManager.getStatus()).thenReturn(
            new SessionStatus(SessionState.LOGGED_OUT, SINCE, DisconnectReason.LOGGED_OUT, null, true));

        mockMvc.perform(get("/api/whatsapp/session"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("LOGGED_OUT"))
            .andExpect(jsonPath("$.lastDisconnectReason").value("LOGGED_OUT"))
            .andExpect(jsonPath("$.credentialsStored").value(true))
            .andExpect(jsonPath("$.pairingCode").doesNotExist());
    }

    @Test
    void testRelink_ReturnsAcceptedWithNewStatus() throws Exception {
        when(sessionManager.relink()).thenReturn(
            new SessionStatus(SessionState.CONNECTING, SINCE, DisconnectReason.LOGGED_OUT, null, false));

        mockMvc.perform(post("/api/whatsapp/session/relink"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.state").value("CONNECTING"))
            .andExpect(jsonPath("$.credentialsStored").value(false));
    }

    @Test
    void testRelink_AfterShutdown_Conflict() throws Exception {
        when(sessionManager.relink()).thenThrow(new IllegalStateException("WhatsApp session manager is shut down"));
        when(sessionManager.getStatus()).thenReturn(
            new SessionStatus(SessionState.DISCONNECTED, SINCE, null, null, true));

        mockMvc.perform(post("/api/whatsapp/session/relink"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.state").value("DISCONNECTED"));
    }
}

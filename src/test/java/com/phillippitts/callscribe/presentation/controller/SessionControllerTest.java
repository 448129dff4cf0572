package com.phillippitts.callscribe.presentation.controller;

import com.phillippitts.callscribe.service.session.SessionCoordinator;
import com.phillippitts.callscribe.service.session.SessionState;
import com.phillippitts.callscribe.service.session.SessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

    @Mock
    private SessionCoordinator coordinator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SessionController(coordinator)).build();
    }

    @Test
    void statusReturnsCoordinatorView() throws Exception {
        when(coordinator.status()).thenReturn(view(SessionState.CANDIDATE, false, "777"));

        mockMvc.perform(get("/api/session"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("CANDIDATE"))
                .andExpect(jsonPath("$.candidateChannelId").value("777"))
                .andExpect(jsonPath("$.manualMode").value(false));
    }

    @Test
    void joinIsAcceptedAndPassesChannelId() throws Exception {
        when(coordinator.joinManually("555")).thenReturn(view(SessionState.JOINING, true, null));

        mockMvc.perform(post("/api/session/join/555"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.state").value("JOINING"))
                .andExpect(jsonPath("$.manualMode").value(true));

        verify(coordinator).joinManually("555");
    }

    @Test
    void leaveIsAccepted() throws Exception {
        when(coordinator.leaveManually()).thenReturn(view(SessionState.FINALIZING, true, null));

        mockMvc.perform(post("/api/session/leave"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.state").value("FINALIZING"));
    }

    @Test
    void autoClearsManualMode() throws Exception {
        when(coordinator.resumeAuto()).thenReturn(view(SessionState.IDLE, false, null));

        mockMvc.perform(post("/api/session/auto"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.manualMode").value(false));

        verify(coordinator).resumeAuto();
    }

    private static SessionStatus view(SessionState state, boolean manual, String candidate) {
        return new SessionStatus(state, manual, candidate, null, null, null);
    }
}

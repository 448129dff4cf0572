package com.phillippitts.callscribe;

import com.phillippitts.callscribe.gateway.DetachedVoiceGateway;
import com.phillippitts.callscribe.gateway.VoiceGateway;
import com.phillippitts.callscribe.service.delivery.DeliveryDispatcher;
import com.phillippitts.callscribe.service.session.SessionCoordinator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Tag("integration")
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CallScribeApplicationTests {

    @Autowired
    private VoiceGateway gateway;

    @Autowired
    private SessionCoordinator coordinator;

    @Autowired
    private DeliveryDispatcher dispatcher;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void contextLoadsWithDetachedGateway() {
        assertThat(gateway).isInstanceOf(DetachedVoiceGateway.class);
        assertThat(coordinator.isRunning()).isTrue();
        assertThat(dispatcher).isNotNull();
    }

    @Test
    void statusEndpointReportsIdleAndEchoesRequestId() throws Exception {
        mockMvc.perform(get("/api/session").header("X-Request-ID", "req-123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-ID", "req-123"))
                .andExpect(jsonPath("$.state").value("IDLE"));
    }

    @Test
    void joiningUnknownChannelIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/session/join/999999"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("IllegalArgumentException"));
    }

    @Test
    void leavingWithoutSessionIsConflict() throws Exception {
        mockMvc.perform(post("/api/session/leave"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details").value("No active session"));
    }
}

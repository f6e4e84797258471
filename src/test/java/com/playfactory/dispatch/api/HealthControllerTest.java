package com.playfactory.dispatch.api;

import com.playfactory.core.health.HealthCheckService;
import com.playfactory.core.health.HealthStatus;
import com.playfactory.matchmaker.LivenessRegistry;
import com.playfactory.matchmaker.MatchmakerStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @MockitoBean
    private LivenessRegistry livenessRegistry;

    @Test
    @DisplayName("Degraded components still report 200")
    void degradedIsUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("docker", HealthStatus.Status.UP, "ok", Map.of()),
                new HealthStatus("capacity", HealthStatus.Status.DEGRADED, "full", Map.of())));
        when(livenessRegistry.statistics()).thenReturn(new MatchmakerStatistics(2, 3, 7, 30));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.capacity.status").value("DEGRADED"))
                .andExpect(jsonPath("$.matchmaker.total_players").value(7));
    }

    @Test
    @DisplayName("A DOWN component returns 503")
    void downIs503() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("docker", HealthStatus.Status.DOWN, "Docker error: refused", Map.of())));
        when(livenessRegistry.statistics()).thenReturn(new MatchmakerStatistics(0, 0, 0, 30));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"));
    }
}

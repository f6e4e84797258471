package com.playfactory.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.playfactory.core.error.BuildFailedException;
import com.playfactory.core.error.InvalidInputException;
import com.playfactory.core.error.NoPortAvailableException;
import com.playfactory.core.error.ResourceExhaustedException;
import com.playfactory.core.error.ServerNotFoundException;
import com.playfactory.core.model.GameServerInstance;
import com.playfactory.core.model.ServerLogs;
import com.playfactory.core.model.ServerStatus;
import com.playfactory.provisioning.GameServerManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ServerController.class)
class ServerControllerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private GameServerManager manager;

    private static GameServerInstance running() {
        return GameServerInstance.provisioning("gs-space-race-1a2b3c4d", "Space Race", "Race!", T0)
                .launched("container-abc", "game-server:gs-space-race-1a2b3c4d", 8081, T0);
    }

    private String createBody() throws Exception {
        return objectMapper.writeValueAsString(new CreateServerRequest("Space Race", "Race!", "function initGame() {}"));
    }

    // ── POST /api/v1/servers ─────────────────────────────────────────

    @Test
    @DisplayName("POST /servers returns 201 with the running instance")
    void createServer() throws Exception {
        when(manager.provision("function initGame() {}", "Space Race", "Race!")).thenReturn(running());

        mockMvc.perform(post("/api/v1/servers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.server_id").value("gs-space-race-1a2b3c4d"))
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.port").value(8081))
                .andExpect(jsonPath("$.container_ref").value("container-abc"));
    }

    @Test
    @DisplayName("POST /servers maps invalid input to 400")
    void createInvalid() throws Exception {
        when(manager.provision(any(), any(), any())).thenThrow(new InvalidInputException("User code is empty"));

        mockMvc.perform(post("/api/v1/servers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("User code is empty"))
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
    }

    @Test
    @DisplayName("POST /servers maps capacity failures to 503")
    void createExhausted() throws Exception {
        when(manager.provision(any(), any(), any()))
                .thenThrow(new ResourceExhaustedException("Maximum container count reached (50)"))
                .thenThrow(new NoPortAvailableException(8081, 9080));

        mockMvc.perform(post("/api/v1/servers").contentType(MediaType.APPLICATION_JSON).content(createBody()))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("RESOURCE_EXHAUSTED"));
        mockMvc.perform(post("/api/v1/servers").contentType(MediaType.APPLICATION_JSON).content(createBody()))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("NO_PORT_AVAILABLE"));
    }

    @Test
    @DisplayName("POST /servers maps build failures to 502")
    void createBuildFailed() throws Exception {
        when(manager.provision(any(), any(), any()))
                .thenThrow(new BuildFailedException("npm install failed", null));

        mockMvc.perform(post("/api/v1/servers").contentType(MediaType.APPLICATION_JSON).content(createBody()))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("BUILD_FAILED"));
    }

    // ── GET ──────────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /servers lists all servers")
    void listServers() throws Exception {
        when(manager.list()).thenReturn(List.of(running()));

        mockMvc.perform(get("/api/v1/servers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].name").value("Space Race"));
    }

    @Test
    @DisplayName("GET /servers/{id} returns 404 for unknown servers")
    void getUnknown() throws Exception {
        when(manager.describe("gs-nope")).thenThrow(new ServerNotFoundException("gs-nope"));

        mockMvc.perform(get("/api/v1/servers/gs-nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Server not found: gs-nope"))
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /servers/{id}/logs passes tail and returns the merged view")
    void logs() throws Exception {
        when(manager.fetchLogs("gs-a", 20)).thenReturn(
                new ServerLogs("gs-a", List.of("[t] Provisioning started", "[container] up"), "container-abc", true));

        mockMvc.perform(get("/api/v1/servers/gs-a/logs").param("tail", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.log_count").value(2))
                .andExpect(jsonPath("$.logs[1]").value("[container] up"))
                .andExpect(jsonPath("$.live").value(true));
    }

    // ── stop / delete ────────────────────────────────────────────────

    @Test
    @DisplayName("POST /servers/{id}/stop returns the stopped instance")
    void stop() throws Exception {
        when(manager.stop("gs-space-race-1a2b3c4d")).thenReturn(running().withStatus(ServerStatus.STOPPED, T0));

        mockMvc.perform(post("/api/v1/servers/gs-space-race-1a2b3c4d/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("STOPPED"));
    }

    @Test
    @DisplayName("DELETE /servers/{id} removes the server")
    void remove() throws Exception {
        mockMvc.perform(delete("/api/v1/servers/gs-a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("removed"));

        verify(manager).remove("gs-a");
    }

    @Test
    @DisplayName("DELETE /servers/{id} returns 404 for unknown servers")
    void removeUnknown() throws Exception {
        doThrow(new ServerNotFoundException("gs-nope")).when(manager).remove(anyString());

        mockMvc.perform(delete("/api/v1/servers/gs-nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /system/resources returns the capacity summary")
    void resources() throws Exception {
        when(manager.resourceSummary()).thenReturn(Map.of("total_servers", 3, "can_create_server", true));

        mockMvc.perform(get("/api/v1/system/resources"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_servers").value(3))
                .andExpect(jsonPath("$.can_create_server").value(true));
    }

    // ── idle reclamation ─────────────────────────────────────────────

    @Test
    @DisplayName("POST /servers/{id}/activity records the connection count")
    void activity() throws Exception {
        when(manager.recordActivity("gs-a", 4)).thenReturn(running().withActivity(4, T0.plusSeconds(30)));

        mockMvc.perform(post("/api/v1/servers/gs-a/activity").param("connection_count", "4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.server_id").value("gs-a"))
                .andExpect(jsonPath("$.connection_count").value(4))
                .andExpect(jsonPath("$.last_activity").value("2026-03-01T12:00:30Z"));
    }

    @Test
    @DisplayName("POST /servers/{id}/activity returns 404 for unknown servers")
    void activityUnknown() throws Exception {
        when(manager.recordActivity("gs-nope", 0)).thenThrow(new ServerNotFoundException("gs-nope"));

        mockMvc.perform(post("/api/v1/servers/gs-nope/activity"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /system/idle-containers returns the idle summary")
    void idleContainers() throws Exception {
        when(manager.idleSummary()).thenReturn(Map.of("count", 1, "idle_timeout_seconds", 1800));

        mockMvc.perform(get("/api/v1/system/idle-containers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.idle_timeout_seconds").value(1800));
    }

    @Test
    @DisplayName("POST /system/cleanup/{id} stops the server")
    void cleanup() throws Exception {
        when(manager.stop("gs-a")).thenReturn(running().withStatus(ServerStatus.STOPPED, T0));

        mockMvc.perform(post("/api/v1/system/cleanup/gs-a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("STOPPED"));

        verify(manager).stop("gs-a");
    }
}

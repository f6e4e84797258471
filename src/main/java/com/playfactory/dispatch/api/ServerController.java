package com.playfactory.dispatch.api;

import com.playfactory.core.error.GameFactoryException;
import com.playfactory.core.model.GameServerInstance;
import com.playfactory.provisioning.GameServerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for game server provisioning and lifecycle.
 */
@RestController
@RequestMapping("/api/v1")
public class ServerController {

    private static final Logger log = LoggerFactory.getLogger(ServerController.class);

    private final GameServerManager manager;

    public ServerController(GameServerManager manager) {
        this.manager = manager;
    }

    /**
     * POST /api/v1/servers: Build and launch a game server from user code. Blocks until the
     * container is running or provisioning has failed.
     */
    @PostMapping("/servers")
    public ResponseEntity<?> create(@RequestBody CreateServerRequest request) {
        try {
            GameServerInstance instance = manager.provision(request.userCode(), request.name(), request.description());
            return ResponseEntity.status(HttpStatus.CREATED).body(instance);
        } catch (GameFactoryException e) {
            log.warn("Provisioning '{}' failed: {}", request.name(), e.getMessage());
            return ApiErrors.of(e);
        }
    }

    @GetMapping("/servers")
    public ResponseEntity<List<GameServerInstance>> list() {
        return ResponseEntity.ok(manager.list());
    }

    /**
     * GET /api/v1/servers/{id}: Current record, with status and stats refreshed from the runtime.
     */
    @GetMapping("/servers/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        try {
            return ResponseEntity.ok(manager.describe(id));
        } catch (GameFactoryException e) {
            return ApiErrors.of(e);
        }
    }

    @GetMapping("/servers/{id}/logs")
    public ResponseEntity<?> logs(@PathVariable String id, @RequestParam(defaultValue = "100") int tail) {
        try {
            return ResponseEntity.ok(manager.fetchLogs(id, tail));
        } catch (GameFactoryException e) {
            return ApiErrors.of(e);
        }
    }

    @GetMapping("/servers/{id}/stats")
    public ResponseEntity<?> stats(@PathVariable String id) {
        try {
            return ResponseEntity.ok(manager.refreshStats(id));
        } catch (GameFactoryException e) {
            return ApiErrors.of(e);
        }
    }

    @PostMapping("/servers/{id}/stop")
    public ResponseEntity<?> stop(@PathVariable String id) {
        try {
            return ResponseEntity.ok(manager.stop(id));
        } catch (GameFactoryException e) {
            return ApiErrors.of(e);
        }
    }

    @DeleteMapping("/servers/{id}")
    public ResponseEntity<Map<String, Object>> remove(@PathVariable String id) {
        try {
            manager.remove(id);
            return ResponseEntity.ok(Map.of("server_id", id, "status", "removed"));
        } catch (GameFactoryException e) {
            return ApiErrors.of(e);
        }
    }

    /**
     * POST /api/v1/servers/{id}/activity: Resets the server's idle clock. Game servers call this
     * with their current player count.
     */
    @PostMapping("/servers/{id}/activity")
    public ResponseEntity<?> activity(@PathVariable String id,
                                      @RequestParam(name = "connection_count", defaultValue = "0") int connections) {
        try {
            GameServerInstance updated = manager.recordActivity(id, connections);
            return ResponseEntity.ok(Map.of(
                    "server_id", id,
                    "connection_count", updated.connections(),
                    "last_activity", updated.lastActivity().toString()));
        } catch (GameFactoryException e) {
            return ApiErrors.of(e);
        }
    }

    @GetMapping("/system/idle-containers")
    public ResponseEntity<Map<String, Object>> idleContainers() {
        return ResponseEntity.ok(manager.idleSummary());
    }

    /**
     * POST /api/v1/system/cleanup/{id}: Stops the server right away, whatever its idle state.
     */
    @PostMapping("/system/cleanup/{id}")
    public ResponseEntity<?> cleanup(@PathVariable String id) {
        try {
            GameServerInstance instance = manager.stop(id);
            log.info("Forced cleanup of {} left it {}", id, instance.status());
            return ResponseEntity.ok(instance);
        } catch (GameFactoryException e) {
            return ApiErrors.of(e);
        }
    }

    /**
     * GET /api/v1/system/resources: Capacity summary and whether a new server would be admitted.
     */
    @GetMapping("/system/resources")
    public ResponseEntity<Map<String, Object>> resources() {
        return ResponseEntity.ok(manager.resourceSummary());
    }
}

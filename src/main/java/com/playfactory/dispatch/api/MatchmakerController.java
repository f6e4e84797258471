package com.playfactory.dispatch.api;

import com.playfactory.core.error.GameFactoryException;
import com.playfactory.core.model.MatchmakerEntry;
import com.playfactory.matchmaker.LivenessRegistry;
import com.playfactory.matchmaker.ServerListing;
import com.playfactory.matchmaker.ServerRegistration;
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
 * REST controller used by game servers to announce themselves and by clients to find a room.
 */
@RestController
@RequestMapping("/api/v1/matchmaker")
public class MatchmakerController {

    private final LivenessRegistry registry;

    public MatchmakerController(LivenessRegistry registry) {
        this.registry = registry;
    }

    @PostMapping("/register")
    public ResponseEntity<Map<String, Object>> register(@RequestBody ServerRegistration registration) {
        try {
            String serverId = registry.register(registration);
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(Map.of("server_id", serverId, "status", "registered"));
        } catch (GameFactoryException e) {
            return ApiErrors.of(e);
        }
    }

    /**
     * POST /api/v1/matchmaker/heartbeat/{id}: Keep an entry alive; the body is optional.
     */
    @PostMapping("/heartbeat/{id}")
    public ResponseEntity<Map<String, Object>> heartbeat(@PathVariable String id,
                                                         @RequestBody(required = false) HeartbeatRequest request) {
        try {
            MatchmakerEntry entry = registry.heartbeat(id, request != null ? request.currentPlayers() : null);
            return ResponseEntity.ok(Map.of(
                    "server_id", entry.serverId(),
                    "status", "ok",
                    "last_heartbeat", entry.lastHeartbeat().toString()));
        } catch (GameFactoryException e) {
            return ApiErrors.of(e);
        }
    }

    @GetMapping("/servers")
    public ResponseEntity<List<ServerListing>> list(
            @RequestParam(name = "active_only", defaultValue = "true") boolean activeOnly) {
        return ResponseEntity.ok(registry.listing(activeOnly));
    }

    @GetMapping("/servers/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        try {
            return ResponseEntity.ok(registry.get(id));
        } catch (GameFactoryException e) {
            return ApiErrors.of(e);
        }
    }

    @DeleteMapping("/servers/{id}")
    public ResponseEntity<Map<String, Object>> unregister(@PathVariable String id) {
        try {
            registry.unregister(id);
            return ResponseEntity.ok(Map.of("server_id", id, "status", "unregistered"));
        } catch (GameFactoryException e) {
            return ApiErrors.of(e);
        }
    }
}

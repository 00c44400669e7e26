package com.example.toolgateway.controller;

import com.example.toolgateway.domain.Connection;
import com.example.toolgateway.service.ConnectionService;
import com.example.toolgateway.service.ConnectionService.ConnectionUpdate;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.example.toolgateway.controller.GatewayController.USER_HEADER;

/**
 * REST API for a user's backend connections. Credentials are write-only and
 * never returned.
 */
@RestController
@RequestMapping("/api/connections")
@RequiredArgsConstructor
public class ConnectionController {

    private final ConnectionService connectionService;

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> list(@RequestHeader(USER_HEADER) String userId,
                                                          @RequestParam(defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(connectionService.getUserConnections(userId, activeOnly).stream()
                .map(this::toView)
                .collect(Collectors.toList()));
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestHeader(USER_HEADER) String userId,
                                    @RequestBody ConnectionCreateRequest request) {
        try {
            Connection connection = connectionService.create(userId, request.getName(), request.getKind(),
                    request.getDescription(), request.getConfig(), request.getCredentials());
            return ResponseEntity.status(HttpStatus.CREATED).body(toView(connection));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> get(@RequestHeader(USER_HEADER) String userId,
                                                   @PathVariable String id) {
        try {
            return ResponseEntity.ok(toView(connectionService.getConnection(id, userId)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @PutMapping("/{id}")
    public ResponseEntity<?> update(@RequestHeader(USER_HEADER) String userId,
                                    @PathVariable String id,
                                    @RequestBody ConnectionUpdate request) {
        try {
            connectionService.getConnection(id, userId);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.notFound().build();
        }
        try {
            return ResponseEntity.ok(toView(connectionService.update(id, userId, request)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(USER_HEADER) String userId, @PathVariable String id) {
        try {
            connectionService.delete(id, userId);
            return ResponseEntity.noContent().build();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @PostMapping("/{id}/test")
    public ResponseEntity<Map<String, Object>> test(@RequestHeader(USER_HEADER) String userId,
                                                    @PathVariable String id) {
        try {
            connectionService.getConnection(id, userId);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(connectionService.testConnection(id, userId));
    }

    private Map<String, Object> toView(Connection connection) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("id", connection.getId());
        item.put("name", connection.getName());
        item.put("kind", connection.getKind());
        item.put("description", connection.getDescription());
        item.put("config", connectionService.getConfig(connection));
        item.put("hasCredentials", connection.getEncryptedCredentials() != null);
        item.put("enabled", connection.isEnabled());
        item.put("lastTestedAt", connection.getLastTestedAt() != null ? connection.getLastTestedAt().toString() : null);
        item.put("lastTestStatus", connection.getLastTestStatus());
        item.put("lastTestError", connection.getLastTestError());
        item.put("createdAt", connection.getCreatedAt() != null ? connection.getCreatedAt().toString() : null);
        item.put("updatedAt", connection.getUpdatedAt() != null ? connection.getUpdatedAt().toString() : null);
        return item;
    }

    @Data
    public static class ConnectionCreateRequest {
        private String name;
        private String kind;
        private String description;
        private Map<String, Object> config;
        private Map<String, Object> credentials;
    }
}

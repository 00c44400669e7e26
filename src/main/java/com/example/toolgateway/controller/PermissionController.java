package com.example.toolgateway.controller;

import com.example.toolgateway.domain.PermissionType;
import com.example.toolgateway.domain.ToolPermission;
import com.example.toolgateway.service.ToolPermissionService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.example.toolgateway.controller.GatewayController.USER_HEADER;

/**
 * Permission administration. The X-User-Id header identifies the
 * administrator making the change; the target user is in the request.
 */
@RestController
@RequestMapping("/api/permissions")
@RequiredArgsConstructor
public class PermissionController {

    private final ToolPermissionService permissionService;

    @GetMapping
    public ResponseEntity<List<ToolPermission>> list(@RequestParam String userId,
                                                     @RequestParam(required = false) String connectionId) {
        return ResponseEntity.ok(permissionService.getUserPermissions(userId, connectionId));
    }

    @PutMapping
    public ResponseEntity<?> set(@RequestHeader(USER_HEADER) String adminId,
                                 @RequestBody PermissionRequest request) {
        try {
            ToolPermission permission = permissionService.setPermission(
                    request.getUserId(), request.getConnectionId(), request.getToolName(),
                    request.getPermissionType(), adminId, request.getParamConstraints(),
                    request.getExpiresAt(), request.getAllowedHours(), request.getAllowedDays(),
                    request.getRateLimit());
            return ResponseEntity.ok(permission);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/bulk")
    public ResponseEntity<?> bulkSet(@RequestHeader(USER_HEADER) String adminId,
                                     @RequestBody BulkPermissionRequest request) {
        try {
            return ResponseEntity.ok(permissionService.bulkSetPermissions(
                    request.getUserId(), request.getConnectionId(), request.getPermissions(), adminId));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@RequestHeader(USER_HEADER) String adminId, @PathVariable String id) {
        try {
            return permissionService.deletePermission(id, adminId)
                    ? ResponseEntity.noContent().build()
                    : ResponseEntity.notFound().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/connections/{connectionId}/tools")
    public ResponseEntity<?> connectionTools(@RequestHeader(USER_HEADER) String ownerId,
                                             @PathVariable String connectionId) {
        try {
            List<String> tools = permissionService.getConnectionTools(connectionId, ownerId);
            return ResponseEntity.ok(Map.of("connectionId", connectionId, "tools", tools));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Data
    public static class PermissionRequest {
        private String userId;
        private String connectionId;
        private String toolName;
        private PermissionType permissionType;
        private Map<String, Object> paramConstraints;
        private Instant expiresAt;
        private List<Integer> allowedHours;
        private List<String> allowedDays;
        private Map<String, Object> rateLimit;
    }

    @Data
    public static class BulkPermissionRequest {
        private String userId;
        private String connectionId;
        private Map<String, PermissionType> permissions;
    }
}

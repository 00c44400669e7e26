package com.example.toolgateway.controller;

import com.example.toolgateway.backend.ToolCallResult;
import com.example.toolgateway.gateway.ToolGateway;
import com.example.toolgateway.gateway.UserGatewayManager;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Tool listing and invocation for the calling agent. The caller identity comes
 * from the X-User-Id header set by the authenticating proxy.
 */
@RestController
@RequestMapping("/api/gateway")
@RequiredArgsConstructor
public class GatewayController {

    static final String USER_HEADER = "X-User-Id";

    private final UserGatewayManager gatewayManager;

    @GetMapping("/tools")
    public ResponseEntity<Map<String, Object>> listTools(@RequestHeader(USER_HEADER) String userId) {
        List<Map<String, Object>> tools = gatewayManager.getOrBuild(userId).listTools();
        return ResponseEntity.ok(Map.of("tools", tools, "count", tools.size()));
    }

    /**
     * Call a tool. Denials and backend failures come back as a 200 with
     * {@code success=false}; only a malformed request is a 400.
     */
    @PostMapping("/call")
    public ResponseEntity<?> call(@RequestHeader(USER_HEADER) String userId,
                                  @RequestBody ToolCallRequest request) {
        if (request.getToolName() == null || request.getToolName().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "toolName is required"));
        }
        ToolGateway gateway = gatewayManager.getOrBuild(userId);
        ToolCallResult result = gateway.callTool(request.getToolName(), request.getParams(), userId,
                request.getUserQuery(), request.getSessionId());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload(@RequestHeader(USER_HEADER) String userId) {
        ToolGateway gateway = gatewayManager.reload(userId);
        return ResponseEntity.ok(Map.of(
                "reloaded", true,
                "connections", gateway.getConnections().size(),
                "tools", gateway.listTools().size()));
    }

    @Data
    public static class ToolCallRequest {
        private String toolName;
        private Map<String, Object> params;
        private String userQuery;
        private String sessionId;
    }
}

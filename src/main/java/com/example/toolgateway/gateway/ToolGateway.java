package com.example.toolgateway.gateway;

import com.example.toolgateway.backend.BackendClient;
import com.example.toolgateway.backend.ToolCallResult;
import com.example.toolgateway.backend.ToolDefinition;
import com.example.toolgateway.domain.AuditStatus;
import com.example.toolgateway.domain.Connection;
import com.example.toolgateway.exception.BackendException;
import com.example.toolgateway.exception.NameFormatException;
import com.example.toolgateway.exception.NoConnectionException;
import com.example.toolgateway.exception.PermissionDeniedException;
import com.example.toolgateway.service.AuditService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One user's live set of backend connections, and the dispatcher for their tool calls.
 *
 * Call flow:
 * 1. Parse "kind.tool". A malformed name fails without an audit record.
 * 2. Resolve the first enabled connection of that kind.
 * 3. Check policy. Denials are audited and never reach the backend.
 * 4. Call the backend on the backend executor, bounded by the call timeout.
 * 5. Audit the outcome exactly once and return it.
 *
 * Nothing thrown after step 1 escapes {@link #callTool}.
 */
@Slf4j
public class ToolGateway implements AutoCloseable {

    private final String userId;
    private final ToolPolicyEngine policyEngine;
    private final AuditService auditService;
    private final AsyncTaskExecutor backendExecutor;
    private final MeterRegistry meterRegistry;
    private final Duration callTimeout;

    // Registration happens only while the gateway is built, before it is shared
    private final Map<String, GatewayConnection> connections = new LinkedHashMap<>();

    public ToolGateway(String userId, ToolPolicyEngine policyEngine, AuditService auditService,
                       AsyncTaskExecutor backendExecutor, MeterRegistry meterRegistry, Duration callTimeout) {
        this.userId = userId;
        this.policyEngine = policyEngine;
        this.auditService = auditService;
        this.backendExecutor = backendExecutor;
        this.meterRegistry = meterRegistry;
        this.callTimeout = callTimeout;
    }

    void register(Connection connection, BackendClient client, List<ToolDefinition> tools) {
        connections.put(connection.getId(), new GatewayConnection(connection, client, List.copyOf(tools)));
        log.info("Registered {} connection '{}' for user {} with {} tools",
                connection.getKind(), connection.getName(), userId, tools.size());
    }

    public String getUserId() {
        return userId;
    }

    public Collection<GatewayConnection> getConnections() {
        return Collections.unmodifiableCollection(connections.values());
    }

    /**
     * Tool catalog across all connections. Names are qualified and descriptions
     * carry the connection's display name.
     */
    public List<Map<String, Object>> listTools() {
        List<Map<String, Object>> tools = new ArrayList<>();
        for (GatewayConnection connection : connections.values()) {
            for (ToolDefinition tool : connection.tools()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("name", QualifiedToolName.of(connection.kind(), tool.getName()));
                entry.put("description", "[" + connection.name() + "] " + tool.getDescription());
                entry.put("parameters", tool.getParameters() != null ? tool.getParameters() : Map.of());
                tools.add(entry);
            }
        }
        return tools;
    }

    public ToolCallResult callTool(String qualifiedName, Map<String, Object> params,
                                   String callerUserId, String userQuery, String sessionId) {
        QualifiedToolName name;
        try {
            name = QualifiedToolName.parse(qualifiedName);
        } catch (NameFormatException e) {
            log.debug("Rejected tool call from {}: {}", callerUserId, e.getMessage());
            return ToolCallResult.failure(e.getMessage());
        }
        Map<String, Object> args = params != null ? params : Map.of();

        ToolCallResult result;
        AuditStatus status;
        long durationMs = 0;
        try {
            GatewayConnection target = resolve(name.kind());
            checkPermission(callerUserId, target, name.tool(), args);

            long start = System.nanoTime();
            try {
                result = invoke(target.client(), name.tool(), args);
            } finally {
                durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                meterRegistry.timer("gateway.backend.duration", "kind", name.kind())
                        .record(durationMs, TimeUnit.MILLISECONDS);
            }
            status = result.isSuccess() ? AuditStatus.SUCCESS : AuditStatus.FAIL;
        } catch (NoConnectionException e) {
            result = ToolCallResult.failure(e.getMessage());
            status = AuditStatus.FAIL;
        } catch (PermissionDeniedException e) {
            result = ToolCallResult.failure("Permission denied: " + e.getMessage());
            status = AuditStatus.DENIED;
        } catch (BackendException e) {
            log.warn("Backend call {} failed for user {}: {}", qualifiedName, callerUserId, e.getMessage());
            result = ToolCallResult.failure(e.getMessage());
            status = AuditStatus.FAIL;
        } catch (RuntimeException e) {
            log.error("Unexpected failure dispatching {} for user {}", qualifiedName, callerUserId, e);
            result = ToolCallResult.failure("Internal error: " + e.getMessage());
            status = AuditStatus.FAIL;
        }
        result.setExecutionTimeMs(durationMs);

        auditService.record(callerUserId, qualifiedName, args, result.getData(), status,
                userQuery, sessionId, result.getError(), durationMs);
        meterRegistry.counter("gateway.tool.calls",
                "kind", name.kind(), "status", status.name().toLowerCase(Locale.ROOT)).increment();
        return result;
    }

    private GatewayConnection resolve(String kind) {
        return connections.values().stream()
                .filter(c -> c.kind().equals(kind) && c.connection().isEnabled())
                .findFirst()
                .orElseThrow(() -> new NoConnectionException(kind));
    }

    private void checkPermission(String callerUserId, GatewayConnection target, String tool, Map<String, Object> args) {
        PermissionDecision decision;
        try {
            decision = policyEngine.check(callerUserId, target.id(), tool, args);
        } catch (RuntimeException e) {
            log.warn("Permission check failed for user {} tool {}, allowing: {}", callerUserId, tool, e.getMessage());
            return;
        }
        if (!decision.allowed()) {
            throw new PermissionDeniedException(decision.reason());
        }
    }

    private ToolCallResult invoke(BackendClient client, String tool, Map<String, Object> args) {
        Future<ToolCallResult> future;
        try {
            future = backendExecutor.submit(() -> client.callTool(tool, args));
        } catch (RejectedExecutionException e) {
            throw new BackendException("Backend executor is saturated, call rejected", e);
        }
        try {
            ToolCallResult result = future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new BackendException("Backend returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new BackendException("Backend call timed out after " + callTimeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BackendException("Backend call cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            throw new BackendException("Backend error: " + message, cause);
        }
    }

    /**
     * Disconnect every backend client. Calls still in flight may fail.
     */
    @Override
    public void close() {
        for (GatewayConnection connection : connections.values()) {
            try {
                connection.client().disconnect();
            } catch (RuntimeException e) {
                log.warn("Failed to disconnect '{}' for user {}: {}", connection.name(), userId, e.getMessage());
            }
        }
        log.info("Closed gateway for user {} ({} connections)", userId, connections.size());
    }
}

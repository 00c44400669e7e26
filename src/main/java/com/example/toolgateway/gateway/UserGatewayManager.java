package com.example.toolgateway.gateway;

import com.example.toolgateway.backend.BackendClient;
import com.example.toolgateway.backend.BackendClientRegistry;
import com.example.toolgateway.backend.ToolDefinition;
import com.example.toolgateway.config.GatewayProperties;
import com.example.toolgateway.domain.Connection;
import com.example.toolgateway.exception.VaultException;
import com.example.toolgateway.service.AuditService;
import com.example.toolgateway.service.ConnectionService;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Lazily builds and caches one {@link ToolGateway} per user.
 *
 * Concurrent first access for the same user shares a single build, so each
 * connection record gets exactly one connected client. Evicted or invalidated
 * gateways are closed, which releases their backend pools.
 */
@Slf4j
@Service
public class UserGatewayManager {

    private final ConnectionService connectionService;
    private final BackendClientRegistry clientRegistry;
    private final ToolPolicyEngine policyEngine;
    private final AuditService auditService;
    private final AsyncTaskExecutor backendExecutor;
    private final MeterRegistry meterRegistry;
    private final Duration callTimeout;
    private final AsyncCache<String, ToolGateway> gateways;

    public UserGatewayManager(ConnectionService connectionService,
                              BackendClientRegistry clientRegistry,
                              ToolPolicyEngine policyEngine,
                              AuditService auditService,
                              @Qualifier("backendExecutor") AsyncTaskExecutor backendExecutor,
                              @Qualifier("gatewayBuildExecutor") Executor buildExecutor,
                              MeterRegistry meterRegistry,
                              GatewayProperties properties) {
        this.connectionService = connectionService;
        this.clientRegistry = clientRegistry;
        this.policyEngine = policyEngine;
        this.auditService = auditService;
        this.backendExecutor = backendExecutor;
        this.meterRegistry = meterRegistry;
        this.callTimeout = Duration.ofSeconds(properties.getBackend().getCallTimeoutSeconds());
        this.gateways = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofMinutes(properties.getCache().getIdleTimeoutMinutes()))
                .maximumSize(properties.getCache().getMaximumUsers())
                .executor(buildExecutor)
                .removalListener((String userId, ToolGateway gateway, RemovalCause cause) -> {
                    if (gateway != null) {
                        log.info("Removing gateway for user {} ({})", userId, cause);
                        gateway.close();
                    }
                })
                .buildAsync();
    }

    /**
     * Return the user's gateway, building and connecting it on first access.
     */
    public ToolGateway getOrBuild(String userId) {
        try {
            return gateways.get(userId, this::build).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    public boolean isCached(String userId) {
        return gateways.getIfPresent(userId) != null;
    }

    /**
     * Drop the user's gateway; the next access rebuilds it.
     */
    public void invalidate(String userId) {
        gateways.synchronous().invalidate(userId);
        log.debug("Invalidated gateway for user {}", userId);
    }

    public ToolGateway reload(String userId) {
        invalidate(userId);
        return getOrBuild(userId);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing all cached gateways");
        gateways.synchronous().asMap().forEach((userId, gateway) -> gateway.close());
    }

    private ToolGateway build(String userId) {
        ToolGateway gateway = new ToolGateway(userId, policyEngine, auditService, backendExecutor,
                meterRegistry, callTimeout);
        List<Connection> connections = connectionService.getUserConnections(userId, true);
        for (Connection connection : connections) {
            BackendClient client = createClient(connection);
            if (client == null) {
                continue;
            }
            try {
                List<ToolDefinition> tools = client.listTools();
                gateway.register(connection, client, tools);
            } catch (RuntimeException e) {
                log.warn("Tool discovery failed for connection '{}' ({}), skipping: {}",
                        connection.getName(), connection.getId(), e.getMessage());
                client.disconnect();
            }
        }
        log.info("Built gateway for user {}: {}/{} connections active",
                userId, gateway.getConnections().size(), connections.size());
        return gateway;
    }

    private BackendClient createClient(Connection connection) {
        try {
            Map<String, Object> credentials = connectionService.getDecryptedCredentials(connection);
            Map<String, Object> config = connectionService.getConfig(connection);
            BackendClient client = clientRegistry.create(connection, config, credentials);
            if (!client.connect()) {
                log.warn("Connection '{}' ({}) failed to connect, skipping", connection.getName(), connection.getId());
                client.disconnect();
                return null;
            }
            return client;
        } catch (VaultException e) {
            log.error("Credentials for connection '{}' ({}) could not be decrypted, skipping: {}",
                    connection.getName(), connection.getId(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Could not create client for connection '{}' ({}), skipping: {}",
                    connection.getName(), connection.getId(), e.getMessage());
        }
        return null;
    }
}

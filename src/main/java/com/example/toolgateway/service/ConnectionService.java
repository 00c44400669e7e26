package com.example.toolgateway.service;

import com.example.toolgateway.backend.BackendClient;
import com.example.toolgateway.backend.BackendClientRegistry;
import com.example.toolgateway.backend.ToolDefinition;
import com.example.toolgateway.domain.Connection;
import com.example.toolgateway.gateway.UserGatewayManager;
import com.example.toolgateway.repository.ConnectionRepository;
import com.example.toolgateway.repository.ToolPermissionRepository;
import com.example.toolgateway.security.CredentialVault;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Connection registry: CRUD over a user's backend connections.
 *
 * Credentials are encrypted before they are stored and decrypted only for
 * gateway construction and connection tests. Any change to a user's
 * connections drops that user's cached gateway once the change has committed,
 * so a rebuild never sees the old rows.
 */
@Slf4j
@Service
public class ConnectionService {

    public static final String TEST_SUCCESS = "success";
    public static final String TEST_FAILED = "failed";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ConnectionRepository connectionRepository;
    private final ToolPermissionRepository permissionRepository;
    private final CredentialVault vault;
    private final BackendClientRegistry clientRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final UserGatewayManager gatewayManager;

    public ConnectionService(ConnectionRepository connectionRepository,
                             ToolPermissionRepository permissionRepository,
                             CredentialVault vault,
                             BackendClientRegistry clientRegistry,
                             ObjectMapper objectMapper,
                             Clock clock,
                             @Lazy UserGatewayManager gatewayManager) {
        this.connectionRepository = connectionRepository;
        this.permissionRepository = permissionRepository;
        this.vault = vault;
        this.clientRegistry = clientRegistry;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.gatewayManager = gatewayManager;
    }

    @Transactional
    public Connection create(String ownerId, String name, String kind, String description,
                             Map<String, Object> config, Map<String, Object> credentials) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Connection name is required");
        }
        if (!clientRegistry.supports(kind)) {
            throw new IllegalArgumentException("Unsupported connection kind: " + kind
                    + " (supported: " + clientRegistry.getKinds() + ")");
        }
        if (connectionRepository.existsByOwnerIdAndName(ownerId, name)) {
            throw new IllegalStateException("Connection name already exists: " + name);
        }

        Connection connection = Connection.builder()
                .ownerId(ownerId)
                .name(name)
                .kind(kind)
                .description(description)
                .config(toJson(config))
                .encryptedCredentials(credentials != null && !credentials.isEmpty() ? vault.encrypt(credentials) : null)
                .enabled(true)
                .build();
        validateConfig(connection, config);
        connection = connectionRepository.save(connection);
        log.info("Created {} connection '{}' ({}) for {}", kind, name, connection.getId(), ownerId);

        invalidateAfterCommit(ownerId);
        return connection;
    }

    /** The owner's connections, newest first */
    public List<Connection> getUserConnections(String ownerId, boolean activeOnly) {
        return activeOnly
                ? connectionRepository.findByOwnerIdAndEnabledOrderByCreatedAtDesc(ownerId, true)
                : connectionRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    /**
     * A connection visible to its owner only.
     *
     * @throws IllegalArgumentException if it does not exist or belongs to someone else
     */
    public Connection getConnection(String id, String ownerId) {
        return connectionRepository.findByIdAndOwnerId(id, ownerId)
                .orElseThrow(() -> new IllegalArgumentException("Connection not found: " + id));
    }

    @Transactional
    public Connection update(String id, String ownerId, ConnectionUpdate update) {
        Connection connection = getConnection(id, ownerId);

        if (update.getName() != null && !update.getName().equals(connection.getName())) {
            if (update.getName().isBlank()) {
                throw new IllegalArgumentException("Connection name is required");
            }
            if (connectionRepository.existsByOwnerIdAndName(ownerId, update.getName())) {
                throw new IllegalStateException("Connection name already exists: " + update.getName());
            }
            connection.setName(update.getName());
        }
        if (update.getDescription() != null) connection.setDescription(update.getDescription());
        if (update.getConfig() != null) {
            validateConfig(connection, update.getConfig());
            connection.setConfig(toJson(update.getConfig()));
        }
        if (update.getCredentials() != null) {
            connection.setEncryptedCredentials(update.getCredentials().isEmpty() ? null : vault.encrypt(update.getCredentials()));
        }
        if (update.getEnabled() != null) connection.setEnabled(update.getEnabled());

        connection = connectionRepository.save(connection);
        log.info("Updated connection '{}' ({}) for {}", connection.getName(), id, ownerId);

        invalidateAfterCommit(ownerId);
        return connection;
    }

    /**
     * Delete a connection together with every permission row that refers to it.
     */
    @Transactional
    public void delete(String id, String ownerId) {
        Connection connection = getConnection(id, ownerId);
        long removed = permissionRepository.deleteByConnectionId(id);
        connectionRepository.delete(connection);
        log.info("Deleted connection '{}' ({}) for {}, {} permission rows removed",
                connection.getName(), id, ownerId, removed);

        invalidateAfterCommit(ownerId);
    }

    /**
     * Record a health-check outcome. Live clients are unaffected, so the
     * cached gateway is kept.
     */
    @Transactional
    public Connection updateTestStatus(String id, String ownerId, String status, String error) {
        Connection connection = getConnection(id, ownerId);
        return saveTestStatus(connection, status, error);
    }

    /**
     * Decrypt the stored credentials. A connection without a blob has no
     * credentials; a blob that cannot be decrypted raises VaultException.
     */
    public Map<String, Object> getDecryptedCredentials(Connection connection) {
        String blob = connection.getEncryptedCredentials();
        if (blob == null || blob.isBlank()) {
            return Map.of();
        }
        return vault.decrypt(blob);
    }

    public Map<String, Object> getConfig(Connection connection) {
        String json = connection.getConfig();
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Connection " + connection.getId() + " has invalid config JSON", e);
        }
    }

    /**
     * Connect a throwaway client, list its tools and record the outcome.
     */
    @Transactional
    public Map<String, Object> testConnection(String id, String ownerId) {
        return testConnection(getConnection(id, ownerId));
    }

    @Transactional
    public Map<String, Object> testConnection(Connection connection) {
        BackendClient client = null;
        List<String> tools = List.of();
        String error = null;
        try {
            client = clientRegistry.create(connection, getConfig(connection), getDecryptedCredentials(connection));
            if (client.connect()) {
                tools = client.listTools().stream().map(ToolDefinition::getName).toList();
            } else {
                error = "Could not connect to " + connection.getKind() + " backend";
            }
        } catch (RuntimeException e) {
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        } finally {
            if (client != null) {
                client.disconnect();
            }
        }

        boolean success = error == null;
        saveTestStatus(connection, success ? TEST_SUCCESS : TEST_FAILED, error);
        log.info("Connection test for '{}' ({}): {}", connection.getName(), connection.getId(),
                success ? TEST_SUCCESS : TEST_FAILED + " - " + error);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", success);
        result.put("tools", tools);
        result.put("error", error);
        return result;
    }

    /**
     * Build an unconnected client so the kind's factory can reject a bad config
     * before it is stored.
     */
    private void validateConfig(Connection connection, Map<String, Object> config) {
        clientRegistry.create(connection, config != null ? config : Map.of(), Map.of());
    }

    private void invalidateAfterCommit(String ownerId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            gatewayManager.invalidate(ownerId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                gatewayManager.invalidate(ownerId);
            }
        });
    }

    private Connection saveTestStatus(Connection connection, String status, String error) {
        connection.setLastTestedAt(clock.instant());
        connection.setLastTestStatus(status);
        connection.setLastTestError(error);
        return connectionRepository.save(connection);
    }

    private String toJson(Map<String, Object> value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Connection config is not serializable", e);
        }
    }

    /**
     * Partial update. Null fields are left unchanged; an empty credential map
     * clears the stored credentials.
     */
    @Data
    public static class ConnectionUpdate {
        private String name;
        private String description;
        private Map<String, Object> config;
        private Map<String, Object> credentials;
        private Boolean enabled;
    }
}

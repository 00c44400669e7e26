package com.example.toolgateway.service;

import com.example.toolgateway.backend.BackendClientRegistry;
import com.example.toolgateway.backend.ToolDefinition;
import com.example.toolgateway.domain.Connection;
import com.example.toolgateway.domain.PermissionType;
import com.example.toolgateway.domain.ToolPermission;
import com.example.toolgateway.gateway.GatewayConnection;
import com.example.toolgateway.gateway.UserGatewayManager;
import com.example.toolgateway.repository.ConnectionRepository;
import com.example.toolgateway.repository.ToolPermissionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Administration of per-(user, connection, tool) policy rows. Not on the
 * tool-call path: the gateway reads rows through {@code ToolPolicyEngine}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolPermissionService {

    private final ToolPermissionRepository permissionRepository;
    private final ConnectionRepository connectionRepository;
    private final ConnectionService connectionService;
    private final UserGatewayManager gatewayManager;
    private final BackendClientRegistry clientRegistry;
    private final ObjectMapper objectMapper;

    public ToolPermission setPermission(String userId, String connectionId, String toolName,
                                        PermissionType type, String createdBy) {
        return setPermission(userId, connectionId, toolName, type, createdBy, null, null, null, null, null);
    }

    /**
     * Create or replace the policy row for the triple.
     *
     * @throws IllegalStateException    if {@code createdBy} is the user being granted
     * @throws IllegalArgumentException for an unknown connection or malformed restrictions
     */
    @Transactional
    public ToolPermission setPermission(String userId, String connectionId, String toolName,
                                        PermissionType type, String createdBy,
                                        Map<String, Object> paramConstraints, Instant expiresAt,
                                        Collection<Integer> allowedHours, Collection<String> allowedDays,
                                        Map<String, Object> rateLimit) {
        requireNotSelf(userId, createdBy);
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("Tool name is required");
        }
        if (!connectionRepository.existsById(connectionId)) {
            throw new IllegalArgumentException("Connection not found: " + connectionId);
        }

        ToolPermission permission = permissionRepository
                .findByUserIdAndConnectionIdAndToolName(userId, connectionId, toolName)
                .orElseGet(() -> ToolPermission.builder()
                        .userId(userId)
                        .connectionId(connectionId)
                        .toolName(toolName)
                        .build());

        permission.setPermissionType(type != null ? type : PermissionType.ALLOWED);
        permission.setCreatedBy(createdBy);
        permission.setParamConstraints(toJson(paramConstraints));
        permission.setExpiresAt(expiresAt);
        permission.setAllowedHours(hoursCsv(allowedHours));
        permission.setAllowedDays(daysCsv(allowedDays));
        permission.setRateLimit(toJson(rateLimit));

        permission = permissionRepository.save(permission);
        log.info("Permission set: user={} connection={} tool={} type={} by {}",
                userId, connectionId, toolName, permission.getPermissionType(), createdBy);
        return permission;
    }

    @Transactional
    public List<ToolPermission> bulkSetPermissions(String userId, String connectionId,
                                                   Map<String, PermissionType> permissions, String createdBy) {
        requireNotSelf(userId, createdBy);
        List<ToolPermission> saved = new ArrayList<>();
        permissions.forEach((tool, type) -> saved.add(setPermission(userId, connectionId, tool, type, createdBy)));
        return saved;
    }

    /**
     * @return false if no row had that id
     * @throws IllegalStateException if {@code deletedBy} is the user the row applies to
     */
    @Transactional
    public boolean deletePermission(String permissionId, String deletedBy) {
        Optional<ToolPermission> existing = permissionRepository.findById(permissionId);
        if (existing.isEmpty()) {
            return false;
        }
        ToolPermission permission = existing.get();
        requireNotSelf(permission.getUserId(), deletedBy);
        permissionRepository.delete(permission);
        log.info("Permission {} ({} on {}) deleted by {}", permissionId, permission.getToolName(),
                permission.getConnectionId(), deletedBy);
        return true;
    }

    private static void requireNotSelf(String userId, String actorId) {
        if (actorId != null && actorId.equals(userId)) {
            throw new IllegalStateException("Users cannot change their own permissions");
        }
    }

    /** Ordered by connection, then tool */
    public List<ToolPermission> getUserPermissions(String userId, String connectionId) {
        return connectionId != null
                ? permissionRepository.findByUserIdAndConnectionIdOrderByToolNameAsc(userId, connectionId)
                : permissionRepository.findByUserIdOrderByConnectionIdAscToolNameAsc(userId);
    }

    /**
     * Tool names a connection offers: the live catalog when the connection is
     * loaded in the owner's gateway, otherwise the kind's default list.
     */
    public List<String> getConnectionTools(String connectionId, String ownerId) {
        Connection connection = connectionService.getConnection(connectionId, ownerId);
        try {
            List<String> live = gatewayManager.getOrBuild(ownerId).getConnections().stream()
                    .filter(c -> c.id().equals(connectionId))
                    .findFirst()
                    .map(GatewayConnection::tools)
                    .map(tools -> tools.stream().map(ToolDefinition::getName).toList())
                    .orElse(null);
            if (live != null) {
                return live;
            }
        } catch (RuntimeException e) {
            log.warn("Could not load live tools for connection {}: {}", connectionId, e.getMessage());
        }
        return clientRegistry.defaultToolNames(connection.getKind());
    }

    private String toJson(Map<String, Object> value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable: " + e.getMessage(), e);
        }
    }

    private static String hoursCsv(Collection<Integer> hours) {
        if (hours == null || hours.isEmpty()) {
            return null;
        }
        for (Integer hour : hours) {
            if (hour == null || hour < 0 || hour > 23) {
                throw new IllegalArgumentException("Allowed hours must be between 0 and 23, got " + hour);
            }
        }
        return hours.stream().sorted().distinct().map(String::valueOf).collect(Collectors.joining(","));
    }

    private static String daysCsv(Collection<String> days) {
        if (days == null || days.isEmpty()) {
            return null;
        }
        List<String> normalized = new ArrayList<>();
        for (String day : days) {
            try {
                normalized.add(DayOfWeek.valueOf(day.trim().toUpperCase(Locale.ROOT)).name().toLowerCase(Locale.ROOT));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new IllegalArgumentException("Unknown weekday: " + day, e);
            }
        }
        return normalized.stream().distinct().collect(Collectors.joining(","));
    }
}

package com.example.toolgateway.gateway;

import com.example.toolgateway.config.GatewayProperties;
import com.example.toolgateway.domain.PermissionType;
import com.example.toolgateway.domain.ToolPermission;
import com.example.toolgateway.repository.ToolPermissionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;

/**
 * Per-(user, connection, tool) policy evaluation.
 *
 * Rules are evaluated in order and the first match wins:
 * 1. No policy row: allow
 * 2. BLOCKED: deny
 * 3. APPROVAL_REQUIRED: deny (there is no approval workflow)
 * 4. Expired row: deny, whatever its type
 * 5. Outside the allowed hours or weekdays: deny
 * 6. Parameter constraints and rate limits: stored, not enforced
 * 7. Otherwise allow
 *
 * If the permission store cannot be read the check fails open: the call is
 * allowed and a warning is logged. Normal denials are never affected by this.
 */
@Slf4j
@Component
public class ToolPolicyEngine {

    private final ToolPermissionRepository permissionRepository;
    private final Clock clock;
    private final ZoneId zone;

    public ToolPolicyEngine(ToolPermissionRepository permissionRepository, Clock clock, GatewayProperties properties) {
        this.permissionRepository = permissionRepository;
        this.clock = clock;
        this.zone = ZoneId.of(properties.getPermissions().getZone());
    }

    public PermissionDecision check(String userId, String connectionId, String toolName, Map<String, Object> params) {
        Optional<ToolPermission> row;
        try {
            row = permissionRepository.findByUserIdAndConnectionIdAndToolName(userId, connectionId, toolName);
        } catch (RuntimeException e) {
            log.warn("Permission lookup failed for user={} connection={} tool={}, allowing: {}",
                    userId, connectionId, toolName, e.getMessage());
            return PermissionDecision.allow();
        }

        // Rule 1: absence of a row is not a denial
        if (row.isEmpty()) {
            return PermissionDecision.allow();
        }
        ToolPermission permission = row.get();

        // Rules 2-3
        if (permission.getPermissionType() == PermissionType.BLOCKED) {
            log.debug("Tool {} denied for user {}: blocked", toolName, userId);
            return PermissionDecision.deny("Tool '" + toolName + "' is blocked for this user");
        }
        if (permission.getPermissionType() == PermissionType.APPROVAL_REQUIRED) {
            log.debug("Tool {} denied for user {}: approval required", toolName, userId);
            return PermissionDecision.deny("Tool '" + toolName + "' requires administrator approval");
        }

        // Rule 4
        Instant now = clock.instant();
        if (permission.isExpired(now)) {
            log.debug("Tool {} denied for user {}: permission expired at {}", toolName, userId, permission.getExpiresAt());
            return PermissionDecision.deny("Permission for tool '" + toolName + "' expired at " + permission.getExpiresAt());
        }

        // Rule 5
        if (permission.hasTimeRestrictions() && !permission.isTimeAllowed(now.atZone(zone))) {
            log.debug("Tool {} denied for user {}: outside allowed time", toolName, userId);
            return PermissionDecision.deny("Tool '" + toolName + "' is not allowed at this time");
        }

        // Rule 6
        if (permission.getParamConstraints() != null) {
            log.debug("Parameter constraints on {} for user {} are not yet enforced", toolName, userId);
        }
        if (permission.getRateLimit() != null) {
            log.debug("Rate limit on {} for user {} is not yet enforced", toolName, userId);
        }

        return PermissionDecision.allow();
    }
}

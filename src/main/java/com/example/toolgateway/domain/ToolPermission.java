package com.example.toolgateway.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Policy row for one (user, connection, tool) triple.
 * A missing row means the tool is allowed. Expiry is evaluated at check time;
 * expired rows are never removed automatically.
 */
@Entity
@Table(name = "tool_permissions",
        indexes = {
                @Index(name = "idx_permission_user", columnList = "user_id"),
                @Index(name = "idx_permission_connection", columnList = "connection_id")
        },
        uniqueConstraints = @UniqueConstraint(name = "uq_permission_user_connection_tool",
                columnNames = {"user_id", "connection_id", "tool_name"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolPermission {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "connection_id", nullable = false)
    private String connectionId;

    /** Unqualified tool name, e.g. "write_query" */
    @Column(name = "tool_name", nullable = false)
    private String toolName;

    @Enumerated(EnumType.STRING)
    @Column(name = "permission_type", nullable = false)
    @Builder.Default
    private PermissionType permissionType = PermissionType.ALLOWED;

    /** JSON parameter constraints. Stored but not enforced. */
    @Column(name = "param_constraints", length = 4096)
    private String paramConstraints;

    @Column(name = "expires_at")
    private Instant expiresAt;

    /** Comma-separated hours 0-23, e.g. "9,10,11". Null = any hour. */
    @Column(name = "allowed_hours")
    private String allowedHours;

    /** Comma-separated lower-case weekday names, e.g. "monday,friday". Null = any day. */
    @Column(name = "allowed_days")
    private String allowedDays;

    /** JSON rate limit descriptor. Stored but not enforced. */
    @Column(name = "rate_limit", length = 1024)
    private String rateLimit;

    /** The administrator who set this row */
    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public boolean hasTimeRestrictions() {
        return !isBlank(allowedHours) || !isBlank(allowedDays);
    }

    /**
     * True when there are no time restrictions, or when {@code time} falls inside
     * both the allowed hours and the allowed weekdays.
     */
    public boolean isTimeAllowed(ZonedDateTime time) {
        if (!isBlank(allowedHours)) {
            Set<Integer> hours = splitCsv(allowedHours).stream()
                    .map(Integer::parseInt)
                    .collect(Collectors.toSet());
            if (!hours.contains(time.getHour())) {
                return false;
            }
        }
        if (!isBlank(allowedDays)) {
            String today = time.getDayOfWeek().name().toLowerCase(Locale.ROOT);
            if (!splitCsv(allowedDays).contains(today)) {
                return false;
            }
        }
        return true;
    }

    private static Set<String> splitCsv(String value) {
        return Arrays.stream(value.split(","))
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.example.toolgateway.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only record of one tool-call attempt. Params and response are stored
 * as masked JSON; rows are written once and never updated.
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_user", columnList = "user_id"),
        @Index(name = "idx_audit_session", columnList = "session_id"),
        @Index(name = "idx_audit_tool", columnList = "tool_name"),
        @Index(name = "idx_audit_timestamp", columnList = "timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "session_id")
    private String sessionId;

    /** Natural-language question that led to the call */
    @Column(name = "user_query", length = 4096)
    private String userQuery;

    /** Qualified name as requested, e.g. "sql.query" */
    @Column(name = "tool_name", nullable = false)
    private String toolName;

    @Column(name = "tool_params", length = 16384)
    private String toolParams;

    @Column(length = 65536)
    private String response;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AuditStatus status;

    @Column(name = "error_message", length = 4096)
    private String errorMessage;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) timestamp = Instant.now();
    }
}

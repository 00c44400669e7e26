package com.example.toolgateway.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * A backend endpoint (database, document store, calendar) owned by exactly one user.
 * Credentials are stored only in encrypted form; the vault owns the blob format.
 */
@Entity
@Table(name = "tool_connections",
        indexes = @Index(name = "idx_connection_owner", columnList = "owner_id"),
        uniqueConstraints = @UniqueConstraint(name = "uq_connection_owner_name", columnNames = {"owner_id", "name"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Connection {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    /** Backend kind, the prefix of qualified tool names: "sql", "docs", ... */
    @Column(nullable = false, length = 50)
    private String kind;

    /** Display name, unique per owner, e.g. "Production MySQL" */
    @Column(nullable = false)
    private String name;

    @Column(length = 2048)
    private String description;

    /** Non-secret settings as JSON: host, port, database, read_only, base_url */
    @Column(name = "config", length = 8192)
    private String config;

    @ToString.Exclude
    @Column(name = "encrypted_credentials", length = 8192)
    private String encryptedCredentials;

    @Builder.Default
    private boolean enabled = true;

    @Column(name = "last_tested_at")
    private Instant lastTestedAt;

    /** "success" or "failed" */
    @Column(name = "last_test_status", length = 20)
    private String lastTestStatus;

    @Column(name = "last_test_error", length = 2048)
    private String lastTestError;

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
}

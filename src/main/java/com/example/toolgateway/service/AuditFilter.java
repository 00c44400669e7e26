package com.example.toolgateway.service;

import com.example.toolgateway.domain.AuditStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit log query. Every criterion is optional; keyword matches the masked
 * response case-insensitively.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditFilter {

    private String userId;
    private String toolName;
    private AuditStatus status;
    private String keyword;
    private Instant start;
    private Instant end;

    @Builder.Default
    private int limit = 100;

    @Builder.Default
    private int offset = 0;
}

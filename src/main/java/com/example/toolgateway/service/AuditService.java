package com.example.toolgateway.service;

import com.example.toolgateway.domain.AuditLog;
import com.example.toolgateway.domain.AuditStatus;
import com.example.toolgateway.repository.AuditLogRepository;
import com.example.toolgateway.security.DataMasker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Audit trail for tool calls. Every attempt that reaches connection resolution
 * is recorded once, with parameters and response masked before they are stored.
 *
 * Recording never throws. If masking fails the payloads are replaced by
 * {@link #MASKING_FAILED}; the raw values are never written. If the database
 * write fails the masked record goes to the {@code AUDIT_FALLBACK} logger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    public static final String MASKING_FAILED = "[masking failed]";

    private static final Logger FALLBACK = LoggerFactory.getLogger("AUDIT_FALLBACK");

    private static final int MAX_PARAMS = 16384;
    private static final int MAX_RESPONSE = 65536;
    private static final int MAX_TEXT = 4096;

    private final AuditLogRepository auditLogRepository;
    private final DataMasker dataMasker;
    private final ObjectMapper objectMapper;

    public void record(String userId, String toolName, Object params, Object response, AuditStatus status,
                       String userQuery, String sessionId, String errorMessage, Long executionTimeMs) {
        String maskedParams;
        String maskedResponse;
        String error = errorMessage;
        try {
            maskedParams = params != null ? objectMapper.writeValueAsString(dataMasker.mask(params)) : null;
            maskedResponse = response != null ? objectMapper.writeValueAsString(dataMasker.mask(response)) : null;
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Masking failed for audit of {} by {}: {}", toolName, userId, e.getMessage());
            maskedParams = params != null ? MASKING_FAILED : null;
            maskedResponse = response != null ? MASKING_FAILED : null;
            error = (error != null ? error + " " : "") + "(payload dropped: masking failed)";
        }

        AuditLog entry = AuditLog.builder()
                .timestamp(Instant.now())
                .userId(userId)
                .sessionId(sessionId)
                .userQuery(truncate(dataMasker.maskString(userQuery), MAX_TEXT))
                .toolName(toolName)
                .toolParams(truncate(maskedParams, MAX_PARAMS))
                .response(truncate(maskedResponse, MAX_RESPONSE))
                .status(status)
                .errorMessage(truncate(dataMasker.maskString(error), MAX_TEXT))
                .executionTimeMs(executionTimeMs)
                .build();
        try {
            auditLogRepository.save(entry);
            log.debug("Audit: [{}] {} -> {}", userId, toolName, status);
        } catch (Exception e) {
            log.error("Failed to write audit log for {} by {}: {}", toolName, userId, e.getMessage());
            writeFallback(entry);
        }
    }

    private void writeFallback(AuditLog entry) {
        try {
            FALLBACK.error(objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            FALLBACK.error("{}", entry);
        }
    }

    /** Filtered audit entries, newest first */
    public List<AuditLog> getLogs(AuditFilter filter) {
        int limit = Math.max(1, filter.getLimit());
        int offset = Math.max(0, filter.getOffset());
        String keyword = filter.getKeyword() != null && !filter.getKeyword().isBlank() ? filter.getKeyword() : null;
        List<AuditLog> page = auditLogRepository.findFiltered(
                filter.getUserId(), filter.getToolName(), filter.getStatus(), keyword,
                filter.getStart(), filter.getEnd(), PageRequest.of(0, offset + limit));
        if (offset >= page.size()) {
            return List.of();
        }
        return page.subList(offset, Math.min(page.size(), offset + limit));
    }

    public Optional<AuditLog> getLog(String id) {
        return auditLogRepository.findById(id);
    }

    public List<AuditLog> getBySession(String sessionId) {
        return auditLogRepository.findBySessionIdOrderByTimestampDesc(sessionId);
    }

    /**
     * Totals by outcome and by tool for an optional time range.
     */
    public Map<String, Object> getStats(Instant from, Instant to) {
        long success = 0;
        long fail = 0;
        long denied = 0;
        for (Object[] row : auditLogRepository.countByStatus(from, to)) {
            long count = ((Number) row[1]).longValue();
            switch ((AuditStatus) row[0]) {
                case SUCCESS -> success = count;
                case FAIL -> fail = count;
                case DENIED -> denied = count;
            }
        }
        Map<String, Long> byTool = new TreeMap<>();
        for (Object[] row : auditLogRepository.countByTool(from, to)) {
            byTool.put((String) row[0], ((Number) row[1]).longValue());
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total", success + fail + denied);
        stats.put("success", success);
        stats.put("fail", fail);
        stats.put("denied", denied);
        stats.put("by_tool", byTool);
        return stats;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max - 3) + "...";
    }
}

package com.example.toolgateway.controller;

import com.example.toolgateway.domain.AuditLog;
import com.example.toolgateway.domain.AuditStatus;
import com.example.toolgateway.service.AuditFilter;
import com.example.toolgateway.service.AuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only access to the tool-call audit trail.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;

    @GetMapping
    public ResponseEntity<List<AuditLog>> list(
            @RequestParam(required = false) String userId,
            @RequestParam(required = false) String toolName,
            @RequestParam(required = false) AuditStatus status,
            @RequestParam(required = false) String keyword,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        AuditFilter filter = AuditFilter.builder()
                .userId(userId)
                .toolName(toolName)
                .status(status)
                .keyword(keyword)
                .start(start)
                .end(end)
                .limit(Math.min(limit, 1000))
                .offset(offset)
                .build();
        return ResponseEntity.ok(auditService.getLogs(filter));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return ResponseEntity.ok(auditService.getStats(from, to));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AuditLog> get(@PathVariable String id) {
        return auditService.getLog(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}

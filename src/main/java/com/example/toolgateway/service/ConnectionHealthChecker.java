package com.example.toolgateway.service;

import com.example.toolgateway.config.GatewayProperties;
import com.example.toolgateway.domain.Connection;
import com.example.toolgateway.repository.ConnectionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Periodically tests every enabled connection and records the outcome.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionHealthChecker {

    private final ConnectionRepository connectionRepository;
    private final ConnectionService connectionService;
    private final GatewayProperties properties;

    @Scheduled(initialDelayString = "${tool-gateway.health-check.interval-seconds:600}",
            fixedDelayString = "${tool-gateway.health-check.interval-seconds:600}",
            timeUnit = TimeUnit.SECONDS)
    public void runHealthChecks() {
        if (!properties.getHealthCheck().isEnabled()) return;

        List<Connection> connections = connectionRepository.findByEnabled(true);
        if (connections.isEmpty()) return;

        int failed = 0;
        for (Connection connection : connections) {
            try {
                Object success = connectionService.testConnection(connection).get("success");
                if (!Boolean.TRUE.equals(success)) failed++;
            } catch (Exception e) {
                failed++;
                log.error("Health check failed for connection {}: {}", connection.getId(), e.getMessage());
            }
        }
        log.info("Connection health check complete: {}/{} healthy", connections.size() - failed, connections.size());
    }
}

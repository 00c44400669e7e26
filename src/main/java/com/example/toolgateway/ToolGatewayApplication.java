package com.example.toolgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Tool Gateway - mediates AI agent calls to user-owned backends.
 *
 * Architecture:
 * - Connection registry → per-user backend endpoints, credentials encrypted at rest
 * - Backend clients → one pooled client per connection, keyed by kind (sql, docs)
 * - Tool gateway → "kind.tool" dispatch with policy check and timing
 * - Policy engine → per-(user, connection, tool) allow/block/expiry/time rules
 * - Audit pipeline → one masked record per call attempt
 */
@SpringBootApplication
@EnableScheduling
public class ToolGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolGatewayApplication.class, args);
    }
}

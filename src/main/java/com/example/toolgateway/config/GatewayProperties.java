package com.example.toolgateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Central configuration for the tool gateway.
 * Maps to the 'tool-gateway' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "tool-gateway")
public class GatewayProperties {

    private VaultConfig vault = new VaultConfig();
    private BackendConfig backend = new BackendConfig();
    private CacheConfig cache = new CacheConfig();
    private SqlConfig sql = new SqlConfig();
    private DocsConfig docs = new DocsConfig();
    private PermissionConfig permissions = new PermissionConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();

    @Data
    public static class VaultConfig {
        /** Base64-encoded AES key (16, 24 or 32 bytes once decoded) */
        private String key = "";
    }

    @Data
    public static class BackendConfig {
        private int callTimeoutSeconds = 30;
        private int executorPoolSize = 16;
    }

    @Data
    public static class CacheConfig {
        private int idleTimeoutMinutes = 30;
        private long maximumUsers = 1000;
    }

    @Data
    public static class SqlConfig {
        private int defaultPoolSize = 5;
        private int poolTimeoutSeconds = 10;
        private int queryTimeoutSeconds = 30;
        private int maxRows = 1000;
        /** JDBC subprotocols a connection may use */
        private List<String> allowedDialects = new ArrayList<>(List.of("mysql", "postgresql"));
    }

    @Data
    public static class DocsConfig {
        private int timeoutSeconds = 15;
    }

    @Data
    public static class PermissionConfig {
        /** Zone used to evaluate allowed hours and weekdays */
        private String zone = "UTC";
    }

    @Data
    public static class HealthCheckConfig {
        private boolean enabled = true;
        private int intervalSeconds = 600;
    }
}

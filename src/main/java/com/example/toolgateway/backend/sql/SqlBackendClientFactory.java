package com.example.toolgateway.backend.sql;

import com.example.toolgateway.backend.BackendClient;
import com.example.toolgateway.backend.BackendClientFactory;
import com.example.toolgateway.config.GatewayProperties;
import com.example.toolgateway.domain.Connection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.example.toolgateway.backend.ConfigValues.getBoolean;
import static com.example.toolgateway.backend.ConfigValues.getInt;
import static com.example.toolgateway.backend.ConfigValues.getString;

/**
 * Builds {@link SqlBackendClient}s. Config keys: jdbc_url, or dialect/host/port/database;
 * read_only (default true); pool_size. Credential keys: username, password.
 *
 * The dialect must be one of {@code tool-gateway.sql.allowed-dialects}. URLs may
 * not carry driver properties: no ';', '?', '&', '=', parentheses or whitespace.
 */
@Component
@RequiredArgsConstructor
public class SqlBackendClientFactory implements BackendClientFactory {

    private static final List<String> TOOL_NAMES = List.of("query", "write_query", "list_tables", "describe_table");

    private static final Pattern JDBC_URL = Pattern.compile("jdbc:([a-z0-9]+):([A-Za-z0-9._:/-]+)");
    private static final Pattern HOST = Pattern.compile("[A-Za-z0-9.-]+");
    private static final Pattern DATABASE = Pattern.compile("[A-Za-z0-9_$-]*");

    private final GatewayProperties properties;

    @Override
    public String getKind() {
        return SqlBackendClient.KIND;
    }

    @Override
    public BackendClient create(Connection connection, Map<String, Object> config, Map<String, Object> credentials) {
        GatewayProperties.SqlConfig sql = properties.getSql();
        return SqlBackendClient.builder()
                .name(connection.getName())
                .jdbcUrl(jdbcUrl(config, sql.getAllowedDialects()))
                .username(getString(credentials, "username", null))
                .password(getString(credentials, "password", null))
                .readOnly(getBoolean(config, "read_only", true))
                .poolSize(getInt(config, "pool_size", sql.getDefaultPoolSize()))
                .poolTimeoutSeconds(sql.getPoolTimeoutSeconds())
                .queryTimeoutSeconds(sql.getQueryTimeoutSeconds())
                .maxRows(sql.getMaxRows())
                .build();
    }

    @Override
    public List<String> defaultToolNames() {
        return TOOL_NAMES;
    }

    /**
     * @throws IllegalArgumentException for a dialect outside the allow-list or a URL part
     *                                  that could smuggle driver settings
     */
    static String jdbcUrl(Map<String, Object> config, Collection<String> allowedDialects) {
        String explicit = getString(config, "jdbc_url", null);
        if (explicit != null) {
            Matcher matcher = JDBC_URL.matcher(explicit);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("jdbc_url may not contain driver parameters");
            }
            requireAllowed(matcher.group(1), allowedDialects);
            return explicit;
        }
        String dialect = getString(config, "dialect", "mysql").toLowerCase(Locale.ROOT);
        requireAllowed(dialect, allowedDialects);
        String host = getString(config, "host", "localhost");
        if (!HOST.matcher(host).matches()) {
            throw new IllegalArgumentException("Invalid host: " + host);
        }
        int port = getInt(config, "port", 3306);
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        String database = getString(config, "database", "");
        if (!DATABASE.matcher(database).matches()) {
            throw new IllegalArgumentException("Invalid database name: " + database);
        }
        return "jdbc:" + dialect + "://" + host + ":" + port + "/" + database;
    }

    private static void requireAllowed(String dialect, Collection<String> allowedDialects) {
        if (!allowedDialects.contains(dialect)) {
            throw new IllegalArgumentException("Unsupported SQL dialect: " + dialect + " (allowed: " + allowedDialects + ")");
        }
    }
}

package com.example.toolgateway.backend.sql;

import com.example.toolgateway.backend.BackendClient;
import com.example.toolgateway.backend.ToolCallResult;
import com.example.toolgateway.backend.ToolDefinition;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Relational database client over JDBC with a bounded HikariCP pool.
 *
 * Tools: query, write_query, list_tables, describe_table. On a read-only
 * connection any statement not starting with SELECT is rejected before it
 * reaches the database.
 */
@Slf4j
public class SqlBackendClient implements BackendClient {

    public static final String KIND = "sql";

    // Drivers disagree on the name of an ordinary table type
    private static final Set<String> TABLE_TYPES = Set.of("TABLE", "BASE TABLE");

    private final String name;
    private final String jdbcUrl;
    private final String username;
    private final String password;
    private final boolean readOnly;
    private final int poolSize;
    private final int poolTimeoutSeconds;
    private final int queryTimeoutSeconds;
    private final int maxRows;

    private volatile HikariDataSource dataSource;

    @Builder
    public SqlBackendClient(String name, String jdbcUrl, String username, String password, boolean readOnly,
                            int poolSize, int poolTimeoutSeconds, int queryTimeoutSeconds, int maxRows) {
        this.name = name;
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.password = password;
        this.readOnly = readOnly;
        this.poolSize = poolSize;
        this.poolTimeoutSeconds = poolTimeoutSeconds;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
        this.maxRows = maxRows;
    }

    @Override
    public String getKind() { return KIND; }

    @Override
    public synchronized boolean connect() {
        if (dataSource != null) {
            return true;
        }
        try {
            HikariConfig config = new HikariConfig();
            config.setPoolName("sql-" + name);
            config.setJdbcUrl(jdbcUrl);
            config.setUsername(username);
            config.setPassword(password);
            config.setMaximumPoolSize(poolSize);
            config.setMinimumIdle(1);
            config.setConnectionTimeout(TimeUnit.SECONDS.toMillis(poolTimeoutSeconds));
            config.setAutoCommit(true);
            config.setReadOnly(readOnly);
            dataSource = new HikariDataSource(config);
            log.info("SQL pool opened for '{}' (max {} connections, read-only={})", name, poolSize, readOnly);
            return true;
        } catch (RuntimeException e) {
            log.warn("SQL connection failed for '{}': {}", name, e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized void disconnect() {
        if (dataSource != null) {
            dataSource.close();
            dataSource = null;
            log.info("SQL pool closed for '{}'", name);
        }
    }

    public boolean isConnected() {
        return dataSource != null;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    @Override
    public List<ToolDefinition> listTools() {
        Map<String, Object> sqlProperties = Map.of(
                "sql", Map.of("type", "string", "description", "SQL statement"),
                "params", Map.of("type", "array", "items", Map.of("type", "string"),
                        "description", "Positional statement parameters (optional)"));
        return List.of(
                ToolDefinition.builder()
                        .name("query")
                        .description(readOnly
                                ? "Run a SQL SELECT query. This connection is read-only."
                                : "Run a SQL statement and return its rows or affected row count.")
                        .parameters(Map.of("type", "object", "properties", sqlProperties, "required", List.of("sql")))
                        .build(),
                ToolDefinition.builder()
                        .name("write_query")
                        .description("Run an INSERT, UPDATE or DELETE statement. Rejected on read-only connections.")
                        .parameters(Map.of("type", "object", "properties", sqlProperties, "required", List.of("sql")))
                        .build(),
                ToolDefinition.builder()
                        .name("list_tables")
                        .description("List all tables in the database.")
                        .parameters(Map.of("type", "object", "properties", Map.of()))
                        .build(),
                ToolDefinition.builder()
                        .name("describe_table")
                        .description("Describe the columns and types of a table.")
                        .parameters(Map.of(
                                "type", "object",
                                "properties", Map.of("table", Map.of("type", "string", "description", "Table name")),
                                "required", List.of("table")))
                        .build()
        );
    }

    @Override
    public ToolCallResult callTool(String toolName, Map<String, Object> params) {
        HikariDataSource ds = dataSource;
        if (ds == null) {
            return ToolCallResult.failure("Not connected. Call connect() first.");
        }
        try {
            return switch (toolName) {
                case "query" -> query(ds, params);
                case "write_query" -> writeQuery(ds, params);
                case "list_tables" -> listTables(ds);
                case "describe_table" -> describeTable(ds, params);
                default -> ToolCallResult.failure("Unknown tool: " + toolName);
            };
        } catch (SQLException e) {
            log.debug("SQL tool {} failed on '{}': {}", toolName, name, e.getMessage());
            return ToolCallResult.failure(e.getMessage());
        }
    }

    private ToolCallResult query(HikariDataSource ds, Map<String, Object> params) throws SQLException {
        String sql = stringParam(params, "sql");
        if (sql == null || sql.isBlank()) {
            return ToolCallResult.failure("Parameter 'sql' is required.");
        }
        if (readOnly && !isSelect(sql)) {
            return ToolCallResult.failure("Read-only connection: only SELECT queries are allowed.");
        }
        try (Connection conn = ds.getConnection();
             PreparedStatement statement = prepare(conn, sql, params)) {
            statement.setMaxRows(maxRows);
            if (!statement.execute()) {
                return ToolCallResult.success(Map.of("affected_rows", statement.getUpdateCount()));
            }
            try (ResultSet rs = statement.getResultSet()) {
                ResultSetMetaData meta = rs.getMetaData();
                List<String> columns = new ArrayList<>();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    columns.add(meta.getColumnLabel(i));
                }
                List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= columns.size(); i++) {
                        row.put(columns.get(i - 1), rs.getObject(i));
                    }
                    rows.add(row);
                }
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("columns", columns);
                data.put("rows", rows);
                data.put("row_count", rows.size());
                return ToolCallResult.success(data);
            }
        }
    }

    private ToolCallResult writeQuery(HikariDataSource ds, Map<String, Object> params) throws SQLException {
        if (readOnly) {
            return ToolCallResult.failure("Read-only connection: write_query is not allowed.");
        }
        String sql = stringParam(params, "sql");
        if (sql == null || sql.isBlank()) {
            return ToolCallResult.failure("Parameter 'sql' is required.");
        }
        try (Connection conn = ds.getConnection();
             PreparedStatement statement = prepare(conn, sql, params)) {
            return ToolCallResult.success(Map.of("affected_rows", statement.executeUpdate()));
        }
    }

    private ToolCallResult listTables(HikariDataSource ds) throws SQLException {
        try (Connection conn = ds.getConnection()) {
            DatabaseMetaData metaData = conn.getMetaData();
            List<String> tables = new ArrayList<>();
            try (ResultSet rs = metaData.getTables(conn.getCatalog(), conn.getSchema(), "%", null)) {
                while (rs.next()) {
                    if (TABLE_TYPES.contains(rs.getString("TABLE_TYPE"))) {
                        tables.add(rs.getString("TABLE_NAME"));
                    }
                }
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("tables", tables);
            data.put("count", tables.size());
            return ToolCallResult.success(data);
        }
    }

    private ToolCallResult describeTable(HikariDataSource ds, Map<String, Object> params) throws SQLException {
        String table = stringParam(params, "table");
        if (table == null || table.isBlank()) {
            return ToolCallResult.failure("Parameter 'table' is required.");
        }
        try (Connection conn = ds.getConnection()) {
            DatabaseMetaData metaData = conn.getMetaData();
            String lookup = table;
            if (metaData.storesUpperCaseIdentifiers()) {
                lookup = table.toUpperCase(Locale.ROOT);
            } else if (metaData.storesLowerCaseIdentifiers()) {
                lookup = table.toLowerCase(Locale.ROOT);
            }
            List<Map<String, Object>> columns = new ArrayList<>();
            try (ResultSet rs = metaData.getColumns(conn.getCatalog(), conn.getSchema(), lookup, "%")) {
                while (rs.next()) {
                    Map<String, Object> column = new LinkedHashMap<>();
                    column.put("name", rs.getString("COLUMN_NAME"));
                    column.put("type", rs.getString("TYPE_NAME"));
                    column.put("nullable", "YES".equals(rs.getString("IS_NULLABLE")));
                    column.put("default", rs.getString("COLUMN_DEF"));
                    columns.add(column);
                }
            }
            if (columns.isEmpty()) {
                return ToolCallResult.failure("Table not found: " + table);
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("table", table);
            data.put("columns", columns);
            return ToolCallResult.success(data);
        }
    }

    private PreparedStatement prepare(Connection conn, String sql, Map<String, Object> params) throws SQLException {
        PreparedStatement statement = conn.prepareStatement(sql);
        statement.setQueryTimeout(queryTimeoutSeconds);
        Object bindings = params.get("params");
        if (bindings instanceof List<?> values) {
            for (int i = 0; i < values.size(); i++) {
                statement.setObject(i + 1, values.get(i));
            }
        }
        return statement;
    }

    static boolean isSelect(String sql) {
        return sql.trim().toUpperCase(Locale.ROOT).startsWith("SELECT");
    }

    private static String stringParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        return value != null ? value.toString() : null;
    }
}

package com.example.toolgateway.backend;

import java.util.List;
import java.util.Map;

/**
 * Client for one backend connection. Every kind follows the same contract:
 * - connect: open the client's internal pool, report whether it is usable
 * - disconnect: release every pooled resource
 * - listTools: the tool catalog, in a stable order
 * - callTool: run one tool, reporting backend failures in the result
 */
public interface BackendClient {

    /**
     * Backend kind this client serves, e.g. "sql".
     */
    String getKind();

    boolean connect();

    void disconnect();

    List<ToolDefinition> listTools();

    /**
     * Execute a tool. Backend-side failures (bad SQL, unknown tool, non-2xx)
     * come back as {@link ToolCallResult#failure(String)}; only unexpected
     * client faults are thrown.
     *
     * @param toolName unqualified tool name, e.g. "list_tables"
     * @param params   tool parameters, never null
     */
    ToolCallResult callTool(String toolName, Map<String, Object> params);
}

package com.example.toolgateway.gateway;

import com.example.toolgateway.backend.BackendClient;
import com.example.toolgateway.backend.ToolDefinition;
import com.example.toolgateway.domain.Connection;

import java.util.List;

/**
 * A connected backend registered in one user's gateway.
 */
public record GatewayConnection(Connection connection, BackendClient client, List<ToolDefinition> tools) {

    public String id() {
        return connection.getId();
    }

    public String kind() {
        return connection.getKind();
    }

    public String name() {
        return connection.getName();
    }
}

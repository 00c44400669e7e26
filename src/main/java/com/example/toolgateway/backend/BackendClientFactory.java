package com.example.toolgateway.backend;

import com.example.toolgateway.domain.Connection;

import java.util.List;
import java.util.Map;

/**
 * Creates clients for one backend kind. Register a new kind by declaring a
 * factory bean; the registry picks it up.
 */
public interface BackendClientFactory {

    String getKind();

    /**
     * Build an unconnected client.
     *
     * @param connection  connection metadata
     * @param config      parsed non-secret configuration
     * @param credentials decrypted credentials
     */
    BackendClient create(Connection connection, Map<String, Object> config, Map<String, Object> credentials);

    /**
     * Tool names this kind offers, for permission administration when no live
     * client is available.
     */
    List<String> defaultToolNames();
}

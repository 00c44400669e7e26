package com.example.toolgateway.backend.docs;

import com.example.toolgateway.backend.BackendClient;
import com.example.toolgateway.backend.BackendClientFactory;
import com.example.toolgateway.domain.Connection;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.example.toolgateway.backend.ConfigValues.getString;

@Component
@RequiredArgsConstructor
public class DocsBackendClientFactory implements BackendClientFactory {

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    @Override
    public String getKind() {
        return DocsBackendClient.KIND;
    }

    @Override
    public BackendClient create(Connection connection, Map<String, Object> config, Map<String, Object> credentials) {
        String baseUrl = getString(config, "base_url", null);
        if (baseUrl == null) {
            throw new IllegalArgumentException("Docs connection '" + connection.getName() + "' has no base_url");
        }
        return new DocsBackendClient(
                connection.getName(),
                baseUrl,
                getString(config, "health_path", "/health"),
                getString(credentials, "api_key", null),
                okHttpClient,
                objectMapper);
    }

    @Override
    public List<String> defaultToolNames() {
        return List.of("search_pages", "read_page");
    }
}

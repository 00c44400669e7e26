package com.example.toolgateway.backend.docs;

import com.example.toolgateway.backend.BackendClient;
import com.example.toolgateway.backend.ToolCallResult;
import com.example.toolgateway.backend.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Document store client over HTTP JSON.
 *
 * Tools: search_pages (GET /search), read_page (GET /pages/{id}).
 */
@Slf4j
public class DocsBackendClient implements BackendClient {

    public static final String KIND = "docs";

    private static final int DEFAULT_SEARCH_LIMIT = 10;

    private final String name;
    private final HttpUrl baseUrl;
    private final String healthPath;
    private final String apiKey;
    private final OkHttpClient sharedClient;
    private final ObjectMapper objectMapper;

    private volatile OkHttpClient httpClient;

    public DocsBackendClient(String name, String baseUrl, String healthPath, String apiKey,
                             OkHttpClient sharedClient, ObjectMapper objectMapper) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid base_url for docs connection '" + name + "': " + baseUrl);
        }
        this.name = name;
        this.baseUrl = parsed;
        this.healthPath = healthPath;
        this.apiKey = apiKey;
        this.sharedClient = sharedClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getKind() { return KIND; }

    @Override
    public synchronized boolean connect() {
        if (httpClient != null) {
            return true;
        }
        OkHttpClient client = sharedClient.newBuilder()
                .connectionPool(new ConnectionPool())
                .build();
        try (Response response = client.newCall(request(url(healthPath).build())).execute()) {
            if (!response.isSuccessful()) {
                log.warn("Docs health check for '{}' returned HTTP {}", name, response.code());
                release(client);
                return false;
            }
        } catch (IOException e) {
            log.warn("Docs connection failed for '{}': {}", name, e.getMessage());
            release(client);
            return false;
        }
        httpClient = client;
        log.info("Docs client connected for '{}' at {}", name, baseUrl);
        return true;
    }

    @Override
    public synchronized void disconnect() {
        if (httpClient != null) {
            release(httpClient);
            httpClient = null;
            log.info("Docs client closed for '{}'", name);
        }
    }

    @Override
    public List<ToolDefinition> listTools() {
        return List.of(
                ToolDefinition.builder()
                        .name("search_pages")
                        .description("Search documents by keyword.")
                        .parameters(Map.of(
                                "type", "object",
                                "properties", Map.of(
                                        "query", Map.of("type", "string", "description", "Search keywords"),
                                        "limit", Map.of("type", "integer", "description", "Maximum results (default 10)")),
                                "required", List.of("query")))
                        .build(),
                ToolDefinition.builder()
                        .name("read_page")
                        .description("Read the full content of a document page.")
                        .parameters(Map.of(
                                "type", "object",
                                "properties", Map.of("page_id", Map.of("type", "string", "description", "Page ID")),
                                "required", List.of("page_id")))
                        .build()
        );
    }

    @Override
    public ToolCallResult callTool(String toolName, Map<String, Object> params) {
        OkHttpClient client = httpClient;
        if (client == null) {
            return ToolCallResult.failure("Not connected. Call connect() first.");
        }
        switch (toolName) {
            case "search_pages": {
                Object query = params.get("query");
                if (query == null || query.toString().isBlank()) {
                    return ToolCallResult.failure("Parameter 'query' is required.");
                }
                Object limit = params.getOrDefault("limit", DEFAULT_SEARCH_LIMIT);
                HttpUrl url = url("/search")
                        .addQueryParameter("q", query.toString())
                        .addQueryParameter("limit", limit.toString())
                        .build();
                return get(client, url);
            }
            case "read_page": {
                Object pageId = params.get("page_id");
                if (pageId == null || pageId.toString().isBlank()) {
                    return ToolCallResult.failure("Parameter 'page_id' is required.");
                }
                return get(client, url("/pages").addPathSegment(pageId.toString()).build());
            }
            default:
                return ToolCallResult.failure("Unknown tool: " + toolName);
        }
    }

    private ToolCallResult get(OkHttpClient client, HttpUrl url) {
        try (Response response = client.newCall(request(url)).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                return ToolCallResult.failure("Docs API returned HTTP " + response.code() + ": " + text);
            }
            return ToolCallResult.success(text.isBlank() ? null : objectMapper.readValue(text, Object.class));
        } catch (IOException e) {
            log.debug("Docs request to {} failed: {}", url, e.getMessage());
            return ToolCallResult.failure("Docs request failed: " + e.getMessage());
        }
    }

    private Request request(HttpUrl url) {
        Request.Builder builder = new Request.Builder().url(url).get()
                .header("Accept", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    private HttpUrl.Builder url(String path) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                builder.addPathSegment(segment);
            }
        }
        return builder;
    }

    private static void release(OkHttpClient client) {
        client.connectionPool().evictAll();
    }
}

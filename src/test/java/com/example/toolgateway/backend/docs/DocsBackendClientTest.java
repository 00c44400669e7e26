package com.example.toolgateway.backend.docs;

import com.example.toolgateway.backend.ToolCallResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DocsBackendClientTest {

    private MockWebServer server;
    private DocsBackendClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new DocsBackendClient("Team Wiki", server.url("/api/").toString(), "/health", "key-123",
                new OkHttpClient.Builder().readTimeout(2, TimeUnit.SECONDS).build(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        client.disconnect();
        server.shutdown();
    }

    @Test
    void connectChecksHealthEndpoint() throws InterruptedException {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"status\":\"ok\"}"));

        assertTrue(client.connect());

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/api/health", request.getPath());
        assertEquals("Bearer key-123", request.getHeader("Authorization"));
    }

    @Test
    void connectFailsOnUnhealthyBackend() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertFalse(client.connect());
        assertFalse(client.callTool("search_pages", Map.of("query", "x")).isSuccess());
    }

    @Test
    void searchesPages() throws InterruptedException {
        connect();
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"results\":[{\"id\":\"p1\",\"title\":\"Runbook\"}],\"total\":1}"));

        ToolCallResult result = client.callTool("search_pages", Map.of("query", "runbook", "limit", 5));

        assertTrue(result.isSuccess(), result.getError());
        Map<?, ?> data = (Map<?, ?>) result.getData();
        assertEquals(1, data.get("total"));
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("/api/search?q=runbook&limit=5", request.getPath());
        assertEquals("Bearer key-123", request.getHeader("Authorization"));
    }

    @Test
    void readsPageById() throws InterruptedException {
        connect();
        server.enqueue(new MockResponse().setBody("{\"id\":\"p 1\",\"content\":\"hello\"}"));

        ToolCallResult result = client.callTool("read_page", Map.of("page_id", "p 1"));

        assertTrue(result.isSuccess(), result.getError());
        assertEquals("hello", ((Map<?, ?>) result.getData()).get("content"));
        assertEquals("/api/pages/p%201", server.takeRequest(1, TimeUnit.SECONDS).getPath());
    }

    @Test
    void nonSuccessStatusBecomesFailure() {
        connect();
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"error\":\"not found\"}"));

        ToolCallResult result = client.callTool("read_page", Map.of("page_id", "missing"));

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("HTTP 404"));
    }

    @Test
    void validatesRequiredParameters() {
        connect();

        assertEquals("Parameter 'query' is required.", client.callTool("search_pages", Map.of()).getError());
        assertEquals("Parameter 'page_id' is required.", client.callTool("read_page", Map.of()).getError());
        assertEquals("Unknown tool: delete_page", client.callTool("delete_page", Map.of()).getError());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void listsTools() {
        assertEquals(List.of("search_pages", "read_page"),
                client.listTools().stream().map(t -> t.getName()).toList());
    }

    private void connect() {
        server.enqueue(new MockResponse().setResponseCode(200));
        assertTrue(client.connect());
        try {
            server.takeRequest(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(e);
        }
    }
}

package com.example.toolgateway.controller;

import com.example.toolgateway.domain.Connection;
import com.example.toolgateway.service.ConnectionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ConnectionController.class)
class ConnectionControllerTest {

    @Autowired MockMvc mvc;
    @MockBean ConnectionService connectionService;

    @Test
    void createReturnsViewWithoutCredentials() throws Exception {
        Connection saved = Connection.builder()
                .id("c1").ownerId("u1").kind("sql").name("Orders DB")
                .config("{\"jdbc_url\":\"jdbc:h2:mem:orders\"}")
                .encryptedCredentials("v1:abc")
                .build();
        when(connectionService.create(eq("u1"), eq("Orders DB"), eq("sql"), any(), anyMap(), anyMap()))
                .thenReturn(saved);
        when(connectionService.getConfig(saved)).thenReturn(Map.of("jdbc_url", "jdbc:h2:mem:orders"));

        mvc.perform(post("/api/connections").header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Orders DB\",\"kind\":\"sql\",\"config\":{\"jdbc_url\":\"jdbc:h2:mem:orders\"},"
                                + "\"credentials\":{\"password\":\"hunter2\"}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("c1"))
                .andExpect(jsonPath("$.hasCredentials").value(true))
                .andExpect(jsonPath("$.encryptedCredentials").doesNotExist())
                .andExpect(jsonPath("$.credentials").doesNotExist());
    }

    @Test
    void createMapsValidationAndConflictErrors() throws Exception {
        when(connectionService.create(eq("u1"), eq("Mail"), eq("smtp"), any(), any(), any()))
                .thenThrow(new IllegalArgumentException("Unsupported connection kind: smtp"));
        when(connectionService.create(eq("u1"), eq("Orders DB"), eq("sql"), any(), any(), any()))
                .thenThrow(new IllegalStateException("Connection name already exists: Orders DB"));

        mvc.perform(post("/api/connections").header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Mail\",\"kind\":\"smtp\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unsupported connection kind: smtp"));

        mvc.perform(post("/api/connections").header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Orders DB\",\"kind\":\"sql\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void otherUsersConnectionIsNotFound() throws Exception {
        when(connectionService.getConnection("c1", "u2"))
                .thenThrow(new IllegalArgumentException("Connection not found: c1"));
        doThrow(new IllegalArgumentException("Connection not found: c1"))
                .when(connectionService).delete("c1", "u2");

        mvc.perform(get("/api/connections/c1").header("X-User-Id", "u2"))
                .andExpect(status().isNotFound());
        mvc.perform(delete("/api/connections/c1").header("X-User-Id", "u2"))
                .andExpect(status().isNotFound());
        mvc.perform(post("/api/connections/c1/test").header("X-User-Id", "u2"))
                .andExpect(status().isNotFound());

        verify(connectionService, never()).testConnection("c1", "u2");
    }

    @Test
    void testEndpointReturnsOutcome() throws Exception {
        when(connectionService.getConnection("c1", "u1")).thenReturn(Connection.builder().id("c1").build());
        when(connectionService.testConnection("c1", "u1"))
                .thenReturn(Map.of("success", false, "error", "Could not connect to sql backend"));

        mvc.perform(post("/api/connections/c1/test").header("X-User-Id", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Could not connect to sql backend"));
    }
}

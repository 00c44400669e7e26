package com.example.toolgateway.backend;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a tool call, as returned by backend clients and by the gateway.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallResult {

    private boolean success;
    private Object data;
    private String error;

    /** Wall-clock time spent in the backend call; set by the gateway */
    private long executionTimeMs;

    public static ToolCallResult success(Object data) {
        return ToolCallResult.builder()
                .success(true)
                .data(data)
                .build();
    }

    public static ToolCallResult failure(String error) {
        return ToolCallResult.builder()
                .success(false)
                .error(error)
                .build();
    }
}

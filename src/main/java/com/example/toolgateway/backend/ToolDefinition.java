package com.example.toolgateway.backend;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolDefinition {

    private String name;
    private String description;

    /** JSON Schema describing the parameters this tool accepts */
    private Map<String, Object> parameters;
}

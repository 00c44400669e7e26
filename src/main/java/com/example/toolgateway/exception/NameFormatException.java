package com.example.toolgateway.exception;

/**
 * Qualified tool name is not of the form "kind.tool".
 */
public class NameFormatException extends GatewayException {

    public NameFormatException(String qualifiedName) {
        super("Invalid tool name format: " + qualifiedName + " (expected \"<kind>.<tool>\")");
    }
}

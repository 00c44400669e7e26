package com.example.toolgateway.exception;

/**
 * No enabled connection of the requested kind is registered for the caller.
 */
public class NoConnectionException extends GatewayException {

    private final String kind;

    public NoConnectionException(String kind) {
        super("No connection for kind: " + kind);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}

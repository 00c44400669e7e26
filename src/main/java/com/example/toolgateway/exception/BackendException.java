package com.example.toolgateway.exception;

/**
 * The backend client raised, timed out, or was cancelled.
 */
public class BackendException extends GatewayException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.example.toolgateway.exception;

/**
 * Base type for failures raised on the tool-call path.
 */
public abstract class GatewayException extends RuntimeException {

    protected GatewayException(String message) {
        super(message);
    }

    protected GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}

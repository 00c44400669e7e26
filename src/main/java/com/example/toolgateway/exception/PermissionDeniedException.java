package com.example.toolgateway.exception;

public class PermissionDeniedException extends GatewayException {

    public PermissionDeniedException(String reason) {
        super(reason);
    }
}

package com.example.toolgateway.gateway;

/**
 * Outcome of a policy check. {@code reason} is set only for denials.
 */
public record PermissionDecision(boolean allowed, String reason) {

    private static final PermissionDecision ALLOW = new PermissionDecision(true, null);

    public static PermissionDecision allow() {
        return ALLOW;
    }

    public static PermissionDecision deny(String reason) {
        return new PermissionDecision(false, reason);
    }
}

package com.example.toolgateway.domain;

public enum PermissionType {
    ALLOWED,
    BLOCKED,
    /** No approval workflow exists yet, so this currently denies. */
    APPROVAL_REQUIRED
}

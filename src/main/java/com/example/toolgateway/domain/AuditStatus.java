package com.example.toolgateway.domain;

public enum AuditStatus {
    SUCCESS, FAIL, DENIED
}

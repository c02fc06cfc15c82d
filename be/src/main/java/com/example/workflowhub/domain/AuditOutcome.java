package com.example.workflowhub.domain;

public enum AuditOutcome {
    APPLIED,
    REJECTED
}

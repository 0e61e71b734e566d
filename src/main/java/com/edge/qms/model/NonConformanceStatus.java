package com.edge.qms.model;

public enum NonConformanceStatus {
    OPEN,
    INVESTIGATING,
    ACTION_PLANNED,
    IMPLEMENTING,
    VERIFYING,
    CLOSED
}

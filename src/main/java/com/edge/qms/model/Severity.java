package com.edge.qms.model;

/**
 * 严重等级
 */
public enum Severity {
    CRITICAL,
    MAJOR,
    MINOR
}

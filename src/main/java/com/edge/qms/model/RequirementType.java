package com.edge.qms.model;

public enum RequirementType {
    MANDATORY,
    CONDITIONAL,
    OPTIONAL
}

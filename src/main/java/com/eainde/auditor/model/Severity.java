package com.eainde.auditor.model;

/**
 * How serious a finding is. Only {@link #HIGH} findings can trigger the fact override
 * during synthesis.
 */
public enum Severity {
    NONE,
    LOW,
    MEDIUM,
    HIGH
}

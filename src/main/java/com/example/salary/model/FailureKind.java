package com.example.salary.model;

/**
 * Step at which a salary run failed.
 */
public enum FailureKind {
    CONNECTION,
    QUERY,
    MISSING_DATA,
    FILE_WRITE,
    INSERT,
    UNEXPECTED
}

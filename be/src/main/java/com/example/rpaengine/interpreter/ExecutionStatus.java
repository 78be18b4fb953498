package com.example.rpaengine.interpreter;

public enum ExecutionStatus {
    COMPLETED,
    ERROR,
    CANCELLED
}

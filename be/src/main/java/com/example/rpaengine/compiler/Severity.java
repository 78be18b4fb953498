package com.example.rpaengine.compiler;

public enum Severity {
    ERROR,
    WARNING
}

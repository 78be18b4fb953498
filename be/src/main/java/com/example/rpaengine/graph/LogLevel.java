package com.example.rpaengine.graph;

public enum LogLevel {
    INFO,
    WARNING,
    ERROR,
    DEBUG
}

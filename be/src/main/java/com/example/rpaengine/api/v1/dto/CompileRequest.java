package com.example.rpaengine.api.v1.dto;

import com.example.rpaengine.graph.Project;

import jakarta.validation.constraints.NotNull;

/**
 * Request body for compile: the project snapshot to compile.
 */
public record CompileRequest(@NotNull(message = "project is required") Project project) {
}

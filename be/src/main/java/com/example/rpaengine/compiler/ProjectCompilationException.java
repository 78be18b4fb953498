package com.example.rpaengine.compiler;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a project has at least one compile-time error. Carries every diagnostic found,
 * warnings included.
 */
@Getter
public class ProjectCompilationException extends RuntimeException {

    private final List<Diagnostic> diagnostics;

    public ProjectCompilationException(List<Diagnostic> diagnostics) {
        super("Project compilation failed: " + (diagnostics != null
                ? diagnostics.stream().filter(Diagnostic::isError).count() + " error(s)" : ""));
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public List<Diagnostic> getErrors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }
}

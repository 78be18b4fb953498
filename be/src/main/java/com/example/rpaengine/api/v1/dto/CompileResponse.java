package com.example.rpaengine.api.v1.dto;

import com.example.rpaengine.compiler.Diagnostic;
import com.example.rpaengine.ir.CallTable;
import com.example.rpaengine.ir.TryRange;

import java.util.List;

/**
 * Result of a successful compile: call table, try ranges, warnings and the IR listing.
 */
public record CompileResponse(
        String projectName,
        int instructionCount,
        List<CallTable.Entry> scenarios,
        List<TryRange> tryRanges,
        List<String> symbols,
        List<Diagnostic> warnings,
        List<String> listing
) {
}

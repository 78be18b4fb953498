package com.example.rpaengine.compiler;

import com.example.rpaengine.ir.CallTable;
import com.example.rpaengine.ir.IrListing;
import com.example.rpaengine.ir.IrProgram;
import com.example.rpaengine.ir.TryRange;

import java.util.List;
import java.util.Optional;

/**
 * Output of {@link ProjectCompiler}: one sealed program holding every scenario, plus the tables
 * the interpreter needs. Immutable and reusable across runs.
 *
 * @param symbols variable names in id order; a run's store is seeded with them
 */
public record CompiledProject(
        String projectName,
        IrProgram program,
        CallTable callTable,
        List<TryRange> tryRanges,
        List<String> symbols,
        List<Diagnostic> warnings
) {
    public CompiledProject {
        tryRanges = List.copyOf(tryRanges);
        symbols = List.copyOf(symbols);
        warnings = List.copyOf(warnings);
    }

    public Optional<CallTable.Entry> scenario(String scenarioId) {
        return callTable.entry(scenarioId);
    }

    /**
     * Innermost (shortest) try range containing the address.
     */
    public Optional<TryRange> innermostTryRange(int address) {
        TryRange best = null;
        for (TryRange range : tryRanges) {
            if (range.contains(address) && (best == null || range.length() < best.length())) {
                best = range;
            }
        }
        return Optional.ofNullable(best);
    }

    public List<String> listing() {
        return IrListing.render(program, callTable, tryRanges);
    }
}

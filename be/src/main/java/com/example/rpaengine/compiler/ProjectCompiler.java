package com.example.rpaengine.compiler;

import com.example.rpaengine.expression.ExpressionEvaluator;
import com.example.rpaengine.graph.Project;
import com.example.rpaengine.graph.Scenario;
import com.example.rpaengine.ir.CallTable;
import com.example.rpaengine.ir.Instruction;
import com.example.rpaengine.ir.IrProgram;
import com.example.rpaengine.ir.TryRange;
import com.example.rpaengine.variables.VariableStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles all scenarios of a project into one shared program.
 * <ol>
 *     <li>validate the project; any error aborts with {@link ProjectCompilationException}</li>
 *     <li>reserve a call-table entry for every scenario, so calls may refer forward or recursively</li>
 *     <li>emit each scenario once, in declaration order, through {@link ScenarioCompiler}</li>
 *     <li>link call instructions to entry addresses and verify every jump target</li>
 * </ol>
 * Compiling an unchanged project twice yields equal programs.
 */
@Slf4j
@RequiredArgsConstructor
public class ProjectCompiler {

    private final ExpressionEvaluator evaluator;

    public CompiledProject compile(Project project) {
        List<Diagnostic> diagnostics = new ArrayList<>(ProjectValidator.validate(project, evaluator));
        if (diagnostics.stream().anyMatch(Diagnostic::isError)) {
            throw new ProjectCompilationException(diagnostics);
        }

        IrProgram program = new IrProgram();
        CallTable callTable = new CallTable();
        for (Scenario scenario : project.scenarios()) {
            callTable.reserve(scenario.id(), scenario.name(), scenario.parameters());
        }

        VariableStore symbols = new VariableStore();
        symbols.intern(ProjectValidator.LAST_ERROR);
        Map<NodeKey, Integer> compiled = new HashMap<>();
        List<TryRange> tryRanges = new ArrayList<>();
        for (Scenario scenario : project.scenarios()) {
            int entry = new ScenarioCompiler(scenario, program, callTable, compiled, symbols, evaluator, tryRanges,
                    diagnostics).compile();
            log.debug("Compiled scenario id={} entry={} end={}", scenario.id(), entry, program.nextAddress());
        }
        if (diagnostics.stream().anyMatch(Diagnostic::isError)) {
            throw new ProjectCompilationException(diagnostics);
        }

        link(program, callTable);
        program.seal();
        List<Diagnostic> warnings = diagnostics.stream().filter(d -> !d.isError()).toList();
        log.debug("Compiled project name={} instructions={} scenarios={} warnings={}",
                project.name(), program.size(), project.scenarios().size(), warnings.size());
        return new CompiledProject(project.name(), program, callTable, tryRanges, symbols.names(), warnings);
    }

    private static void link(IrProgram program, CallTable callTable) {
        for (int address = 0; address < program.size(); address++) {
            if (program.get(address) instanceof Instruction.Call call) {
                int entry = callTable.entry(call.scenarioId())
                        .map(CallTable.Entry::entryAddress)
                        .orElseThrow(() -> new IllegalStateException("unresolved call target " + call.scenarioId()));
                program.patch(address, i -> ((Instruction.Call) i).withEntryAddress(entry));
            }
        }
    }
}

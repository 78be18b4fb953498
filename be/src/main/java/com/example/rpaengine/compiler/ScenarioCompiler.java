package com.example.rpaengine.compiler;

import com.example.rpaengine.expression.Expression;
import com.example.rpaengine.expression.ExpressionEvaluator;
import com.example.rpaengine.expression.ExpressionParseException;
import com.example.rpaengine.graph.Activity;
import com.example.rpaengine.graph.BranchType;
import com.example.rpaengine.graph.Node;
import com.example.rpaengine.graph.Scenario;
import com.example.rpaengine.graph.VariableBinding;
import com.example.rpaengine.ir.CallTable;
import com.example.rpaengine.ir.Instruction;
import com.example.rpaengine.ir.IrProgram;
import com.example.rpaengine.ir.ResolvedBinding;
import com.example.rpaengine.ir.TryRange;
import com.example.rpaengine.variables.Value;
import com.example.rpaengine.variables.VariableStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * Emits the code of one scenario into the shared program. Every scenario, the run entry or a
 * callee, goes through this same class.
 * <p>
 * Each branch region (If arm, loop body, Try, Catch, error branch) is emitted inline and falls
 * through to the code that follows it, so a path that runs out of connections continues at its
 * enclosing structure's continuation; at the top level that is the unit's trailing {@code Halt}.
 * Reaching a node that is already compiled emits a jump to it; reaching the node of an enclosing
 * Loop/While from its body jumps to that loop's next-iteration instruction. A Try region never
 * jumps to code compiled outside it: such nodes are emitted again inside the region (W010).
 * </p>
 */
final class ScenarioCompiler {

    private final Scenario scenario;
    private final IrProgram program;
    private final CallTable callTable;
    private final Map<NodeKey, Integer> compiled;
    private final VariableStore symbols;
    private final ExpressionEvaluator evaluator;
    private final List<TryRange> tryRanges;
    private final List<Diagnostic> diagnostics;
    private final Deque<LoopContext> loops = new ArrayDeque<>();
    private final Deque<TryScope> tryScopes = new ArrayDeque<>();

    ScenarioCompiler(Scenario scenario, IrProgram program, CallTable callTable, Map<NodeKey, Integer> compiled,
                     VariableStore symbols, ExpressionEvaluator evaluator, List<TryRange> tryRanges,
                     List<Diagnostic> diagnostics) {
        this.scenario = scenario;
        this.program = program;
        this.callTable = callTable;
        this.compiled = compiled;
        this.symbols = symbols;
        this.evaluator = evaluator;
        this.tryRanges = tryRanges;
        this.diagnostics = diagnostics;
    }

    /**
     * Compiles the unit and returns its entry address.
     */
    int compile() {
        Node start = scenario.startNode()
                .orElseThrow(() -> new IllegalStateException("scenario " + scenario.id() + " has no Start node"));
        int entry = program.nextAddress();
        callTable.setEntryAddress(scenario.id(), entry);
        program.emit(new Instruction.ScenarioStart(scenario.id(), scenario.name()));
        compileFrom(start.id());
        program.emit(new Instruction.Halt());
        return entry;
    }

    /**
     * Emits the straight-line path starting at {@code nodeId}. Only nested regions recurse.
     */
    private void compileFrom(String nodeId) {
        String current = nodeId;
        while (current != null) {
            current = compileNode(current);
        }
    }

    /**
     * Emits one node and returns the node its default path continues with, or {@code null}
     * when the path ends here.
     */
    private String compileNode(String nodeId) {
        for (LoopContext loop : loops) {
            if (loop.nodeId.equals(nodeId)) {
                loop.continueJumps.add(program.emit(new Instruction.Jump(Instruction.PLACEHOLDER)));
                return null;
            }
        }
        NodeKey key = new NodeKey(scenario.id(), nodeId);
        Integer existing = lookup(key);
        if (existing != null) {
            program.emit(new Instruction.Jump(existing));
            return null;
        }
        if (compiledOutsideTry(key)) {
            diagnostics.add(Diagnostic.warning("W010", scenario.id(), nodeId, "Node '" + nodeId
                    + "' is reached from a Try branch after being compiled outside it; its code is repeated inside the Try"));
        }
        Node node = scenario.node(nodeId)
                .orElseThrow(() -> new IllegalStateException("node " + nodeId + " not found in scenario " + scenario.id()));
        Activity activity = node.activity();
        if (activity instanceof Activity.Note) {
            visited().put(key, program.nextAddress());
            return next(nodeId);
        }
        visited().put(key, program.emit(new Instruction.NodeMarker(nodeId, activity.displayName(), node.label())));

        if (activity instanceof Activity.Start) {
            return next(nodeId);
        } else if (activity instanceof Activity.End) {
            program.emit(new Instruction.ScenarioEnd(scenario.id(), scenario.name()));
            program.emit(new Instruction.Return());
            return null;
        } else if (activity instanceof Activity.Log a) {
            program.emit(new Instruction.Log(a.level(), evaluator.parseTemplate(a.message())));
            return next(nodeId);
        } else if (activity instanceof Activity.Delay a) {
            program.emit(new Instruction.Delay(Math.max(0, a.milliseconds())));
            return next(nodeId);
        } else if (activity instanceof Activity.SetVariable a) {
            return compileSetVariable(nodeId, a);
        } else if (activity instanceof Activity.Evaluate a) {
            return compileEvaluate(nodeId, a);
        } else if (activity instanceof Activity.IfCondition a) {
            return compileIf(nodeId, a);
        } else if (activity instanceof Activity.Loop a) {
            return compileLoop(nodeId, a);
        } else if (activity instanceof Activity.While a) {
            return compileWhile(nodeId, a);
        } else if (activity instanceof Activity.Continue) {
            innermostLoop(nodeId, "Continue").ifPresent(loop ->
                    loop.continueJumps.add(program.emit(new Instruction.Jump(Instruction.PLACEHOLDER))));
            return null;
        } else if (activity instanceof Activity.Break) {
            innermostLoop(nodeId, "Break").ifPresent(loop ->
                    loop.breakJumps.add(program.emit(new Instruction.Jump(Instruction.PLACEHOLDER))));
            return null;
        } else if (activity instanceof Activity.TryCatch) {
            return compileTryCatch(key);
        } else if (activity instanceof Activity.CallScenario a) {
            return compileCall(nodeId, a);
        } else if (activity instanceof Activity.RunPowershell a) {
            boolean hasError = scenario.hasBranch(nodeId, BranchType.ERROR_BRANCH);
            int address = program.emit(new Instruction.RunPowershell(a.code(), errorSlot(hasError)));
            return compileWithErrorBranch(nodeId, address,
                    target -> ((Instruction.RunPowershell) program.get(address)).withErrorTarget(target));
        }
        return next(nodeId);
    }

    private String next(String nodeId) {
        return scenario.target(nodeId, BranchType.DEFAULT).orElse(null);
    }

    /**
     * Visited map of the innermost open Try region, or the project-wide one outside any Try.
     */
    private Map<NodeKey, Integer> visited() {
        TryScope scope = tryScopes.peek();
        return scope != null ? scope.compiled : compiled;
    }

    private Integer lookup(NodeKey key) {
        Integer existing = visited().get(key);
        if (existing != null) {
            return existing;
        }
        for (TryScope scope : tryScopes) {
            if (scope.owner.equals(key)) {
                return scope.ownerAddress;
            }
        }
        return null;
    }

    private boolean compiledOutsideTry(NodeKey key) {
        if (tryScopes.isEmpty()) {
            return false;
        }
        if (compiled.containsKey(key)) {
            return true;
        }
        return tryScopes.stream().skip(1).anyMatch(scope -> scope.compiled.containsKey(key));
    }

    private String compileSetVariable(String nodeId, Activity.SetVariable a) {
        Value value;
        try {
            value = a.varType().parse(a.value());
        } catch (IllegalArgumentException e) {
            diagnostics.add(Diagnostic.error("E105", scenario.id(), nodeId, "Invalid " + a.varType() + " value: " + e.getMessage()));
            value = Value.of(a.value());
        }
        program.emit(new Instruction.SetVar(symbols.intern(a.name()), a.name(), value));
        return next(nodeId);
    }

    private String compileEvaluate(String nodeId, Activity.Evaluate a) {
        Expression expression = parse(nodeId, a.expression());
        boolean hasResult = a.resultVariable() != null && !a.resultVariable().isBlank();
        int result = hasResult ? symbols.intern(a.resultVariable()) : -1;
        boolean hasError = scenario.hasBranch(nodeId, BranchType.ERROR_BRANCH);
        int address = program.emit(new Instruction.Evaluate(expression, result, a.resultVariable(), errorSlot(hasError)));
        return compileWithErrorBranch(nodeId, address,
                target -> ((Instruction.Evaluate) program.get(address)).withErrorTarget(target));
    }

    private String compileCall(String nodeId, Activity.CallScenario a) {
        if (!callTable.contains(a.scenarioId())) {
            diagnostics.add(Diagnostic.error("E103", scenario.id(), nodeId,
                    "Call Scenario references non-existent scenario '" + a.scenarioId() + "'"));
            return null;
        }
        List<ResolvedBinding> bindings = new ArrayList<>();
        for (VariableBinding b : a.parameters()) {
            bindings.add(new ResolvedBinding(symbols.intern(b.targetVarName()), b.targetVarName(),
                    symbols.intern(b.sourceVarName()), b.sourceVarName(), b.direction()));
        }
        boolean hasError = scenario.hasBranch(nodeId, BranchType.ERROR_BRANCH);
        int address = program.emit(new Instruction.Call(a.scenarioId(), bindings, Instruction.PLACEHOLDER, errorSlot(hasError)));
        return compileWithErrorBranch(nodeId, address,
                target -> ((Instruction.Call) program.get(address)).withErrorTarget(target));
    }

    /**
     * Without an error branch the default path simply continues. Otherwise the default path is
     * emitted inline, the error branch follows behind a jump, and both meet at the address after it.
     */
    private String compileWithErrorBranch(String nodeId, int address, IntFunction<Instruction> withErrorTarget) {
        Optional<String> errorTarget = scenario.target(nodeId, BranchType.ERROR_BRANCH);
        if (errorTarget.isEmpty()) {
            return next(nodeId);
        }
        scenario.target(nodeId, BranchType.DEFAULT).ifPresent(this::compileFrom);
        int jumpOver = program.emit(new Instruction.Jump(Instruction.PLACEHOLDER));
        int errorStart = program.nextAddress();
        Instruction patched = withErrorTarget.apply(errorStart);
        program.patch(address, current -> patched);
        compileFrom(errorTarget.get());
        int after = program.nextAddress();
        program.patch(jumpOver, i -> ((Instruction.Jump) i).withTarget(after));
        return null;
    }

    private String compileIf(String nodeId, Activity.IfCondition a) {
        Expression condition = parse(nodeId, a.condition());
        Optional<String> whenTrue = scenario.target(nodeId, BranchType.TRUE_BRANCH);
        Optional<String> whenFalse = scenario.target(nodeId, BranchType.FALSE_BRANCH);

        int jumpIfNot = program.emit(new Instruction.JumpIfNot(condition, Instruction.PLACEHOLDER));
        whenTrue.ifPresent(this::compileFrom);
        int jumpOver = whenFalse.isPresent() ? program.emit(new Instruction.Jump(Instruction.PLACEHOLDER)) : -1;
        int falseStart = program.nextAddress();
        whenFalse.ifPresent(this::compileFrom);
        int after = program.nextAddress();

        program.patch(jumpIfNot, i -> ((Instruction.JumpIfNot) i).withTarget(falseStart));
        if (jumpOver >= 0) {
            program.patch(jumpOver, i -> ((Instruction.Jump) i).withTarget(after));
        }
        return next(nodeId);
    }

    private String compileLoop(String nodeId, Activity.Loop a) {
        Optional<String> body = scenario.target(nodeId, BranchType.LOOP_BODY);
        if (body.isEmpty()) {
            return next(nodeId);
        }
        int index = symbols.intern(a.index());
        program.emit(new Instruction.LoopInit(index, a.index(), a.start(), a.end(), a.step()));
        int check = program.emit(new Instruction.LoopCheck(index, a.end(), a.step(),
                Instruction.PLACEHOLDER, Instruction.PLACEHOLDER));

        LoopContext loop = new LoopContext(nodeId);
        loops.push(loop);
        int bodyStart = program.nextAddress();
        compileFrom(body.get());
        loops.pop();

        int next = program.emit(new Instruction.LoopNext(index, a.step(), check));
        int exit = program.nextAddress();
        program.patch(check, i -> ((Instruction.LoopCheck) i).withTargets(bodyStart, exit));
        loop.close(program, next, exit);
        return next(nodeId);
    }

    private String compileWhile(String nodeId, Activity.While a) {
        Optional<String> body = scenario.target(nodeId, BranchType.LOOP_BODY);
        if (body.isEmpty()) {
            return next(nodeId);
        }
        Expression condition = parse(nodeId, a.condition());
        program.emit(new Instruction.WhileInit(program.nextAddress() + 1));
        int check = program.emit(new Instruction.WhileCheck(condition, Instruction.PLACEHOLDER, Instruction.PLACEHOLDER));

        LoopContext loop = new LoopContext(nodeId);
        loops.push(loop);
        int bodyStart = program.nextAddress();
        compileFrom(body.get());
        loops.pop();

        int next = program.emit(new Instruction.WhileNext(check));
        int exit = program.nextAddress();
        program.patch(check, i -> ((Instruction.WhileCheck) i).withTargets(bodyStart, exit));
        loop.close(program, next, exit);
        return next(nodeId);
    }

    /**
     * The Try region gets its own visited map: everything it reaches is emitted inside
     * {@code [tryStart, tryEnd)}, so no path out of the Try escapes the Catch.
     */
    private String compileTryCatch(NodeKey key) {
        String nodeId = key.nodeId();
        Optional<String> tryTarget = scenario.target(nodeId, BranchType.TRY_BRANCH);
        Optional<String> catchTarget = scenario.target(nodeId, BranchType.CATCH_BRANCH);

        int tryStart = program.nextAddress();
        if (tryTarget.isPresent()) {
            if (catchTarget.isPresent()) {
                tryScopes.push(new TryScope(key, visited().get(key)));
                compileFrom(tryTarget.get());
                tryScopes.pop();
            } else {
                compileFrom(tryTarget.get());
            }
        }
        int tryEnd = program.nextAddress();
        if (catchTarget.isPresent()) {
            int jumpOver = program.emit(new Instruction.Jump(Instruction.PLACEHOLDER));
            int catchStart = program.nextAddress();
            compileFrom(catchTarget.get());
            int after = program.nextAddress();
            program.patch(jumpOver, i -> ((Instruction.Jump) i).withTarget(after));
            if (tryEnd > tryStart) {
                tryRanges.add(new TryRange(tryStart, tryEnd, catchStart, scenario.id(), nodeId));
            }
        }
        return next(nodeId);
    }

    private Optional<LoopContext> innermostLoop(String nodeId, String what) {
        LoopContext loop = loops.peek();
        if (loop == null) {
            diagnostics.add(Diagnostic.error("E202", scenario.id(), nodeId, what + " node is not inside a Loop or While body"));
        }
        return Optional.ofNullable(loop);
    }

    private Expression parse(String nodeId, String text) {
        try {
            return evaluator.parse(text);
        } catch (ExpressionParseException e) {
            diagnostics.add(Diagnostic.error("E104", scenario.id(), nodeId, "Invalid expression syntax: " + e.getMessage()));
            return new Expression.Literal(Value.UNDEFINED);
        }
    }

    private static int errorSlot(boolean hasErrorBranch) {
        return hasErrorBranch ? Instruction.PLACEHOLDER : Instruction.NO_TARGET;
    }

    /**
     * Open Try region: the TryCatch node that owns it and the nodes compiled inside it.
     */
    private static final class TryScope {
        private final NodeKey owner;
        private final int ownerAddress;
        private final Map<NodeKey, Integer> compiled = new HashMap<>();

        TryScope(NodeKey owner, int ownerAddress) {
            this.owner = owner;
            this.ownerAddress = ownerAddress;
        }
    }

    /**
     * Pending jumps of one Loop/While body, patched once the next-iteration and exit addresses are known.
     */
    private static final class LoopContext {
        private final String nodeId;
        private final List<Integer> continueJumps = new ArrayList<>();
        private final List<Integer> breakJumps = new ArrayList<>();

        LoopContext(String nodeId) {
            this.nodeId = nodeId;
        }

        void close(IrProgram program, int nextAddress, int exitAddress) {
            for (int address : continueJumps) {
                program.patch(address, i -> ((Instruction.Jump) i).withTarget(nextAddress));
            }
            for (int address : breakJumps) {
                program.patch(address, i -> ((Instruction.Jump) i).withTarget(exitAddress));
            }
        }
    }
}

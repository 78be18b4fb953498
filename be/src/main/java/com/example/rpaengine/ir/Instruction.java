package com.example.rpaengine.ir;

import com.example.rpaengine.expression.Expression;
import com.example.rpaengine.graph.LogLevel;
import com.example.rpaengine.variables.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One IR instruction. Addresses are indexes into the owning {@link IrProgram}.
 * <p>
 * Jump-carrying instructions are emitted with {@link #PLACEHOLDER} targets and backpatched via
 * {@link IrProgram#patch}. Optional error targets use {@link #NO_TARGET} when absent.
 * </p>
 */
public sealed interface Instruction {

    int PLACEHOLDER = -1;
    int NO_TARGET = -2;

    /**
     * Every jump target this instruction may transfer to, excluding absent error targets.
     */
    default List<Integer> targets() {
        return List.of();
    }

    String describe();

    private static String addr(int t) {
        return t == PLACEHOLDER ? "?" : Integer.toString(t);
    }

    private static List<Integer> present(int... targets) {
        List<Integer> list = new ArrayList<>();
        for (int t : targets) {
            if (t != NO_TARGET) {
                list.add(t);
            }
        }
        return list;
    }

    record ScenarioStart(String scenarioId, String scenarioName) implements Instruction {
        @Override
        public String describe() {
            return "SCENARIO_START " + scenarioId;
        }
    }

    record ScenarioEnd(String scenarioId, String scenarioName) implements Instruction {
        @Override
        public String describe() {
            return "SCENARIO_END " + scenarioId;
        }
    }

    /**
     * Marks the start of a node's code; sets the node context for subsequent log events.
     */
    record NodeMarker(String nodeId, String activity, String label) implements Instruction {
        @Override
        public String describe() {
            return "NODE " + nodeId + " [" + activity + "] " + label;
        }
    }

    record Halt() implements Instruction {
        @Override
        public String describe() {
            return "HALT";
        }
    }

    record Jump(int target) implements Instruction {
        @Override
        public List<Integer> targets() {
            return List.of(target);
        }

        public Jump withTarget(int t) {
            return new Jump(t);
        }

        @Override
        public String describe() {
            return "JUMP -> " + addr(target);
        }
    }

    record JumpIfNot(Expression condition, int target) implements Instruction {
        @Override
        public List<Integer> targets() {
            return List.of(target);
        }

        public JumpIfNot withTarget(int t) {
            return new JumpIfNot(condition, t);
        }

        @Override
        public String describe() {
            return "JUMP_IF_NOT " + condition.render() + " -> " + addr(target);
        }
    }

    record SetVar(int variable, String name, Value value) implements Instruction {
        @Override
        public String describe() {
            return "SET_VAR " + name + "#" + variable + " = " + value.display();
        }
    }

    record Log(LogLevel level, Expression message) implements Instruction {
        @Override
        public String describe() {
            return "LOG " + level + " " + message.render();
        }
    }

    record Delay(long milliseconds) implements Instruction {
        @Override
        public String describe() {
            return "DELAY " + milliseconds + "ms";
        }
    }

    /**
     * Evaluates an expression, storing the result when {@code resultVariable >= 0}.
     */
    record Evaluate(Expression expression, int resultVariable, String resultName, int errorTarget) implements Instruction {
        @Override
        public List<Integer> targets() {
            return present(errorTarget);
        }

        public Evaluate withErrorTarget(int t) {
            return new Evaluate(expression, resultVariable, resultName, t);
        }

        @Override
        public String describe() {
            String result = resultVariable >= 0 ? " => " + resultName + "#" + resultVariable : "";
            String onError = errorTarget != NO_TARGET ? " !-> " + addr(errorTarget) : "";
            return "EVALUATE " + expression.render() + result + onError;
        }
    }

    record LoopInit(int index, String indexName, long start, long end, long step) implements Instruction {
        @Override
        public String describe() {
            return "LOOP_INIT " + indexName + "#" + index + " = " + start + " (end " + end + ", step " + step + ")";
        }
    }

    /**
     * Continues to {@code bodyTarget} while the index has not reached {@code end} in the direction of {@code step}.
     */
    record LoopCheck(int index, long end, long step, int bodyTarget, int endTarget) implements Instruction {
        @Override
        public List<Integer> targets() {
            return List.of(bodyTarget, endTarget);
        }

        public LoopCheck withTargets(int body, int exit) {
            return new LoopCheck(index, end, step, body, exit);
        }

        @Override
        public String describe() {
            return "LOOP_CHECK #" + index + (step > 0 ? " < " : " > ") + end
                    + " body -> " + addr(bodyTarget) + " exit -> " + addr(endTarget);
        }
    }

    record LoopNext(int index, long step, int checkTarget) implements Instruction {
        @Override
        public List<Integer> targets() {
            return List.of(checkTarget);
        }

        @Override
        public String describe() {
            return "LOOP_NEXT #" + index + " += " + step + " -> " + addr(checkTarget);
        }
    }

    /**
     * Resets the iteration counter of the while loop whose check lives at {@code checkAddress}.
     */
    record WhileInit(int checkAddress) implements Instruction {
        @Override
        public String describe() {
            return "WHILE_INIT @" + checkAddress;
        }
    }

    record WhileCheck(Expression condition, int bodyTarget, int endTarget) implements Instruction {
        @Override
        public List<Integer> targets() {
            return List.of(bodyTarget, endTarget);
        }

        public WhileCheck withTargets(int body, int exit) {
            return new WhileCheck(condition, body, exit);
        }

        @Override
        public String describe() {
            return "WHILE_CHECK " + condition.render() + " body -> " + addr(bodyTarget) + " exit -> " + addr(endTarget);
        }
    }

    record WhileNext(int checkTarget) implements Instruction {
        @Override
        public List<Integer> targets() {
            return List.of(checkTarget);
        }

        @Override
        public String describe() {
            return "WHILE_NEXT -> " + addr(checkTarget);
        }
    }

    /**
     * Invokes a scenario. {@code entryAddress} is linked once every scenario has been compiled.
     */
    record Call(String scenarioId, List<ResolvedBinding> bindings, int entryAddress, int errorTarget) implements Instruction {
        public Call {
            bindings = List.copyOf(bindings);
        }

        @Override
        public List<Integer> targets() {
            return present(entryAddress, errorTarget);
        }

        public Call withEntryAddress(int address) {
            return new Call(scenarioId, bindings, address, errorTarget);
        }

        public Call withErrorTarget(int t) {
            return new Call(scenarioId, bindings, entryAddress, t);
        }

        @Override
        public String describe() {
            String params = bindings.stream()
                    .map(b -> b.calleeName() + " " + b.direction() + " " + b.callerName())
                    .collect(Collectors.joining(", ", "(", ")"));
            String onError = errorTarget != NO_TARGET ? " !-> " + addr(errorTarget) : "";
            return "CALL " + scenarioId + params + " @" + addr(entryAddress) + onError;
        }
    }

    record Return() implements Instruction {
        @Override
        public String describe() {
            return "RETURN";
        }
    }

    record RunPowershell(String code, int errorTarget) implements Instruction {
        @Override
        public List<Integer> targets() {
            return present(errorTarget);
        }

        public RunPowershell withErrorTarget(int t) {
            return new RunPowershell(code, t);
        }

        @Override
        public String describe() {
            return "RUN_POWERSHELL" + (errorTarget != NO_TARGET ? " !-> " + addr(errorTarget) : "");
        }
    }
}

package com.example.rpaengine.graph;

import com.example.rpaengine.variables.VariableType;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Operation performed by a node. Serialized with a {@code type} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Activity.Start.class, name = "start"),
        @JsonSubTypes.Type(value = Activity.End.class, name = "end"),
        @JsonSubTypes.Type(value = Activity.Log.class, name = "log"),
        @JsonSubTypes.Type(value = Activity.Delay.class, name = "delay"),
        @JsonSubTypes.Type(value = Activity.SetVariable.class, name = "set_variable"),
        @JsonSubTypes.Type(value = Activity.Evaluate.class, name = "evaluate"),
        @JsonSubTypes.Type(value = Activity.IfCondition.class, name = "if_condition"),
        @JsonSubTypes.Type(value = Activity.Loop.class, name = "loop"),
        @JsonSubTypes.Type(value = Activity.While.class, name = "while"),
        @JsonSubTypes.Type(value = Activity.Continue.class, name = "continue"),
        @JsonSubTypes.Type(value = Activity.Break.class, name = "break"),
        @JsonSubTypes.Type(value = Activity.TryCatch.class, name = "try_catch"),
        @JsonSubTypes.Type(value = Activity.CallScenario.class, name = "call_scenario"),
        @JsonSubTypes.Type(value = Activity.RunPowershell.class, name = "run_powershell"),
        @JsonSubTypes.Type(value = Activity.Note.class, name = "note")
})
public sealed interface Activity {

    /**
     * Upper-case activity name used as log context, e.g. {@code IF CONDITION}.
     */
    String displayName();

    /**
     * Whether a failure of this activity may be routed through an {@link BranchType#ERROR_BRANCH}.
     */
    default boolean canHaveErrorOutput() {
        return false;
    }

    record Start() implements Activity {
        @Override
        public String displayName() {
            return "START";
        }
    }

    record End() implements Activity {
        @Override
        public String displayName() {
            return "END";
        }
    }

    record Log(LogLevel level, String message) implements Activity {
        public Log {
            level = level != null ? level : LogLevel.INFO;
            message = message != null ? message : "";
        }

        @Override
        public String displayName() {
            return "LOG";
        }
    }

    record Delay(long milliseconds) implements Activity {
        @Override
        public String displayName() {
            return "DELAY";
        }
    }

    record SetVariable(String name, String value, VariableType varType) implements Activity {
        public SetVariable {
            name = name != null ? name : "";
            value = value != null ? value : "";
            varType = varType != null ? varType : VariableType.STRING;
        }

        @Override
        public String displayName() {
            return "SET VARIABLE";
        }
    }

    /**
     * Evaluates an expression; the result is stored in {@code resultVariable} when one is given.
     */
    record Evaluate(String expression, String resultVariable) implements Activity {
        public Evaluate {
            expression = expression != null ? expression : "";
        }

        @Override
        public String displayName() {
            return "EVALUATE";
        }

        @Override
        public boolean canHaveErrorOutput() {
            return true;
        }
    }

    record IfCondition(String condition) implements Activity {
        public IfCondition {
            condition = condition != null ? condition : "";
        }

        @Override
        public String displayName() {
            return "IF CONDITION";
        }
    }

    /**
     * Counted loop: {@code index} runs from {@code start} towards {@code end} (exclusive) by {@code step}.
     */
    record Loop(String index, long start, long end, long step) implements Activity {
        public Loop {
            index = index != null ? index : "";
        }

        @Override
        public String displayName() {
            return "LOOP";
        }
    }

    record While(String condition) implements Activity {
        public While {
            condition = condition != null ? condition : "";
        }

        @Override
        public String displayName() {
            return "WHILE";
        }
    }

    record Continue() implements Activity {
        @Override
        public String displayName() {
            return "CONTINUE";
        }
    }

    record Break() implements Activity {
        @Override
        public String displayName() {
            return "BREAK";
        }
    }

    record TryCatch() implements Activity {
        @Override
        public String displayName() {
            return "TRY CATCH";
        }
    }

    record CallScenario(String scenarioId, List<VariableBinding> parameters) implements Activity {
        public CallScenario {
            Objects.requireNonNull(scenarioId, "scenarioId");
            parameters = parameters != null ? List.copyOf(parameters) : List.of();
        }

        @Override
        public String displayName() {
            return "CALL SCENARIO";
        }

        @Override
        public boolean canHaveErrorOutput() {
            return true;
        }
    }

    record RunPowershell(String code) implements Activity {
        public RunPowershell {
            code = code != null ? code : "";
        }

        @Override
        public String displayName() {
            return "RUN POWERSHELL";
        }

        @Override
        public boolean canHaveErrorOutput() {
            return true;
        }
    }

    /**
     * Annotation on the canvas; never compiled.
     */
    record Note(String text) implements Activity {
        @Override
        public String displayName() {
            return "NOTE";
        }
    }
}

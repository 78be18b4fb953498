package com.example.rpaengine.graph;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * All scenarios of one project. The main scenario is the default run entry.
 */
public record Project(String name, String mainScenarioId, List<Scenario> scenarios) {
    public Project {
        Objects.requireNonNull(scenarios, "scenarios");
        scenarios = List.copyOf(scenarios);
        name = name != null ? name : "project";
    }

    public Optional<Scenario> scenario(String id) {
        return scenarios.stream().filter(s -> s.id().equals(id)).findFirst();
    }

    /**
     * The scenario named by {@code mainScenarioId}, falling back to the first declared one.
     */
    public Optional<Scenario> mainScenario() {
        if (mainScenarioId != null) {
            Optional<Scenario> main = scenario(mainScenarioId);
            if (main.isPresent()) {
                return main;
            }
        }
        return scenarios.isEmpty() ? Optional.empty() : Optional.of(scenarios.get(0));
    }
}

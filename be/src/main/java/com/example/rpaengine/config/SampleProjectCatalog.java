package com.example.rpaengine.config;

import com.example.rpaengine.api.SampleNotFoundException;
import com.example.rpaengine.graph.Project;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Sample projects by file name (without extension), filled at startup by {@link ExampleProjectsLoader}.
 */
@Component
public class SampleProjectCatalog {

    private final Map<String, Project> samples = new ConcurrentSkipListMap<>();

    void register(String name, Project project) {
        samples.put(name, project);
    }

    public List<String> names() {
        return List.copyOf(samples.keySet());
    }

    /**
     * @throws SampleNotFoundException if no sample has that name
     */
    public Project get(String name) {
        Project project = samples.get(name);
        if (project == null) {
            throw new SampleNotFoundException(name);
        }
        return project;
    }
}

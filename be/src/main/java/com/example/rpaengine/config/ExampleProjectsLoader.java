package com.example.rpaengine.config;

import com.example.rpaengine.graph.Project;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads sample projects from classpath resources into the {@link SampleProjectCatalog} at startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExampleProjectsLoader implements ApplicationRunner {

    private static final String EXAMPLES_DIR = "examples/";
    private static final List<String> EXAMPLE_FILES = List.of(
            "hello-world.json",
            "if-condition.json",
            "loops.json",
            "call-scenario.json",
            "try-catch.json"
    );

    private final SampleProjectCatalog catalog;
    private final JsonMapper jsonMapper;

    @Override
    public void run(ApplicationArguments args) {
        for (String filename : EXAMPLE_FILES) {
            loadExample(filename);
        }
    }

    private void loadExample(String filename) {
        String path = EXAMPLES_DIR + filename;
        Resource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            log.warn("Sample project resource not found: {}", path);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            Project project = jsonMapper.readValue(in, Project.class);
            String name = filename.substring(0, filename.lastIndexOf('.'));
            catalog.register(name, project);
            log.info("Loaded sample project name={} scenarios={}", name, project.scenarios().size());
        } catch (JacksonException e) {
            log.error("Failed to parse sample project {}: {}", path, e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read sample project {}: {}", path, e.getMessage());
        }
    }
}

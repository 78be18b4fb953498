package com.example.rpaengine.api.v1;

import com.example.rpaengine.api.v1.dto.RunResponse;
import com.example.rpaengine.api.v1.dto.SampleListResponse;
import com.example.rpaengine.config.SampleProjectCatalog;
import com.example.rpaengine.graph.Project;
import com.example.rpaengine.service.ScenarioRunService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Sample projects bundled with the backend: list, fetch and run them.
 */
@RestController
@RequestMapping("/api/v1/samples")
@RequiredArgsConstructor
@Slf4j
public class SampleController {

    private final SampleProjectCatalog catalog;
    private final ScenarioRunService runService;

    @GetMapping
    public ResponseEntity<SampleListResponse> list() {
        log.debug("Listing sample projects");
        return ResponseEntity.ok(new SampleListResponse(catalog.names()));
    }

    @GetMapping("/{name}")
    public ResponseEntity<Project> get(@PathVariable String name) {
        log.info("Getting sample project name={}", name);
        return ResponseEntity.ok(catalog.get(name));
    }

    @PostMapping("/{name}/run")
    public ResponseEntity<RunResponse> run(@PathVariable String name,
                                           @RequestBody(required = false) Map<String, Object> inputs) {
        log.info("Running sample project name={} inputKeys={}", name, inputs != null ? inputs.keySet() : "none");
        Project project = catalog.get(name);
        return ResponseEntity.ok(runService.run(project, null, inputs != null ? inputs : Map.of()));
    }
}

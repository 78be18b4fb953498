package com.example.rpaengine.api.v1;

import com.example.rpaengine.api.v1.dto.RunRequest;
import com.example.rpaengine.api.v1.dto.RunResponse;
import com.example.rpaengine.api.v1.dto.RunStartedResponse;
import com.example.rpaengine.service.ScenarioRunService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for scenario runs.
 * <p>
 * Exposes {@code /api/v1/runs}: synchronous run (POST), asynchronous start (POST /async),
 * status (GET /{id}) and stop (POST /{id}/stop). Runtime failures are part of the response
 * status, not HTTP errors.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/runs")
@RequiredArgsConstructor
@Slf4j
public class RunController {

    private final ScenarioRunService runService;

    @PostMapping
    public ResponseEntity<RunResponse> run(@Valid @RequestBody RunRequest request) {
        log.info("Run request project={} scenario={} inputKeys={}", request.project().name(), request.scenarioId(),
                request.inputs().keySet());
        return ResponseEntity.ok(runService.run(request.project(), request.scenarioId(), request.inputs()));
    }

    @PostMapping("/async")
    public ResponseEntity<RunStartedResponse> start(@Valid @RequestBody RunRequest request) {
        log.info("Async run request project={} scenario={}", request.project().name(), request.scenarioId());
        UUID id = runService.start(request.project(), request.scenarioId(), request.inputs());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new RunStartedResponse(id));
    }

    @GetMapping("/{id}")
    public ResponseEntity<RunResponse> status(@PathVariable UUID id) {
        log.debug("Run status id={}", id);
        return ResponseEntity.ok(runService.status(id));
    }

    @PostMapping("/{id}/stop")
    public ResponseEntity<RunResponse> stop(@PathVariable UUID id) {
        log.info("Stopping run id={}", id);
        return ResponseEntity.ok(runService.stop(id));
    }
}

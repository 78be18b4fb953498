package com.example.rpaengine.api.v1;

import com.example.rpaengine.api.v1.dto.CompileRequest;
import com.example.rpaengine.api.v1.dto.CompileResponse;
import com.example.rpaengine.compiler.CompiledProject;
import com.example.rpaengine.service.ScenarioRunService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Compiles a project without running it; used by the studio's IR debugger view.
 * Compile errors are answered with 400 and the full diagnostic list.
 */
@RestController
@RequestMapping("/api/v1/compile")
@RequiredArgsConstructor
@Slf4j
public class CompileController {

    private final ScenarioRunService runService;

    @PostMapping
    public ResponseEntity<CompileResponse> compile(@Valid @RequestBody CompileRequest request) {
        log.info("Compile request project={}", request.project().name());
        CompiledProject compiled = runService.compile(request.project());
        return ResponseEntity.ok(new CompileResponse(
                compiled.projectName(),
                compiled.program().size(),
                List.copyOf(compiled.callTable().entries()),
                compiled.tryRanges(),
                compiled.symbols(),
                compiled.warnings(),
                compiled.listing()
        ));
    }
}

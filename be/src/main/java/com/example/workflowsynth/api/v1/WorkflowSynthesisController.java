package com.example.workflowsynth.api.v1;

import com.example.workflowsynth.api.v1.dto.AssembleWorkflowRequest;
import com.example.workflowsynth.api.v1.dto.GenerateWorkflowRequest;
import com.example.workflowsynth.service.WorkflowSynthesisService;
import com.example.workflowsynth.synthesis.SynthesisResult;
import com.example.workflowsynth.validation.ValidationReport;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for workflow synthesis.
 * <p>
 * {@code POST /api/v1/workflows/generate} plans and generates a workflow with the model,
 * {@code POST /api/v1/workflows/assemble} assembles caller-supplied fragments, and
 * {@code POST /api/v1/workflows/validate} validates a finished workflow JSON. Recoverable graph problems are
 * reported in the response body with status 200.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/workflows")
@RequiredArgsConstructor
@Slf4j
public class WorkflowSynthesisController {

    private final WorkflowSynthesisService service;

    @PostMapping("/generate")
    public ResponseEntity<SynthesisResult> generate(@Valid @RequestBody GenerateWorkflowRequest request) {
        log.info("Generating workflow name={} promptLength={}", request.name(), request.prompt().length());
        return ResponseEntity.ok(service.synthesize(request.name(), request.prompt()));
    }

    @PostMapping("/assemble")
    public ResponseEntity<SynthesisResult> assemble(@Valid @RequestBody AssembleWorkflowRequest request) {
        log.info("Assembling workflow name={} fragments={}", request.name(), request.fragments().size());
        return ResponseEntity.ok(service.assemble(request.toAssemblyRequest()));
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidationReport> validate(@RequestBody Map<String, Object> workflow) {
        log.info("Validating workflow name={}", workflow.get("name"));
        return ResponseEntity.ok(service.validate(workflow));
    }
}

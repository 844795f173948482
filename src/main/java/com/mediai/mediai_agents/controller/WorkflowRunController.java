package com.mediai.mediai_agents.controller;

import com.mediai.mediai_agents.model.crew.WorkflowContext;
import com.mediai.mediai_agents.model.domain.WorkflowRun;
import com.mediai.mediai_agents.repository.WorkflowRunRepository;
import com.mediai.mediai_agents.service.WorkflowService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class WorkflowRunController {

    private final WorkflowRunRepository workflowRunRepository;
    private final WorkflowService       workflowService;

    // GET /api/workflow-runs?workflow=data_pipeline: run history, newest first
    @GetMapping("/workflow-runs")
    public List<RunSummary> listAll(@RequestParam(required = false) String workflow) {
        List<WorkflowRun> runs = workflow == null || workflow.isBlank()
                ? workflowRunRepository.findAllByOrderByStartedAtDesc()
                : workflowRunRepository.findByWorkflowOrderByStartedAtDesc(workflow);
        return runs.stream().map(this::toSummary).toList();
    }

    // GET /api/workflow-runs/{id}: full detail including the report snapshot
    @GetMapping("/workflow-runs/{id}")
    public ResponseEntity<RunDetail> getById(@PathVariable UUID id) {
        return workflowRunRepository.findById(id)
                .map(run -> ResponseEntity.ok(toDetail(run)))
                .orElse(ResponseEntity.notFound().build());
    }

    // POST /api/workflows/run: body is the workflow context (crew name -> task inputs)
    @PostMapping("/workflows/run")
    public RunDetail runWorkflow(@RequestBody(required = false) Map<String, Object> body) {
        WorkflowContext context;
        try {
            context = WorkflowContext.from(body != null ? body : Map.of());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        return toDetail(workflowService.runWorkflow(context, "API"));
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    private RunSummary toSummary(WorkflowRun run) {
        return new RunSummary(
                run.getId().toString(),
                run.getWorkflow(),
                run.getStatus().name(),
                run.getTriggeredBy(),
                run.getStartedAt() != null ? run.getStartedAt().toString() : null,
                run.getCompletedAt() != null ? run.getCompletedAt().toString() : null,
                durationMs(run));
    }

    private RunDetail toDetail(WorkflowRun run) {
        return new RunDetail(
                run.getId().toString(),
                run.getWorkflow(),
                run.getStatus().name(),
                run.getTriggeredBy(),
                run.getStartedAt() != null ? run.getStartedAt().toString() : null,
                run.getCompletedAt() != null ? run.getCompletedAt().toString() : null,
                durationMs(run),
                run.getReportSnapshot());
    }

    private long durationMs(WorkflowRun run) {
        return (run.getCompletedAt() != null && run.getStartedAt() != null)
                ? Duration.between(run.getStartedAt(), run.getCompletedAt()).toMillis()
                : -1;
    }

    public record RunSummary(
            String id,
            String workflow,
            String status,
            String triggeredBy,
            String startedAt,
            String completedAt,
            long   durationMs
    ) {}

    public record RunDetail(
            String              id,
            String              workflow,
            String              status,
            String              triggeredBy,
            String              startedAt,
            String              completedAt,
            long                durationMs,
            Map<String, Object> reportSnapshot
    ) {}
}

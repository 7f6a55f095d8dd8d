package com.congruence.dispatch.api;

import com.congruence.core.model.MiningRun;
import com.congruence.core.model.TriggerRequest;
import com.congruence.core.pipeline.BackgroundMiningExecutor;
import com.congruence.core.pipeline.MiningPipeline;
import com.congruence.core.pipeline.PipelineResult;
import com.congruence.core.pipeline.RunHandle;
import com.congruence.core.persistence.MiningRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for mining triggers and run status.
 */
@RestController
@RequestMapping("/api/v1")
public class MiningController {

    private static final Logger log = LoggerFactory.getLogger(MiningController.class);

    private final MiningPipeline pipeline;
    private final BackgroundMiningExecutor background;
    private final MiningRunRepository runs;

    public MiningController(MiningPipeline pipeline, BackgroundMiningExecutor background, MiningRunRepository runs) {
        this.pipeline = pipeline;
        this.background = background;
        this.runs = runs;
    }

    /**
     * POST /api/v1/projects/{id}/mining: Runs the pipeline, or queues it with {@code ?async=true}.
     */
    @PostMapping("/projects/{id}/mining")
    public ResponseEntity<Map<String, Object>> trigger(@PathVariable long id,
                                                       @RequestBody MiningRequest request,
                                                       @RequestParam(defaultValue = "false") boolean async) {
        TriggerRequest trigger = TriggerRequest.of(id, request.branch(), request.dataType(), request.safeMode());
        if (async) {
            RunHandle handle = background.submit(trigger);
            log.info("Queued mining run {} for project {}", handle.runId(), id);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("run_id", handle.runId());
            body.put("status", handle.status().name());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        }
        PipelineResult result = pipeline.run(trigger);
        Map<String, Object> body = runBody(result.run());
        if (result.ingestion() != null) {
            body.put("ingestion", result.ingestion());
        }
        if (result.coordination() != null) {
            body.put("coordination_runs", result.coordination().runs().stream()
                    .map(CoordinationController::toBody).toList());
        }
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/v1/mining-runs/{id}: Status and captured output of a run.
     */
    @GetMapping("/mining-runs/{id}")
    public ResponseEntity<Map<String, Object>> getRun(@PathVariable long id) {
        return runs.findById(id)
                .map(run -> {
                    Map<String, Object> body = runBody(run);
                    body.put("log", run.log());
                    return ResponseEntity.ok(body);
                })
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/projects/{id}/mining-runs: Most recent runs first.
     */
    @GetMapping("/projects/{id}/mining-runs")
    public List<Map<String, Object>> listRuns(@PathVariable long id,
                                              @RequestParam(defaultValue = "20") int limit) {
        return runs.findRecent(id, limit).stream().map(MiningController::runBody).toList();
    }

    static Map<String, Object> runBody(MiningRun run) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("run_id", run.id());
        body.put("project_id", run.projectId());
        body.put("branch", run.branch());
        body.put("data_type", run.dataType().value());
        body.put("status", run.status().name());
        body.put("command", run.command());
        body.put("artifact_dir", run.artifactDir());
        body.put("created_at", run.createdAt());
        body.put("started_at", run.startedAt());
        body.put("finished_at", run.finishedAt());
        body.put("error_code", run.errorCode());
        body.put("error_message", run.errorMessage());
        return body;
    }
}

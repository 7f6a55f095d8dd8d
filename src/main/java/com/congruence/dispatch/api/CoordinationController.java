package com.congruence.dispatch.api;

import com.congruence.core.error.ValidationException;
import com.congruence.core.model.Algorithm;
import com.congruence.core.model.CoordinationRun;
import com.congruence.core.model.CrEdge;
import com.congruence.core.persistence.CoordinationRunRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST controller exposing congruence runs and their CR edges to downstream consumers.
 */
@RestController
@RequestMapping("/api/v1/projects/{id}/coordination-runs")
public class CoordinationController {

    private final CoordinationRunRepository runs;

    public CoordinationController(CoordinationRunRepository runs) {
        this.runs = runs;
    }

    @GetMapping
    public List<Map<String, Object>> list(@PathVariable long id, @RequestParam(defaultValue = "20") int limit) {
        return runs.findByProject(id, limit).stream().map(CoordinationController::toBody).toList();
    }

    /**
     * GET /api/v1/projects/{id}/coordination-runs/latest?algorithm=STC
     */
    @GetMapping("/latest")
    public ResponseEntity<Map<String, Object>> latest(@PathVariable long id,
                                                      @RequestParam(defaultValue = "STC") String algorithm) {
        Algorithm parsed;
        try {
            parsed = Algorithm.valueOf(algorithm.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid algorithm: " + algorithm);
        }
        return runs.findLatest(id, parsed)
                .map(run -> ResponseEntity.ok(toBody(run)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{runId}/cr-edges")
    public ResponseEntity<List<Map<String, Object>>> crEdges(@PathVariable long id, @PathVariable long runId) {
        if (runs.findById(runId).filter(run -> run.projectId() == id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        List<Map<String, Object>> edges = runs.findCrEdges(runId).stream()
                .map(CoordinationController::toBody)
                .toList();
        return ResponseEntity.ok(edges);
    }

    static Map<String, Object> toBody(CoordinationRun run) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", run.id());
        body.put("branch", run.branch());
        body.put("algorithm", run.algorithm().name());
        body.put("td_source", run.tdSource().name());
        body.put("ca_source", run.caSource());
        body.put("score", run.score());
        body.put("band", run.band().name());
        body.put("cr_count", run.crCount());
        body.put("diff_count", run.diffCount());
        body.put("class_config", run.classConfig());
        body.put("class_breakdown", run.classBreakdown());
        body.put("created_at", run.createdAt());
        return body;
    }

    private static Map<String, Object> toBody(CrEdge edge) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("contributor_i", edge.contributors().first());
        body.put("contributor_j", edge.contributors().second());
        body.put("weight", edge.weight());
        return body;
    }
}

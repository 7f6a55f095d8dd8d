package com.congruence.core.coordination;

import com.congruence.core.error.PersistenceException;
import com.congruence.core.ingest.ArtifactReader;
import com.congruence.core.ingest.FileTypes;
import com.congruence.core.metrics.CongruenceMetrics;
import com.congruence.core.model.Algorithm;
import com.congruence.core.model.CaEdge;
import com.congruence.core.model.CoordinationRun;
import com.congruence.core.model.CrEdge;
import com.congruence.core.model.MiningArtifact;
import com.congruence.core.model.ProjectContributor;
import com.congruence.core.model.TaEntry;
import com.congruence.core.model.TdEdge;
import com.congruence.core.model.TdSource;
import com.congruence.core.persistence.CodeFileRepository;
import com.congruence.core.persistence.CoordinationRunRepository;
import com.congruence.core.persistence.GraphRepository;
import com.congruence.core.persistence.ProjectContributorRepository;
import com.congruence.core.persistence.TransactionRunner;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the TD, CA and CR graphs of a project branch and scores their congruence.
 *
 * <p>TA comes from the rows the ingester wrote; TD from the dependency miner's matrix.
 * Graph replacement, the new runs and their CR edges are written in one transaction.
 */
@Service
public class CoordinationGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(CoordinationGraphBuilder.class);

    static final String CA_SOURCE = "ta-shared-files";

    private final ArtifactReader reader;
    private final TransactionRunner tx;
    private final GraphRepository graphs;
    private final CodeFileRepository codeFiles;
    private final ProjectContributorRepository projectContributors;
    private final CoordinationRunRepository runs;
    private final CoordinationProperties properties;
    private final CongruenceCalculator calculator;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final CongruenceMetrics metrics;

    public CoordinationGraphBuilder(ArtifactReader reader, TransactionRunner tx, GraphRepository graphs,
                                    CodeFileRepository codeFiles, ProjectContributorRepository projectContributors,
                                    CoordinationRunRepository runs, CoordinationProperties properties,
                                    CrWeightingPolicy weightingPolicy, ObjectMapper objectMapper, Clock clock,
                                    @Autowired(required = false) CongruenceMetrics metrics) {
        this.reader = reader;
        this.tx = tx;
        this.graphs = graphs;
        this.codeFiles = codeFiles;
        this.projectContributors = projectContributors;
        this.runs = runs;
        this.properties = properties;
        this.calculator = new CongruenceCalculator(properties.getThresholds(), weightingPolicy);
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Scores the branch from the TA rows already stored and the dependency artifacts in
     * {@code outputDir}. Without a dependency matrix TD is empty and every score is 1.0.
     */
    public CoordinationResult build(long projectId, String branch, Path outputDir) {
        List<TaEntry> ta = graphs.findTaEntries(projectId, branch);
        Optional<JsonNode> matrixNode = reader.readOptionalObject(outputDir, MiningArtifact.FILE_DEPENDENCY_MATRIX);
        if (matrixNode.isEmpty()) {
            log.warn("No {} for project {} on {}, technical dependencies are empty",
                    MiningArtifact.FILE_DEPENDENCY_MATRIX.fileName(), projectId, branch);
        }
        Map<String, Map<String, Double>> rawMatrix = matrixNode.map(ArtifactReader::matrix).orElseGet(Map::of);
        Map<String, String> idToFile = dependencyIdMap(outputDir);

        List<CaEdge> ca = calculator.communicationActivity(ta);
        ClassPolicy policy = ClassPolicy.from(properties.getClasses());
        Map<Long, String> classes = contributorClasses(projectId, policy);
        Instant now = clock.instant();

        CoordinationResult result = tx.inTransaction("coordination for project " + projectId, conn -> {
            Map<String, Long> pathIds = new HashMap<>();
            Map<Long, Map<Long, Double>> matrix = new LinkedHashMap<>();
            int unresolved = 0;
            for (Map.Entry<String, Map<String, Double>> row : rawMatrix.entrySet()) {
                Long x = resolveFile(conn, projectId, idToFile.get(row.getKey()), pathIds);
                if (x == null) {
                    unresolved++;
                    continue;
                }
                for (Map.Entry<String, Double> cell : row.getValue().entrySet()) {
                    Long y = resolveFile(conn, projectId, idToFile.get(cell.getKey()), pathIds);
                    if (y == null) {
                        unresolved++;
                        continue;
                    }
                    matrix.computeIfAbsent(x, k -> new LinkedHashMap<>()).put(y, cell.getValue());
                }
            }
            if (unresolved > 0) {
                log.warn("{} dependency cells reference files missing from the id map", unresolved);
            }

            List<TdEdge> td = calculator.technicalDependencies(matrix);
            List<CrEdge> cr = calculator.coordinationRequirements(ta, td);
            int diff = calculator.diffCount(cr, ca);

            graphs.replaceTdEdges(conn, projectId, branch, td);
            graphs.replaceCaEdges(conn, projectId, branch, ca);

            List<CoordinationRun> stored = new ArrayList<>();
            for (Algorithm algorithm : properties.getAlgorithms()) {
                CoordinationRun run = switch (algorithm) {
                    case STC -> new CoordinationRun(0, projectId, branch, Algorithm.STC, TdSource.LD, CA_SOURCE,
                            "{}", "{}", calculator.stc(cr, ca), cr.size(), diff, now);
                    case MC_STC -> {
                        List<ClassPairScore> scores = calculator.classPairScores(cr, ca, classes, policy);
                        yield new CoordinationRun(0, projectId, branch, Algorithm.MC_STC, TdSource.LD, CA_SOURCE,
                                toJson(policy.describe()), toJson(breakdown(scores)), calculator.mcStc(scores),
                                cr.size(), diff, now);
                    }
                };
                stored.add(runs.insert(conn, run, cr));
            }
            return new CoordinationResult(stored, td.size(), ca.size(), cr.size());
        });

        for (CoordinationRun run : result.runs()) {
            log.info("{} score for project {} on {}: {} ({} required, {} missing, {})", run.algorithm(), projectId,
                    branch, run.score(), run.crCount(), run.diffCount(), run.band());
            if (metrics != null) {
                metrics.recordScore(run.algorithm().name(), run.score());
            }
        }
        return result;
    }

    /**
     * The dependency miner's own id map, or the assignment miner's when it is missing.
     */
    private Map<String, String> dependencyIdMap(Path outputDir) {
        return reader.readOptionalObject(outputDir, MiningArtifact.FILE_DEPENDENCY_ID_TO_FILE)
                .or(() -> reader.readOptionalObject(outputDir, MiningArtifact.ID_TO_FILE))
                .map(ArtifactReader::textMap)
                .orElseGet(Map::of);
    }

    private Map<Long, String> contributorClasses(long projectId, ClassPolicy policy) {
        Map<Long, String> classes = new HashMap<>();
        for (ProjectContributor pc : projectContributors.findByProject(projectId)) {
            classes.put(pc.contributorId(), policy.classify(pc.login(), pc.totalModifications(), pc.functionalRole()));
        }
        return classes;
    }

    private Long resolveFile(Connection conn, long projectId, String path, Map<String, Long> cache)
            throws SQLException {
        if (path == null || path.isBlank()) {
            return null;
        }
        Long id = cache.get(path);
        if (id == null) {
            id = codeFiles.upsert(conn, projectId, path, FileTypes.language(path)).id();
            cache.put(path, id);
        }
        return id;
    }

    private static Map<String, Object> breakdown(List<ClassPairScore> scores) {
        Map<String, Object> breakdown = new LinkedHashMap<>();
        for (ClassPairScore score : scores) {
            breakdown.put(score.classPair(), Map.of(
                    "cr", score.crCount(),
                    "matched", score.matched(),
                    "ratio", score.ratio(),
                    "weight", score.weight()));
        }
        return breakdown;
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialize coordination metadata", e);
        }
    }
}

package com.congruence.core.ingest;

import com.congruence.core.metrics.CongruenceMetrics;
import com.congruence.core.model.CodeFile;
import com.congruence.core.model.Contributor;
import com.congruence.core.model.MiningArtifact;
import com.congruence.core.model.ProjectContributor;
import com.congruence.core.model.TaEntry;
import com.congruence.core.persistence.CodeFileRepository;
import com.congruence.core.persistence.ContributorRepository;
import com.congruence.core.persistence.GraphRepository;
import com.congruence.core.persistence.ProjectContributorRepository;
import com.congruence.core.persistence.TransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns the assignment-matrix artifacts of one run into contributor snapshots,
 * code files and TA entries.
 *
 * <p>Everything for a run is written in one transaction. Each contributor is
 * written under its own savepoint so a bad row is rolled back and skipped
 * without losing the rest. Re-ingesting the same artifacts gives the same rows:
 * snapshots and TA entries for the project and branch are replaced, never
 * accumulated. A caller that already holds a transaction gets the writes
 * inside it, committed or rolled back together with its other work.
 */
@Service
public class OutputIngester {

    private static final Logger log = LoggerFactory.getLogger(OutputIngester.class);

    private final ArtifactReader reader;
    private final LoginNormalizer loginNormalizer;
    private final RoleClassifier roleClassifier;
    private final IngestProperties properties;
    private final TransactionRunner tx;
    private final ContributorRepository contributors;
    private final ProjectContributorRepository projectContributors;
    private final CodeFileRepository codeFiles;
    private final GraphRepository graphs;
    private final Clock clock;
    private final CongruenceMetrics metrics;

    public OutputIngester(ArtifactReader reader, LoginNormalizer loginNormalizer, RoleClassifier roleClassifier,
                          IngestProperties properties, TransactionRunner tx, ContributorRepository contributors,
                          ProjectContributorRepository projectContributors, CodeFileRepository codeFiles,
                          GraphRepository graphs, Clock clock,
                          @Autowired(required = false) CongruenceMetrics metrics) {
        this.reader = reader;
        this.loginNormalizer = loginNormalizer;
        this.roleClassifier = roleClassifier;
        this.properties = properties;
        this.tx = tx;
        this.contributors = contributors;
        this.projectContributors = projectContributors;
        this.codeFiles = codeFiles;
        this.graphs = graphs;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Ingests {@code idToUser.json}, {@code AssignmentMatrix.json} and, when present,
     * {@code idToFile.json} from {@code outputDir}.
     *
     * @throws IngestionException when a required artifact is missing or malformed; nothing is written
     */
    public IngestionResult ingest(long projectId, String branch, Path outputDir) {
        Map<String, String> idToUser = ArtifactReader.textMap(
                reader.readRequiredObject(outputDir, MiningArtifact.ID_TO_USER));
        Map<String, Map<String, Double>> matrix = ArtifactReader.matrix(
                reader.readRequiredObject(outputDir, MiningArtifact.ASSIGNMENT_MATRIX));
        Map<String, String> idToFile = reader.readOptionalObject(outputDir, MiningArtifact.ID_TO_FILE)
                .map(ArtifactReader::textMap)
                .orElseGet(Map::of);
        if (idToFile.isEmpty()) {
            log.info("No {} for project {}, file paths fall back to miner ids", MiningArtifact.ID_TO_FILE.fileName(),
                    projectId);
        }

        Map<String, AuthorGroup> authors = groupByLogin(idToUser, matrix);
        Instant analysedAt = clock.instant();

        IngestionResult result = tx.inTransaction("ingest project " + projectId, conn -> {
            Map<String, Long> fileIds = new HashMap<>();
            Set<Long> kept = new HashSet<>();
            List<TaEntry> taEntries = new ArrayList<>();
            int skipped = 0;

            for (AuthorGroup author : authors.values()) {
                try {
                    var newFileIds = new HashMap<String, Long>();
                    List<TaEntry> entries = tx.inSavepoint("contributor " + author.login, rowConn ->
                            writeContributor(rowConn, projectId, branch, author, idToFile, fileIds, newFileIds,
                                    analysedAt));
                    fileIds.putAll(newFileIds);
                    taEntries.addAll(entries);
                    kept.add(author.contributorId);
                } catch (RuntimeException e) {
                    skipped++;
                    log.error("Skipping contributor {} ({}): {}", author.login, author.email, e.getMessage());
                }
            }

            graphs.replaceTaEntries(conn, projectId, branch, taEntries);
            int removed = projectContributors.deleteStale(conn, projectId, branch, kept);
            if (removed > 0) {
                log.info("Removed {} contributor snapshots no longer present on {}", removed, branch);
            }
            long files = taEntries.stream().mapToLong(TaEntry::fileId).distinct().count();
            return new IngestionResult(kept.size(), skipped, (int) files, taEntries.size());
        });

        log.info("Ingested {} contributors ({} skipped), {} files, {} TA entries for project {} on {}",
                result.contributors(), result.skipped(), result.files(), result.taEntries(), projectId, branch);
        if (metrics != null) {
            metrics.recordIngestion(result.contributors(), result.skipped());
        }
        return result;
    }

    private List<TaEntry> writeContributor(Connection conn, long projectId, String branch, AuthorGroup author,
                                           Map<String, String> idToFile, Map<String, Long> knownFileIds,
                                           Map<String, Long> newFileIds, Instant analysedAt) throws SQLException {
        Contributor contributor = contributors.upsert(conn, author.login, author.email);
        author.contributorId = contributor.id();

        int filesCount = author.edits.size();
        int total = author.edits.values().stream().mapToInt(Integer::intValue).sum();
        double avg = filesCount == 0 ? 0.0
                : BigDecimal.valueOf(total).divide(BigDecimal.valueOf(filesCount), 2, RoundingMode.HALF_UP).doubleValue();

        Map<String, Integer> fileTypes = new TreeMap<>();
        List<TaEntry> entries = new ArrayList<>();
        for (Map.Entry<String, Integer> edit : author.edits.entrySet()) {
            String path = idToFile.getOrDefault(edit.getKey(), "#" + edit.getKey());
            fileTypes.merge(idToFile.containsKey(edit.getKey()) ? FileTypes.extension(path) : FileTypes.NO_EXTENSION,
                    edit.getValue(), Integer::sum);

            Long fileId = knownFileIds.get(path);
            if (fileId == null) {
                fileId = newFileIds.get(path);
            }
            if (fileId == null) {
                CodeFile file = codeFiles.upsert(conn, projectId, path, FileTypes.language(path));
                fileId = file.id();
                newFileIds.put(path, fileId);
            }
            entries.add(new TaEntry(contributor.id(), fileId, edit.getValue()));
        }

        RoleClassifier.Assessment role = roleClassifier.classify(total, filesCount, avg);
        projectContributors.upsert(conn, new ProjectContributor(
                projectId, contributor.id(), contributor.login(), String.join(",", author.minerIds),
                filesCount, total, avg, role.role(), role.confidence(), roleClassifier.isCore(total),
                false, branch, analysedAt, fileTypes));
        return mergeDuplicateFiles(entries);
    }

    /**
     * Miner ids of one person are merged; several emails may share a login.
     */
    private Map<String, AuthorGroup> groupByLogin(Map<String, String> idToUser, Map<String, Map<String, Double>> matrix) {
        Set<String> ignored = new HashSet<>();
        properties.getIgnoredEmails().forEach(e -> ignored.add(e.toLowerCase(Locale.ROOT)));

        Map<String, AuthorGroup> groups = new LinkedHashMap<>();
        for (Map.Entry<String, String> user : idToUser.entrySet()) {
            String email = user.getValue() == null ? "" : user.getValue().trim();
            if (ignored.contains(email.toLowerCase(Locale.ROOT))) {
                log.debug("Ignoring synthetic author {}", email);
                continue;
            }
            String login = loginNormalizer.normalize(email);
            if (login.isEmpty()) {
                log.warn("Miner user {} has no usable email, ignored", user.getKey());
                continue;
            }
            AuthorGroup group = groups.computeIfAbsent(login, l -> new AuthorGroup(l, email));
            group.minerIds.add(user.getKey());
            for (Map.Entry<String, Double> cell : matrix.getOrDefault(user.getKey(), Map.of()).entrySet()) {
                int count = (int) Math.round(cell.getValue());
                if (count > 0) {
                    group.edits.merge(cell.getKey(), count, Integer::sum);
                }
            }
        }
        return groups;
    }

    private static List<TaEntry> mergeDuplicateFiles(List<TaEntry> entries) {
        Map<Long, Integer> byFile = new LinkedHashMap<>();
        for (TaEntry entry : entries) {
            byFile.merge(entry.fileId(), entry.editCount(), Integer::sum);
        }
        if (byFile.size() == entries.size()) {
            return entries;
        }
        long contributorId = entries.get(0).contributorId();
        List<TaEntry> merged = new ArrayList<>();
        byFile.forEach((fileId, count) -> merged.add(new TaEntry(contributorId, fileId, count)));
        return merged;
    }

    private static final class AuthorGroup {
        final String login;
        final String email;
        final List<String> minerIds = new ArrayList<>();
        final Map<String, Integer> edits = new LinkedHashMap<>();
        long contributorId;

        AuthorGroup(String login, String email) {
            this.login = login;
            this.email = email;
        }
    }
}

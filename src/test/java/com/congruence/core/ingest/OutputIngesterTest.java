package com.congruence.core.ingest;

import com.congruence.core.model.FunctionalRole;
import com.congruence.core.model.ProjectContributor;
import com.congruence.core.model.TaEntry;
import com.congruence.core.persistence.CodeFileRepository;
import com.congruence.core.persistence.ContributorRepository;
import com.congruence.core.persistence.GraphRepository;
import com.congruence.core.persistence.H2Database;
import com.congruence.core.persistence.ProjectContributorRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OutputIngesterTest {

    @TempDir
    Path out;

    private H2Database db;
    private OutputIngester ingester;
    private ProjectContributorRepository projectContributors;
    private ContributorRepository contributors;
    private GraphRepository graphs;

    @BeforeEach
    void setUp() {
        db = H2Database.create();
        ObjectMapper mapper = new ObjectMapper();
        contributors = new ContributorRepository(db.tx());
        projectContributors = new ProjectContributorRepository(db.tx(), mapper);
        graphs = new GraphRepository(db.tx());
        IngestProperties properties = new IngestProperties();
        ingester = new OutputIngester(new ArtifactReader(mapper), new LoginNormalizer(properties), new RoleClassifier(),
                properties, db.tx(), contributors, projectContributors, new CodeFileRepository(), graphs,
                Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC), null);
    }

    private void write(String name, String json) throws IOException {
        Files.writeString(out.resolve(name), json);
    }

    private void standardArtifacts() throws IOException {
        write("idToUser.json", """
                {"1": "alice@example.com", "2": "bob@example.com"}
                """);
        write("idToFile.json", """
                {"10": "src/app.py", "11": "src/util.py", "12": "README"}
                """);
        write("AssignmentMatrix.json", """
                {"1": {"10": 40, "11": 20}, "2": {"11": 5, "12": 7}}
                """);
    }

    // ── Happy path ──────────────────────────────────────────────────

    @Test
    @DisplayName("Contributors, files and TA entries are written with classified roles")
    void ingestsArtifacts() throws IOException {
        standardArtifacts();

        IngestionResult result = ingester.ingest(1, "main", out);

        assertEquals(new IngestionResult(2, 0, 3, 4), result);
        List<ProjectContributor> rows = projectContributors.findByProject(1);
        assertEquals("alice", rows.get(0).login());
        assertEquals(60, rows.get(0).totalModifications());
        assertEquals(30.0, rows.get(0).avgModificationsPerFile());
        assertEquals(FunctionalRole.CODER, rows.get(0).functionalRole());
        assertEquals(Map.of("py", 60), rows.get(0).fileTypes());
        assertEquals(FunctionalRole.REVIEWER, rows.get(1).functionalRole());
        assertEquals(Map.of("py", 5, "no_ext", 7), rows.get(1).fileTypes());
        assertEquals("main", rows.get(1).minedBranch());
    }

    @Test
    @DisplayName("Ingesting the same artifacts twice gives the same rows")
    void idempotent() throws IOException {
        standardArtifacts();

        ingester.ingest(1, "main", out);
        List<ProjectContributor> first = projectContributors.findByProject(1);
        List<TaEntry> firstTa = graphs.findTaEntries(1, "main");
        ingester.ingest(1, "main", out);

        assertEquals(first, projectContributors.findByProject(1));
        assertEquals(firstTa, graphs.findTaEntries(1, "main"));
        assertEquals(2, db.count("contributors"));
        assertEquals(3, db.count("code_files"));
    }

    // ── Author handling ─────────────────────────────────────────────

    @Test
    @DisplayName("Noreply addresses merge with the plain address of the same login")
    void noreplyMerged() throws IOException {
        write("idToUser.json", """
                {"1": "alice@example.com", "2": "12345+alice@users.noreply.github.com"}
                """);
        write("idToFile.json", "{\"10\": \"a.py\"}");
        write("AssignmentMatrix.json", """
                {"1": {"10": 3}, "2": {"10": 4}}
                """);

        IngestionResult result = ingester.ingest(1, "main", out);

        assertEquals(1, result.contributors());
        ProjectContributor alice = projectContributors.findByProject(1).get(0);
        assertEquals("1,2", alice.minerUserId());
        assertEquals(7, alice.totalModifications());
        assertEquals(1, alice.filesModified());
    }

    @Test
    @DisplayName("The safe-mode commit identity never becomes a contributor")
    void ignoredEmail() throws IOException {
        write("idToUser.json", """
                {"1": "alice@example.com", "2": "safe-mode@congruence.local"}
                """);
        write("AssignmentMatrix.json", """
                {"1": {"10": 1}, "2": {"10": 500}}
                """);

        ingester.ingest(1, "main", out);

        assertTrue(contributors.findByLogin("safe-mode").isEmpty());
        assertEquals(1, projectContributors.findByProject(1).size());
    }

    @Test
    @DisplayName("A contributor that cannot be stored is skipped without losing the others")
    void badRowSkipped() throws IOException {
        String longLogin = "x".repeat(300);
        write("idToUser.json", """
                {"1": "alice@example.com", "2": "%s@example.com"}
                """.formatted(longLogin));
        write("AssignmentMatrix.json", """
                {"1": {"10": 1}, "2": {"11": 2}}
                """);

        IngestionResult result = ingester.ingest(1, "main", out);

        assertEquals(1, result.contributors());
        assertEquals(1, result.skipped());
        assertEquals(1, result.taEntries());
        assertEquals(1, db.count("code_files"));
    }

    @Test
    @DisplayName("Files missing from idToFile get a placeholder path")
    void placeholderPath() throws IOException {
        write("idToUser.json", "{\"1\": \"alice@example.com\"}");
        write("AssignmentMatrix.json", "{\"1\": {\"7\": 2}}");

        ingester.ingest(1, "main", out);

        long count = db.tx().withConnection("q", conn -> {
            try (var stmt = conn.prepareStatement("SELECT COUNT(*) FROM code_files WHERE file_path = '#7'");
                 var rs = stmt.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        });
        assertEquals(1, count);
        assertEquals(Map.of("no_ext", 2), projectContributors.findByProject(1).get(0).fileTypes());
    }

    @Test
    @DisplayName("Contributors absent from a later run on the same branch are removed")
    void staleRemoved() throws IOException {
        standardArtifacts();
        ingester.ingest(1, "main", out);

        write("idToUser.json", "{\"1\": \"alice@example.com\"}");
        write("AssignmentMatrix.json", "{\"1\": {\"10\": 40}}");
        ingester.ingest(1, "main", out);

        assertEquals(List.of("alice"), projectContributors.findByProject(1).stream()
                .map(ProjectContributor::login).toList());
        assertEquals(1, graphs.findTaEntries(1, "main").size());
    }

    // ── Failures ────────────────────────────────────────────────────

    @Test
    @DisplayName("A missing assignment matrix fails before anything is written")
    void missingArtifact() throws IOException {
        write("idToUser.json", "{\"1\": \"alice@example.com\"}");

        assertThrows(IngestionException.class, () -> ingester.ingest(1, "main", out));
        assertEquals(0, db.count("contributors"));
    }
}

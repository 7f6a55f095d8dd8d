package com.congruence.core.ingest;

import com.congruence.core.model.MiningArtifact;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactReaderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ArtifactReader reader = new ArtifactReader(mapper);

    @TempDir
    Path dir;

    @Test
    @DisplayName("Unparseable content is kept under a content key")
    void wrapsRawContent() throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "not { json");

        JsonNode node = reader.read(file);

        assertEquals("not { json", node.get("content").asText());
    }

    @Test
    @DisplayName("Required artifacts must exist and be objects")
    void requiredObject() throws Exception {
        assertThrows(IngestionException.class, () -> reader.readRequiredObject(dir, MiningArtifact.ID_TO_USER));

        Files.writeString(MiningArtifact.ID_TO_USER.in(dir), "[1, 2]");
        assertThrows(IngestionException.class, () -> reader.readRequiredObject(dir, MiningArtifact.ID_TO_USER));

        Files.writeString(MiningArtifact.ID_TO_USER.in(dir), "garbage");
        assertThrows(IngestionException.class, () -> reader.readRequiredObject(dir, MiningArtifact.ID_TO_USER));
    }

    @Test
    @DisplayName("Optional artifacts that are absent or unusable read as empty")
    void optionalObject() throws Exception {
        assertTrue(reader.readOptionalObject(dir, MiningArtifact.ID_TO_FILE).isEmpty());

        Files.writeString(MiningArtifact.ID_TO_FILE.in(dir), "garbage");
        assertTrue(reader.readOptionalObject(dir, MiningArtifact.ID_TO_FILE).isEmpty());

        Files.writeString(MiningArtifact.ID_TO_FILE.in(dir), "{\"1\": \"a.py\"}");
        assertEquals(Map.of("1", "a.py"),
                ArtifactReader.textMap(reader.readOptionalObject(dir, MiningArtifact.ID_TO_FILE).orElseThrow()));
    }

    @Test
    @DisplayName("Matrix rows that are not objects and non-numeric cells are ignored")
    void matrixFiltering() throws Exception {
        JsonNode node = mapper.readTree("""
                {"1": {"10": 2, "11": "x"}, "2": 5, "3": {"12": 1.5}}
                """);

        Map<String, Map<String, Double>> matrix = ArtifactReader.matrix(node);

        assertEquals(Map.of("1", Map.of("10", 2.0), "3", Map.of("12", 1.5)), matrix);
    }
}

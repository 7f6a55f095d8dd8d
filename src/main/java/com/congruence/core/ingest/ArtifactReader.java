package com.congruence.core.ingest;

import com.congruence.core.model.MiningArtifact;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the miner's JSON artifacts. Content that does not parse is kept as
 * {@code {"content": <raw text>}} instead of being dropped.
 */
@Component
public class ArtifactReader {

    private static final Logger log = LoggerFactory.getLogger(ArtifactReader.class);

    private final ObjectMapper objectMapper;

    public ArtifactReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode read(Path file) {
        String raw;
        try {
            raw = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IngestionException("Cannot read artifact " + file, e);
        }
        return tryParse(raw).orElseGet(() -> {
            log.warn("Artifact {} is not valid JSON, keeping raw content", file.getFileName());
            return wrapRaw(raw);
        });
    }

    public Optional<JsonNode> tryParse(String raw) {
        try {
            JsonNode node = objectMapper.readTree(raw);
            return Optional.ofNullable(node).filter(n -> !n.isMissingNode());
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public ObjectNode wrapRaw(String raw) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("content", raw);
        return node;
    }

    /**
     * @throws IngestionException when the artifact is absent or not a JSON object
     */
    public JsonNode readRequiredObject(Path outputDir, MiningArtifact artifact) {
        Path file = artifact.in(outputDir);
        if (!Files.isRegularFile(file)) {
            throw new IngestionException("Required artifact %s not found in %s".formatted(artifact.fileName(), outputDir));
        }
        JsonNode node = read(file);
        if (!node.isObject() || isWrappedRaw(node)) {
            throw new IngestionException("Artifact %s is not a JSON object".formatted(artifact.fileName()));
        }
        return node;
    }

    /**
     * The artifact as an object, or empty when it is absent or unusable.
     */
    public Optional<JsonNode> readOptionalObject(Path outputDir, MiningArtifact artifact) {
        Path file = artifact.in(outputDir);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        JsonNode node = read(file);
        return node.isObject() && !isWrappedRaw(node) ? Optional.of(node) : Optional.empty();
    }

    /**
     * {@code {id: text}} maps such as {@code idToUser.json}.
     */
    public static Map<String, String> textMap(JsonNode node) {
        var result = new LinkedHashMap<String, String>();
        node.fields().forEachRemaining(e -> result.put(e.getKey(), e.getValue().asText()));
        return result;
    }

    /**
     * {@code {rowId: {colId: number}}} matrices. Rows that are not objects and
     * non-numeric cells are ignored.
     */
    public static Map<String, Map<String, Double>> matrix(JsonNode node) {
        var result = new LinkedHashMap<String, Map<String, Double>>();
        node.fields().forEachRemaining(row -> {
            if (!row.getValue().isObject()) {
                return;
            }
            var cells = new LinkedHashMap<String, Double>();
            row.getValue().fields().forEachRemaining(cell -> {
                if (cell.getValue().isNumber()) {
                    cells.put(cell.getKey(), cell.getValue().asDouble());
                }
            });
            result.put(row.getKey(), cells);
        });
        return result;
    }

    private static boolean isWrappedRaw(JsonNode node) {
        return node.size() == 1 && node.has("content") && node.get("content").isTextual();
    }
}

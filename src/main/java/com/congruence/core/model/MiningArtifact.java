package com.congruence.core.model;

import java.nio.file.Path;

/**
 * Fixed-name JSON files the mining tool writes into a run's output directory.
 */
public enum MiningArtifact {
    ID_TO_USER("idToUser.json"),
    ID_TO_FILE("idToFile.json"),
    ASSIGNMENT_MATRIX("AssignmentMatrix.json"),
    FILE_DEPENDENCY_MATRIX("FileDependencyMatrix.json"),
    /** File ids of the dependency miner; falls back to {@link #ID_TO_FILE} when absent. */
    FILE_DEPENDENCY_ID_TO_FILE("FileDependencyIdToFile.json"),
    DEVELOPER_KNOWLEDGE("DeveloperKnowledge.json"),
    FILES_OWNERSHIP("FilesOwnership.json"),
    POTENTIAL_AUTHORSHIP("PotentialAuthorship.json");

    private final String fileName;

    MiningArtifact(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }

    public Path in(Path outputDir) {
        return outputDir.resolve(fileName);
    }
}

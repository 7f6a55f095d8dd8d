package com.congruence.mining;

import com.congruence.core.model.MiningArtifact;

import java.nio.file.Path;
import java.util.List;

/**
 * Miners of the external tool and the options each one needs.
 */
public enum MinerCommand {

    /** Contributor x file edit counts. */
    ASSIGNMENT_MATRIX("AssignmentMatrixMiner"),
    /** Co-change weighted file pairs. */
    FILE_DEPENDENCY("FileDependencyMiner"),
    /** Developer knowledge and file ownership. */
    FILES_OWNERSHIP("FilesOwnershipMiner");

    private final String commandName;

    MinerCommand(String commandName) {
        this.commandName = commandName;
    }

    public String commandName() {
        return commandName;
    }

    /**
     * Options for mining {@code gitDir}. Matrix miners write their artifacts to
     * {@code outputDir}; the ownership miner takes one path per artifact.
     */
    public List<String> options(Path gitDir, Path outputDir) {
        return switch (this) {
            case ASSIGNMENT_MATRIX, FILE_DEPENDENCY -> List.of(
                    "--repository", gitDir.toString(),
                    "--output-dir", outputDir.toString());
            case FILES_OWNERSHIP -> List.of(
                    "--repository", gitDir.toString(),
                    "--developer-knowledge", MiningArtifact.DEVELOPER_KNOWLEDGE.in(outputDir).toString(),
                    "--files-ownership", MiningArtifact.FILES_OWNERSHIP.in(outputDir).toString(),
                    "--potential-ownership", MiningArtifact.POTENTIAL_AUTHORSHIP.in(outputDir).toString());
        };
    }
}

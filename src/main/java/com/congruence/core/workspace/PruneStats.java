package com.congruence.core.workspace;

/**
 * What sanitizing removed from a workspace.
 */
public record PruneStats(
    int filesRemoved,
    int directoriesRemoved,
    int symlinksRemoved,
    int submodulesRemoved,
    int emptyDirectoriesRemoved
) {

    public PruneStats withSubmodules(int submodules) {
        return new PruneStats(filesRemoved, directoriesRemoved, symlinksRemoved, submodules, emptyDirectoriesRemoved);
    }

    public PruneStats withEmptyDirectories(int emptyDirectories) {
        return new PruneStats(filesRemoved, directoriesRemoved, symlinksRemoved, submodulesRemoved, emptyDirectories);
    }
}

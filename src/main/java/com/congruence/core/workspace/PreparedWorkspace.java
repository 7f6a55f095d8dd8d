package com.congruence.core.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A sanitized, disposable clone owned by exactly one run. Closing deletes it.
 */
public final class PreparedWorkspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PreparedWorkspace.class);

    private final Path root;
    private final String branch;
    private final PruneStats stats;
    private final AtomicBoolean closed = new AtomicBoolean();

    public PreparedWorkspace(Path root, String branch, PruneStats stats) {
        this.root = root;
        this.branch = branch;
        this.stats = stats;
    }

    public Path root() {
        return root;
    }

    public Path gitDir() {
        return root.resolve(".git");
    }

    /** Branch to mine. */
    public String branch() {
        return branch;
    }

    public PruneStats stats() {
        return stats;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            FileTrees.deleteRecursively(root);
            log.debug("Deleted workspace {}", root);
        }
    }
}

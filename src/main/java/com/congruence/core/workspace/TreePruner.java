package com.congruence.core.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Filesystem half of workspace sanitizing. Links are never followed: a symbolic
 * link is removed as a link, whatever it points to.
 */
class TreePruner {

    private static final Logger log = LoggerFactory.getLogger(TreePruner.class);

    private static final String GIT_DIR = ".git";

    /**
     * Deletes excluded directories, disallowed files and every symbolic link below {@code root}.
     * The top-level {@code .git} directory is left alone.
     */
    PruneStats prune(Path root, SafeModeOptions options) throws IOException {
        int[] files = {0};
        int[] dirs = {0};
        int[] links = {0};

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                if (name.equals(GIT_DIR) && dir.getParent().equals(root)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                if (options.excludesDirectory(name)) {
                    FileTrees.deleteTree(dir);
                    dirs[0]++;
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (attrs.isSymbolicLink()) {
                    Files.delete(file);
                    links[0]++;
                } else if (!attrs.isRegularFile() || !options.allowsFile(file.getFileName().toString())) {
                    Files.delete(file);
                    files[0]++;
                }
                return FileVisitResult.CONTINUE;
            }
        });

        log.debug("Pruned {}: {} files, {} directories, {} links", root, files[0], dirs[0], links[0]);
        return new PruneStats(files[0], dirs[0], links[0], 0, 0);
    }

    /**
     * Removes directories left empty, bottom-up. Neither the root nor {@code .git} is touched.
     *
     * @return number of directories removed
     */
    int removeEmptyDirectories(Path root) throws IOException {
        int[] removed = {0};
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && dir.getFileName().toString().equals(GIT_DIR) && dir.getParent().equals(root)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                if (!dir.equals(root) && isEmpty(dir)) {
                    Files.delete(dir);
                    removed[0]++;
                }
                return FileVisitResult.CONTINUE;
            }
        });
        return removed[0];
    }

    private static boolean isEmpty(Path dir) throws IOException {
        try (var entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }
}

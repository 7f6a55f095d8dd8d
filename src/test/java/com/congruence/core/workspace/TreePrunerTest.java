package com.congruence.core.workspace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class TreePrunerTest {

    @TempDir
    Path root;

    private final TreePruner pruner = new TreePruner();
    private final SafeModeOptions pythonOnly = SafeModeOptions.of(List.of(".py"), List.of("node_modules", "build"), false);

    private Path write(String relative) throws Exception {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "content of " + relative);
        return file;
    }

    @Test
    @DisplayName("Only allow-listed files survive and .git is left alone")
    void keepsAllowedFiles() throws Exception {
        write("app/main.py");
        write("app/README.md");
        write("app/data/config.yaml");
        write(".git/config");
        write(".git/objects/ab/cdef");

        PruneStats stats = pruner.prune(root, pythonOnly);

        assertTrue(Files.exists(root.resolve("app/main.py")));
        assertFalse(Files.exists(root.resolve("app/README.md")));
        assertFalse(Files.exists(root.resolve("app/data/config.yaml")));
        assertTrue(Files.exists(root.resolve(".git/config")));
        assertTrue(Files.exists(root.resolve(".git/objects/ab/cdef")));
        assertEquals(2, stats.filesRemoved());
    }

    @Test
    @DisplayName("Excluded directories are removed with their content, even allowed files")
    void removesExcludedDirectories() throws Exception {
        write("node_modules/pkg/index.py");
        write("src/build/gen.py");
        write("src/ok.py");

        PruneStats stats = pruner.prune(root, pythonOnly);

        assertFalse(Files.exists(root.resolve("node_modules")));
        assertFalse(Files.exists(root.resolve("src/build")));
        assertTrue(Files.exists(root.resolve("src/ok.py")));
        assertEquals(2, stats.directoriesRemoved());
    }

    @Test
    @DisplayName("Symbolic links are removed without touching their target")
    void removesSymlinks() throws Exception {
        Path target = write("src/real.py");
        Path outside = Files.createTempFile("outside", ".py");
        try {
            Path link = root.resolve("src/link.py");
            Path escape = root.resolve("src/escape.py");
            try {
                Files.createSymbolicLink(link, target);
                Files.createSymbolicLink(escape, outside);
            } catch (UnsupportedOperationException | IOException e) {
                assumeTrue(false, "symbolic links not supported here");
            }

            PruneStats stats = pruner.prune(root, pythonOnly);

            assertFalse(Files.exists(link, LinkOption.NOFOLLOW_LINKS));
            assertFalse(Files.exists(escape, LinkOption.NOFOLLOW_LINKS));
            assertTrue(Files.exists(target));
            assertTrue(Files.exists(outside));
            assertEquals(2, stats.symlinksRemoved());
        } finally {
            Files.deleteIfExists(outside);
        }
    }

    @Test
    @DisplayName("Empty directories are removed bottom-up, .git and the root stay")
    void removesEmptyDirectories() throws Exception {
        Files.createDirectories(root.resolve("a/b/c"));
        Files.createDirectories(root.resolve(".git/refs/tags"));
        write("d/keep.py");

        int removed = pruner.removeEmptyDirectories(root);

        assertEquals(3, removed);
        assertFalse(Files.exists(root.resolve("a")));
        assertTrue(Files.exists(root.resolve(".git/refs/tags")));
        assertTrue(Files.exists(root.resolve("d/keep.py")));
        assertTrue(Files.exists(root));
    }
}

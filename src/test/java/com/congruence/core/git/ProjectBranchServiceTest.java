package com.congruence.core.git;

import com.congruence.core.model.BranchInfo;
import com.congruence.core.model.Project;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ProjectBranchServiceTest {

    @TempDir
    Path reposDir;

    private GitAccessService gitAccess;
    private CredentialResolver credentialResolver;
    private ProjectBranchService service;

    @BeforeEach
    void setUp() {
        gitAccess = mock(GitAccessService.class);
        credentialResolver = mock(CredentialResolver.class);
        when(credentialResolver.resolveCredential(anyString(), anyString())).thenReturn(Optional.empty());
        GitProperties properties = new GitProperties();
        properties.setRepositoriesDir(reposDir.toString());
        service = new ProjectBranchService(gitAccess, credentialResolver,
                new BranchCache(Clock.systemUTC(), Duration.ofSeconds(300)), properties);
    }

    @Test
    @DisplayName("Clones live under project_<id>")
    void repositoryPath() {
        assertEquals(reposDir.resolve("project_7"), service.repositoryPath(7));
    }

    @Test
    @DisplayName("ensureClone clones once and reuses an existing clone")
    void ensureCloneSkipsExisting() throws Exception {
        Project project = new Project(7, "https://github.com/acme/app.git", "main", "owner-1");

        Path first = service.ensureClone(project);
        verify(gitAccess).cloneRepository(eq("https://github.com/acme/app.git"), eq(first), eq("main"), isNull());

        Files.createDirectories(first.resolve(".git"));
        service.ensureClone(project);
        verify(gitAccess, times(1)).cloneRepository(anyString(), any(), any(), any());
    }

    @Test
    @DisplayName("Branch listings are cached until a switch invalidates them")
    void switchInvalidatesCache() {
        Path path = service.repositoryPath(3);
        when(gitAccess.listBranches(path)).thenReturn(List.of(new BranchInfo("main", true, "abc", "id1")));
        when(gitAccess.currentBranch(path)).thenReturn("dev");

        service.branches(3);
        service.branches(3);
        verify(gitAccess, times(1)).listBranches(path);

        assertEquals("dev", service.switchBranch(3, "dev"));
        service.branches(3);
        verify(gitAccess, times(2)).listBranches(path);
    }

    @Test
    @DisplayName("A failed checkout still invalidates the cached listing")
    void failedSwitchInvalidates() {
        Path path = service.repositoryPath(4);
        when(gitAccess.listBranches(path)).thenReturn(List.of());
        doThrow(new GitAccessException(GitErrorType.BRANCH_NOT_FOUND, "no such branch", "check the name", "", ""))
                .when(gitAccess).checkoutBranch(path, "nope");

        service.branches(4);
        assertThrows(GitAccessException.class, () -> service.switchBranch(4, "nope"));
        service.branches(4);
        verify(gitAccess, times(2)).listBranches(path);
    }

    @Test
    @DisplayName("cleanupRepository deletes the local clone")
    void cleanup() throws Exception {
        Path clone = Files.createDirectories(service.repositoryPath(9).resolve(".git"));
        Files.writeString(clone.resolve("HEAD"), "ref: refs/heads/main\n");

        service.cleanupRepository(9);

        assertFalse(Files.exists(service.repositoryPath(9)));
    }
}

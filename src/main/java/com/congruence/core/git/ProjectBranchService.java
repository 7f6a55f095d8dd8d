package com.congruence.core.git;

import com.congruence.core.model.BranchInfo;
import com.congruence.core.model.Credential;
import com.congruence.core.model.Project;
import com.congruence.core.workspace.FileTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Project-scoped view of the local clones: {@code <repositories-dir>/project_<id>}.
 * Branch listings go through the {@link BranchCache}.
 */
@Service
public class ProjectBranchService {

    private static final Logger log = LoggerFactory.getLogger(ProjectBranchService.class);

    private final GitAccessService gitAccess;
    private final CredentialResolver credentialResolver;
    private final BranchCache branchCache;
    private final GitProperties properties;

    public ProjectBranchService(GitAccessService gitAccess,
                                CredentialResolver credentialResolver,
                                BranchCache branchCache,
                                GitProperties properties) {
        this.gitAccess = gitAccess;
        this.credentialResolver = credentialResolver;
        this.branchCache = branchCache;
        this.properties = properties;
    }

    public Path repositoryPath(long projectId) {
        return Path.of(properties.getRepositoriesDir()).resolve("project_" + projectId);
    }

    /**
     * Clones the project repository unless a clone already exists.
     *
     * @return path of the local clone
     */
    public Path ensureClone(Project project) {
        Path path = repositoryPath(project.id());
        if (Files.exists(path.resolve(".git"))) {
            return path;
        }
        Credential credential = credentialResolver.resolveCredential(project.repoUrl(), project.ownerId()).orElse(null);
        gitAccess.cloneRepository(project.repoUrl(), path, project.defaultBranch(), credential);
        branchCache.invalidate(project.id());
        return path;
    }

    public List<BranchInfo> branches(long projectId) {
        Path path = repositoryPath(projectId);
        return branchCache.get(projectId, () -> gitAccess.listBranches(path));
    }

    public String switchBranch(long projectId, String branch) {
        Path path = repositoryPath(projectId);
        try {
            gitAccess.checkoutBranch(path, branch);
        } finally {
            branchCache.invalidate(projectId);
        }
        return gitAccess.currentBranch(path);
    }

    /**
     * Deletes the local clone of a project.
     */
    public void cleanupRepository(long projectId) {
        Path path = repositoryPath(projectId);
        FileTrees.deleteRecursively(path);
        branchCache.invalidate(projectId);
        log.info("Removed local clone {}", path);
    }
}

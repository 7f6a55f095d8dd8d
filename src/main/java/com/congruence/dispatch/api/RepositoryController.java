package com.congruence.dispatch.api;

import com.congruence.core.error.ValidationException;
import com.congruence.core.git.CredentialResolver;
import com.congruence.core.git.GitAccessService;
import com.congruence.core.git.ProjectBranchService;
import com.congruence.core.model.AccessValidation;
import com.congruence.core.model.BranchInfo;
import com.congruence.core.model.Credential;
import com.congruence.core.model.Project;
import com.congruence.core.persistence.ProjectRepository;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for repository access checks and project branches.
 */
@RestController
@RequestMapping("/api/v1")
public class RepositoryController {

    private final GitAccessService gitAccess;
    private final CredentialResolver credentialResolver;
    private final ProjectBranchService branchService;
    private final ProjectRepository projects;

    public RepositoryController(GitAccessService gitAccess, CredentialResolver credentialResolver,
                                ProjectBranchService branchService, ProjectRepository projects) {
        this.gitAccess = gitAccess;
        this.credentialResolver = credentialResolver;
        this.branchService = branchService;
        this.projects = projects;
    }

    /**
     * POST /api/v1/repositories/validate: Lists remote branches without cloning.
     */
    @PostMapping("/repositories/validate")
    public AccessValidation validate(@RequestBody ValidateRepositoryRequest request) {
        if (request.url() == null || request.url().isBlank()) {
            throw new ValidationException("url is required");
        }
        Credential credential = request.ownerId() == null ? null
                : credentialResolver.resolveCredential(request.url(), request.ownerId()).orElse(null);
        return gitAccess.validateAccess(request.url(), credential);
    }

    @GetMapping("/projects/{id}/branches")
    public List<BranchInfo> branches(@PathVariable long id) {
        branchService.ensureClone(project(id));
        return branchService.branches(id);
    }

    /**
     * POST /api/v1/projects/{id}/branches: Checks out {@code {"branch": "..."}} in the project clone.
     */
    @PostMapping("/projects/{id}/branches")
    public Map<String, Object> switchBranch(@PathVariable long id, @RequestBody Map<String, String> body) {
        String branch = body.get("branch");
        if (branch == null || branch.isBlank()) {
            throw new ValidationException("branch is required");
        }
        branchService.ensureClone(project(id));
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("current_branch", branchService.switchBranch(id, branch));
        result.put("branches", branchService.branches(id));
        return result;
    }

    private Project project(long id) {
        return projects.findById(id).orElseThrow(() -> new ValidationException("Unknown project: " + id));
    }
}

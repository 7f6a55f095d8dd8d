package com.congruence.dispatch.cli;

import com.congruence.core.error.CongruenceException;
import com.congruence.core.git.CredentialResolver;
import com.congruence.core.git.GitAccessService;
import com.congruence.core.model.AccessValidation;
import com.congruence.core.model.Credential;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: congruence validate-repo &lt;url&gt;
 */
@Command(name = "validate-repo", mixinStandardHelpOptions = true,
        description = "Check that a repository is reachable and list its branches")
@Component
public class ValidateRepoCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Repository URL (https or ssh)")
    private String url;

    @Option(names = {"--owner"}, description = "Owner whose stored credentials may be used")
    private String ownerId;

    private final GitAccessService gitAccess;
    private final CredentialResolver credentialResolver;

    public ValidateRepoCommand(GitAccessService gitAccess, CredentialResolver credentialResolver) {
        this.gitAccess = gitAccess;
        this.credentialResolver = credentialResolver;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            Credential credential = ownerId == null ? null
                    : credentialResolver.resolveCredential(url, ownerId).orElse(null);
            AccessValidation result = gitAccess.validateAccess(url, credential);
            ConsoleOutput.success("Repository accessible" + (result.usedAuth() ? " (authenticated)" : ""));
            ConsoleOutput.info("Default branch: " + (result.defaultBranch() == null ? "-" : result.defaultBranch()));
            for (String branch : result.branches()) {
                System.out.println("  " + branch);
            }
            return 0;
        } catch (CongruenceException e) {
            return ConsoleOutput.failure(e);
        }
    }
}

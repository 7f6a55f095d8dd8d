package com.congruence.mining;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Mining tool settings, bound from {@code congruence.miner.*}.
 */
@Component
@ConfigurationProperties(prefix = "congruence.miner")
public class MinerProperties {

    /** {@code jar} runs the miner jar directly, {@code docker} execs into a running container. */
    private String backend = "jar";

    private String javaPath = "java";
    private String jarPath = "/app/tnm-cli.jar";

    /** Custom command prefix, split like a shell would. Overrides the backend when set. */
    private String runScript = "";

    /** Container the docker backend execs into. */
    private String containerName = "secuflow-tnm";

    /** Jar location inside that container. */
    private String containerJarPath = "/app/tnm-cli.jar";

    /** Working directory for direct runs; empty for the current directory. */
    private String workDir = "";

    /** Root of the per-project-and-branch artifact directories. */
    private String outputDir = "/app/tnm_output";

    private int timeoutSeconds = 1800;

    /** Log miner output line by line while it runs. */
    private boolean streamOutput = false;

    public String getBackend() { return backend; }
    public void setBackend(String backend) { this.backend = backend; }

    public String getJavaPath() { return javaPath; }
    public void setJavaPath(String javaPath) { this.javaPath = javaPath; }

    public String getJarPath() { return jarPath; }
    public void setJarPath(String jarPath) { this.jarPath = jarPath; }

    public String getRunScript() { return runScript; }
    public void setRunScript(String runScript) { this.runScript = runScript; }

    public String getContainerName() { return containerName; }
    public void setContainerName(String containerName) { this.containerName = containerName; }

    public String getContainerJarPath() { return containerJarPath; }
    public void setContainerJarPath(String containerJarPath) { this.containerJarPath = containerJarPath; }

    public String getWorkDir() { return workDir; }
    public void setWorkDir(String workDir) { this.workDir = workDir; }

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

    public boolean isStreamOutput() { return streamOutput; }
    public void setStreamOutput(boolean streamOutput) { this.streamOutput = streamOutput; }

    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public boolean hasRunScript() {
        return runScript != null && !runScript.isBlank();
    }
}

package com.congruence.mining;

import com.congruence.core.error.ValidationException;
import com.congruence.core.process.ProcessResult;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.StreamType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs the mining tool inside an already running container through the Docker
 * exec API. Paths handed to the tool must be visible inside the container, so the
 * repositories and output directories are expected on a shared volume.
 *
 * <p>Each exec carries a unique {@code -Dcongruence.exec=<tag>} marker. The exec API
 * has no kill, so on timeout or interrupt a second exec runs {@code pkill -KILL -f}
 * on that marker, which ends this miner without touching other runs sharing the
 * container. Then {@link MiningTimeoutException} is raised.
 */
public class DockerExecMiningBackend implements MiningBackend {

    private static final Logger log = LoggerFactory.getLogger(DockerExecMiningBackend.class);

    static final String MARKER_PROPERTY = "congruence.exec";
    private static final long KILL_WAIT_SECONDS = 10;

    private final DockerClient dockerClient;
    private final String containerName;
    private final String javaPath;
    private final String jarPath;

    public DockerExecMiningBackend(DockerClient dockerClient, String containerName,
                                   String javaPath, String jarPath) {
        this.dockerClient = dockerClient;
        this.containerName = containerName;
        this.javaPath = javaPath;
        this.jarPath = jarPath;
    }

    @Override
    public String name() {
        return "docker:" + containerName;
    }

    /**
     * The target container must exist and be running.
     */
    @Override
    public void verifyReady() {
        Boolean running;
        try {
            running = dockerClient.inspectContainerCmd(containerName).exec().getState().getRunning();
        } catch (NotFoundException e) {
            throw new ValidationException("Miner container '%s' does not exist".formatted(containerName));
        }
        if (!Boolean.TRUE.equals(running)) {
            throw new ValidationException("Miner container '%s' is not running".formatted(containerName));
        }
    }

    List<String> commandLine(MinerInvocation invocation, String tag) {
        var command = new ArrayList<String>(List.of(javaPath, "-D" + MARKER_PROPERTY + "=" + tag, "-jar", jarPath));
        command.addAll(invocation.toolArguments());
        return command;
    }

    @Override
    public ProcessResult execute(MinerInvocation invocation) {
        String tag = UUID.randomUUID().toString();
        List<String> command = commandLine(invocation, tag);
        var create = dockerClient.execCreateCmd(containerName)
                .withCmd(command.toArray(String[]::new))
                .withAttachStdout(true)
                .withAttachStderr(true);
        if (invocation.cwd() != null) {
            create.withWorkingDir(invocation.cwd().toString());
        }
        String execId = create.exec().getId();
        log.debug("Created exec {} in container {}", execId, containerName);

        long start = System.nanoTime();
        var collector = new FrameCollector(invocation.lineSink());
        try {
            dockerClient.execStartCmd(execId).exec(collector);
            boolean completed = collector.awaitCompletion(invocation.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                log.warn("Miner {} in container {} exceeded {}s, killing it", invocation.command(), containerName,
                        invocation.timeout().toSeconds());
                kill(tag);
                closeQuietly(collector);
                throw new MiningTimeoutException(invocation.command(), invocation.timeout(),
                        collector.stdout(), collector.stderr());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(tag);
            closeQuietly(collector);
            throw new MinerExecutionException("Interrupted while waiting for miner " + invocation.command(), e);
        }

        Long exitCode = dockerClient.inspectExecCmd(execId).exec().getExitCodeLong();
        var duration = Duration.ofNanos(System.nanoTime() - start);
        return new ProcessResult(exitCode == null ? -1 : exitCode.intValue(),
                collector.stdout(), collector.stderr(), duration);
    }

    /**
     * Kills the miner exec carrying {@code tag}. Failures are logged; the caller raises
     * its own error either way.
     */
    void kill(String tag) {
        String pattern = MARKER_PROPERTY + "=" + tag;
        try {
            String killId = dockerClient.execCreateCmd(containerName)
                    .withCmd("pkill", "-KILL", "-f", pattern)
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .exec()
                    .getId();
            boolean done = dockerClient.execStartCmd(killId)
                    .exec(new ResultCallback.Adapter<Frame>())
                    .awaitCompletion(KILL_WAIT_SECONDS, TimeUnit.SECONDS);
            Long exitCode = done ? dockerClient.inspectExecCmd(killId).exec().getExitCodeLong() : null;
            if (exitCode != null && exitCode == 0) {
                log.info("Killed miner exec {} in container {}", tag, containerName);
            } else {
                log.warn("Kill of miner exec {} in container {} ended with {}", tag, containerName,
                        done ? exitCode : "no answer within " + KILL_WAIT_SECONDS + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while killing miner exec {} in container {}", tag, containerName);
        } catch (RuntimeException e) {
            log.warn("Could not kill miner exec {} in container {}: {}", tag, containerName, e.getMessage());
        }
    }

    private static void closeQuietly(FrameCollector collector) {
        try {
            collector.close();
        } catch (IOException e) {
            log.debug("Failed to close exec stream: {}", e.getMessage());
        }
    }

    /**
     * Splits multiplexed frames into stdout and stderr. Frames carry arbitrary chunks,
     * so partial lines are held back until their newline arrives.
     */
    static final class FrameCollector extends ResultCallback.Adapter<Frame> {

        private final Consumer<String> lineSink;
        private final StringBuilder stdout = new StringBuilder();
        private final StringBuilder stderr = new StringBuilder();
        private final StringBuilder pendingLine = new StringBuilder();

        FrameCollector(Consumer<String> lineSink) {
            this.lineSink = lineSink;
        }

        @Override
        public void onNext(Frame frame) {
            String chunk = new String(frame.getPayload(), StandardCharsets.UTF_8);
            if (frame.getStreamType() == StreamType.STDERR) {
                synchronized (this) {
                    stderr.append(chunk);
                }
                return;
            }
            synchronized (this) {
                stdout.append(chunk);
            }
            if (lineSink != null) {
                emitLines(chunk);
            }
        }

        @Override
        public void onComplete() {
            if (lineSink != null && !pendingLine.isEmpty()) {
                lineSink.accept(pendingLine.toString());
                pendingLine.setLength(0);
            }
            super.onComplete();
        }

        private void emitLines(String chunk) {
            for (int i = 0; i < chunk.length(); i++) {
                char c = chunk.charAt(i);
                if (c == '\n') {
                    lineSink.accept(pendingLine.toString());
                    pendingLine.setLength(0);
                } else if (c != '\r') {
                    pendingLine.append(c);
                }
            }
        }

        synchronized String stdout() {
            return stdout.toString().strip();
        }

        synchronized String stderr() {
            return stderr.toString().strip();
        }
    }
}

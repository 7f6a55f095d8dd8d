package com.congruence.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs external commands with a hard time bound.
 *
 * <p>stdout and stderr are drained on dedicated threads so a chatty process can
 * never block on a full pipe. When a line sink is given each stdout line is
 * handed over as it arrives instead of only being buffered. On timeout the
 * process tree is killed and {@link ProcessTimeoutException} is raised.
 */
@Component
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    /** Upper bound of buffered output per stream. */
    static final int MAX_CAPTURE_CHARS = 4 * 1024 * 1024;

    /** How long output is still read after the process exited. */
    static final long DRAIN_MILLIS = 5000;

    public ProcessResult run(List<String> command, Path workDir, Duration timeout) {
        return run(command, workDir, timeout, Map.of(), null);
    }

    public ProcessResult run(List<String> command, Path workDir, Duration timeout,
                             Map<String, String> environment, Consumer<String> lineSink) {
        String masked = SensitiveData.maskCommand(command);
        log.debug("Running: {}", masked);

        var builder = new ProcessBuilder(command).redirectErrorStream(false);
        if (workDir != null) {
            builder.directory(workDir.toFile());
        }
        builder.environment().putAll(environment);

        long start = System.nanoTime();
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ProcessLaunchException("Failed to start: " + masked, e);
        }
        // Nothing is ever written to the child's stdin.
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of {}: {}", masked, e.getMessage());
        }

        var stdout = new StreamPump(process.getInputStream(), lineSink);
        var stderr = new StreamPump(process.getErrorStream(), null);
        Thread outThread = startPump(stdout, "proc-out");
        Thread errThread = startPump(stderr, "proc-err");

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                kill(process);
                outThread.join(1000);
                errThread.join(1000);
                log.warn("Killed after {}s: {}", timeout.toSeconds(), masked);
                throw new ProcessTimeoutException(masked, timeout, stdout.text(), stderr.text());
            }
            drain(outThread, masked);
            drain(errThread, masked);
            var duration = Duration.ofNanos(System.nanoTime() - start);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.debug("Exit code {} from: {}", exitCode, masked);
            }
            return new ProcessResult(exitCode, stdout.text(), stderr.text(), duration);
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            throw new ProcessLaunchException("Interrupted while waiting for: " + masked, e);
        }
    }

    private static Thread startPump(StreamPump pump, String name) {
        var thread = new Thread(pump, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * A background child that inherited the pipe keeps it open after the process exits;
     * output read so far is returned instead of waiting for it.
     */
    private static void drain(Thread pump, String masked) throws InterruptedException {
        pump.join(DRAIN_MILLIS);
        if (pump.isAlive()) {
            log.warn("Output of {} still open {}ms after exit, returning what was read", masked, DRAIN_MILLIS);
        }
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class StreamPump implements Runnable {

        private final InputStream stream;
        private final Consumer<String> lineSink;
        private final StringBuilder buffer = new StringBuilder();
        private boolean truncated;

        StreamPump(InputStream stream, Consumer<String> lineSink) {
            this.stream = stream;
            this.lineSink = lineSink;
        }

        @Override
        public void run() {
            try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (lineSink != null) {
                        lineSink.accept(line);
                    }
                    append(line);
                }
            } catch (IOException e) {
                // Stream closes abruptly when the process is killed.
                log.debug("Output stream closed: {}", e.getMessage());
            }
        }

        private synchronized void append(String line) {
            if (buffer.length() + line.length() + 1 > MAX_CAPTURE_CHARS) {
                truncated = true;
                return;
            }
            if (!buffer.isEmpty()) {
                buffer.append('\n');
            }
            buffer.append(line);
        }

        synchronized String text() {
            return truncated ? buffer + "\n[output truncated]" : buffer.toString();
        }
    }
}

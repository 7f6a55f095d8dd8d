package com.congruence.mining;

import com.congruence.core.error.ValidationException;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.ExecCreateCmd;
import com.github.dockerjava.api.command.ExecCreateCmdResponse;
import com.github.dockerjava.api.command.ExecStartCmd;
import com.github.dockerjava.api.command.InspectExecCmd;
import com.github.dockerjava.api.command.InspectExecResponse;
import com.github.dockerjava.api.command.InspectContainerCmd;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.StreamType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * The exec API is mocked one call at a time, as its fluent builders do not
 * work well with deep stubs.
 */
class DockerExecMiningBackendTest {

    private DockerClient dockerClient;
    private DockerExecMiningBackend backend;

    @BeforeEach
    void setUp() {
        dockerClient = mock(DockerClient.class);
        backend = new DockerExecMiningBackend(dockerClient, "secuflow-tnm", "java", "/app/tnm-cli.jar");
    }

    private void mockContainerState(Boolean running) {
        var cmd = mock(InspectContainerCmd.class);
        var response = mock(InspectContainerResponse.class);
        var state = mock(InspectContainerResponse.ContainerState.class);
        when(dockerClient.inspectContainerCmd("secuflow-tnm")).thenReturn(cmd);
        when(cmd.exec()).thenReturn(response);
        when(response.getState()).thenReturn(state);
        when(state.getRunning()).thenReturn(running);
    }

    @Test
    @DisplayName("Running container is ready")
    void runningContainerReady() {
        mockContainerState(true);
        assertDoesNotThrow(backend::verifyReady);
    }

    @Test
    @DisplayName("Stopped or missing container is rejected")
    void stoppedOrMissing() {
        mockContainerState(false);
        assertThrows(ValidationException.class, backend::verifyReady);

        var cmd = mock(InspectContainerCmd.class);
        when(dockerClient.inspectContainerCmd("secuflow-tnm")).thenReturn(cmd);
        when(cmd.exec()).thenThrow(new NotFoundException("No such container"));
        assertThrows(ValidationException.class, backend::verifyReady);
    }

    @Test
    @DisplayName("Command line uses the in-container java and jar")
    void commandLine() {
        var invocation = new MinerInvocation("FileDependencyMiner", List.of("--repository", "/data/r/.git"),
                List.of("main"), Path.of("/data/out"), Duration.ofSeconds(1), null);

        assertEquals(List.of("java", "-Dcongruence.exec=t1", "-jar", "/app/tnm-cli.jar", "FileDependencyMiner",
                        "--repository", "/data/r/.git", "main"),
                backend.commandLine(invocation, "t1"));
        assertEquals("docker:secuflow-tnm", backend.name());
    }

    @Test
    @DisplayName("Frame collector splits streams and emits whole lines across frames")
    void frameCollector() {
        var lines = new ArrayList<String>();
        var collector = new DockerExecMiningBackend.FrameCollector(lines::add);

        collector.onNext(new Frame(StreamType.STDOUT, "first li".getBytes(StandardCharsets.UTF_8)));
        collector.onNext(new Frame(StreamType.STDERR, "warn\n".getBytes(StandardCharsets.UTF_8)));
        collector.onNext(new Frame(StreamType.STDOUT, "ne\r\nsecond".getBytes(StandardCharsets.UTF_8)));
        collector.onComplete();

        assertEquals(List.of("first line", "second"), lines);
        assertEquals("first line\r\nsecond", collector.stdout());
        assertEquals("warn", collector.stderr());
    }

    // ── Timeout ─────────────────────────────────────────────────────

    private static ExecCreateCmdResponse execResponse(String id) {
        var response = mock(ExecCreateCmdResponse.class);
        when(response.getId()).thenReturn(id);
        return response;
    }

    @Test
    @DisplayName("A timed-out miner is killed by its marker before the timeout is raised")
    void timeoutKillsExec() {
        var minerResponse = execResponse("exec-miner");
        var killResponse = execResponse("exec-kill");
        var commands = new ArrayList<List<String>>();
        var create = mock(ExecCreateCmd.class, call -> {
            switch (call.getMethod().getName()) {
                case "withCmd" -> commands.add(List.of((String[]) call.getRawArguments()[0]));
                case "exec" -> {
                    return commands.size() == 1 ? minerResponse : killResponse;
                }
                default -> { }
            }
            return call.getMethod().getReturnType().isInstance(call.getMock()) ? call.getMock() : null;
        });
        when(dockerClient.execCreateCmd("secuflow-tnm")).thenReturn(create);

        var minerStart = mock(ExecStartCmd.class);
        when(dockerClient.execStartCmd("exec-miner")).thenReturn(minerStart);
        when(minerStart.exec(any())).thenAnswer(inv -> inv.getArgument(0));

        var killStart = mock(ExecStartCmd.class);
        when(dockerClient.execStartCmd("exec-kill")).thenReturn(killStart);
        when(killStart.exec(any())).thenAnswer(inv -> {
            ResultCallback<?> callback = inv.getArgument(0);
            callback.onComplete();
            return callback;
        });

        var inspect = mock(InspectExecCmd.class);
        var inspected = mock(InspectExecResponse.class);
        when(dockerClient.inspectExecCmd("exec-kill")).thenReturn(inspect);
        when(inspect.exec()).thenReturn(inspected);
        when(inspected.getExitCodeLong()).thenReturn(0L);

        var invocation = new MinerInvocation("AssignmentMatrixMiner", List.of(), List.of("main"), null,
                Duration.ofMillis(50), null);

        assertThrows(MiningTimeoutException.class, () -> backend.execute(invocation));

        assertEquals(2, commands.size());
        String marker = commands.get(0).get(1);
        assertTrue(marker.startsWith("-Dcongruence.exec="));
        assertEquals(List.of("pkill", "-KILL", "-f", marker.substring(2)), commands.get(1));
        verify(dockerClient).inspectExecCmd("exec-kill");
        verify(dockerClient, never()).inspectExecCmd("exec-miner");
    }
}

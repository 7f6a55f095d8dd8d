package com.congruence.mining;

import com.congruence.core.process.ProcessRunner;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class MinerConfig {

    private static final Logger log = LoggerFactory.getLogger(MinerConfig.class);

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    @ConditionalOnProperty(name = "congruence.miner.backend", havingValue = "docker")
    public DockerClient dockerClient() {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    /**
     * A run script wins over the configured backend. Otherwise {@code docker}
     * selects the exec backend and anything else runs the jar directly.
     */
    @Bean
    public MiningBackend miningBackend(MinerProperties properties, ProcessRunner processRunner,
                                       ObjectProvider<DockerClient> dockerClient) {
        Path workDir = properties.getWorkDir().isBlank() ? null : Path.of(properties.getWorkDir());
        if (properties.hasRunScript()) {
            log.info("Miner backend: run script '{}'", properties.getRunScript());
            return ProcessMiningBackend.forRunScript(processRunner, properties.getRunScript(), workDir);
        }
        if ("docker".equalsIgnoreCase(properties.getBackend())) {
            log.info("Miner backend: docker exec into '{}'", properties.getContainerName());
            return new DockerExecMiningBackend(dockerClient.getObject(), properties.getContainerName(),
                    properties.getJavaPath(), properties.getContainerJarPath());
        }
        log.info("Miner backend: {} -jar {}", properties.getJavaPath(), properties.getJarPath());
        return ProcessMiningBackend.forJar(processRunner, properties.getJavaPath(), properties.getJarPath(), workDir);
    }
}

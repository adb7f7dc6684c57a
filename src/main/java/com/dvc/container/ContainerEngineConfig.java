package com.dvc.container;

import com.dvc.config.DvcProperties;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ContainerEngineConfig {

    @Bean
    public DockerClient dockerClient(DvcProperties properties) {
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(properties.getDocker().getHost())
                .build();
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .connectionTimeout(Duration.ofSeconds(10))
                .responseTimeout(Duration.ofMinutes(5))
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public ContainerEngine containerEngine(DockerClient dockerClient, DvcProperties properties) {
        var docker = properties.getDocker();
        return new DockerContainerEngine(dockerClient, docker.getAccessHost(), docker.getNetwork(),
                docker.getStopTimeout(), docker.getPullTimeout());
    }
}

package com.autowake.runtime;

import com.autowake.core.catalog.ServiceCatalog;
import com.autowake.core.config.AutowakeProperties;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RuntimeConfig {

    @Bean
    @ConditionalOnMissingBean
    public DockerClient dockerClient(AutowakeProperties properties) {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", properties.getDocker().getHost());
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support (no junixsocket needed)
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .connectionTimeout(properties.getDocker().getConnectTimeout())
                .responseTimeout(properties.getDocker().getResponseTimeout())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public ContainerRuntimeAdapter containerRuntimeAdapter(DockerClient dockerClient,
                                                           ServiceCatalog catalog,
                                                           AutowakeProperties properties) {
        return new DockerContainerRuntimeAdapter(dockerClient, catalog, properties.getDocker().getStopTimeoutSeconds());
    }
}

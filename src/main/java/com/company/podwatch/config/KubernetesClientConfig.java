package com.company.podwatch.config;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Picks up in-cluster service account credentials or the local kubeconfig
 */
@Configuration
@Slf4j
public class KubernetesClientConfig {

    @Value("${podwatch.inventory.request-timeout:30s}")
    private Duration requestTimeout;

    @Value("${podwatch.inventory.connect-timeout:10s}")
    private Duration connectTimeout;

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        Config config = Config.autoConfigure(null);
        config.setRequestTimeout((int) requestTimeout.toMillis());
        config.setConnectionTimeout((int) connectTimeout.toMillis());

        log.info("Kubernetes client targeting {}", config.getMasterUrl());
        return new KubernetesClientBuilder().withConfig(config).build();
    }
}

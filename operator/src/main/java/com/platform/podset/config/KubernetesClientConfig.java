package com.platform.podset.config;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Kubernetes client used by the store and the informers.
 * Connection settings come from the usual kubeconfig / in-cluster service account discovery.
 */
@Slf4j
@Configuration
public class KubernetesClientConfig {

    @Value("${podset.kubernetes.request-timeout-ms:10000}")
    private int requestTimeoutMs;

    @Value("${podset.kubernetes.connection-timeout-ms:5000}")
    private int connectionTimeoutMs;

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        Config config = new ConfigBuilder(Config.autoConfigure(null))
            .withRequestTimeout(requestTimeoutMs)
            .withConnectionTimeout(connectionTimeoutMs)
            // the work queue owns retries
            .withRequestRetryBackoffLimit(0)
            .build();

        log.info("Kubernetes client configured for {} (namespace={})",
            config.getMasterUrl(), config.getNamespace());
        return new KubernetesClientBuilder().withConfig(config).build();
    }
}

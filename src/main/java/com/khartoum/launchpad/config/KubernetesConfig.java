package com.khartoum.launchpad.config;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.Config;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Slf4j
@Configuration
public class KubernetesConfig {

    @Value("${kubernetes.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${kubernetes.read-timeout-ms:30000}")
    private int readTimeoutMs;

    @Bean
    public ApiClient kubernetesApiClient() throws IOException {
        ApiClient client = Config.defaultClient();
        client.setConnectTimeout(connectTimeoutMs);
        client.setReadTimeout(readTimeoutMs);
        io.kubernetes.client.openapi.Configuration.setDefaultApiClient(client);
        log.info("Kubernetes client targeting {}", client.getBasePath());
        return client;
    }
}

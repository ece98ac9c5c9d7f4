package com.khartoum.launchpad.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Blocking HTTP client shared by the management API, tenant data API,
 * account API and key validators.
 */
@Configuration
public class HttpClientConfig {

    @Value("${launchpad.http.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${launchpad.http.read-timeout-ms:60000}")
    private int readTimeoutMs;

    @Bean
    public RestTemplate restTemplate() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}

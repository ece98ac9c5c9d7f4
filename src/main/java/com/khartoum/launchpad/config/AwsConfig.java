package com.khartoum.launchpad.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.route53.Route53Client;
import software.amazon.awssdk.services.route53.Route53ClientBuilder;

import java.net.URI;

/**
 * Route53 client for tenant subdomain records. Route53 is a global service,
 * so the region only changes when pointing at a local emulator.
 */
@Slf4j
@Configuration
public class AwsConfig {

    @Value("${aws.route53.region:aws-global}")
    private String region;

    // e.g. http://localhost:4566 for LocalStack; blank means the real endpoint
    @Value("${aws.route53.endpoint-override:}")
    private String endpointOverride;

    @Bean(destroyMethod = "close")
    public Route53Client route53Client() {
        Route53ClientBuilder builder = Route53Client.builder()
            .region(Region.of(region))
            .credentialsProvider(DefaultCredentialsProvider.create());

        if (!endpointOverride.isBlank()) {
            log.info("Route53 endpoint overridden to {}", endpointOverride);
            builder.endpointOverride(URI.create(endpointOverride));
        }
        return builder.build();
    }
}

package com.khartoum.launchpad.service;

import com.khartoum.launchpad.config.LaunchpadProperties;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.apis.NetworkingV1Api;
import io.kubernetes.client.openapi.models.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Routes tenant hostnames to the shared site deployment. Each hostname gets an
 * ingress whose cert-manager annotation requests a TLS certificate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KubernetesService {

    private final ApiClient apiClient;
    private final LaunchpadProperties properties;

    @Value("${kubernetes.namespace:tenant-sites}")
    private String namespace;

    // ==================== INGRESS ====================

    public void createIngress(String hostname) throws ApiException {
        NetworkingV1Api api = new NetworkingV1Api(apiClient);
        LaunchpadProperties.Domains domains = properties.getDomains();
        String ingressName = ingressName(hostname);

        V1Ingress ingress = new V1Ingress()
            .metadata(new V1ObjectMeta()
                .name(ingressName)
                .namespace(namespace)
                .labels(Map.of("app.kubernetes.io/managed-by", "launchpad"))
                .annotations(Map.of(
                    "kubernetes.io/ingress.class", "nginx",
                    "cert-manager.io/cluster-issuer", domains.getClusterIssuer()
                ))
            )
            .spec(new V1IngressSpec()
                .tls(List.of(new V1IngressTLS()
                    .hosts(List.of(hostname))
                    .secretName(tlsSecretName(hostname))
                ))
                .rules(List.of(new V1IngressRule()
                    .host(hostname)
                    .http(new V1HTTPIngressRuleValue()
                        .paths(List.of(new V1HTTPIngressPath()
                            .path("/")
                            .pathType("Prefix")
                            .backend(new V1IngressBackend()
                                .service(new V1IngressServiceBackend()
                                    .name(domains.getIngressServiceName())
                                    .port(new V1ServiceBackendPort().number(domains.getIngressServicePort()))
                                )
                            )
                        ))
                    )
                ))
            );

        try {
            api.createNamespacedIngress(namespace, ingress, null, null, null, null);
            log.info("Created ingress {} for {}", ingressName, hostname);
        } catch (ApiException e) {
            if (e.getCode() == 409) {
                log.warn("Ingress already exists for {}", hostname);
            } else {
                throw e;
            }
        }
    }

    // ==================== CERTIFICATE ====================

    /**
     * True when cert-manager has already written the TLS secret for the hostname.
     */
    public boolean isCertificateReady(String hostname) throws ApiException {
        CoreV1Api api = new CoreV1Api(apiClient);
        try {
            api.readNamespacedSecret(tlsSecretName(hostname), namespace, null);
            return true;
        } catch (ApiException e) {
            if (e.getCode() == 404) {
                return false;
            }
            throw e;
        }
    }

    static String ingressName(String hostname) {
        return "tenant-" + sanitize(hostname);
    }

    static String tlsSecretName(String hostname) {
        return "tenant-tls-" + sanitize(hostname);
    }

    private static String sanitize(String hostname) {
        String name = hostname.toLowerCase(Locale.ROOT).replace('.', '-');
        if (name.length() <= 52) {
            return name;
        }
        // Resource names are limited to 63 characters including the prefix
        String suffix = String.format("%08x", hostname.hashCode());
        return name.substring(0, 43).replaceAll("-+$", "") + "-" + suffix;
    }
}

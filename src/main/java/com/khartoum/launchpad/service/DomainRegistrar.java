package com.khartoum.launchpad.service;

import com.khartoum.launchpad.config.LaunchpadProperties;
import com.khartoum.launchpad.dto.Availability;
import com.khartoum.launchpad.dto.DomainRegistration;
import com.khartoum.launchpad.dto.SlugValidation;
import com.khartoum.launchpad.model.TenantStatus;
import com.khartoum.launchpad.repository.TenantDomainRepository;
import com.khartoum.launchpad.repository.TenantRepository;
import io.kubernetes.client.openapi.ApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates and registers tenant hostnames. DNS lives in Route53 for hostnames
 * under the platform's base domain; TLS is issued by cert-manager through the
 * tenant's ingress.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DomainRegistrar {

    /** 2-63 chars, lowercase alphanumeric + hyphens, no leading/trailing hyphen */
    private static final Pattern SLUG_PATTERN = Pattern.compile("^[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?$");

    static final Set<String> RESERVED_SLUGS = Set.of(
        "www", "api", "app", "admin", "mail", "ftp", "ns1", "ns2",
        "blog", "help", "support", "status", "docs", "cdn", "static", "assets",
        "media", "test", "staging", "dev", "demo", "launchpad", "platform", "dashboard"
    );

    private static final String TAKEN = "Subdomain is already taken";

    private final TenantRepository tenantRepository;
    private final TenantDomainRepository tenantDomainRepository;
    private final Route53Service route53Service;
    private final KubernetesService kubernetesService;
    private final LaunchpadProperties properties;

    public SlugValidation validateSlugFormat(String slug) {
        if (slug == null || slug.length() < 2) {
            return SlugValidation.invalid("Must be at least 2 characters");
        }
        if (slug.length() > 63) {
            return SlugValidation.invalid("Must be 63 characters or fewer");
        }
        if (!SLUG_PATTERN.matcher(slug).matches()) {
            return SlugValidation.invalid(
                "Only lowercase letters, numbers, and hyphens allowed. Cannot start or end with a hyphen.");
        }
        if (RESERVED_SLUGS.contains(slug)) {
            return SlugValidation.invalid("This subdomain is reserved");
        }
        return SlugValidation.ok();
    }

    /**
     * Registers the hostname with DNS and the TLS issuer. Never throws: any
     * failure is reported through {@link DomainRegistration#isSuccess()}.
     */
    public DomainRegistration addDomain(String hostname) {
        if (!properties.getDomains().isEnabled()) {
            log.warn("Skipping domain setup for \"{}\": domain registration is disabled", hostname);
            return DomainRegistration.skippedRegistration();
        }

        try {
            if (isPlatformHostname(hostname)) {
                route53Service.upsertCname(hostname);
            }
            kubernetesService.createIngress(hostname);
            boolean verified = kubernetesService.isCertificateReady(hostname);
            log.info("Registered domain {} (certificate ready: {})", hostname, verified);
            return DomainRegistration.registered(verified);
        } catch (ApiException e) {
            log.error("Ingress registration failed for {}: HTTP {} {}", hostname, e.getCode(), e.getResponseBody(), e);
            return DomainRegistration.failed("Failed to add domain (" + e.getCode() + ")");
        } catch (RuntimeException e) {
            log.error("Domain registration failed for {}", hostname, e);
            return DomainRegistration.failed(e.getMessage() != null ? e.getMessage() : "Failed to add domain");
        }
    }

    /**
     * Cheapest checks first: format, platform records, then the DNS zone.
     */
    public Availability checkSubdomainAvailability(String slug) {
        SlugValidation format = validateSlugFormat(slug);
        if (!format.isValid()) {
            return Availability.no(format.getReason());
        }

        String hostname = properties.subdomainFor(slug);

        if (tenantRepository.existsBySlugAndStatusNot(slug, TenantStatus.ARCHIVED)) {
            return Availability.no(TAKEN);
        }
        if (tenantDomainRepository.existsByHostname(hostname)) {
            return Availability.no(TAKEN);
        }

        if (properties.getDomains().isEnabled() && route53Service.recordExists(hostname)) {
            // A record outside the platform's tables is most likely an orphan, still unavailable
            return Availability.no(TAKEN);
        }

        return Availability.yes();
    }

    boolean isPlatformHostname(String hostname) {
        return properties.isUnderBaseDomain(hostname);
    }
}

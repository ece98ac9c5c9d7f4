package com.khartoum.launchpad.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Locale;

/**
 * Settings for the launch pipeline and the external services it talks to.
 */
@Data
@ConfigurationProperties(prefix = "launchpad")
public class LaunchpadProperties {

    /** Parent domain of every tenant subdomain, e.g. {@code red-bricks.app}. */
    private String baseDomain = "red-bricks.app";

    private Pipeline pipeline = new Pipeline();
    private Database database = new Database();
    private Domains domains = new Domains();
    private Account account = new Account();
    private Admin admin = new Admin();
    private Encryption encryption = new Encryption();

    public String subdomainFor(String slug) {
        return slug + "." + baseDomain;
    }

    public String siteUrlFor(String slug) {
        return "https://" + subdomainFor(slug);
    }

    /** True for hostnames below the base domain, not the base domain itself. */
    public boolean isUnderBaseDomain(String hostname) {
        return hostname.toLowerCase(Locale.ROOT).endsWith("." + baseDomain);
    }

    @Data
    public static class Pipeline {
        /** Upper bound for a single pipeline step. Zero or negative disables the deadline. */
        private Duration stepTimeout = Duration.ofMinutes(10);
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 100;
    }

    @Data
    public static class Database {
        private String managementUrl = "https://api.supabase.com/v1";
        private String managementToken;
        private String organizationId;
        private String region = "us-east-1";
        private String plan = "free";
        private String projectPrefix = "rb-";
        private Duration readyTimeout = Duration.ofMinutes(2);
        private Duration pollInterval = Duration.ofSeconds(3);
        /** Classpath location of the versioned template migrations. */
        private String migrationsLocation = "classpath*:template-migrations/*.sql";
    }

    @Data
    public static class Domains {
        /** When false, domain registration is skipped and reported as unverified. */
        private boolean enabled = true;
        private String loadBalancerDns;
        private String ingressServiceName = "tenant-site";
        private int ingressServicePort = 3000;
        private String clusterIssuer = "letsencrypt-prod";
    }

    @Data
    public static class Account {
        private String apiUrl = "https://api.redbricksdata.com/api/frontend";
    }

    @Data
    public static class Admin {
        private String apiKey;
    }

    @Data
    public static class Encryption {
        /** Base64 encoded 256-bit key. */
        private String key;
    }
}

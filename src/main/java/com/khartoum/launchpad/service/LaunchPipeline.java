package com.khartoum.launchpad.service;

import com.khartoum.launchpad.config.AsyncConfig;
import com.khartoum.launchpad.config.LaunchpadProperties;
import com.khartoum.launchpad.dto.CredentialEntry;
import com.khartoum.launchpad.dto.DomainRegistration;
import com.khartoum.launchpad.dto.LaunchContext;
import com.khartoum.launchpad.dto.LaunchRequest;
import com.khartoum.launchpad.dto.ProvisionedDatabase;
import com.khartoum.launchpad.dto.SiteSeed;
import com.khartoum.launchpad.exception.DomainRegistrationException;
import com.khartoum.launchpad.model.KeyKind;
import com.khartoum.launchpad.model.SslStatus;
import com.khartoum.launchpad.model.StepStatus;
import com.khartoum.launchpad.model.TenantDomain;
import com.khartoum.launchpad.repository.TenantDomainRepository;
import com.khartoum.launchpad.repository.TenantRepository;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the six launch steps of a tenant in order. Every step transition is
 * committed through {@link JobTracker} before the next step starts, so a
 * polling client always sees the last finished step. The first fatal error
 * fails the job and suspends the tenant; nothing is retried or rolled back.
 * <p>
 * A step body that outlives its deadline cannot be stopped if it ignores the
 * interrupt, so every body checks the run's halted flag before it writes, and
 * tenant writes only apply while the tenant is still provisioning.
 */
@Slf4j
@Service
public class LaunchPipeline {

    public static final List<String> STEP_NAMES = List.of(
        "Creating database",
        "Running migrations",
        "Seeding configuration",
        "Configuring domain",
        "Storing credentials",
        "Activating site"
    );

    static final int CREATE_DATABASE = 0;
    static final int RUN_MIGRATIONS = 1;
    static final int SEED_CONFIGURATION = 2;
    static final int CONFIGURE_DOMAIN = 3;
    static final int STORE_CREDENTIALS = 4;
    static final int ACTIVATE_SITE = 5;

    private static final String DEFAULT_THEME = "luxury-blue";

    private final JobTracker jobTracker;
    private final DatabaseProvisioner databaseProvisioner;
    private final MigrationCatalog migrationCatalog;
    private final DomainRegistrar domainRegistrar;
    private final CredentialVault credentialVault;
    private final TenantRepository tenantRepository;
    private final TenantDomainRepository tenantDomainRepository;
    private final LaunchpadProperties properties;
    private final AsyncTaskExecutor stepExecutor;

    public LaunchPipeline(JobTracker jobTracker,
                          DatabaseProvisioner databaseProvisioner,
                          MigrationCatalog migrationCatalog,
                          DomainRegistrar domainRegistrar,
                          CredentialVault credentialVault,
                          TenantRepository tenantRepository,
                          TenantDomainRepository tenantDomainRepository,
                          LaunchpadProperties properties,
                          @Qualifier(AsyncConfig.STEP_EXECUTOR) AsyncTaskExecutor stepExecutor) {
        this.jobTracker = jobTracker;
        this.databaseProvisioner = databaseProvisioner;
        this.migrationCatalog = migrationCatalog;
        this.domainRegistrar = domainRegistrar;
        this.credentialVault = credentialVault;
        this.tenantRepository = tenantRepository;
        this.tenantDomainRepository = tenantDomainRepository;
        this.properties = properties;
        this.stepExecutor = stepExecutor;
    }

    /** Detached entry point used by the launch request. */
    @Async(AsyncConfig.PROVISIONING_EXECUTOR)
    public void run(LaunchContext context) {
        MDC.put("jobId", String.valueOf(context.getJobId()));
        try {
            execute(context);
        } finally {
            MDC.remove("jobId");
        }
    }

    public void execute(LaunchContext context) {
        UUID tenantId = context.getTenantId();
        UUID jobId = context.getJobId();
        LaunchRequest request = context.getRequest();
        AtomicBoolean halted = new AtomicBoolean();
        log.info("Launching tenant {} ({}) under job {}", request.getSlug(), tenantId, jobId);

        try {
            ProvisionedDatabase database = runStep(context, halted, CREATE_DATABASE, "Database creation failed: ", () -> {
                ProvisionedDatabase created = databaseProvisioner.createDatabase(request.getSlug());
                ensureLive(halted, CREATE_DATABASE);
                requireProvisioning(tenantId, tenantRepository.recordDatabaseRef(tenantId, created.getReference()));
                return created;
            });

            runStep(context, halted, RUN_MIGRATIONS, "Migration failed: ", () -> {
                databaseProvisioner.runMigrations(database.getReference());
                String latest = migrationCatalog.latestVersion();
                ensureLive(halted, RUN_MIGRATIONS);
                if (latest != null) {
                    requireProvisioning(tenantId, tenantRepository.recordSchemaVersion(tenantId, latest));
                }
                return null;
            });

            runStep(context, halted, SEED_CONFIGURATION, "Seeding failed: ", () -> {
                ensureLive(halted, SEED_CONFIGURATION);
                databaseProvisioner.seedDatabase(database.getReference(), database.getApiUrl(),
                    database.getServiceRoleKey(), siteSeed(context));
                return null;
            });

            runStep(context, halted, CONFIGURE_DOMAIN, "Domain configuration failed: ", () -> {
                configureDomains(tenantId, request, halted);
                return null;
            });

            runStep(context, halted, STORE_CREDENTIALS, "Failed to store credentials: ", () -> {
                List<CredentialEntry> entries = credentials(context, database);
                ensureLive(halted, STORE_CREDENTIALS);
                credentialVault.storeKeys(tenantId, entries);
                return null;
            });

            runStep(context, halted, ACTIVATE_SITE, "Activation failed: ", () -> {
                ensureLive(halted, ACTIVATE_SITE);
                requireProvisioning(tenantId, tenantRepository.activate(tenantId));
                return null;
            });

            jobTracker.completeJob(jobId);
            log.info("Tenant {} is live at {}", request.getSlug(), properties.siteUrlFor(request.getSlug()));

        } catch (StepHaltedException e) {
            log.warn("Launch of {} stopped at step {}", request.getSlug(), e.getStep());
        } catch (RuntimeException e) {
            log.error("Launch pipeline error for tenant {}", tenantId, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            try {
                jobTracker.failJob(jobId, tenantId, message);
            } catch (RuntimeException trackerError) {
                log.error("Could not record failure of job {}", jobId, trackerError);
            }
        }
    }

    // ==================== STEP RUNNER ====================

    private <T> T runStep(LaunchContext context, AtomicBoolean halted, int index, String failurePrefix,
                          Callable<T> body) {
        UUID jobId = context.getJobId();
        UUID tenantId = context.getTenantId();
        String name = STEP_NAMES.get(index);

        jobTracker.updateStep(jobId, index, StepStatus.RUNNING);
        Future<T> future = stepExecutor.submit(body);

        try {
            T result = await(future);
            jobTracker.updateStep(jobId, index, StepStatus.COMPLETED);
            return result;
        } catch (TimeoutException e) {
            halted.set(true);
            future.cancel(true);
            String message = "Step \"" + name + "\" timed out after " + describe(stepTimeout());
            jobTracker.updateStep(jobId, index, StepStatus.TIMEOUT, message);
            jobTracker.timeoutJob(jobId, tenantId, message);
            throw new StepHaltedException(index);
        } catch (ExecutionException e) {
            String message = messageOf(e.getCause());
            log.error("Step \"{}\" failed for tenant {}", name, tenantId, e.getCause());
            jobTracker.updateStep(jobId, index, StepStatus.FAILED, message);
            jobTracker.failJob(jobId, tenantId, failurePrefix + message);
            throw new StepHaltedException(index);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            halted.set(true);
            future.cancel(true);
            jobTracker.updateStep(jobId, index, StepStatus.FAILED, "Interrupted");
            jobTracker.failJob(jobId, tenantId, failurePrefix + "launch was interrupted");
            throw new StepHaltedException(index);
        }
    }

    private <T> T await(Future<T> future) throws InterruptedException, ExecutionException, TimeoutException {
        Duration timeout = stepTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return future.get();
        }
        return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private Duration stepTimeout() {
        return properties.getPipeline().getStepTimeout();
    }

    private static String describe(Duration duration) {
        return duration.toMillis() >= 1000 ? duration.toSeconds() + "s" : duration.toMillis() + "ms";
    }

    // ==================== STEP BODIES ====================

    private SiteSeed siteSeed(LaunchContext context) {
        LaunchRequest request = context.getRequest();
        return SiteSeed.builder()
            .siteName(request.getDisplayName())
            .themePreset(request.getThemePreset() != null ? request.getThemePreset() : DEFAULT_THEME)
            .adminEmail(context.getAdminEmail())
            .features(request.getFeatures() != null ? new HashMap<>(request.getFeatures()) : new HashMap<>())
            .build();
    }

    /**
     * The subdomain is mandatory. A custom domain is best effort: when it
     * fails, or another tenant claims it first, the subdomain stays primary.
     */
    private void configureDomains(UUID tenantId, LaunchRequest request, AtomicBoolean halted) {
        String subdomain = properties.subdomainFor(request.getSlug());
        ensureLive(halted, CONFIGURE_DOMAIN);
        DomainRegistration subdomainResult = domainRegistrar.addDomain(subdomain);
        if (!subdomainResult.isSuccess()) {
            throw new DomainRegistrationException(subdomainResult.getError());
        }

        ensureLive(halted, CONFIGURE_DOMAIN);
        TenantDomain subdomainRow = TenantDomain.of(tenantId, subdomain, true, sslStatusOf(subdomainResult));
        tenantDomainRepository.save(subdomainRow);

        String customDomain = request.getCustomDomain();
        if (customDomain == null || customDomain.isBlank()) {
            return;
        }
        if (properties.isUnderBaseDomain(customDomain) || customDomain.equalsIgnoreCase(subdomain)) {
            log.warn("Ignoring custom domain {} under the platform domain, keeping {} as primary", customDomain, subdomain);
            return;
        }
        if (tenantDomainRepository.existsByHostname(customDomain)) {
            log.warn("Custom domain {} is already registered, keeping {} as primary", customDomain, subdomain);
            return;
        }

        ensureLive(halted, CONFIGURE_DOMAIN);
        DomainRegistration customResult = domainRegistrar.addDomain(customDomain);
        TenantDomain customRow;
        if (customResult.isSuccess()) {
            customRow = TenantDomain.of(tenantId, customDomain, false, sslStatusOf(customResult));
        } else {
            log.warn("Custom domain {} failed, keeping {} as primary: {}",
                customDomain, subdomain, customResult.getError());
            customRow = TenantDomain.of(tenantId, customDomain, false, SslStatus.FAILED);
        }

        ensureLive(halted, CONFIGURE_DOMAIN);
        try {
            tenantDomainRepository.saveAndFlush(customRow);
        } catch (DataIntegrityViolationException e) {
            log.warn("Custom domain {} was claimed by another tenant meanwhile, keeping {} as primary",
                customDomain, subdomain);
            return;
        }

        if (customResult.isSuccess()) {
            subdomainRow.setPrimary(false);
            customRow.setPrimary(true);
            tenantDomainRepository.saveAll(List.of(subdomainRow, customRow));
        }
    }

    private static SslStatus sslStatusOf(DomainRegistration registration) {
        return registration.isVerified() ? SslStatus.ACTIVE : SslStatus.PENDING;
    }

    /**
     * Platform-issued values are known good and stored as validated. Keys the
     * user typed in are stored unvalidated until an explicit check succeeds.
     */
    private List<CredentialEntry> credentials(LaunchContext context, ProvisionedDatabase database) {
        LaunchRequest request = context.getRequest();
        List<CredentialEntry> entries = new ArrayList<>();
        entries.add(CredentialEntry.confirmed(KeyKind.DATABASE_URL, database.getApiUrl()));
        entries.add(CredentialEntry.confirmed(KeyKind.DATABASE_ANON_KEY, database.getAnonKey()));
        entries.add(CredentialEntry.confirmed(KeyKind.DATABASE_SERVICE_ROLE, database.getServiceRoleKey()));

        if (hasText(context.getTeamApiToken())) {
            entries.add(CredentialEntry.confirmed(KeyKind.PLATFORM_TOKEN, context.getTeamApiToken()));
        }
        if (hasText(request.getGoogleMapsKey())) {
            entries.add(CredentialEntry.unconfirmed(KeyKind.GOOGLE_MAPS, request.getGoogleMapsKey()));
        }
        if (hasText(request.getAiKey())) {
            String kind = hasText(request.getAiProvider()) ? request.getAiProvider() : KeyKind.GEMINI;
            entries.add(CredentialEntry.unconfirmed(kind, request.getAiKey()));
        }
        if (hasText(request.getEmailKey())) {
            String kind = hasText(request.getEmailProvider()) ? request.getEmailProvider() : KeyKind.RESEND;
            entries.add(CredentialEntry.unconfirmed(kind, request.getEmailKey()));
        }
        return entries;
    }

    private static void ensureLive(AtomicBoolean halted, int index) {
        if (halted.get()) {
            throw new StepHaltedException(index);
        }
    }

    private static void requireProvisioning(UUID tenantId, int updatedRows) {
        if (updatedRows == 0) {
            throw new IllegalStateException("Tenant " + tenantId + " is no longer provisioning");
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String messageOf(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /** Unwinds the pipeline after a step has already recorded its failure. */
    static class StepHaltedException extends RuntimeException {
        private final int step;

        StepHaltedException(int step) {
            super(null, null, false, false);
            this.step = step;
        }

        int getStep() {
            return step;
        }
    }
}

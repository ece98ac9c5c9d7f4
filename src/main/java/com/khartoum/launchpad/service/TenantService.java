package com.khartoum.launchpad.service;

import com.khartoum.launchpad.config.LaunchpadProperties;
import com.khartoum.launchpad.dto.JobStatusResponse;
import com.khartoum.launchpad.dto.LaunchRequest;
import com.khartoum.launchpad.exception.JobNotFoundException;
import com.khartoum.launchpad.exception.JobTrackerException;
import com.khartoum.launchpad.exception.SlugConflictException;
import com.khartoum.launchpad.model.JobType;
import com.khartoum.launchpad.model.Tenant;
import com.khartoum.launchpad.model.TenantJob;
import com.khartoum.launchpad.model.TenantStatus;
import com.khartoum.launchpad.repository.TenantJobRepository;
import com.khartoum.launchpad.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class TenantService {
    private final TenantRepository tenantRepository;
    private final TenantJobRepository tenantJobRepository;
    private final JobTracker jobTracker;
    private final LaunchpadProperties properties;

    /**
     * Creates the tenant and its launch job in one transaction. When the job
     * cannot be created the tenant row is rolled back with it.
     */
    @Transactional
    public TenantJob createTenantWithJob(LaunchRequest request, Long teamId, String adminEmail) {
        if (tenantRepository.existsBySlug(request.getSlug())) {
            throw new SlugConflictException(request.getSlug());
        }

        Tenant tenant = new Tenant();
        tenant.setTeamId(teamId);
        tenant.setSlug(request.getSlug());
        tenant.setDisplayName(request.getDisplayName());
        if (request.getTemplate() != null) {
            tenant.setTemplate(request.getTemplate());
        }
        if (request.getThemePreset() != null) {
            tenant.setThemePreset(request.getThemePreset());
        }
        tenant.setFeatureFlags(request.getFeatures() != null ? new HashMap<>(request.getFeatures()) : new HashMap<>());
        tenant.setStatus(TenantStatus.PROVISIONING);
        tenant.setAdminEmail(adminEmail);

        try {
            tenant = tenantRepository.saveAndFlush(tenant);
        } catch (DataIntegrityViolationException e) {
            // Lost a race with a concurrent launch of the same slug
            throw new SlugConflictException(request.getSlug());
        }

        try {
            return jobTracker.createJob(tenant.getId(), JobType.LAUNCH, LaunchPipeline.STEP_NAMES);
        } catch (RuntimeException e) {
            log.error("Failed to create job tracker for tenant {}", tenant.getSlug(), e);
            throw new JobTrackerException("Failed to create job tracker", e);
        }
    }

    /**
     * Drops a launch whose pipeline was never scheduled, freeing the slug for
     * an immediate retry.
     */
    @Transactional
    public void discardLaunch(UUID tenantId, UUID jobId) {
        tenantJobRepository.deleteById(jobId);
        tenantRepository.deleteById(tenantId);
        log.info("Discarded unscheduled launch {} of tenant {}", jobId, tenantId);
    }

    /**
     * Job progress for its owner. Jobs of other owners are reported exactly
     * like jobs that do not exist.
     */
    @Transactional(readOnly = true)
    public JobStatusResponse getJobStatus(UUID jobId, String callerEmail) {
        TenantJob job = tenantJobRepository.findById(jobId).orElseThrow(JobNotFoundException::new);
        Tenant tenant = tenantRepository.findById(job.getTenantId()).orElseThrow(JobNotFoundException::new);

        if (callerEmail == null || !callerEmail.equals(tenant.getAdminEmail())) {
            log.debug("Job {} requested by a non-owner", jobId);
            throw new JobNotFoundException();
        }

        return new JobStatusResponse(
            job.getId(),
            job.getStatus(),
            job.getSteps(),
            job.getError(),
            new JobStatusResponse.TenantSummary(
                tenant.getSlug(),
                tenant.getStatus(),
                tenant.getDisplayName(),
                properties.siteUrlFor(tenant.getSlug())
            )
        );
    }
}

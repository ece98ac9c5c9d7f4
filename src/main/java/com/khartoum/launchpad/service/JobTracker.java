package com.khartoum.launchpad.service;

import com.khartoum.launchpad.model.JobStatus;
import com.khartoum.launchpad.model.JobStep;
import com.khartoum.launchpad.model.JobType;
import com.khartoum.launchpad.model.StepStatus;
import com.khartoum.launchpad.model.TenantJob;
import com.khartoum.launchpad.repository.TenantJobRepository;
import com.khartoum.launchpad.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persisted state machine of a single tenant job. The pipeline running the job
 * is the only writer of its steps, so a read-modify-write of the whole steps
 * list is safe.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobTracker {

    private final TenantJobRepository tenantJobRepository;
    private final TenantRepository tenantRepository;

    @Transactional
    public TenantJob createJob(UUID tenantId, JobType type, List<String> stepNames) {
        TenantJob job = new TenantJob();
        job.setTenantId(tenantId);
        job.setJobType(type);
        job.setStatus(JobStatus.RUNNING);
        job.setSteps(stepNames.stream().map(JobStep::pending).toList());
        TenantJob saved = tenantJobRepository.saveAndFlush(job);
        log.info("Created {} job {} for tenant {} with {} steps", type.value(), saved.getId(), tenantId, stepNames.size());
        return saved;
    }

    public void updateStep(UUID jobId, int index, StepStatus status) {
        updateStep(jobId, index, status, null);
    }

    /**
     * Moves one step to {@code status}. Only the targeted step changes; the
     * rest of the list is written back as read.
     */
    @Transactional
    public void updateStep(UUID jobId, int index, StepStatus status, String error) {
        if (status == StepStatus.PENDING) {
            throw new IllegalStateException("Step " + index + " of job " + jobId + " cannot return to pending");
        }

        TenantJob job = tenantJobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("Ignoring step update for missing job {}", jobId);
            return;
        }

        List<JobStep> steps = new ArrayList<>();
        for (JobStep step : job.getSteps()) {
            steps.add(step.toBuilder().build());
        }
        if (index < 0 || index >= steps.size()) {
            throw new IllegalArgumentException("Job " + jobId + " has no step " + index);
        }

        JobStep step = steps.get(index);
        Instant now = Instant.now();
        step.setStatus(status);
        if (status == StepStatus.RUNNING) {
            step.setStartedAt(now);
        }
        if (status.isTerminal()) {
            step.setCompletedAt(now);
        }
        if (error != null) {
            step.setError(error);
        }

        job.setSteps(steps);
        tenantJobRepository.save(job);
        log.debug("Job {} step {} ({}) -> {}", jobId, index, step.getName(), status.value());
    }

    /** Fails the job and suspends its tenant together. */
    @Transactional
    public void failJob(UUID jobId, UUID tenantId, String message) {
        finish(jobId, tenantId, JobStatus.FAILED, message);
    }

    /** Like {@link #failJob} but records that a step ran past its deadline. */
    @Transactional
    public void timeoutJob(UUID jobId, UUID tenantId, String message) {
        finish(jobId, tenantId, JobStatus.TIMEOUT, message);
    }

    @Transactional
    public void completeJob(UUID jobId) {
        tenantJobRepository.findById(jobId).ifPresentOrElse(job -> {
            job.setStatus(JobStatus.COMPLETED);
            job.setCompletedAt(LocalDateTime.now());
            tenantJobRepository.save(job);
            log.info("Job {} completed", jobId);
        }, () -> log.warn("Cannot complete missing job {}", jobId));
    }

    private void finish(UUID jobId, UUID tenantId, JobStatus status, String message) {
        tenantJobRepository.findById(jobId).ifPresentOrElse(job -> {
            job.setStatus(status);
            job.setError(message);
            job.setCompletedAt(LocalDateTime.now());
            tenantJobRepository.save(job);
        }, () -> log.warn("Cannot mark missing job {} as {}", jobId, status.value()));

        tenantRepository.suspend(tenantId);
        log.error("Job {} {} and tenant {} suspended: {}", jobId, status.value(), tenantId, message);
    }
}

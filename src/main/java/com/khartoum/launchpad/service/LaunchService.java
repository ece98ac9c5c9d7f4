package com.khartoum.launchpad.service;

import com.khartoum.launchpad.config.LaunchpadProperties;
import com.khartoum.launchpad.dto.AccountProfile;
import com.khartoum.launchpad.dto.LaunchContext;
import com.khartoum.launchpad.dto.LaunchRequest;
import com.khartoum.launchpad.dto.LaunchResponse;
import com.khartoum.launchpad.dto.SlugValidation;
import com.khartoum.launchpad.dto.TeamInfo;
import com.khartoum.launchpad.exception.InvalidRequestException;
import com.khartoum.launchpad.model.KeyKind;
import com.khartoum.launchpad.model.TenantJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/**
 * Accepts a launch request: validates it, creates the tenant and job rows and
 * hands the run to the pipeline. Not transactional itself, so both rows are
 * committed before the detached run can read them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LaunchService {

    private final DomainRegistrar domainRegistrar;
    private final AccountClient accountClient;
    private final TenantService tenantService;
    private final LaunchPipeline launchPipeline;
    private final LaunchpadProperties properties;

    public LaunchResponse launch(String token, LaunchRequest request) {
        SlugValidation slugCheck = domainRegistrar.validateSlugFormat(request.getSlug());
        if (!slugCheck.isValid()) {
            throw new InvalidRequestException(slugCheck.getReason());
        }
        if (request.getAiProvider() != null && !KeyKind.AI_PROVIDERS.contains(request.getAiProvider())) {
            throw new InvalidRequestException("Unknown AI provider: " + request.getAiProvider());
        }
        if (request.getEmailProvider() != null && !KeyKind.EMAIL_PROVIDERS.contains(request.getEmailProvider())) {
            throw new InvalidRequestException("Unknown email provider: " + request.getEmailProvider());
        }

        String customDomain = request.getCustomDomain();
        if (customDomain != null && !customDomain.isBlank()
            && (properties.isUnderBaseDomain(customDomain) || customDomain.equalsIgnoreCase(properties.getBaseDomain()))) {
            // Platform hostnames are only ever issued through the slug
            throw new InvalidRequestException("Custom domain cannot be under " + properties.getBaseDomain());
        }

        AccountProfile profile = accountClient.getProfile(token);
        TeamInfo team = accountClient.getTeamInfo(token);

        TenantJob job = tenantService.createTenantWithJob(request, team.getId(), profile.getEmail());
        log.info("Accepted launch of {} for team {} as job {}", request.getSlug(), team.getId(), job.getId());

        LaunchContext context = LaunchContext.builder()
            .tenantId(job.getTenantId())
            .jobId(job.getId())
            .request(request)
            .adminEmail(profile.getEmail())
            .teamApiToken(team.getApiToken())
            .build();

        try {
            launchPipeline.run(context);
        } catch (TaskRejectedException e) {
            log.error("Launch queue is full, rejecting job {}", job.getId(), e);
            try {
                tenantService.discardLaunch(job.getTenantId(), job.getId());
            } catch (RuntimeException discardError) {
                log.error("Could not discard unscheduled launch of {}", request.getSlug(), discardError);
            }
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE,
                "Too many launches in progress. Please try again shortly.");
        }

        return new LaunchResponse(job.getTenantId(), job.getId());
    }
}

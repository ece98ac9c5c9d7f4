package com.khartoum.launchpad.controller;

import com.khartoum.launchpad.dto.AccountProfile;
import com.khartoum.launchpad.dto.JobStatusResponse;
import com.khartoum.launchpad.dto.LaunchRequest;
import com.khartoum.launchpad.dto.LaunchResponse;
import com.khartoum.launchpad.exception.InvalidRequestException;
import com.khartoum.launchpad.service.AccountClient;
import com.khartoum.launchpad.service.LaunchService;
import com.khartoum.launchpad.service.TenantService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;
import java.util.regex.Pattern;

@Slf4j
@RestController
@RequestMapping("/api/launch")
@RequiredArgsConstructor
public class LaunchController {

    private static final Pattern UUID_PATTERN =
        Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

    private final LaunchService launchService;
    private final TenantService tenantService;
    private final AccountClient accountClient;

    @PostMapping
    public ResponseEntity<LaunchResponse> launch(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @Valid @RequestBody LaunchRequest request) {
        String token = BearerToken.from(authorization);
        log.info("Launch requested: {}", request.getSlug());
        return ResponseEntity.ok(launchService.launch(token, request));
    }

    @GetMapping("/status")
    public ResponseEntity<JobStatusResponse> status(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(required = false) String jobId) {
        String token = BearerToken.from(authorization);

        if (jobId == null || jobId.isBlank()) {
            throw new InvalidRequestException("jobId is required");
        }
        if (!UUID_PATTERN.matcher(jobId).matches()) {
            throw new InvalidRequestException("Invalid jobId format");
        }

        AccountProfile profile = accountClient.getProfile(token);
        return ResponseEntity.ok(tenantService.getJobStatus(UUID.fromString(jobId), profile.getEmail()));
    }
}

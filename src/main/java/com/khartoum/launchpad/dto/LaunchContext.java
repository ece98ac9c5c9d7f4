package com.khartoum.launchpad.dto;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.util.UUID;

/**
 * Everything a detached launch run needs, captured while the request was
 * still authenticated.
 */
@Data
@Builder
public class LaunchContext {
    private UUID tenantId;
    private UUID jobId;
    private LaunchRequest request;
    private String adminEmail;

    @ToString.Exclude
    private String teamApiToken;
}

package com.khartoum.launchpad.dto;

import java.util.UUID;

public class LaunchResponse {
    public UUID tenantId;
    public UUID jobId;

    public LaunchResponse(UUID tenantId, UUID jobId) {
        this.tenantId = tenantId;
        this.jobId = jobId;
    }
}

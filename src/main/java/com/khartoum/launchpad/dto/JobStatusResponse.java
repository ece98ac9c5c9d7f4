package com.khartoum.launchpad.dto;

import com.khartoum.launchpad.model.JobStatus;
import com.khartoum.launchpad.model.JobStep;
import com.khartoum.launchpad.model.TenantStatus;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Data
@AllArgsConstructor
public class JobStatusResponse {
    private UUID jobId;
    private JobStatus status;
    private List<JobStep> steps;
    private String error;
    private TenantSummary tenant;

    @Data
    @AllArgsConstructor
    public static class TenantSummary {
        private String slug;
        private TenantStatus status;
        private String displayName;
        private String url;
    }
}

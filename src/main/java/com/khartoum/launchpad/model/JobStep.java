package com.khartoum.launchpad.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One named unit of work inside a {@link TenantJob}. Steps are not rows of
 * their own: the whole list is stored as a single value on the job.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStep {
    private String name;
    private StepStatus status;
    private Instant startedAt;
    private Instant completedAt;
    private String error;

    public static JobStep pending(String name) {
        return JobStep.builder().name(name).status(StepStatus.PENDING).build();
    }
}

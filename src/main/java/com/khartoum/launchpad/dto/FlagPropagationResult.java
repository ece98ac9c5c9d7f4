package com.khartoum.launchpad.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class FlagPropagationResult {
    private String message;
    private int totalTenants;
    private int tenantsUpdated;
    private int totalFlagsAdded;
    private List<TenantError> errors;

    @Data
    @AllArgsConstructor
    public static class TenantError {
        private String tenantId;
        private String slug;
        private String error;
    }
}

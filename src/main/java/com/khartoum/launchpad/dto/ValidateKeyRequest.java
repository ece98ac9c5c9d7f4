package com.khartoum.launchpad.dto;

import lombok.Data;
import lombok.ToString;

import java.util.UUID;

@Data
public class ValidateKeyRequest {
    @ToString.Exclude
    private String apiKey;

    private String provider;

    /** When set, a successful check is recorded on this tenant's stored key. */
    private UUID tenantId;
}

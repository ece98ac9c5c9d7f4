package com.khartoum.launchpad.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.ToString;

@Data
@AllArgsConstructor
public class ProvisionedDatabase {
    private String reference;
    private String apiUrl;

    @ToString.Exclude
    private String anonKey;

    @ToString.Exclude
    private String serviceRoleKey;
}

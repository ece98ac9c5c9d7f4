package com.khartoum.launchpad.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.ToString;

/**
 * A plaintext credential waiting to be encrypted and stored. {@code validated}
 * marks values already confirmed to work, such as keys the platform just
 * issued itself.
 */
@Data
@AllArgsConstructor
public class CredentialEntry {
    private String kind;

    @ToString.Exclude
    private String value;

    private boolean validated;

    public static CredentialEntry confirmed(String kind, String value) {
        return new CredentialEntry(kind, value, true);
    }

    public static CredentialEntry unconfirmed(String kind, String value) {
        return new CredentialEntry(kind, value, false);
    }
}

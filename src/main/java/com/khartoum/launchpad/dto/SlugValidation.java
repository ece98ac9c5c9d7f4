package com.khartoum.launchpad.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SlugValidation {
    private boolean valid;
    private String reason;

    public static SlugValidation ok() {
        return new SlugValidation(true, null);
    }

    public static SlugValidation invalid(String reason) {
        return new SlugValidation(false, reason);
    }
}

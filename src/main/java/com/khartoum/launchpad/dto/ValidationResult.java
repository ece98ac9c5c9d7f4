package com.khartoum.launchpad.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationResult {
    private boolean valid;
    private String message;
    private String details;

    public static ValidationResult valid(String message) {
        return new ValidationResult(true, message, null);
    }

    public static ValidationResult invalid(String message) {
        return new ValidationResult(false, message, null);
    }

    public static ValidationResult invalid(String message, String details) {
        return new ValidationResult(false, message, details);
    }
}

package com.khartoum.launchpad.controller;

import com.khartoum.launchpad.dto.ValidateKeyRequest;
import com.khartoum.launchpad.dto.ValidationResult;
import com.khartoum.launchpad.service.AccountClient;
import com.khartoum.launchpad.service.validation.KeyValidationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/validate")
@RequiredArgsConstructor
public class ValidationController {

    private final KeyValidationService keyValidationService;
    private final AccountClient accountClient;

    /**
     * Live check of a maps, ai or email provider key. The caller is only
     * resolved when the result should be recorded on a tenant.
     */
    @PostMapping("/{kind}")
    public ResponseEntity<ValidationResult> validate(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable String kind,
            @RequestBody ValidateKeyRequest request) {
        String token = BearerToken.from(authorization);
        String callerEmail = request.getTenantId() != null ? accountClient.getProfile(token).getEmail() : null;

        ValidationResult result = keyValidationService.validate(kind, request, callerEmail);
        log.info("Validated {} key (provider {}): {}", kind, request.getProvider(), result.isValid());
        return ResponseEntity.ok(result);
    }
}

package com.khartoum.launchpad.controller;

import com.khartoum.launchpad.dto.Availability;
import com.khartoum.launchpad.dto.SlugCheckRequest;
import com.khartoum.launchpad.service.DomainRegistrar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/domains")
@RequiredArgsConstructor
public class DomainController {

    private final DomainRegistrar domainRegistrar;

    @PostMapping("/check")
    public ResponseEntity<Availability> check(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestBody SlugCheckRequest request) {
        BearerToken.from(authorization);

        if (request.getSlug() == null || request.getSlug().isEmpty()) {
            return ResponseEntity.badRequest().body(Availability.no("Subdomain is required"));
        }
        return ResponseEntity.ok(domainRegistrar.checkSubdomainAvailability(request.getSlug()));
    }
}

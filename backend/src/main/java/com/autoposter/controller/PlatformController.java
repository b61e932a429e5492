package com.autoposter.controller;

import com.autoposter.service.PlatformCredentialService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/platform")
@RequiredArgsConstructor
public class PlatformController {

    private final PlatformCredentialService platformCredentialService;

    /**
     * Tests the configured platform credential. A rejected credential is reported in the body, not as an error status.
     */
    @PostMapping("/verify")
    public ResponseEntity<PlatformCredentialService.CredentialCheck> verify() {
        return ResponseEntity.ok(platformCredentialService.verify());
    }
}

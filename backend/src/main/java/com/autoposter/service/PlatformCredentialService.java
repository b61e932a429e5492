package com.autoposter.service;

import com.autoposter.model.FailureReason;
import com.autoposter.provider.PlatformAccount;
import com.autoposter.provider.PlatformApiException;
import com.autoposter.provider.PlatformClient;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Operator-triggered connection test against the publishing platform. Never publishes anything.
 */
@Service
@RequiredArgsConstructor
public class PlatformCredentialService {

    private static final Logger log = LoggerFactory.getLogger(PlatformCredentialService.class);

    private final PlatformClient platformClient;
    private final Clock clock;

    public CredentialCheck verify() {
        OffsetDateTime checkedAt = OffsetDateTime.now(clock);
        try {
            PlatformAccount account = platformClient.verifyCredentials();
            return new CredentialCheck(true, account.id(), account.username(), null, null, checkedAt);
        } catch (PlatformApiException ex) {
            log.warn("Platform credential check failed: reason={}, message={}", ex.getReason(), ex.getMessage());
            return new CredentialCheck(false, null, null, ex.getReason(), ex.getMessage(), checkedAt);
        }
    }

    public record CredentialCheck(
            boolean verified,
            String accountId,
            String username,
            FailureReason failureReason,
            String message,
            OffsetDateTime checkedAt
    ) {
    }
}

package com.hyperhook.backend.security;

import com.hyperhook.backend.config.WebhookProperties;
import com.hyperhook.backend.dto.TradeSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Shared-secret and source-address checks for inbound signals. Fails closed when no
 * secret is configured.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookAuthenticator {

    private final WebhookProperties webhookProperties;

    /**
     * @param sourceAddress remote address of the caller, or {@code null} to skip the allow-list check
     */
    public boolean authenticate(TradeSignal signal, String sourceAddress) {
        boolean passwordOk = checkPassword(signal == null ? null : signal.getPassword());
        boolean sourceOk = checkSource(sourceAddress);
        return passwordOk && sourceOk;
    }

    private boolean checkPassword(String provided) {
        String expected = webhookProperties.getPassword();
        if (expected == null || expected.isEmpty()) {
            log.error("WEBHOOK_PASSWORD not configured, rejecting webhook");
            return false;
        }
        if (provided == null) {
            log.warn("No password provided in webhook");
            return false;
        }
        if (!MessageDigest.isEqual(sha256(expected), sha256(provided))) {
            log.warn("Invalid webhook password provided");
            return false;
        }
        return true;
    }

    private boolean checkSource(String sourceAddress) {
        if (sourceAddress == null || sourceAddress.isBlank()) {
            return true;
        }
        boolean allowed = webhookProperties.getAllowedSourceAddresses().contains(sourceAddress.trim());
        if (!allowed) {
            log.warn("Unauthorized source IP: {}", sourceAddress);
        }
        return allowed;
    }

    // Equal-length digests keep the comparison time independent of the secret's length.
    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package com.hyperhook.backend.security;

import com.hyperhook.backend.config.WebhookProperties;
import com.hyperhook.backend.dto.TradeSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookAuthenticatorTest {

    private WebhookProperties properties;
    private WebhookAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        properties = new WebhookProperties();
        properties.setPassword("s3cret");
        authenticator = new WebhookAuthenticator(properties);
    }

    @Test
    void acceptsCorrectPasswordFromAllowedSource() {
        assertThat(authenticator.authenticate(signal("s3cret"), "52.89.214.238")).isTrue();
    }

    @Test
    void skipsSourceCheckWhenNoAddressIsSupplied() {
        assertThat(authenticator.authenticate(signal("s3cret"), null)).isTrue();
    }

    @Test
    void rejectsCorrectPasswordFromUnknownSource() {
        assertThat(authenticator.authenticate(signal("s3cret"), "10.0.0.1")).isFalse();
    }

    @Test
    void rejectsWrongOrMissingPassword() {
        assertThat(authenticator.authenticate(signal("s3cret!"), "52.89.214.238")).isFalse();
        assertThat(authenticator.authenticate(signal("S3CRET"), null)).isFalse();
        assertThat(authenticator.authenticate(signal(null), null)).isFalse();
        assertThat(authenticator.authenticate(null, null)).isFalse();
    }

    @Test
    void failsClosedWithoutConfiguredPassword() {
        properties.setPassword(null);
        assertThat(authenticator.authenticate(signal(""), null)).isFalse();

        properties.setPassword("");
        assertThat(authenticator.authenticate(signal(""), null)).isFalse();
    }

    @Test
    void usesConfiguredAllowList() {
        properties.getAllowedSourceAddresses().add("203.0.113.7");

        assertThat(authenticator.authenticate(signal("s3cret"), "203.0.113.7")).isTrue();
    }

    private static TradeSignal signal(String password) {
        return TradeSignal.builder().action("long").ticker("BTC").password(password).build();
    }
}

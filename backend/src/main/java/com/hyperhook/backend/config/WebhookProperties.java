package com.hyperhook.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "hyperhook.webhook")
public class WebhookProperties {

    private String password;

    private List<String> allowedSourceAddresses = new ArrayList<>(List.of(
            "52.89.214.238",
            "34.212.75.30",
            "54.218.53.128",
            "52.32.178.7"
    ));

    /**
     * When false the controller never hands the remote address to the authenticator,
     * so only the shared secret is checked.
     */
    private boolean enforceSourceAddress = true;

    private boolean trustForwardedFor = false;
}

package com.hyperhook.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final Environment environment;
    private final WebhookProperties webhookProperties;
    private final HyperliquidProperties hyperliquidProperties;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        String address = environment.getProperty("server.address");
        String host = (address == null || address.isBlank() || "0.0.0.0".equals(address)) ? "localhost" : address;
        log.info("Webhook listening on http://{}:{}/webhook", host, port);
        log.info("Using {} at {}", hyperliquidProperties.isUseMainnet() ? "MAINNET" : "TESTNET",
                hyperliquidProperties.resolveBaseUrl());
        if (webhookProperties.getPassword() == null || webhookProperties.getPassword().isEmpty()) {
            log.warn("WEBHOOK_PASSWORD is not set; every webhook will be rejected");
        }
        if (!hyperliquidProperties.hasPrivateKey()) {
            log.warn("HYPERLIQUID_PRIVATE_KEY is not set; trading actions will fail");
        }
        if (!webhookProperties.isEnforceSourceAddress()) {
            log.warn("Source address allow-list is disabled");
        }
    }
}

package com.hyperhook.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI hyperhookOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Hyperhook Webhook API")
                        .description("Executes TradingView alerts as Hyperliquid perpetual market orders")
                        .version("1.0"));
    }
}

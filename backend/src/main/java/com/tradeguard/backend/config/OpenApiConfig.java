package com.tradeguard.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI tradeGuardOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("TradeGuard API")
                        .description("Signal coordination, pre-trade gating, post-trade proofs and capital allocation")
                        .version("1.0"));
    }
}

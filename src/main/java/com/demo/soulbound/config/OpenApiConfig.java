package com.demo.soulbound.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI soulboundOpenAPI() {
        return new OpenAPI().info(new Info()
                .title("Soulbound Credentials API")
                .description("Credential types, minting (role or signed), burning, recovery, administration. "
                        + "Mutating calls identify the caller with the X-Caller header.")
                .version("v1"));
    }
}

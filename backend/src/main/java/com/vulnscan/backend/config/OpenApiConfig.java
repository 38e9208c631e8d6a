package com.vulnscan.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI vulnScanOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("VulnScan Orchestrator API")
                        .description("Scan lifecycle, history diffs and webhook tests")
                        .version("1.0"));
    }
}

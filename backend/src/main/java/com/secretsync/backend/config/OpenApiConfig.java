package com.secretsync.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI secretSyncOpenApi() {
        SecurityScheme tokenScheme = new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer")
                .description("Static API token, required by POST /api/sync when API_TOKEN is set");
        return new OpenAPI()
                .info(new Info()
                        .title("GCP Secret Sync to Kubernetes")
                        .description("Syncs secrets from GCP Secret Manager to Kubernetes")
                        .version("1.0"))
                .components(new Components().addSecuritySchemes("apiToken", tokenScheme));
    }
}

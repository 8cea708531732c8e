package com.machina.provisioning.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI provisioningOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Provisioning Service API")
                .version("1.0.0")
                .description("""
                    Provisions and manages cloud machines through Terraform deployments.

                    ## Features
                    - Deployment state machine: queued, planning, awaiting approval, applying, finished
                    - One active deployment per machine
                    - Plan approval for destructive or large changes
                    - Live deployment logs over server-sent events
                    - AES-256-GCM encrypted provider credentials
                    - Scheduled reconciliation of machine status against the provider

                    ## Authentication
                    All `/api/**` endpoints require a JWT Bearer token.
                    """))
            .addSecurityItem(new SecurityRequirement().addList("Bearer Authentication"))
            .components(new Components()
                .addSecuritySchemes("Bearer Authentication",
                    new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .bearerFormat("JWT")));
    }
}

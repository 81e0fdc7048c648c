package com.tcgptracker.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI description of the JSON endpoints.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI trackerOpenApi(TrackerProperties properties) {
        return new OpenAPI().info(new Info()
            .title("TCGP Tracker API")
            .description("Collection status, theme preference and health endpoints")
            .version(properties.getGitHash()));
    }
}

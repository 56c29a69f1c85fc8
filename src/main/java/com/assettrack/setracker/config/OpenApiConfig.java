package com.assettrack.setracker.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI description of the REST API, served at /v3/api-docs and /swagger-ui.html.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI gatewayOpenApi(@Value("${app.version:0.0.1}") String version) {
        return new OpenAPI()
                .info(new Info()
                        .title("SeTracker Gateway API")
                        .description("Send commands to and read data from Beesure/SeTracker GPS devices")
                        .version(version));
    }
}

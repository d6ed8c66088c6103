package com.alert.engine.service.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI configuration for the alert API.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI alertEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Alert Engine Service API")
                        .description("Throttles, deduplicates and escalates operational alerts. " +
                                "Accepts inventory, pricing, security and system events and exposes alert lifecycle actions.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Operations Platform Team")
                                .email("ops-platform@example.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}

package com.alert.engine.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Alert Engine Service - throttles, deduplicates and escalates operational alerts.
 *
 * Main entry point for the Spring Boot application.
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
@ConfigurationPropertiesScan("com.alert.engine.service.config")
public class AlertEngineServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertEngineServiceApplication.class, args);
    }
}

package com.alert.engine.service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * Time and randomness sources shared by the throttling components.
 */
@Slf4j
@Configuration
public class ThrottlingEngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock alertClock() {
        log.info("Initializing UTC system clock");
        return Clock.systemUTC();
    }

    /**
     * Random source for the adaptive strategy. {@link Random} is safe for concurrent use.
     */
    @Bean
    @ConditionalOnMissingBean
    public RandomGenerator adaptiveRandom() {
        log.info("Initializing adaptive random source");
        return new Random();
    }
}

package com.keyguard.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Application-wide beans and configuration property bindings.
 */
@Configuration
@EnableConfigurationProperties({ApiKeyProperties.class, HttpProperties.class, DatabaseProperties.class})
public class AppConfig {

    /**
     * UTC clock for every stored timestamp. Tests replace it with a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

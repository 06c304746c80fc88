package com.keyguard.config;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMax;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Database settings beyond the standard spring.r2dbc.* properties.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "keyguard.database")
public class DatabaseProperties {

    /**
     * Run schema.sql on startup. Statements are idempotent.
     */
    private boolean initializeSchema = false;

    /**
     * Server-side statement timeout applied to every connection.
     */
    @NotNull
    @DurationMin(seconds = 1)
    @DurationMax(minutes = 5)
    private Duration statementTimeout = Duration.ofSeconds(30);
}

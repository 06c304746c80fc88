package com.keyguard.config;

import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.ConnectionFactoryOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.r2dbc.ConnectionFactoryOptionsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

/**
 * Database configuration for the R2DBC PostgreSQL connection.
 */
@Slf4j
@Configuration
@EnableR2dbcRepositories(basePackages = "com.keyguard.repository")
public class DatabaseConfig {

    /**
     * Apply the configured statement timeout to every pooled connection.
     */
    @Bean
    public ConnectionFactoryOptionsBuilderCustomizer statementTimeoutCustomizer(DatabaseProperties properties) {
        return builder -> builder.option(ConnectionFactoryOptions.STATEMENT_TIMEOUT, properties.getStatementTimeout());
    }

    /**
     * Initialize database schema on startup.
     * Executes schema.sql when keyguard.database.initialize-schema is true.
     */
    @Bean
    public ConnectionFactoryInitializer initializer(ConnectionFactory connectionFactory,
                                                    DatabaseProperties properties) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);
        initializer.setEnabled(properties.isInitializeSchema());

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        populator.addScript(new ClassPathResource("schema.sql"));
        initializer.setDatabasePopulator(populator);

        if (properties.isInitializeSchema()) {
            log.info("Database schema initialization enabled");
        }
        return initializer;
    }
}

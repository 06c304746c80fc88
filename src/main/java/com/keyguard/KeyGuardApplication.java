package com.keyguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * KeyGuard Server Application
 *
 * API-key protected item service built with Spring Boot WebFlux and R2DBC.
 */
@SpringBootApplication
public class KeyGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeyGuardApplication.class, args);
    }

}

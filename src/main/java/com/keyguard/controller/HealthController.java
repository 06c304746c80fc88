package com.keyguard.controller;

import com.keyguard.model.dto.ReadinessResponse;
import com.keyguard.repository.ApiKeyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Health check endpoints.
 */
@Slf4j
@RestController
@RequestMapping
@RequiredArgsConstructor
public class HealthController {

    static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final ApiKeyRepository apiKeyRepository;

    @GetMapping("/")
    public Mono<Map<String, String>> root() {
        return Mono.just(Map.of("message", "Welcome to the API."));
    }

    /**
     * Liveness check: the process is up.
     */
    @GetMapping("/health/live")
    public Mono<Map<String, String>> liveness() {
        return Mono.just(Map.of("status", "ok"));
    }

    /**
     * Readiness check: the api_keys table can be queried. Returns 503 when
     * it cannot, so orchestrators stop routing traffic here.
     */
    @GetMapping("/health/ready")
    public Mono<ResponseEntity<ReadinessResponse>> readiness() {
        return apiKeyRepository.count()
                .timeout(HEALTH_CHECK_TIMEOUT)
                .map(count -> "ok")
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("Database health check timed out after {}", HEALTH_CHECK_TIMEOUT);
                    return Mono.just("timeout");
                })
                .onErrorResume(e -> {
                    log.warn("Database health check failed: {}", e.getMessage());
                    return Mono.just("error");
                })
                .map(database -> {
                    boolean ok = "ok".equals(database);
                    ReadinessResponse body = ReadinessResponse.builder()
                            .status(ok ? "ok" : "degraded")
                            .checks(Map.of("database", database))
                            .build();
                    return ResponseEntity.status(ok ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
                });
    }
}

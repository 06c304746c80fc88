package com.keyguard.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keyguard.exception.InvalidApiKeyException;
import com.keyguard.exception.StoreUnavailableException;
import com.keyguard.model.dto.ErrorResponse;
import com.keyguard.service.ApiKeyValidator;
import com.keyguard.web.CorrelationIdFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.web.server.util.matcher.ServerWebExchangeMatcher;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Collections;

/**
 * Filter for API Key authentication.
 * Validates the key header on protected paths and puts the validated
 * {@link com.keyguard.model.entity.ApiKey} in the security context.
 *
 * Every validation failure produces the same 401 response. Its body carries
 * no correlation id, so rejections for different reasons cannot be told apart.
 */
@Slf4j
public class ApiKeyAuthenticationFilter implements WebFilter {

    private final ApiKeyValidator apiKeyValidator;
    private final ServerWebExchangeMatcher protectedPaths;
    private final String headerName;
    private final ObjectMapper objectMapper;

    public ApiKeyAuthenticationFilter(ApiKeyValidator apiKeyValidator,
                                      ServerWebExchangeMatcher protectedPaths,
                                      String headerName,
                                      ObjectMapper objectMapper) {
        this.apiKeyValidator = apiKeyValidator;
        this.protectedPaths = protectedPaths;
        this.headerName = headerName;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        return protectedPaths.matches(exchange)
                .flatMap(match -> match.isMatch()
                        ? authenticate(exchange, chain)
                        : chain.filter(exchange));
    }

    private Mono<Void> authenticate(ServerWebExchange exchange, WebFilterChain chain) {
        String apiKey = exchange.getRequest().getHeaders().getFirst(headerName);
        String correlationId = CorrelationIdFilter.correlationId(exchange);

        return apiKeyValidator.validate(apiKey, correlationId)
                .flatMap(key -> {
                    UsernamePasswordAuthenticationToken authentication =
                            new UsernamePasswordAuthenticationToken(key, null, Collections.emptyList());
                    return chain.filter(exchange)
                            .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication));
                })
                .onErrorResume(InvalidApiKeyException.class, e -> {
                    exchange.getResponse().getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, "ApiKey");
                    return writeError(exchange, HttpStatus.UNAUTHORIZED, InvalidApiKeyException.MESSAGE, null);
                })
                .onErrorResume(StoreUnavailableException.class, e -> writeError(
                        exchange, HttpStatus.SERVICE_UNAVAILABLE, StoreUnavailableException.MESSAGE, correlationId));
    }

    private Mono<Void> writeError(ServerWebExchange exchange, HttpStatus status, String detail, String correlationId) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        ErrorResponse body = ErrorResponse.builder()
                .detail(detail)
                .correlationId(correlationId)
                .build();
        try {
            byte[] bytes = objectMapper.writeValueAsBytes(body);
            return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize error body", e);
            return response.setComplete();
        }
    }
}

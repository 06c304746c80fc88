package com.keyguard.web;

import com.keyguard.config.HttpProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Assigns every request a correlation id and logs its completion.
 *
 * A client supplied X-Correlation-ID is reused only if it is a short token of
 * letters, digits, '-' and '_', so it is safe to write to logs.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String PROCESS_TIME_HEADER = "X-Process-Time";
    public static final String CORRELATION_ID_ATTRIBUTE = CorrelationIdFilter.class.getName() + ".correlationId";

    private static final Pattern CORRELATION_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

    private final HttpProperties httpProperties;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = resolve(exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER));
        long start = System.nanoTime();

        exchange.getAttributes().put(CORRELATION_ID_ATTRIBUTE, correlationId);
        exchange.getResponse().beforeCommit(() -> {
            exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);
            if (httpProperties.isExposeTimingHeader()) {
                exchange.getResponse().getHeaders().set(PROCESS_TIME_HEADER,
                        String.format("%.2fms", elapsedMillis(start)));
            }
            return Mono.empty();
        });

        return chain.filter(exchange)
                .doFinally(signal -> log.info("Request completed | method={} | path={} | status={} | time={}ms | correlationId={}",
                        exchange.getRequest().getMethod(),
                        exchange.getRequest().getPath().value(),
                        exchange.getResponse().getStatusCode(),
                        String.format("%.2f", elapsedMillis(start)),
                        correlationId));
    }

    /**
     * Correlation id stored on the exchange by this filter.
     *
     * @param exchange Current exchange
     * @return The id, or "unknown" if the filter did not run
     */
    public static String correlationId(ServerWebExchange exchange) {
        return exchange.getAttributeOrDefault(CORRELATION_ID_ATTRIBUTE, "unknown");
    }

    static String resolve(String candidate) {
        if (candidate != null && CORRELATION_ID_PATTERN.matcher(candidate).matches()) {
            return candidate;
        }
        return UUID.randomUUID().toString();
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}

package com.keyguard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * HTTP edge settings, bound from {@code keyguard.http.*}.
 */
@Data
@ConfigurationProperties(prefix = "keyguard.http")
public class HttpProperties {

    /**
     * Allowed CORS origins. Empty disables CORS.
     */
    private List<String> corsOrigins = new ArrayList<>();

    /**
     * Adds X-Process-Time to responses. Turn off in production.
     */
    private boolean exposeTimingHeader = true;
}

package com.keyguard.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for key metadata. Never carries the secret.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyResponse {
    private String id;
    private String name;
    private String clientId;
    private String keyPrefix;
    @JsonProperty("is_active")
    private boolean active;
    private Instant expiresAt;
    private Instant createdAt;
    private Instant lastUsedAt;
    private Instant revokedAt;
}

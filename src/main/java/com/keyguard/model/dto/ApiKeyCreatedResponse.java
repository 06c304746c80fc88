package com.keyguard.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for key issuance.
 * Contains the plaintext key which is only returned once at creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyCreatedResponse {
    private String id;
    private String name;
    private String clientId;
    private String keyPrefix;
    private String key;
    private Instant expiresAt;
    private Instant createdAt;
    private String message;
}

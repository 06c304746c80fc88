package com.keyguard.service;

import com.keyguard.config.ApiKeyProperties;
import com.keyguard.exception.DuplicateResourceException;
import com.keyguard.exception.InvalidRequestException;
import com.keyguard.model.dto.ApiKeyCreateRequest;
import com.keyguard.model.dto.ApiKeyCreatedResponse;
import com.keyguard.model.dto.ApiKeyListResponse;
import com.keyguard.model.dto.ApiKeyResponse;
import com.keyguard.model.entity.ApiKey;
import com.keyguard.repository.ApiKeyRepository;
import com.keyguard.util.ApiKeyCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for issuing, looking up, listing and revoking API keys.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyService {

    static final String SINGLE_DISCLOSURE_MESSAGE =
            "API key created successfully. Save this key now - it will only be shown once!";

    private static final int MAX_FIELD_LENGTH = 255;

    private final ApiKeyRepository apiKeyRepository;
    private final ApiKeyCodec apiKeyCodec;
    private final ApiKeyProperties properties;
    private final Clock clock;

    /**
     * Issue a new API key.
     *
     * @param request Key issuance request
     * @return Stored metadata together with the plaintext key
     */
    @Transactional
    public Mono<ApiKeyCreatedResponse> createKey(ApiKeyCreateRequest request) {
        return Mono.fromCallable(() -> normalize(request))
                .flatMap(normalized -> apiKeyRepository
                        .existsByClientIdAndName(normalized.getClientId(), normalized.getName())
                        .flatMap(exists -> {
                            if (exists) {
                                return Mono.error(new DuplicateResourceException(String.format(
                                        "API key named '%s' already exists for client '%s'",
                                        normalized.getName(), normalized.getClientId())));
                            }
                            return insertKey(normalized);
                        }));
    }

    private Mono<ApiKeyCreatedResponse> insertKey(ApiKeyCreateRequest request) {
        String secret = apiKeyCodec.generateSecret();
        String keyPrefix = apiKeyCodec.extractPrefix(secret);

        return Mono.fromCallable(() -> apiKeyCodec.hashSecret(secret))
                .subscribeOn(Schedulers.boundedElastic())
                .map(hash -> ApiKey.builder()
                        .name(request.getName())
                        .clientId(request.getClientId())
                        .keyHash(hash)
                        .keyPrefix(keyPrefix)
                        .active(true)
                        .expiresAt(request.getExpiresAt())
                        .createdAt(Instant.now(clock))
                        .build())
                .flatMap(apiKeyRepository::save)
                .onErrorMap(DataIntegrityViolationException.class, e -> new DuplicateResourceException(
                        "API key conflicts with an existing key", e))
                .doOnNext(saved -> log.info("Created API key: id={}, prefix={}, clientId={}, name={}, expiresAt={}",
                        saved.getId(), keyPrefix, saved.getClientId(), saved.getName(), saved.getExpiresAt()))
                .map(saved -> ApiKeyCreatedResponse.builder()
                        .id(saved.getId().toString())
                        .name(saved.getName())
                        .clientId(saved.getClientId())
                        .keyPrefix(saved.getKeyPrefix())
                        .key(secret)
                        .expiresAt(saved.getExpiresAt())
                        .createdAt(saved.getCreatedAt())
                        .message(SINGLE_DISCLOSURE_MESSAGE)
                        .build());
    }

    /**
     * Get a key by id.
     *
     * @param id Key ID
     * @return The key, or empty if unknown
     */
    public Mono<ApiKey> findById(UUID id) {
        return apiKeyRepository.findById(id);
    }

    /**
     * Find the single key whose lookup prefix starts with {@code prefix}.
     * Prefixes shorter than the configured minimum are refused without a
     * query, and a prefix matching several keys is treated as not found.
     *
     * @param prefix Leading characters of the key
     * @return The key, or empty
     */
    public Mono<ApiKey> findByPrefix(String prefix) {
        if (prefix == null || prefix.length() < properties.getMinSearchPrefixLength()) {
            log.warn("Key prefix search rejected: too short (length={}, minRequired={})",
                    prefix == null ? 0 : prefix.length(), properties.getMinSearchPrefixLength());
            return Mono.empty();
        }
        return apiKeyRepository.findByKeyPrefixStartingWith(prefix, 2)
                .collectList()
                .flatMap(matches -> {
                    if (matches.size() > 1) {
                        log.warn("Key prefix search is ambiguous: prefix={}", prefix);
                        return Mono.empty();
                    }
                    return Mono.justOrEmpty(matches.stream().findFirst());
                });
    }

    /**
     * Find a key by prefix, falling back to the id when the argument parses
     * as a UUID.
     *
     * @param prefixOrId Key prefix or ID
     * @return The key, or empty
     */
    public Mono<ApiKey> findByPrefixOrId(String prefixOrId) {
        return findByPrefix(prefixOrId)
                .switchIfEmpty(Mono.defer(() -> parseUuid(prefixOrId)
                        .map(this::findById)
                        .orElseGet(Mono::empty)));
    }

    /**
     * List keys, newest first.
     *
     * @param skip Number of keys to skip
     * @param limit Maximum number of keys to return
     * @return Page of keys and the total key count
     */
    public Mono<ApiKeyListResponse> listKeys(long skip, int limit) {
        Mono<Long> total = apiKeyRepository.count();
        Mono<List<ApiKeyResponse>> page = apiKeyRepository.findPage(skip, limit)
                .map(ApiKeyService::toResponse)
                .collectList();

        return Mono.zip(page, total)
                .map(tuple -> ApiKeyListResponse.builder()
                        .keys(tuple.getT1())
                        .total(tuple.getT2())
                        .build());
    }

    /**
     * Revoke a key. Revoking an already revoked key succeeds again and keeps
     * the original revocation time.
     *
     * @param id Key ID
     * @return true if a key with this id exists
     */
    @Transactional
    public Mono<Boolean> revokeKey(UUID id) {
        return apiKeyRepository.revoke(id, Instant.now(clock))
                .map(rows -> rows > 0)
                .doOnNext(revoked -> {
                    if (revoked) {
                        log.info("Revoked API key: id={}", id);
                    }
                });
    }

    /**
     * Convert entity to response DTO.
     */
    public static ApiKeyResponse toResponse(ApiKey key) {
        return ApiKeyResponse.builder()
                .id(key.getId().toString())
                .name(key.getName())
                .clientId(key.getClientId())
                .keyPrefix(key.getKeyPrefix())
                .active(key.isActive())
                .expiresAt(key.getExpiresAt())
                .createdAt(key.getCreatedAt())
                .lastUsedAt(key.getLastUsedAt())
                .revokedAt(key.getRevokedAt())
                .build();
    }

    private static ApiKeyCreateRequest normalize(ApiKeyCreateRequest request) {
        return ApiKeyCreateRequest.builder()
                .name(requireText("name", request.getName()))
                .clientId(requireText("client_id", request.getClientId()))
                .expiresAt(request.getExpiresAt())
                .build();
    }

    private static String requireText(String field, String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidRequestException(field, "Value cannot be empty or whitespace-only");
        }
        if (trimmed.length() > MAX_FIELD_LENGTH) {
            throw new InvalidRequestException(field, "Value cannot exceed " + MAX_FIELD_LENGTH + " characters");
        }
        return trimmed;
    }

    private static Optional<UUID> parseUuid(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}

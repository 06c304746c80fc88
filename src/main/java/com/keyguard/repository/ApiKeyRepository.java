package com.keyguard.repository;

import com.keyguard.model.entity.ApiKey;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

/**
 * Repository for API Key entities.
 */
@Repository
public interface ApiKeyRepository extends ReactiveCrudRepository<ApiKey, UUID> {

    /**
     * Find the active key with the given lookup prefix and lock its row.
     * A row already locked by another transaction is skipped, so the result
     * is empty instead of waiting for the lock. Must run inside a transaction.
     */
    @Query("SELECT * FROM api_keys WHERE key_prefix = :keyPrefix AND is_active = TRUE FOR UPDATE SKIP LOCKED")
    Mono<ApiKey> findActiveByKeyPrefixForUpdate(String keyPrefix);

    /**
     * Keys whose lookup prefix starts with the given text. Callers cap the
     * result to detect ambiguous prefixes.
     */
    @Query("SELECT * FROM api_keys WHERE starts_with(key_prefix, :prefix) ORDER BY created_at DESC LIMIT :max")
    Flux<ApiKey> findByKeyPrefixStartingWith(String prefix, int max);

    /**
     * One page of keys, newest first.
     */
    @Query("SELECT * FROM api_keys ORDER BY created_at DESC, id LIMIT :limit OFFSET :offset")
    Flux<ApiKey> findPage(long offset, int limit);

    @Query("SELECT EXISTS(SELECT 1 FROM api_keys WHERE client_id = :clientId AND name = :name)")
    Mono<Boolean> existsByClientIdAndName(String clientId, String name);

    /**
     * Update last used timestamp.
     */
    @Modifying
    @Query("UPDATE api_keys SET last_used_at = :usedAt WHERE id = :id")
    Mono<Integer> touchLastUsed(UUID id, Instant usedAt);

    /**
     * Soft revoke by id. An earlier revocation timestamp is kept.
     *
     * @return number of matched rows, 0 when the id is unknown
     */
    @Modifying
    @Query("UPDATE api_keys SET is_active = FALSE, revoked_at = COALESCE(revoked_at, :revokedAt) WHERE id = :id")
    Mono<Integer> revoke(UUID id, Instant revokedAt);
}

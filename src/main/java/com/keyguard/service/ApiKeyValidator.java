package com.keyguard.service;

import com.keyguard.config.ApiKeyProperties;
import com.keyguard.exception.InvalidApiKeyException;
import com.keyguard.exception.InvalidApiKeyException.RejectionReason;
import com.keyguard.exception.StoreUnavailableException;
import com.keyguard.model.entity.ApiKey;
import com.keyguard.repository.ApiKeyRepository;
import com.keyguard.util.ApiKeyCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

/**
 * Request-time API key validation.
 *
 * <p>Steps: missing and length checks, prefix derivation, locked lookup of
 * the active key with that prefix, bcrypt verification, expiry check, and
 * finally the last_used_at update. The first steps need no store and run
 * before any connection is taken. The lookup and the update share one
 * transaction, so the row lock taken by the lookup is held until commit. A
 * key whose row is locked by a concurrent validation is not found by the
 * lookup and is rejected.
 *
 * <p>Every rejection surfaces as the same {@link InvalidApiKeyException}; the
 * failing step is only logged. Store outages, including a transaction that
 * cannot be opened, surface as {@link StoreUnavailableException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyValidator {

    private final ApiKeyRepository apiKeyRepository;
    private final ApiKeyCodec apiKeyCodec;
    private final ApiKeyProperties properties;
    private final Clock clock;
    private final TransactionalOperator transactionalOperator;

    /**
     * Validate a presented secret and record its use.
     *
     * @param secret The presented plaintext secret, may be null
     * @param correlationId Request correlation id, used for logging only
     * @return The validated key with the updated last_used_at
     */
    public Mono<ApiKey> validate(String secret, String correlationId) {
        if (secret == null || secret.isBlank()) {
            return reject(RejectionReason.MISSING, "", correlationId);
        }
        if (secret.length() < properties.getMinLength()) {
            return reject(RejectionReason.TOO_SHORT, "", correlationId);
        }
        String prefix = apiKeyCodec.extractPrefix(secret);

        return transactionalOperator.transactional(
                        Mono.defer(() -> lookupVerifyAndTouch(secret, prefix, correlationId)))
                .doOnNext(key -> log.debug("API key validated: id={}, prefix={}, clientId={}, correlationId={}",
                        key.getId(), prefix, key.getClientId(), correlationId))
                .timeout(properties.getValidationTimeout())
                .onErrorMap(ApiKeyValidator::isStoreFailure, e -> {
                    log.error("API key validation could not reach the store (prefix={}, correlationId={})",
                            prefix, correlationId, e);
                    return new StoreUnavailableException("Key store unavailable", e);
                });
    }

    private Mono<ApiKey> lookupVerifyAndTouch(String secret, String prefix, String correlationId) {
        return apiKeyRepository.findActiveByKeyPrefixForUpdate(prefix)
                .switchIfEmpty(Mono.defer(() -> reject(RejectionReason.NOT_FOUND, prefix, correlationId)))
                .flatMap(key -> verify(secret, key)
                        .flatMap(matches -> {
                            if (!matches) {
                                return reject(RejectionReason.HASH_MISMATCH, prefix, correlationId);
                            }
                            Instant now = Instant.now(clock);
                            if (key.isExpired(now)) {
                                log.warn("API key validation failed: key expired (prefix={}, expiresAt={}, correlationId={})",
                                        prefix, key.getExpiresAt(), correlationId);
                                return Mono.<ApiKey>error(new InvalidApiKeyException(RejectionReason.EXPIRED));
                            }
                            return touch(key, now);
                        }));
    }

    // bcrypt is CPU bound; keep it off the I/O threads
    private Mono<Boolean> verify(String secret, ApiKey key) {
        return Mono.fromCallable(() -> apiKeyCodec.verifySecret(secret, key.getKeyHash()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<ApiKey> touch(ApiKey key, Instant now) {
        return apiKeyRepository.touchLastUsed(key.getId(), now)
                .map(rows -> {
                    key.setLastUsedAt(now);
                    return key;
                });
    }

    private static boolean isStoreFailure(Throwable error) {
        return error instanceof DataAccessResourceFailureException
                || error instanceof TransientDataAccessException
                || error instanceof TransactionException
                || error instanceof TimeoutException;
    }

    private static Mono<ApiKey> reject(RejectionReason reason, String prefix, String correlationId) {
        log.warn("API key validation failed: {} (prefix={}, correlationId={})", reason, prefix, correlationId);
        return Mono.error(new InvalidApiKeyException(reason));
    }
}

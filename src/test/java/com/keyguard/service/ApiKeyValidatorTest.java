package com.keyguard.service;

import com.keyguard.config.ApiKeyProperties;
import com.keyguard.exception.InvalidApiKeyException;
import com.keyguard.exception.InvalidApiKeyException.RejectionReason;
import com.keyguard.exception.StoreUnavailableException;
import com.keyguard.model.entity.ApiKey;
import com.keyguard.repository.ApiKeyRepository;
import com.keyguard.util.ApiKeyCodec;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ApiKeyValidator.
 */
@ExtendWith(MockitoExtension.class)
class ApiKeyValidatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String CORRELATION_ID = "test-correlation";

    private static ApiKeyCodec apiKeyCodec;
    private static String secret;
    private static String secretHash;

    @Mock
    private ApiKeyRepository apiKeyRepository;

    @Mock
    private Clock clock;

    @Mock
    private TransactionalOperator transactionalOperator;

    private ApiKeyProperties properties;
    private ApiKeyValidator validator;
    private ApiKey storedKey;

    @BeforeAll
    static void setUpSecret() {
        ApiKeyProperties properties = new ApiKeyProperties();
        properties.setBcryptRounds(ApiKeyProperties.BCRYPT_ROUNDS_MIN);
        apiKeyCodec = new ApiKeyCodec(properties);
        secret = apiKeyCodec.generateSecret();
        secretHash = apiKeyCodec.hashSecret(secret);
    }

    @BeforeEach
    void setUp() {
        properties = new ApiKeyProperties();
        properties.setBcryptRounds(ApiKeyProperties.BCRYPT_ROUNDS_MIN);
        validator = new ApiKeyValidator(apiKeyRepository, apiKeyCodec, properties, clock, transactionalOperator);
        lenient().when(transactionalOperator.transactional(any(Mono.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        storedKey = ApiKey.builder()
                .id(UUID.randomUUID())
                .name("CI")
                .clientId("build-bot")
                .keyHash(secretHash)
                .keyPrefix(apiKeyCodec.extractPrefix(secret))
                .active(true)
                .createdAt(NOW.minusSeconds(3600))
                .build();
    }

    @Test
    void validate_Success_TouchesLastUsed() {
        when(clock.instant()).thenReturn(NOW);
        when(apiKeyRepository.findActiveByKeyPrefixForUpdate(storedKey.getKeyPrefix()))
                .thenReturn(Mono.just(storedKey));
        when(apiKeyRepository.touchLastUsed(storedKey.getId(), NOW)).thenReturn(Mono.just(1));

        StepVerifier.create(validator.validate(secret, CORRELATION_ID))
                .assertNext(key -> {
                    assertThat(key.getId()).isEqualTo(storedKey.getId());
                    assertThat(key.getLastUsedAt()).isEqualTo(NOW);
                })
                .verifyComplete();
    }

    @Test
    void validate_MissingKey() {
        StepVerifier.create(validator.validate(null, CORRELATION_ID))
                .expectErrorSatisfies(error -> assertRejected(error, RejectionReason.MISSING))
                .verify();
        StepVerifier.create(validator.validate("   ", CORRELATION_ID))
                .expectErrorSatisfies(error -> assertRejected(error, RejectionReason.MISSING))
                .verify();

        verifyNoInteractions(apiKeyRepository, transactionalOperator);
    }

    @Test
    void validate_TooShortIsRejectedBeforeLookup() {
        StepVerifier.create(validator.validate("sk_short", CORRELATION_ID))
                .expectErrorSatisfies(error -> assertRejected(error, RejectionReason.TOO_SHORT))
                .verify();

        verifyNoInteractions(apiKeyRepository, transactionalOperator);
    }

    @Test
    void validate_MissingKeyIsRejectedWhileStoreIsDown() {
        lenient().when(transactionalOperator.transactional(any(Mono.class)))
                .thenReturn(Mono.error(new CannotCreateTransactionException("Could not open R2DBC Connection")));

        StepVerifier.create(validator.validate(null, CORRELATION_ID))
                .expectErrorSatisfies(error -> assertRejected(error, RejectionReason.MISSING))
                .verify();
    }

    @Test
    void validate_TransactionThatCannotOpenIsStoreOutage() {
        when(transactionalOperator.transactional(any(Mono.class)))
                .thenReturn(Mono.error(new CannotCreateTransactionException("Could not open R2DBC Connection")));

        StepVerifier.create(validator.validate(secret, CORRELATION_ID))
                .expectError(StoreUnavailableException.class)
                .verify();

        verifyNoInteractions(apiKeyRepository);
    }

    @Test
    void validate_VerifiesSecretOffTheCallingThread() {
        AtomicReference<String> verifyingThread = new AtomicReference<>();
        ApiKeyCodec recordingCodec = spy(apiKeyCodec);
        doAnswer(invocation -> {
            verifyingThread.set(Thread.currentThread().getName());
            return invocation.callRealMethod();
        }).when(recordingCodec).verifySecret(anyString(), anyString());
        validator = new ApiKeyValidator(apiKeyRepository, recordingCodec, properties, clock, transactionalOperator);
        when(clock.instant()).thenReturn(NOW);
        when(apiKeyRepository.findActiveByKeyPrefixForUpdate(storedKey.getKeyPrefix()))
                .thenReturn(Mono.just(storedKey));
        when(apiKeyRepository.touchLastUsed(storedKey.getId(), NOW)).thenReturn(Mono.just(1));

        StepVerifier.create(validator.validate(secret, CORRELATION_ID))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(verifyingThread.get()).startsWith("boundedElastic");
    }

    @Test
    void validate_UnknownPrefix() {
        when(apiKeyRepository.findActiveByKeyPrefixForUpdate(anyString())).thenReturn(Mono.empty());

        StepVerifier.create(validator.validate("sk_" + "x".repeat(43), CORRELATION_ID))
                .expectErrorSatisfies(error -> assertRejected(error, RejectionReason.NOT_FOUND))
                .verify();
    }

    @Test
    void validate_WrongSecretWithMatchingPrefix() {
        String forged = storedKey.getKeyPrefix() + "A".repeat(40);
        when(apiKeyRepository.findActiveByKeyPrefixForUpdate(storedKey.getKeyPrefix()))
                .thenReturn(Mono.just(storedKey));

        StepVerifier.create(validator.validate(forged, CORRELATION_ID))
                .expectErrorSatisfies(error -> assertRejected(error, RejectionReason.HASH_MISMATCH))
                .verify();

        verify(apiKeyRepository, never()).touchLastUsed(any(UUID.class), any(Instant.class));
    }

    @Test
    void validate_ExpiredKey() {
        storedKey.setExpiresAt(NOW.minusSeconds(1));
        when(clock.instant()).thenReturn(NOW);
        when(apiKeyRepository.findActiveByKeyPrefixForUpdate(storedKey.getKeyPrefix()))
                .thenReturn(Mono.just(storedKey));

        StepVerifier.create(validator.validate(secret, CORRELATION_ID))
                .expectErrorSatisfies(error -> assertRejected(error, RejectionReason.EXPIRED))
                .verify();

        verify(apiKeyRepository, never()).touchLastUsed(any(UUID.class), any(Instant.class));
    }

    @Test
    void validate_KeyExpiringNowIsStillValid() {
        storedKey.setExpiresAt(NOW);
        when(clock.instant()).thenReturn(NOW);
        when(apiKeyRepository.findActiveByKeyPrefixForUpdate(storedKey.getKeyPrefix()))
                .thenReturn(Mono.just(storedKey));
        when(apiKeyRepository.touchLastUsed(storedKey.getId(), NOW)).thenReturn(Mono.just(1));

        StepVerifier.create(validator.validate(secret, CORRELATION_ID))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    void validate_SequentialValidationsAdvanceLastUsed() {
        Instant later = NOW.plusSeconds(30);
        when(clock.instant()).thenReturn(NOW, later);
        when(apiKeyRepository.findActiveByKeyPrefixForUpdate(storedKey.getKeyPrefix()))
                .thenReturn(Mono.just(storedKey));
        when(apiKeyRepository.touchLastUsed(storedKey.getId(), NOW)).thenReturn(Mono.just(1));
        when(apiKeyRepository.touchLastUsed(storedKey.getId(), later)).thenReturn(Mono.just(1));

        StepVerifier.create(validator.validate(secret, CORRELATION_ID))
                .assertNext(key -> assertThat(key.getLastUsedAt()).isEqualTo(NOW))
                .verifyComplete();
        StepVerifier.create(validator.validate(secret, CORRELATION_ID))
                .assertNext(key -> assertThat(key.getLastUsedAt()).isEqualTo(later))
                .verifyComplete();
    }

    @Test
    void validate_StoreOutageIsNotARejection() {
        when(apiKeyRepository.findActiveByKeyPrefixForUpdate(storedKey.getKeyPrefix()))
                .thenReturn(Mono.error(new DataAccessResourceFailureException("connection refused")));

        StepVerifier.create(validator.validate(secret, CORRELATION_ID))
                .expectError(StoreUnavailableException.class)
                .verify();
    }

    @Test
    void validate_SlowStoreTimesOut() {
        properties.setValidationTimeout(Duration.ofMillis(50));
        when(apiKeyRepository.findActiveByKeyPrefixForUpdate(storedKey.getKeyPrefix()))
                .thenReturn(Mono.never());

        StepVerifier.create(validator.validate(secret, CORRELATION_ID))
                .expectError(StoreUnavailableException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void validate_RejectionsShareOneMessage() {
        InvalidApiKeyException missing = new InvalidApiKeyException(RejectionReason.MISSING);
        InvalidApiKeyException expired = new InvalidApiKeyException(RejectionReason.EXPIRED);

        assertThat(missing.getMessage()).isEqualTo(expired.getMessage()).isEqualTo("Invalid API key");
    }

    private static void assertRejected(Throwable error, RejectionReason reason) {
        assertThat(error).isInstanceOf(InvalidApiKeyException.class);
        assertThat(((InvalidApiKeyException) error).getReason()).isEqualTo(reason);
        assertThat(error.getMessage()).isEqualTo(InvalidApiKeyException.MESSAGE);
    }
}

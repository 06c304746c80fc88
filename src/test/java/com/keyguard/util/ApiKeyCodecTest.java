package com.keyguard.util;

import com.keyguard.config.ApiKeyProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ApiKeyCodec.
 */
class ApiKeyCodecTest {

    private ApiKeyProperties properties;
    private ApiKeyCodec codec;

    @BeforeEach
    void setUp() {
        properties = new ApiKeyProperties();
        properties.setBcryptRounds(ApiKeyProperties.BCRYPT_ROUNDS_MIN);
        codec = new ApiKeyCodec(properties);
    }

    @Test
    void generateSecret_HasTagAndEncodedRandomPart() {
        String secret = codec.generateSecret();

        assertThat(secret).startsWith("sk_");
        // 32 random bytes are 43 URL-safe base64 characters without padding
        assertThat(secret).hasSize(3 + 43);
        assertThat(secret.substring(3)).matches("[A-Za-z0-9_-]+");
    }

    @Test
    void generateSecret_IsUniqueAndLongEnough() {
        Set<String> secrets = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            String secret = codec.generateSecret();
            assertThat(secret.length()).isGreaterThanOrEqualTo(properties.getMinLength());
            secrets.add(secret);
        }

        assertThat(secrets).hasSize(10_000);
    }

    @Test
    void hashSecret_VerifiesOnlyOriginalSecret() {
        String secret = codec.generateSecret();
        String hash = codec.hashSecret(secret);

        assertThat(hash).isNotEqualTo(secret).startsWith("$2a$10$");
        assertThat(codec.verifySecret(secret, hash)).isTrue();
        assertThat(codec.verifySecret(secret + "x", hash)).isFalse();
    }

    @Test
    void hashSecret_SaltsEachHash() {
        String secret = codec.generateSecret();

        assertThat(codec.hashSecret(secret)).isNotEqualTo(codec.hashSecret(secret));
    }

    @Test
    void verifySecret_RejectsEmptyInputAndMalformedHash() {
        String secret = codec.generateSecret();

        assertThat(codec.verifySecret(null, codec.hashSecret(secret))).isFalse();
        assertThat(codec.verifySecret("", codec.hashSecret(secret))).isFalse();
        assertThat(codec.verifySecret(secret, null)).isFalse();
        assertThat(codec.verifySecret(secret, "")).isFalse();
        assertThat(codec.verifySecret(secret, "not-a-bcrypt-hash")).isFalse();
    }

    @Test
    void verifySecret_RejectsInputPastBcryptLimit() {
        String secret = "sk_" + "a".repeat(69);
        String hash = codec.hashSecret(secret);

        assertThat(codec.verifySecret(secret, hash)).isTrue();
        assertThat(codec.verifySecret(secret + "attacker-suffix", hash)).isFalse();
        assertThat(codec.verifySecret(secret + "Z", hash)).isFalse();
    }

    @Test
    void constructor_LargestAllowedSettingsFitBcryptLimit() {
        ApiKeyProperties largest = new ApiKeyProperties();
        largest.setBcryptRounds(ApiKeyProperties.BCRYPT_ROUNDS_MIN);
        largest.setTag("a".repeat(ApiKeyProperties.TAG_MAX_LENGTH));
        largest.setSecretBytes(ApiKeyProperties.SECRET_BYTES_MAX);
        ApiKeyCodec largestCodec = new ApiKeyCodec(largest);

        String secret = largestCodec.generateSecret();

        assertThat(secret).hasSize(ApiKeyCodec.BCRYPT_MAX_INPUT_BYTES);
        assertThat(largestCodec.verifySecret(secret, largestCodec.hashSecret(secret))).isTrue();
    }

    @Test
    void constructor_RejectsSecretsLongerThanBcryptReads() {
        ApiKeyProperties oversized = new ApiKeyProperties();
        oversized.setBcryptRounds(ApiKeyProperties.BCRYPT_ROUNDS_MIN);
        oversized.setSecretBytes(64);

        assertThatThrownBy(() -> new ApiKeyCodec(oversized))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("72");
    }

    @Test
    void extractPrefix_TakesFirstTwelveCharacters() {
        assertThat(codec.extractPrefix("sk_abcdefghijklmnop")).isEqualTo("sk_abcdefghi");
        assertThat(codec.extractPrefix("sk_short")).isEqualTo("sk_short");
        assertThat(codec.extractPrefix(null)).isEmpty();
    }
}

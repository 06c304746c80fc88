package com.keyguard.util;

import com.keyguard.config.ApiKeyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generation, hashing and verification of API key secrets.
 */
@Slf4j
@Component
public class ApiKeyCodec {

    /**
     * Length of the non-secret lookup prefix. Matches the key_prefix column width.
     */
    public static final int LOOKUP_PREFIX_LENGTH = 12;

    /**
     * bcrypt ignores input past this many bytes, so longer secrets are never accepted.
     */
    public static final int BCRYPT_MAX_INPUT_BYTES = 72;

    private final SecureRandom secureRandom;
    private final BCryptPasswordEncoder passwordEncoder;
    private final String tag;
    private final int secretBytes;

    public ApiKeyCodec(ApiKeyProperties properties) {
        this.secureRandom = new SecureRandom();
        this.passwordEncoder = new BCryptPasswordEncoder(properties.getBcryptRounds(), secureRandom);
        this.tag = properties.getTag();
        this.secretBytes = properties.getSecretBytes();

        int generatedBytes = tag.getBytes(StandardCharsets.UTF_8).length + encodedLength(secretBytes);
        if (generatedBytes > BCRYPT_MAX_INPUT_BYTES) {
            throw new IllegalArgumentException(String.format(
                    "Generated secrets would be %d bytes, bcrypt reads at most %d",
                    generatedBytes, BCRYPT_MAX_INPUT_BYTES));
        }
    }

    /**
     * Generate a new secret with the configured tag.
     *
     * @return Generated secret (e.g., sk_abc123...)
     */
    public String generateSecret() {
        byte[] randomBytes = new byte[secretBytes];
        secureRandom.nextBytes(randomBytes);
        String encoded = Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
        return tag + encoded;
    }

    /**
     * Hash a secret with bcrypt using the configured cost.
     *
     * @param secret The plaintext secret
     * @return bcrypt hash including its salt
     */
    public String hashSecret(String secret) {
        return passwordEncoder.encode(secret);
    }

    /**
     * Check a plaintext secret against a stored bcrypt hash.
     *
     * @param secret The plaintext secret
     * @param hash The stored hash
     * @return true if the secret matches; always false past 72 bytes
     */
    public boolean verifySecret(String secret, String hash) {
        if (secret == null || secret.isEmpty() || hash == null || hash.isEmpty()) {
            return false;
        }
        if (secret.getBytes(StandardCharsets.UTF_8).length > BCRYPT_MAX_INPUT_BYTES) {
            return false;
        }
        try {
            return passwordEncoder.matches(secret, hash);
        } catch (IllegalArgumentException e) {
            log.warn("Stored key hash is not a valid bcrypt hash");
            return false;
        }
    }

    /**
     * Get the lookup prefix of a secret (first 12 characters).
     *
     * @param secret The plaintext secret
     * @return Lookup prefix, or the whole secret if it is shorter
     */
    public String extractPrefix(String secret) {
        if (secret == null) {
            return "";
        }
        return secret.substring(0, Math.min(LOOKUP_PREFIX_LENGTH, secret.length()));
    }

    private static int encodedLength(int bytes) {
        return (bytes * 4 + 2) / 3;
    }
}

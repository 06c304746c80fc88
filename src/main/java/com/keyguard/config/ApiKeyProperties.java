package com.keyguard.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * API key settings, bound once from {@code keyguard.api-key.*}.
 *
 * Bcrypt cost is bounded to 10..16: lower is too cheap to brute force,
 * higher makes every authenticated request noticeably slower.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "keyguard.api-key")
public class ApiKeyProperties {

    public static final int BCRYPT_ROUNDS_MIN = 10;
    public static final int BCRYPT_ROUNDS_MAX = 16;

    /**
     * Tag and encoded random part together must fit the 72 bytes bcrypt reads.
     */
    public static final int TAG_MAX_LENGTH = 8;
    public static final int SECRET_BYTES_MAX = 48;

    /**
     * Literal tag prepended to every issued secret.
     */
    @NotBlank
    @Size(max = TAG_MAX_LENGTH)
    @Pattern(regexp = "[A-Za-z0-9_-]*")
    private String tag = "sk_";

    /**
     * Random bytes per secret before encoding.
     */
    @Min(32)
    @Max(SECRET_BYTES_MAX)
    private int secretBytes = 32;

    /**
     * Presented secrets shorter than this are rejected before any lookup.
     */
    @Min(12)
    private int minLength = 32;

    @Min(BCRYPT_ROUNDS_MIN)
    @Max(BCRYPT_ROUNDS_MAX)
    private int bcryptRounds = 12;

    /**
     * Shortest prefix accepted by administrative prefix search.
     */
    @Min(1)
    private int minSearchPrefixLength = 4;

    @NotBlank
    private String headerName = "X-API-Key";

    @NotNull
    private Duration validationTimeout = Duration.ofSeconds(5);
}

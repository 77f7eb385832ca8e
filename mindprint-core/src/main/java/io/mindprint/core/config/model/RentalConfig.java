package io.mindprint.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Rental token settings.
 *
 * @param defaultTtlHours lifetime applied when a rental is issued without an explicit TTL;
 *                        {@code null} issues non-expiring tokens
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RentalConfig(
    String namespace,
    int tokenBytes,
    Long defaultTtlHours
) {
    public static final int MIN_TOKEN_BYTES = 16;

    public RentalConfig {
        if (namespace == null || namespace.isBlank()) {
            namespace = "mp";
        }
        if (namespace.contains("@")) {
            throw new IllegalArgumentException("rental namespace must not contain '@'");
        }
        if (tokenBytes < MIN_TOKEN_BYTES) {
            throw new IllegalArgumentException("rental tokenBytes must be >= " + MIN_TOKEN_BYTES);
        }
        if (defaultTtlHours != null && defaultTtlHours < 0) {
            throw new IllegalArgumentException("rental defaultTtlHours must be >= 0");
        }
    }

    public static RentalConfig defaults() {
        return new RentalConfig("mp", 32, 720L);
    }

    public RentalConfig withNamespace(String value) {
        return new RentalConfig(value, tokenBytes, defaultTtlHours);
    }
}

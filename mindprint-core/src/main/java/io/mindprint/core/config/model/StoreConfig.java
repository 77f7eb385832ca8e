package io.mindprint.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreConfig(
    String path,
    long busyTimeoutMillis
) {

    public static StoreConfig defaults() {
        return new StoreConfig("~/.mindprint/mindprint.db", 5000);
    }

    public StoreConfig withPath(String value) {
        return new StoreConfig(value, busyTimeoutMillis);
    }
}

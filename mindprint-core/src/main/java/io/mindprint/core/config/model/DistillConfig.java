package io.mindprint.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DistillConfig(
    int minTokens,
    int maxBulletsPerSection,
    String outputDirName
) {

    public static DistillConfig defaults() {
        return new DistillConfig(4, 10, ".mindprint");
    }
}

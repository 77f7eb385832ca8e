package io.mindprint.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MindprintConfig(
    String userId,
    StoreConfig store,
    RentalConfig rental,
    DistillConfig distill
) {

    public static MindprintConfig defaults() {
        return new MindprintConfig(
            "",
            StoreConfig.defaults(),
            RentalConfig.defaults(),
            DistillConfig.defaults()
        );
    }

    public MindprintConfig withUserId(String value) {
        return new MindprintConfig(value, store, rental, distill);
    }

    public MindprintConfig withStore(StoreConfig value) {
        return new MindprintConfig(userId, value, rental, distill);
    }

    public MindprintConfig withRental(RentalConfig value) {
        return new MindprintConfig(userId, store, value, distill);
    }
}

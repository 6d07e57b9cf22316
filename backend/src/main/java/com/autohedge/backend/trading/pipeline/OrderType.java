package com.autohedge.backend.trading.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum OrderType {
    MARKET,
    LIMIT,
    STOP,
    STOP_LIMIT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Accepts {@code stop_limit}, {@code stop-limit} and {@code stop limit}. */
    public static Optional<OrderType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return Arrays.stream(values()).filter(v -> v.wireName().equals(normalized)).findFirst();
    }
}

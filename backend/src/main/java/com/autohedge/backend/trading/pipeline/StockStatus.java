package com.autohedge.backend.trading.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StockStatus {
    COMPLETED,
    REJECTED_EXHAUSTED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

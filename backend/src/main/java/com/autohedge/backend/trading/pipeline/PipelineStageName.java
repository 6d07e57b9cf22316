package com.autohedge.backend.trading.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PipelineStageName {
    THESIS,
    MARKET_DATA,
    QUANT,
    RISK,
    ORDER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

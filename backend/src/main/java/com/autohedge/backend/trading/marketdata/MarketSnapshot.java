package com.autohedge.backend.trading.marketdata;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record MarketSnapshot(
        String symbol,
        Map<String, Object> quote,
        Map<String, Object> indicators,
        Map<String, Object> fundamentals,
        Instant fetchedAt
) {
    public MarketSnapshot {
        quote = copy(quote);
        indicators = copy(indicators);
        fundamentals = copy(fundamentals);
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}

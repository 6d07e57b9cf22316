package com.autohedge.backend.trading.pipeline;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record QuantAnalysis(
        String stock,
        int thesisAttempt,
        String summary,
        double score,
        Map<String, Object> signals,
        Instant generatedAt
) {
    public QuantAnalysis {
        signals = signals == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(signals));
    }
}

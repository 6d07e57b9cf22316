package com.autohedge.backend.trading.pipeline;

import java.time.Instant;

/**
 * One director answer for a stock. A risk rejection never edits a thesis; the next attempt
 * produces a new one carrying the rejection it answers.
 */
public record Thesis(
        String stock,
        String narrative,
        int attempt,
        String priorRejectionRationale,
        Instant generatedAt
) {}

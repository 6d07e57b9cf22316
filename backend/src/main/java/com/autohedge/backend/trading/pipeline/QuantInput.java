package com.autohedge.backend.trading.pipeline;

import com.autohedge.backend.trading.marketdata.MarketSnapshot;

public record QuantInput(String stock, Thesis thesis, MarketSnapshot snapshot) {}

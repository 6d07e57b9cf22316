package com.autohedge.backend.trading.marketdata;

public class SymbolNotFoundException extends RuntimeException {
    public SymbolNotFoundException(String symbol) {
        super("No market data for symbol " + symbol);
    }
}

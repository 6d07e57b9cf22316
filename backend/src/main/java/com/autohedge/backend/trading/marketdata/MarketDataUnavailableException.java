package com.autohedge.backend.trading.marketdata;

public class MarketDataUnavailableException extends RuntimeException {
    public MarketDataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

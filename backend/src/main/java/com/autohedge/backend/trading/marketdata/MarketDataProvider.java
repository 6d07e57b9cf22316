package com.autohedge.backend.trading.marketdata;

public interface MarketDataProvider {

    /**
     * @throws SymbolNotFoundException        when the provider does not know the symbol
     * @throws MarketDataUnavailableException when the provider cannot be reached
     */
    MarketSnapshot fetch(String symbol);

    default boolean isAvailable() {
        return true;
    }
}

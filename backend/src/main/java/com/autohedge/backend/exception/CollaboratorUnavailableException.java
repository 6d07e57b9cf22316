package com.autohedge.backend.exception;

/**
 * Raised when the reasoning provider or the market data provider cannot be reached
 * before a fund run starts. Fails the whole trade rather than individual stocks.
 */
public class CollaboratorUnavailableException extends RuntimeException {
    public CollaboratorUnavailableException(String message) {
        super(message);
    }
}

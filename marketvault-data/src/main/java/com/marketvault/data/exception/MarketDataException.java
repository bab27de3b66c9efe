package com.marketvault.data.exception;

/**
 * Base type for failures talking to an exchange or fetching market data.
 */
public class MarketDataException extends Exception {

    public MarketDataException(String message) {
        super(message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}

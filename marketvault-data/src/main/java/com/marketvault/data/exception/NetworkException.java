package com.marketvault.data.exception;

/**
 * Transient transport or server-side failure. Safe to retry.
 */
public class NetworkException extends MarketDataException {

    public NetworkException(String message) {
        super(message);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}

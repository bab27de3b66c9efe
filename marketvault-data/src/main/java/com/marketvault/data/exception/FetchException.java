package com.marketvault.data.exception;

import com.marketvault.data.plan.Window;

/**
 * A window could not be fetched, typically after retries were exhausted.
 * Prior on-disk state for the window is left untouched.
 */
public class FetchException extends MarketDataException {

    private final String symbol;
    private final Window window;

    public FetchException(String symbol, Window window, String message, Throwable cause) {
        super("Failed to fetch " + symbol + " " + window + ": " + message, cause);
        this.symbol = symbol;
        this.window = window;
    }

    public String getSymbol() {
        return symbol;
    }

    public Window getWindow() {
        return window;
    }
}

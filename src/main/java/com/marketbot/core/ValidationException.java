package com.marketbot.core;

public class ValidationException extends MarketDataException {
    public ValidationException(String message) {
        super("validation", message);
    }
}

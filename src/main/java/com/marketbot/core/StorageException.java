package com.marketbot.core;

public class StorageException extends MarketDataException {
    public StorageException(String message) {
        super("storage", message);
    }

    public StorageException(String message, Throwable cause) {
        super("storage", message, cause);
    }
}

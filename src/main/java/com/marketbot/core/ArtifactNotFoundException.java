package com.marketbot.core;

public class ArtifactNotFoundException extends MarketDataException {
    public ArtifactNotFoundException(String message) {
        super("lookup", message);
    }
}

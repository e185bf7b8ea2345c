package com.marketbot.session;

public enum SessionPhase {
    PRE,
    OPEN,
    POST
}

package com.hybridsignal.core.model;

/**
 * Coarse trade direction carried by every {@link Signal}.
 */
public enum Direction {

    BUY,
    SELL,
    NEUTRAL;

    public boolean isDirectional() {
        return this != NEUTRAL;
    }
}

package com.hybridsignal.core.model;

/**
 * Ordered seven-step classification of a signal, most bearish first.
 *
 * <p>{@link #direction()} is the coarse BUY / SELL / NEUTRAL projection. The declaration order
 * is significant: {@code compareTo} ranks types from most bearish to most bullish.
 */
public enum SignalType {

    STRONG_SELL(Direction.SELL),
    SELL(Direction.SELL),
    WEAK_SELL(Direction.SELL),
    NEUTRAL(Direction.NEUTRAL),
    WEAK_BUY(Direction.BUY),
    BUY(Direction.BUY),
    STRONG_BUY(Direction.BUY);

    private final Direction direction;

    SignalType(Direction direction) {
        this.direction = direction;
    }

    public Direction direction() {
        return direction;
    }

    public boolean isWeak() {
        return this == WEAK_BUY || this == WEAK_SELL;
    }

    /** Plain (non-strong, non-weak) type for a direction. */
    public static SignalType of(Direction direction) {
        return switch (direction) {
            case BUY  -> BUY;
            case SELL -> SELL;
            default   -> NEUTRAL;
        };
    }

    public static SignalType strong(Direction direction) {
        return switch (direction) {
            case BUY  -> STRONG_BUY;
            case SELL -> STRONG_SELL;
            default   -> NEUTRAL;
        };
    }

    public static SignalType weak(Direction direction) {
        return switch (direction) {
            case BUY  -> WEAK_BUY;
            case SELL -> WEAK_SELL;
            default   -> NEUTRAL;
        };
    }
}

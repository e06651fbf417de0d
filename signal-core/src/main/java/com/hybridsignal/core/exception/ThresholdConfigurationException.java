package com.hybridsignal.core.exception;

/**
 * Raised at threshold load time when a zone set is ambiguous or malformed.
 * Evaluation never raises it; a book that was built successfully is always consistent.
 */
public class ThresholdConfigurationException extends SignalEngineException {

    public ThresholdConfigurationException(String message) {
        super("ThresholdConfig", message);
    }

    public ThresholdConfigurationException(String message, Throwable cause) {
        super("ThresholdConfig", message, cause);
    }
}

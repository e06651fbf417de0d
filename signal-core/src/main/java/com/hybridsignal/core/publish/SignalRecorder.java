package com.hybridsignal.core.publish;

import com.hybridsignal.core.model.Signal;

/**
 * Sink for signals that passed the emission gate, typically a signal history store.
 *
 * <p>Implementations must not block the calling pipeline for long; a slow store should hand
 * the record off asynchronously.
 */
public interface SignalRecorder {

    void recordSignal(Signal signal);
}

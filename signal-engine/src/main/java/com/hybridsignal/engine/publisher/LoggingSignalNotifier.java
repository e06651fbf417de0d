package com.hybridsignal.engine.publisher;

import com.hybridsignal.core.model.Signal;
import com.hybridsignal.core.publish.SignalNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link SignalNotifier}. Chat or e-mail transports are out of scope for the engine;
 * this one renders the message a transport would send and logs it.
 */
public class LoggingSignalNotifier implements SignalNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingSignalNotifier.class);

    @Override
    public void notify(Signal signal) {
        log.info("SIGNAL_NOTIFY {}", render(signal));
    }

    public static String render(Signal signal) {
        return String.format("%s %s [%s] strength=%.2f confidence=%.2f | %s",
            signal.signalType(), signal.instrumentId(), signal.timeframe(),
            signal.strength(), signal.confidence(), signal.rationale());
    }
}

package com.hybridsignal.engine.publisher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hybridsignal.core.model.Signal;
import com.hybridsignal.core.publish.SignalRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link SignalRecorder}: writes the emitted signal as one JSON log line. A history
 * store replaces it by registering its own {@code SignalRecorder} bean.
 */
public class LoggingSignalRecorder implements SignalRecorder {

    private static final Logger log = LoggerFactory.getLogger(LoggingSignalRecorder.class);

    private final ObjectMapper objectMapper;

    public LoggingSignalRecorder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void recordSignal(Signal signal) {
        try {
            log.info("SIGNAL_RECORDED {}", objectMapper.writeValueAsString(signal));
        } catch (JsonProcessingException e) {
            log.warn("SIGNAL_RECORDED instrument={} timeframe={} type={} (json failed: {})",
                     signal.instrumentId(), signal.timeframe(), signal.signalType(), e.getMessage());
        }
    }
}

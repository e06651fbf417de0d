package com.hybridsignal.core.dedup;

import com.hybridsignal.core.exception.SignalEngineException;

/**
 * Signals that the backing {@link DeduplicationStore} could not answer.
 * {@link DeduplicationCache} converts it into its configured fail-open / fail-closed answer.
 */
public class DeduplicationStoreException extends SignalEngineException {

    public DeduplicationStoreException(String message) {
        super("DeduplicationStore", message);
    }

    public DeduplicationStoreException(String message, Throwable cause) {
        super("DeduplicationStore", message, cause);
    }
}

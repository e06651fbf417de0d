package com.hybridsignal.core.publish;

import com.hybridsignal.core.model.Signal;

/**
 * Outbound notification of an emitted signal (chat, e-mail, message bus).
 *
 * <p>Called only after {@link com.hybridsignal.core.dedup.DeduplicationCache} allowed the
 * signal. Transports live outside the core; the engine ships a logging implementation.
 */
public interface SignalNotifier {

    void notify(Signal signal);
}

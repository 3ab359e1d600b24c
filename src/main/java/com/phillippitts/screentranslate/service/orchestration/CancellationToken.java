package com.phillippitts.screentranslate.service.orchestration;

import com.phillippitts.screentranslate.domain.FlowError;
import com.phillippitts.screentranslate.exception.FlowException;

/**
 * Cooperative cancellation flag for one flow. Checked at phase boundaries; running provider
 * calls are not interrupted.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws FlowException with {@link FlowError.Kind#CANCELLED} if the token was cancelled
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new FlowException(FlowError.cancelled());
        }
    }
}

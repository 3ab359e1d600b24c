package com.phillippitts.screentranslate.exception;

import com.phillippitts.screentranslate.domain.FlowError;

import java.util.Objects;

/**
 * Phase-scoped flow failure. Lower-level exceptions are kept as the cause; callers only
 * see the {@link FlowError}.
 */
public class FlowException extends ScreenTranslateException {

    private final FlowError error;

    public FlowException(FlowError error) {
        this(error, null);
    }

    public FlowException(FlowError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error").message(), cause);
        this.error = error;
    }

    public FlowError getError() {
        return error;
    }

    public FlowError.Kind getKind() {
        return error.kind();
    }
}

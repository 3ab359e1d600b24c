package com.phillippitts.screentranslate.exception;

/**
 * Base exception for all application-specific errors.
 */
public class ScreenTranslateException extends RuntimeException {

    public ScreenTranslateException(String message) {
        super(message);
    }

    public ScreenTranslateException(String message, Throwable cause) {
        super(message, cause);
    }

    public ScreenTranslateException(Throwable cause) {
        super(cause);
    }
}

package com.zzf.miku.highlight.error;

/**
 * Base type for every failure raised by the highlight engine.
 * Carries a stable code for programmatic handling and whether the caller can retry or re-plan.
 */
public abstract class HighlightException extends RuntimeException {

    protected HighlightException(String message) {
        super(message);
    }

    protected HighlightException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getCode();

    public abstract boolean isRecoverable();
}

package com.zzf.miku.highlight.error;

public class ReviewSessionNotFoundException extends HighlightException {

    public ReviewSessionNotFoundException(String sessionId) {
        super("Review session not found: " + sessionId);
    }

    @Override
    public String getCode() {
        return "SESSION_NOT_FOUND";
    }

    @Override
    public boolean isRecoverable() {
        return false;
    }
}

package com.zzf.miku.highlight.error;

/**
 * Thrown only by the strict {@code validateTransition} entry points. The plain transition
 * functions return the unchanged state instead.
 */
public class StateTransitionException extends HighlightException {
    private final String currentState;
    private final String event;

    public StateTransitionException(String message, String currentState, String event) {
        super(message);
        this.currentState = currentState;
        this.event = event;
    }

    @Override
    public String getCode() {
        return "STATE_TRANSITION";
    }

    @Override
    public boolean isRecoverable() {
        return false;
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getEvent() {
        return event;
    }
}

package com.zzf.miku.highlight.state;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Externally observable state of a review session.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class HighlightManagerContext {
    private final ManagerState state;
    private final String errorMessage;
    private final boolean processing;
    private final long lastTransitionAt;

    public HighlightManagerContext(ManagerState state, String errorMessage, boolean processing, long lastTransitionAt) {
        this.state = state;
        this.errorMessage = errorMessage;
        this.processing = processing;
        this.lastTransitionAt = lastTransitionAt;
    }

    public static HighlightManagerContext initial() {
        return new HighlightManagerContext(ManagerState.IDLE, null, false, System.currentTimeMillis());
    }

    /**
     * Advances the context by one event. A {@code REVIEW_FAILED} always records its message; any
     * other event clears the message unless the session stays in {@code ERROR}.
     */
    public HighlightManagerContext applyTransition(ManagerEvent event) {
        return applyTransition(event, HighlightManagerStateMachine.transition(state, event));
    }

    public HighlightManagerContext applyTransition(ManagerEvent event, TransitionResult result) {
        String message = errorMessage;
        if (event instanceof ManagerEvent.ReviewFailed failed) {
            message = failed.getError();
        } else if (result.getState() != ManagerState.ERROR) {
            message = null;
        }
        return new HighlightManagerContext(result.getState(), message, result.getState().isBusy(), System.currentTimeMillis());
    }
}

package com.zzf.miku.highlight.state;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Observable lifecycle projection of one suggestion.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SuggestionWithState {
    private final String id;
    private final SuggestionState state;
    private final long stateEnteredAt;
    private final SuggestionState previousState;

    public SuggestionWithState(String id, SuggestionState state, long stateEnteredAt, SuggestionState previousState) {
        this.id = id;
        this.state = state;
        this.stateEnteredAt = stateEnteredAt;
        this.previousState = previousState;
    }

    public static SuggestionWithState create(String id) {
        return new SuggestionWithState(id, SuggestionState.PENDING, System.currentTimeMillis(), null);
    }

    /**
     * @return the advanced projection, or this instance when the event does not apply
     */
    public SuggestionWithState apply(SuggestionEvent event) {
        SuggestionState next = SuggestionStateMachine.transition(state, event);
        if (next == state) {
            return this;
        }
        return new SuggestionWithState(id, next, System.currentTimeMillis(), state);
    }
}

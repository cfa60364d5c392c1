package com.zzf.miku.highlight.state;

import com.zzf.miku.highlight.error.StateTransitionException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pure transition function for a review session. Side effects come back as values in
 * {@link TransitionResult}; nothing here touches the store or the document.
 */
public final class HighlightManagerStateMachine {
    private static final Map<ManagerState, Set<ManagerEvent.Type>> ACCEPTED_EVENTS = new EnumMap<>(ManagerState.class);

    static {
        ACCEPTED_EVENTS.put(ManagerState.IDLE, EnumSet.of(ManagerEvent.Type.REQUEST_REVIEW));
        ACCEPTED_EVENTS.put(ManagerState.REVIEWING, EnumSet.of(
                ManagerEvent.Type.REVIEW_COMPLETE,
                ManagerEvent.Type.REVIEW_FAILED,
                ManagerEvent.Type.CLEAR_ALL));
        ACCEPTED_EVENTS.put(ManagerState.HAS_SUGGESTIONS, EnumSet.of(
                ManagerEvent.Type.ACCEPT_SUGGESTION,
                ManagerEvent.Type.DISMISS_SUGGESTION,
                ManagerEvent.Type.SUGGESTIONS_UPDATED,
                ManagerEvent.Type.CLEAR_ALL,
                ManagerEvent.Type.TEXT_CHANGED,
                ManagerEvent.Type.REQUEST_REVIEW));
        ACCEPTED_EVENTS.put(ManagerState.APPLYING, EnumSet.of(
                ManagerEvent.Type.APPLY_COMPLETE,
                ManagerEvent.Type.REVIEW_FAILED));
        ACCEPTED_EVENTS.put(ManagerState.ERROR, EnumSet.of(
                ManagerEvent.Type.RECOVER,
                ManagerEvent.Type.CLEAR_ALL));
    }

    private HighlightManagerStateMachine() {}

    /**
     * @return the next state and its side effects; an undefined pair yields the current state and none
     */
    public static TransitionResult transition(ManagerState current, ManagerEvent event) {
        if (!canTransition(current, event)) {
            return TransitionResult.of(current);
        }
        switch (current) {
            case IDLE:
                return TransitionResult.of(ManagerState.REVIEWING, SideEffect.startReview());
            case REVIEWING:
                return fromReviewing(event);
            case HAS_SUGGESTIONS:
                return fromHasSuggestions(event);
            case APPLYING:
                return fromApplying(event);
            case ERROR:
                return TransitionResult.of(ManagerState.IDLE, SideEffect.clearAllSuggestions());
            default:
                return TransitionResult.of(current);
        }
    }

    private static TransitionResult fromReviewing(ManagerEvent event) {
        switch (event.getType()) {
            case REVIEW_COMPLETE:
                boolean any = !((ManagerEvent.ReviewComplete) event).getSuggestions().isEmpty();
                return TransitionResult.of(any ? ManagerState.HAS_SUGGESTIONS : ManagerState.IDLE);
            case REVIEW_FAILED:
                return TransitionResult.of(ManagerState.ERROR, SideEffect.logError(((ManagerEvent.ReviewFailed) event).getError()));
            case CLEAR_ALL:
                return TransitionResult.of(ManagerState.IDLE, SideEffect.cancelReview());
            default:
                return TransitionResult.of(ManagerState.REVIEWING);
        }
    }

    private static TransitionResult fromHasSuggestions(ManagerEvent event) {
        switch (event.getType()) {
            case ACCEPT_SUGGESTION:
                return TransitionResult.of(ManagerState.APPLYING,
                        SideEffect.applySuggestion(((ManagerEvent.SuggestionTargeted) event).getId()));
            case DISMISS_SUGGESTION:
                // an empty store is reported separately through SUGGESTIONS_UPDATED
                return TransitionResult.of(ManagerState.HAS_SUGGESTIONS,
                        SideEffect.removeSuggestion(((ManagerEvent.SuggestionTargeted) event).getId()));
            case SUGGESTIONS_UPDATED:
                return TransitionResult.of(remainingState((ManagerEvent.RemainingCount) event));
            case CLEAR_ALL:
                return TransitionResult.of(ManagerState.IDLE, SideEffect.clearAllSuggestions());
            case TEXT_CHANGED:
                ManagerEvent.TextChanged edit = (ManagerEvent.TextChanged) event;
                return TransitionResult.of(ManagerState.HAS_SUGGESTIONS,
                        SideEffect.updatePositions(edit.getEditStart(), edit.getDeleteCount(), edit.getInsertLength()));
            case REQUEST_REVIEW:
                return TransitionResult.of(ManagerState.REVIEWING, SideEffect.clearAllSuggestions(), SideEffect.startReview());
            default:
                return TransitionResult.of(ManagerState.HAS_SUGGESTIONS);
        }
    }

    private static TransitionResult fromApplying(ManagerEvent event) {
        if (event.getType() == ManagerEvent.Type.APPLY_COMPLETE) {
            return TransitionResult.of(remainingState((ManagerEvent.RemainingCount) event));
        }
        return TransitionResult.of(ManagerState.ERROR, SideEffect.logError(((ManagerEvent.ReviewFailed) event).getError()));
    }

    private static ManagerState remainingState(ManagerEvent.RemainingCount event) {
        return event.getRemainingSuggestions() > 0 ? ManagerState.HAS_SUGGESTIONS : ManagerState.IDLE;
    }

    public static ManagerState nextState(ManagerState current, ManagerEvent event) {
        return transition(current, event).getState();
    }

    public static boolean canTransition(ManagerState current, ManagerEvent event) {
        return ACCEPTED_EVENTS.get(current).contains(event.getType());
    }

    /**
     * @throws StateTransitionException when the event is not defined for the state
     */
    public static TransitionResult validateTransition(ManagerState current, ManagerEvent event) {
        if (!canTransition(current, event)) {
            throw new StateTransitionException(
                    "Invalid state transition: cannot apply " + event.getType() + " from " + current,
                    current.name(), event.getType().name());
        }
        return transition(current, event);
    }

    public static List<ManagerEvent.Type> validEvents(ManagerState state) {
        return new ArrayList<>(ACCEPTED_EVENTS.get(state));
    }
}

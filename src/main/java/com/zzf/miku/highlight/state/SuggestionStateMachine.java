package com.zzf.miku.highlight.state;

import com.zzf.miku.highlight.error.StateTransitionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Lifecycle of a single suggestion.
 * <p>
 * {@link #transition} treats an undefined (state, event) pair as a no-op and returns the current
 * state. Callers that want fail-fast behaviour use {@link #validateTransition}.
 */
public final class SuggestionStateMachine {
    private static final Map<SuggestionState, Map<SuggestionEvent, SuggestionState>> TRANSITIONS =
            new EnumMap<>(SuggestionState.class);

    static {
        Map<SuggestionEvent, SuggestionState> pending = on(SuggestionState.PENDING);
        pending.put(SuggestionEvent.REVIEW_COMPLETE, SuggestionState.READY);
        pending.put(SuggestionEvent.USER_DISMISSES, SuggestionState.DISMISSED);

        Map<SuggestionEvent, SuggestionState> ready = on(SuggestionState.READY);
        ready.put(SuggestionEvent.USER_ACTIVATES, SuggestionState.ACTIVE);
        ready.put(SuggestionEvent.TEXT_EDIT, SuggestionState.ADJUSTED);
        ready.put(SuggestionEvent.USER_DISMISSES, SuggestionState.DISMISSED);

        Map<SuggestionEvent, SuggestionState> active = on(SuggestionState.ACTIVE);
        active.put(SuggestionEvent.USER_DEACTIVATES, SuggestionState.INACTIVE);
        active.put(SuggestionEvent.USER_ACCEPTS, SuggestionState.ACCEPTED);
        active.put(SuggestionEvent.USER_DISMISSES, SuggestionState.DISMISSED);
        active.put(SuggestionEvent.TEXT_EDIT, SuggestionState.ADJUSTED);

        Map<SuggestionEvent, SuggestionState> inactive = on(SuggestionState.INACTIVE);
        inactive.put(SuggestionEvent.USER_ACTIVATES, SuggestionState.ACTIVE);
        inactive.put(SuggestionEvent.TEXT_EDIT, SuggestionState.ADJUSTED);
        inactive.put(SuggestionEvent.USER_DISMISSES, SuggestionState.DISMISSED);

        Map<SuggestionEvent, SuggestionState> adjusted = on(SuggestionState.ADJUSTED);
        adjusted.put(SuggestionEvent.VALIDATION_SUCCESS, SuggestionState.VALIDATED);
        adjusted.put(SuggestionEvent.VALIDATION_FAILURE, SuggestionState.INVALIDATED);
        adjusted.put(SuggestionEvent.TEXT_CHANGED_TOO_MUCH, SuggestionState.INVALIDATED);
        adjusted.put(SuggestionEvent.USER_DISMISSES, SuggestionState.DISMISSED);

        Map<SuggestionEvent, SuggestionState> validated = on(SuggestionState.VALIDATED);
        validated.put(SuggestionEvent.USER_ACTIVATES, SuggestionState.ACTIVE);
        validated.put(SuggestionEvent.USER_DEACTIVATES, SuggestionState.INACTIVE);
        validated.put(SuggestionEvent.TEXT_EDIT, SuggestionState.ADJUSTED);
        validated.put(SuggestionEvent.USER_DISMISSES, SuggestionState.DISMISSED);
        validated.put(SuggestionEvent.USER_ACCEPTS, SuggestionState.ACCEPTED);

        on(SuggestionState.ACCEPTED).put(SuggestionEvent.TEXT_APPLIED, SuggestionState.COMPLETED);

        on(SuggestionState.INVALIDATED);
        on(SuggestionState.COMPLETED);
        on(SuggestionState.DISMISSED);
    }

    private SuggestionStateMachine() {}

    private static Map<SuggestionEvent, SuggestionState> on(SuggestionState state) {
        return TRANSITIONS.computeIfAbsent(state, k -> new EnumMap<>(SuggestionEvent.class));
    }

    public static SuggestionState transition(SuggestionState current, SuggestionEvent event) {
        SuggestionState next = TRANSITIONS.get(current).get(event);
        return next == null ? current : next;
    }

    public static boolean canTransition(SuggestionState current, SuggestionEvent event) {
        return TRANSITIONS.get(current).containsKey(event);
    }

    /**
     * @throws StateTransitionException when {@code event} is not defined for {@code current}
     */
    public static SuggestionState validateTransition(SuggestionState current, SuggestionEvent event) {
        if (!canTransition(current, event)) {
            throw new StateTransitionException(
                    "Invalid suggestion transition: cannot apply " + event + " from " + current,
                    current.name(), event.name());
        }
        return transition(current, event);
    }

    public static List<SuggestionEvent> validEvents(SuggestionState state) {
        return new ArrayList<>(TRANSITIONS.get(state).keySet());
    }

    public static Set<SuggestionState> possibleNextStates(SuggestionState state) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(TRANSITIONS.get(state).values()));
    }

    /**
     * Applies the same event to every suggestion; no-ops keep their original instance.
     */
    public static List<SuggestionWithState> transitionAll(List<SuggestionWithState> suggestions, SuggestionEvent event) {
        return suggestions.stream().map(s -> s.apply(event)).collect(Collectors.toList());
    }

    public static List<SuggestionWithState> filterByState(List<SuggestionWithState> suggestions, SuggestionState state) {
        return filter(suggestions, s -> s.getState() == state);
    }

    public static List<SuggestionWithState> filterActive(List<SuggestionWithState> suggestions) {
        return filter(suggestions, s -> s.getState().isActive());
    }

    public static Map<SuggestionState, Long> countByState(List<SuggestionWithState> suggestions) {
        Map<SuggestionState, Long> counts = new LinkedHashMap<>();
        for (SuggestionState state : SuggestionState.values()) {
            counts.put(state, 0L);
        }
        for (SuggestionWithState s : suggestions) {
            counts.merge(s.getState(), 1L, Long::sum);
        }
        return counts;
    }

    private static List<SuggestionWithState> filter(List<SuggestionWithState> suggestions, Predicate<SuggestionWithState> predicate) {
        return suggestions.stream().filter(predicate).collect(Collectors.toList());
    }
}

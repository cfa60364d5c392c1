package com.zzf.miku.highlight.session;

import com.zzf.miku.highlight.SuggestionHighlight;
import com.zzf.miku.highlight.state.SuggestionEvent;
import com.zzf.miku.highlight.state.SuggestionState;
import com.zzf.miku.highlight.state.SuggestionStateMachine;
import com.zzf.miku.highlight.state.SuggestionWithState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-suggestion lifecycle projections for one session, keyed by suggestion id.
 * Entries in terminal states are kept until {@link #clear()} so callers can still see how a suggestion ended.
 */
class SuggestionLifecycleTracker {
    private final Map<String, SuggestionWithState> entries = new LinkedHashMap<>();

    /**
     * Starts tracking suggestions that are new, or that came back after being accepted or dismissed
     * (for example through undo).
     *
     * @param reviewInProgress when false, new entries move straight to READY
     */
    void track(Collection<SuggestionHighlight> present, boolean reviewInProgress) {
        for (SuggestionHighlight s : present) {
            SuggestionWithState current = entries.get(s.getId());
            if (current == null || current.getState() == SuggestionState.COMPLETED
                    || current.getState() == SuggestionState.DISMISSED) {
                SuggestionWithState created = SuggestionWithState.create(s.getId());
                if (!reviewInProgress || current != null) {
                    created = created.apply(SuggestionEvent.REVIEW_COMPLETE);
                }
                entries.put(s.getId(), created);
            }
        }
    }

    SuggestionState apply(String id, SuggestionEvent event) {
        SuggestionWithState current = entries.get(id);
        if (current == null) {
            return null;
        }
        SuggestionWithState next = current.apply(event);
        entries.put(id, next);
        return next.getState();
    }

    void applyAll(SuggestionEvent event) {
        entries.replaceAll((id, s) -> s.apply(event));
    }

    /**
     * Accepting implies focusing, so a suggestion that is only READY is activated first.
     */
    void accept(String id) {
        SuggestionWithState current = entries.get(id);
        if (current == null) {
            return;
        }
        if (!SuggestionStateMachine.canTransition(current.getState(), SuggestionEvent.USER_ACCEPTS)) {
            current = current.apply(SuggestionEvent.USER_ACTIVATES);
        }
        entries.put(id, current.apply(SuggestionEvent.USER_ACCEPTS));
    }

    SuggestionWithState get(String id) {
        return entries.get(id);
    }

    List<SuggestionWithState> getAll() {
        return new ArrayList<>(entries.values());
    }

    void clear() {
        entries.clear();
    }
}

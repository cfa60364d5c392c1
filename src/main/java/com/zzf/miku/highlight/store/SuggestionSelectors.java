package com.zzf.miku.highlight.store;

import com.zzf.miku.highlight.Range;
import com.zzf.miku.highlight.SuggestionHighlight;

import java.util.List;

public final class SuggestionSelectors {

    private SuggestionSelectors() {}

    public static List<SuggestionHighlight> all(SuggestionStoreState state) {
        return state.getHighlights().getAll();
    }

    public static SuggestionHighlight active(SuggestionStoreState state) {
        return state.getActiveId() == null ? null : state.getHighlights().get(state.getActiveId());
    }

    public static SuggestionHighlight byId(SuggestionStoreState state, String id) {
        return state.getHighlights().get(id);
    }

    public static int count(SuggestionStoreState state) {
        return state.getHighlights().size();
    }

    public static boolean has(SuggestionStoreState state, String id) {
        return state.getHighlights().has(id);
    }

    public static SuggestionHighlight atPoint(SuggestionStoreState state, int point) {
        List<SuggestionHighlight> hits = state.getHighlights().queryPoint(point);
        return hits.isEmpty() ? null : hits.get(0);
    }

    public static List<SuggestionHighlight> inRange(SuggestionStoreState state, int start, int end) {
        return state.getHighlights().queryRange(Range.of(start, end));
    }

    public static List<String> rejectedIds(SuggestionStoreState state) {
        return state.getLastRejectedIds();
    }

    public static boolean hasAny(SuggestionStoreState state) {
        return !state.getHighlights().isEmpty();
    }

    public static boolean isActive(SuggestionStoreState state, String id) {
        return id != null && id.equals(state.getActiveId());
    }
}

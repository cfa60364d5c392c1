package com.zzf.miku.highlight.store;

import com.zzf.miku.highlight.RangeIndex;
import com.zzf.miku.highlight.SuggestionHighlight;

import java.util.List;

/**
 * Immutable snapshot of the suggestion store. {@code activeId} is null or names a stored suggestion.
 */
public final class SuggestionStoreState {
    private static final SuggestionStoreState INITIAL = new SuggestionStoreState(RangeIndex.empty(), null, 0, List.of());

    private final RangeIndex<SuggestionHighlight> highlights;
    private final String activeId;
    private final long version;
    private final List<String> lastRejectedIds;

    public SuggestionStoreState(RangeIndex<SuggestionHighlight> highlights, String activeId, long version, List<String> lastRejectedIds) {
        this.highlights = highlights;
        this.activeId = activeId;
        this.version = version;
        this.lastRejectedIds = lastRejectedIds == null ? List.of() : List.copyOf(lastRejectedIds);
    }

    public static SuggestionStoreState initial() {
        return INITIAL;
    }

    public RangeIndex<SuggestionHighlight> getHighlights() {
        return highlights;
    }

    public String getActiveId() {
        return activeId;
    }

    public long getVersion() {
        return version;
    }

    public List<String> getLastRejectedIds() {
        return lastRejectedIds;
    }

    SuggestionStoreState withLastRejectedIds(List<String> rejected) {
        return new SuggestionStoreState(highlights, activeId, version, rejected);
    }

    @Override
    public String toString() {
        return "SuggestionStoreState{size=" + highlights.size() + ", activeId=" + activeId
                + ", version=" + version + ", lastRejectedIds=" + lastRejectedIds + "}";
    }
}

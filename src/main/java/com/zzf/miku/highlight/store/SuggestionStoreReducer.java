package com.zzf.miku.highlight.store;

import com.zzf.miku.highlight.FromArrayResult;
import com.zzf.miku.highlight.OverlapStrategy;
import com.zzf.miku.highlight.RangeIndex;
import com.zzf.miku.highlight.RangeItem;
import com.zzf.miku.highlight.SuggestionHighlight;
import com.zzf.miku.highlight.error.OverlapException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Pure {@code (state, action) -> state} function behind {@link SuggestionStore}.
 * <p>
 * A genuine no-op returns the same state instance; every effective change bumps {@code version} by one.
 * A rejected {@code ADD} records the rejected id but keeps the version.
 */
public final class SuggestionStoreReducer {

    private SuggestionStoreReducer() {}

    public static SuggestionStoreState reduce(SuggestionStoreState state, StoreAction action) {
        switch (action.getType()) {
            case SET_ALL:
                return setAll(state, (StoreAction.SetAll) action);
            case ADD:
                return add(state, (StoreAction.Add) action);
            case REMOVE:
                return remove(state, (StoreAction.Remove) action);
            case REMOVE_ALL:
                return new SuggestionStoreState(RangeIndex.empty(), null, state.getVersion() + 1, List.of());
            case SET_ACTIVE:
                return setActive(state, (StoreAction.SetActive) action);
            case APPLY_EDIT:
                return applyEdit(state, (StoreAction.ApplyEdit) action);
            case UPDATE_HIGHLIGHT:
                return update(state, (StoreAction.UpdateHighlight) action);
            case RESTORE:
                return ((StoreAction.Restore) action).getState();
            default:
                throw new IllegalArgumentException("Unsupported store action: " + action.getType());
        }
    }

    private static SuggestionStoreState setAll(SuggestionStoreState state, StoreAction.SetAll action) {
        FromArrayResult<SuggestionHighlight> result = RangeIndex.fromArray(action.getHighlights(), OverlapStrategy.KEEP_FIRST);
        List<String> rejected = result.getRejected().stream().map(RangeItem::getId).collect(Collectors.toList());
        return new SuggestionStoreState(result.getIndex(), null, state.getVersion() + 1, rejected);
    }

    private static SuggestionStoreState add(SuggestionStoreState state, StoreAction.Add action) {
        SuggestionHighlight highlight = action.getHighlight();
        RangeIndex<SuggestionHighlight> next;
        try {
            next = state.getHighlights().add(highlight);
        } catch (OverlapException | IllegalArgumentException e) {
            return state.withLastRejectedIds(List.of(highlight.getId()));
        }
        return new SuggestionStoreState(next, state.getActiveId(), state.getVersion() + 1, List.of());
    }

    private static SuggestionStoreState remove(SuggestionStoreState state, StoreAction.Remove action) {
        RangeIndex<SuggestionHighlight> next = state.getHighlights().delete(action.getId());
        if (next == state.getHighlights()) {
            return state;
        }
        String activeId = action.getId().equals(state.getActiveId()) ? null : state.getActiveId();
        return new SuggestionStoreState(next, activeId, state.getVersion() + 1, List.of());
    }

    private static SuggestionStoreState setActive(SuggestionStoreState state, StoreAction.SetActive action) {
        String id = action.getId();
        if (id != null && !state.getHighlights().has(id)) {
            return state;
        }
        if (id == null ? state.getActiveId() == null : id.equals(state.getActiveId())) {
            return state;
        }
        return new SuggestionStoreState(state.getHighlights(), id, state.getVersion() + 1, state.getLastRejectedIds());
    }

    private static SuggestionStoreState applyEdit(SuggestionStoreState state, StoreAction.ApplyEdit action) {
        RangeIndex<SuggestionHighlight> next = state.getHighlights()
                .applyEdit(action.getEditStart(), action.getDeleteCount(), action.getInsertLength());
        String activeId = state.getActiveId() != null && next.has(state.getActiveId()) ? state.getActiveId() : null;
        return new SuggestionStoreState(next, activeId, state.getVersion() + 1, List.of());
    }

    private static SuggestionStoreState update(SuggestionStoreState state, StoreAction.UpdateHighlight action) {
        SuggestionHighlight existing = state.getHighlights().get(action.getId());
        if (existing == null) {
            return state;
        }
        HighlightPatch patch = action.getPatch();
        SuggestionHighlight updated = patch.applyTo(existing);
        if (patch.changesRange(existing)) {
            try {
                RangeIndex<SuggestionHighlight> next = state.getHighlights().delete(existing.getId()).add(updated);
                return new SuggestionStoreState(next, state.getActiveId(), state.getVersion() + 1, List.of());
            } catch (OverlapException e) {
                return state;
            }
        }
        List<SuggestionHighlight> all = state.getHighlights().getAll().stream()
                .map(h -> h.getId().equals(existing.getId()) ? updated : h)
                .collect(Collectors.toList());
        RangeIndex<SuggestionHighlight> rebuilt = RangeIndex.fromArray(all, OverlapStrategy.KEEP_FIRST).getIndex();
        return new SuggestionStoreState(rebuilt, state.getActiveId(), state.getVersion() + 1, List.of());
    }
}

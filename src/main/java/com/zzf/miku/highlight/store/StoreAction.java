package com.zzf.miku.highlight.store;

import com.zzf.miku.highlight.SuggestionHighlight;

import java.util.List;
import java.util.Objects;

/**
 * Messages accepted by {@link SuggestionStoreReducer}. Each concrete action is an immutable value.
 */
public abstract class StoreAction {

    public enum Type {
        SET_ALL,
        ADD,
        REMOVE,
        REMOVE_ALL,
        SET_ACTIVE,
        APPLY_EDIT,
        UPDATE_HIGHLIGHT,
        RESTORE
    }

    private StoreAction() {}

    public abstract Type getType();

    public static SetAll setAll(List<SuggestionHighlight> highlights) {
        return new SetAll(highlights);
    }

    public static Add add(SuggestionHighlight highlight) {
        return new Add(highlight);
    }

    public static Remove remove(String id) {
        return new Remove(id);
    }

    public static RemoveAll removeAll() {
        return RemoveAll.INSTANCE;
    }

    public static SetActive setActive(String id) {
        return new SetActive(id);
    }

    public static ApplyEdit applyEdit(int editStart, int deleteCount, int insertLength) {
        return new ApplyEdit(editStart, deleteCount, insertLength);
    }

    public static UpdateHighlight update(String id, HighlightPatch patch) {
        return new UpdateHighlight(id, patch);
    }

    public static Restore restore(SuggestionStoreState state) {
        return new Restore(state);
    }

    public static final class SetAll extends StoreAction {
        private final List<SuggestionHighlight> highlights;

        private SetAll(List<SuggestionHighlight> highlights) {
            this.highlights = highlights == null ? List.of() : List.copyOf(highlights);
        }

        public List<SuggestionHighlight> getHighlights() {
            return highlights;
        }

        @Override
        public Type getType() {
            return Type.SET_ALL;
        }
    }

    public static final class Add extends StoreAction {
        private final SuggestionHighlight highlight;

        private Add(SuggestionHighlight highlight) {
            this.highlight = Objects.requireNonNull(highlight, "highlight");
        }

        public SuggestionHighlight getHighlight() {
            return highlight;
        }

        @Override
        public Type getType() {
            return Type.ADD;
        }
    }

    public static final class Remove extends StoreAction {
        private final String id;

        private Remove(String id) {
            this.id = id;
        }

        public String getId() {
            return id;
        }

        @Override
        public Type getType() {
            return Type.REMOVE;
        }
    }

    public static final class RemoveAll extends StoreAction {
        private static final RemoveAll INSTANCE = new RemoveAll();

        private RemoveAll() {}

        @Override
        public Type getType() {
            return Type.REMOVE_ALL;
        }
    }

    public static final class SetActive extends StoreAction {
        private final String id;

        private SetActive(String id) {
            this.id = id;
        }

        /**
         * @return the suggestion to focus, or null to clear focus
         */
        public String getId() {
            return id;
        }

        @Override
        public Type getType() {
            return Type.SET_ACTIVE;
        }
    }

    public static final class ApplyEdit extends StoreAction {
        private final int editStart;
        private final int deleteCount;
        private final int insertLength;

        private ApplyEdit(int editStart, int deleteCount, int insertLength) {
            if (editStart < 0 || deleteCount < 0 || insertLength < 0) {
                throw new IllegalArgumentException("Edit offsets must be non-negative: start=" + editStart
                        + " delete=" + deleteCount + " insert=" + insertLength);
            }
            this.editStart = editStart;
            this.deleteCount = deleteCount;
            this.insertLength = insertLength;
        }

        public int getEditStart() {
            return editStart;
        }

        public int getDeleteCount() {
            return deleteCount;
        }

        public int getInsertLength() {
            return insertLength;
        }

        @Override
        public Type getType() {
            return Type.APPLY_EDIT;
        }
    }

    public static final class UpdateHighlight extends StoreAction {
        private final String id;
        private final HighlightPatch patch;

        private UpdateHighlight(String id, HighlightPatch patch) {
            this.id = id;
            this.patch = Objects.requireNonNull(patch, "patch");
        }

        public String getId() {
            return id;
        }

        public HighlightPatch getPatch() {
            return patch;
        }

        @Override
        public Type getType() {
            return Type.UPDATE_HIGHLIGHT;
        }
    }

    public static final class Restore extends StoreAction {
        private final SuggestionStoreState state;

        private Restore(SuggestionStoreState state) {
            this.state = Objects.requireNonNull(state, "state");
        }

        public SuggestionStoreState getState() {
            return state;
        }

        @Override
        public Type getType() {
            return Type.RESTORE;
        }
    }

    @Override
    public String toString() {
        return getType().name();
    }
}

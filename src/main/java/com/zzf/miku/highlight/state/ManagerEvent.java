package com.zzf.miku.highlight.state;

import com.zzf.miku.highlight.SuggestionHighlight;

import java.util.List;

/**
 * Session-level events. Payload-carrying events expose their data through typed getters.
 */
public abstract class ManagerEvent {

    public enum Type {
        REQUEST_REVIEW,
        REVIEW_COMPLETE,
        REVIEW_FAILED,
        ACCEPT_SUGGESTION,
        DISMISS_SUGGESTION,
        APPLY_COMPLETE,
        CLEAR_ALL,
        TEXT_CHANGED,
        SUGGESTIONS_UPDATED,
        RECOVER
    }

    private final Type type;

    private ManagerEvent(Type type) {
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return type.name();
    }

    public static ManagerEvent requestReview() {
        return Simple.REQUEST_REVIEW;
    }

    public static ManagerEvent clearAll() {
        return Simple.CLEAR_ALL;
    }

    public static ManagerEvent recover() {
        return Simple.RECOVER;
    }

    public static ReviewComplete reviewComplete(List<SuggestionHighlight> suggestions) {
        return new ReviewComplete(suggestions);
    }

    public static ReviewFailed reviewFailed(String error) {
        return new ReviewFailed(error);
    }

    public static SuggestionTargeted acceptSuggestion(String id) {
        return new SuggestionTargeted(Type.ACCEPT_SUGGESTION, id);
    }

    public static SuggestionTargeted dismissSuggestion(String id) {
        return new SuggestionTargeted(Type.DISMISS_SUGGESTION, id);
    }

    public static RemainingCount applyComplete(int remaining) {
        return new RemainingCount(Type.APPLY_COMPLETE, remaining);
    }

    public static RemainingCount suggestionsUpdated(int remaining) {
        return new RemainingCount(Type.SUGGESTIONS_UPDATED, remaining);
    }

    public static TextChanged textChanged(int editStart, int deleteCount, int insertLength) {
        return new TextChanged(editStart, deleteCount, insertLength);
    }

    static final class Simple extends ManagerEvent {
        static final Simple REQUEST_REVIEW = new Simple(Type.REQUEST_REVIEW);
        static final Simple CLEAR_ALL = new Simple(Type.CLEAR_ALL);
        static final Simple RECOVER = new Simple(Type.RECOVER);

        private Simple(Type type) {
            super(type);
        }
    }

    public static final class ReviewComplete extends ManagerEvent {
        private final List<SuggestionHighlight> suggestions;

        private ReviewComplete(List<SuggestionHighlight> suggestions) {
            super(Type.REVIEW_COMPLETE);
            this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        }

        public List<SuggestionHighlight> getSuggestions() {
            return suggestions;
        }
    }

    public static final class ReviewFailed extends ManagerEvent {
        private final String error;

        private ReviewFailed(String error) {
            super(Type.REVIEW_FAILED);
            this.error = error == null ? "" : error;
        }

        public String getError() {
            return error;
        }
    }

    public static final class SuggestionTargeted extends ManagerEvent {
        private final String id;

        private SuggestionTargeted(Type type, String id) {
            super(type);
            this.id = id;
        }

        public String getId() {
            return id;
        }
    }

    public static final class RemainingCount extends ManagerEvent {
        private final int remainingSuggestions;

        private RemainingCount(Type type, int remainingSuggestions) {
            super(type);
            this.remainingSuggestions = remainingSuggestions;
        }

        public int getRemainingSuggestions() {
            return remainingSuggestions;
        }
    }

    public static final class TextChanged extends ManagerEvent {
        private final int editStart;
        private final int deleteCount;
        private final int insertLength;

        private TextChanged(int editStart, int deleteCount, int insertLength) {
            super(Type.TEXT_CHANGED);
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
    }
}

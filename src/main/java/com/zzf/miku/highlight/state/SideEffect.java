package com.zzf.miku.highlight.state;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Work requested by a manager transition. The machine only describes it; a handler performs it.
 * Fields that do not apply to a type are null or zero.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SideEffect {

    public enum Type {
        START_REVIEW,
        CANCEL_REVIEW,
        APPLY_SUGGESTION,
        REMOVE_SUGGESTION,
        CLEAR_ALL_SUGGESTIONS,
        UPDATE_POSITIONS,
        LOG_ERROR
    }

    private static final SideEffect START_REVIEW = new SideEffect(Type.START_REVIEW, null, null, 0, 0, 0);
    private static final SideEffect CANCEL_REVIEW = new SideEffect(Type.CANCEL_REVIEW, null, null, 0, 0, 0);
    private static final SideEffect CLEAR_ALL_SUGGESTIONS = new SideEffect(Type.CLEAR_ALL_SUGGESTIONS, null, null, 0, 0, 0);

    private final Type type;
    private final String suggestionId;
    private final String error;
    private final int editStart;
    private final int deleteCount;
    private final int insertLength;

    private SideEffect(Type type, String suggestionId, String error, int editStart, int deleteCount, int insertLength) {
        this.type = type;
        this.suggestionId = suggestionId;
        this.error = error;
        this.editStart = editStart;
        this.deleteCount = deleteCount;
        this.insertLength = insertLength;
    }

    public static SideEffect startReview() {
        return START_REVIEW;
    }

    public static SideEffect cancelReview() {
        return CANCEL_REVIEW;
    }

    public static SideEffect clearAllSuggestions() {
        return CLEAR_ALL_SUGGESTIONS;
    }

    public static SideEffect applySuggestion(String id) {
        return new SideEffect(Type.APPLY_SUGGESTION, id, null, 0, 0, 0);
    }

    public static SideEffect removeSuggestion(String id) {
        return new SideEffect(Type.REMOVE_SUGGESTION, id, null, 0, 0, 0);
    }

    public static SideEffect updatePositions(int editStart, int deleteCount, int insertLength) {
        return new SideEffect(Type.UPDATE_POSITIONS, null, null, editStart, deleteCount, insertLength);
    }

    public static SideEffect logError(String error) {
        return new SideEffect(Type.LOG_ERROR, null, error, 0, 0, 0);
    }
}

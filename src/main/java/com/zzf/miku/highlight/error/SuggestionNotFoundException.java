package com.zzf.miku.highlight.error;

public class SuggestionNotFoundException extends HighlightException {
    private final String suggestionId;

    public SuggestionNotFoundException(String suggestionId) {
        super("Suggestion not found: " + suggestionId);
        this.suggestionId = suggestionId;
    }

    @Override
    public String getCode() {
        return "SUGGESTION_NOT_FOUND";
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }

    public String getSuggestionId() {
        return suggestionId;
    }
}

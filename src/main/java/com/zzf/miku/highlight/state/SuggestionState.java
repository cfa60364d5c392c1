package com.zzf.miku.highlight.state;

public enum SuggestionState {
    PENDING("AI is analyzing and generating this suggestion"),
    READY("Suggestion is ready for review"),
    ACTIVE("User is viewing this suggestion"),
    INACTIVE("Suggestion exists but is not currently focused"),
    ADJUSTED("Suggestion positions have been updated after a text edit"),
    VALIDATED("Suggestion is still valid after adjustment"),
    INVALIDATED("Suggestion is no longer valid due to text changes"),
    ACCEPTED("User has accepted this suggestion"),
    COMPLETED("Suggestion has been fully applied to the document"),
    DISMISSED("User has dismissed this suggestion");

    private final String description;

    SuggestionState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == DISMISSED || this == INVALIDATED;
    }

    /**
     * States in which the suggestion is still shown and can be acted on.
     */
    public boolean isActive() {
        return this == READY || this == ACTIVE || this == INACTIVE || this == ADJUSTED || this == VALIDATED;
    }
}

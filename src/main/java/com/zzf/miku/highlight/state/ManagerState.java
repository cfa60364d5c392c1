package com.zzf.miku.highlight.state;

public enum ManagerState {
    IDLE("No active suggestions. Ready to start a review."),
    REVIEWING("AI is analyzing the document and generating suggestions."),
    HAS_SUGGESTIONS("Suggestions are available for review."),
    APPLYING("Applying a suggestion to the document."),
    ERROR("An error occurred. Recovery required.");

    private final String description;

    ManagerState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean canInteract() {
        return this == HAS_SUGGESTIONS;
    }

    public boolean canStartReview() {
        return this == IDLE || this == HAS_SUGGESTIONS;
    }

    public boolean isBusy() {
        return this == REVIEWING || this == APPLYING;
    }

    public boolean isError() {
        return this == ERROR;
    }
}

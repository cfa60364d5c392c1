package com.zzf.miku.highlight.state;

public enum SuggestionEvent {
    REVIEW_COMPLETE("AI has finished generating the suggestion"),
    USER_ACTIVATES("User clicked or focused on the suggestion"),
    USER_DEACTIVATES("User clicked away or unfocused the suggestion"),
    USER_ACCEPTS("User accepted the suggested change"),
    USER_DISMISSES("User rejected the suggestion"),
    TEXT_EDIT("Document text was edited"),
    VALIDATION_SUCCESS("Suggestion text still matches after edit"),
    VALIDATION_FAILURE("Suggestion text no longer matches after edit"),
    TEXT_APPLIED("The suggested text change was applied to the document"),
    TEXT_CHANGED_TOO_MUCH("The text changed too much to keep the suggestion");

    private final String description;

    SuggestionEvent(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}

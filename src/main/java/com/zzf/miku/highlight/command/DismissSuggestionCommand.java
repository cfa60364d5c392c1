package com.zzf.miku.highlight.command;

import com.zzf.miku.highlight.HighlightIds;
import com.zzf.miku.highlight.SuggestionHighlight;
import com.zzf.miku.highlight.store.StoreAction;
import com.zzf.miku.highlight.store.SuggestionStore;
import com.zzf.miku.highlight.store.SuggestionStoreState;

public class DismissSuggestionCommand extends BaseCommand {
    public static final String TYPE = "DISMISS_SUGGESTION";

    private final SuggestionHighlight suggestion;
    private final SuggestionStore store;
    private final SuggestionStoreState previousState;
    private final String description;

    public DismissSuggestionCommand(SuggestionHighlight suggestion, SuggestionStore store) {
        super(HighlightIds.commandId());
        this.suggestion = suggestion;
        this.store = store;
        this.previousState = store.getState();
        this.description = "Dismiss suggestion: \"" + truncate(suggestion.getOriginalText(), 40) + "\"";
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public void execute() {
        store.dispatch(StoreAction.remove(suggestion.getId()));
    }

    @Override
    public void undo() {
        store.dispatch(StoreAction.restore(previousState));
    }

    public SuggestionHighlight getSuggestion() {
        return suggestion;
    }
}

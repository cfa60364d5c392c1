package com.zzf.miku.highlight.command;

import com.zzf.miku.highlight.HighlightIds;
import com.zzf.miku.highlight.store.StoreAction;
import com.zzf.miku.highlight.store.SuggestionStore;
import com.zzf.miku.highlight.store.SuggestionStoreState;

public class DismissAllSuggestionsCommand extends BaseCommand {
    public static final String TYPE = "DISMISS_ALL_SUGGESTIONS";

    private final SuggestionStore store;
    private final SuggestionStoreState previousState;
    private final int suggestionCount;

    public DismissAllSuggestionsCommand(SuggestionStore store) {
        super(HighlightIds.commandId());
        this.store = store;
        this.previousState = store.getState();
        this.suggestionCount = previousState.getHighlights().size();
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public String getDescription() {
        return "Dismiss all " + suggestionCount + " suggestion" + (suggestionCount == 1 ? "" : "s");
    }

    @Override
    public void execute() {
        store.dispatch(StoreAction.removeAll());
    }

    @Override
    public void undo() {
        store.dispatch(StoreAction.restore(previousState));
    }

    public int getSuggestionCount() {
        return suggestionCount;
    }
}

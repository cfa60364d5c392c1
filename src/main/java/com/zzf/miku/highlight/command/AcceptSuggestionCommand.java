package com.zzf.miku.highlight.command;

import com.zzf.miku.highlight.HighlightIds;
import com.zzf.miku.highlight.SuggestionHighlight;
import com.zzf.miku.highlight.error.DocumentException;
import com.zzf.miku.highlight.store.StoreAction;
import com.zzf.miku.highlight.store.SuggestionStore;
import com.zzf.miku.highlight.store.SuggestionStoreState;
import com.zzf.miku.highlight.text.DocumentAccessor;

/**
 * Replaces a suggestion's original text with its revision and drops the suggestion.
 * <p>
 * The document is re-read on every execute and undo. If the text has moved since the suggestion
 * was recorded it is relocated with {@link TextLocator}; if it is gone, a {@link DocumentException}
 * is thrown and nothing changes. Undo restores the exact store snapshot taken when the command was
 * built, not a recomputed one.
 */
public class AcceptSuggestionCommand extends BaseCommand {
    public static final String TYPE = "ACCEPT_SUGGESTION";

    private final String suggestionId;
    private final String originalText;
    private final String revisedText;
    private final SuggestionStoreState previousState;
    private final DocumentAccessor document;
    private final SuggestionStore store;
    private final int searchWindow;
    private final String description;
    private int position;

    public AcceptSuggestionCommand(SuggestionHighlight suggestion, DocumentAccessor document, SuggestionStore store) {
        this(suggestion, document, store, store.getState(), TextLocator.DEFAULT_SEARCH_WINDOW);
    }

    public AcceptSuggestionCommand(SuggestionHighlight suggestion, DocumentAccessor document, SuggestionStore store,
                                   SuggestionStoreState previousState, int searchWindow) {
        super(HighlightIds.commandId());
        this.suggestionId = suggestion.getId();
        this.originalText = suggestion.getOriginalText();
        this.revisedText = suggestion.getSuggestedRevision();
        this.position = suggestion.getRange().getStart();
        this.previousState = previousState;
        this.document = document;
        this.store = store;
        this.searchWindow = searchWindow;
        this.description = "Accept suggestion: \"" + truncate(originalText, 30) + "\" -> \"" + truncate(revisedText, 30) + "\"";
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
        String doc = document.getDocument();
        int at = TextLocator.find(doc, originalText, position, searchWindow);
        if (at == -1) {
            throw new DocumentException("Cannot accept suggestion: original text \""
                    + truncate(originalText, 20) + "\" not found at expected position");
        }
        position = at;

        document.updateDocument(doc.substring(0, at) + revisedText + doc.substring(at + originalText.length()));
        store.dispatch(StoreAction.remove(suggestionId));
        if (revisedText.length() != originalText.length()) {
            store.dispatch(StoreAction.applyEdit(at, originalText.length(), revisedText.length()));
        }
    }

    @Override
    public void undo() {
        String doc = document.getDocument();
        int at = TextLocator.find(doc, revisedText, position, searchWindow);
        if (at == -1) {
            throw new DocumentException("Cannot undo: revised text \"" + truncate(revisedText, 20) + "\" not found");
        }
        document.updateDocument(doc.substring(0, at) + originalText + doc.substring(at + revisedText.length()));
        store.dispatch(StoreAction.restore(previousState));
    }

    public String getSuggestionId() {
        return suggestionId;
    }

    public String getOriginalText() {
        return originalText;
    }

    public String getRevisedText() {
        return revisedText;
    }

    public int getPosition() {
        return position;
    }
}

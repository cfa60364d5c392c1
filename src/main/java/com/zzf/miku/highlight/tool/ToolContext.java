package com.zzf.miku.highlight.tool;

import com.zzf.miku.highlight.store.SuggestionStoreState;

/**
 * Snapshot handed to a tool: the document, the store state and an optional abort signal.
 */
public final class ToolContext {
    private final DocumentContext document;
    private final SuggestionStoreState store;
    private final AbortSignal abortSignal;

    public ToolContext(DocumentContext document, SuggestionStoreState store, AbortSignal abortSignal) {
        this.document = document;
        this.store = store == null ? SuggestionStoreState.initial() : store;
        this.abortSignal = abortSignal;
    }

    public static ToolContext of(String content, SuggestionStoreState store) {
        return new ToolContext(DocumentContext.of(content), store, null);
    }

    public static ToolContext of(String content, SuggestionStoreState store, AbortSignal abortSignal) {
        return new ToolContext(DocumentContext.of(content), store, abortSignal);
    }

    public DocumentContext getDocument() {
        return document;
    }

    public SuggestionStoreState getStore() {
        return store;
    }

    public AbortSignal getAbortSignal() {
        return abortSignal;
    }

    public boolean isAborted() {
        return abortSignal != null && abortSignal.isAborted();
    }
}

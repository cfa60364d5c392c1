package com.zzf.miku.highlight.store;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Mutable holder around {@link SuggestionStoreReducer} with subscribe/notify.
 * Listeners only hear about dispatches that produced a new state instance.
 */
@Slf4j
public class SuggestionStore {
    private final List<Consumer<SuggestionStoreState>> listeners = new CopyOnWriteArrayList<>();
    private volatile SuggestionStoreState state;
    private volatile boolean debugLogging;

    public SuggestionStore() {
        this(SuggestionStoreState.initial());
    }

    public SuggestionStore(SuggestionStoreState initialState) {
        this.state = initialState == null ? SuggestionStoreState.initial() : initialState;
    }

    public SuggestionStoreState getState() {
        return state;
    }

    public void setDebugLogging(boolean debugLogging) {
        this.debugLogging = debugLogging;
    }

    /**
     * @return the state after the action
     */
    public SuggestionStoreState dispatch(StoreAction action) {
        SuggestionStoreState before = state;
        SuggestionStoreState after = SuggestionStoreReducer.reduce(before, action);
        if (debugLogging) {
            log.debug("store.dispatch action={} version={}->{} size={} rejected={}",
                    action, before.getVersion(), after.getVersion(), after.getHighlights().size(), after.getLastRejectedIds());
        }
        if (after == before) {
            return after;
        }
        state = after;
        for (Consumer<SuggestionStoreState> listener : listeners) {
            try {
                listener.accept(after);
            } catch (RuntimeException e) {
                log.warn("store.listener.failed action={} err={}", action, e.getMessage(), e);
            }
        }
        return after;
    }

    /**
     * @return a handle that removes the listener when run
     */
    public Runnable subscribe(Consumer<SuggestionStoreState> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public SuggestionStoreState snapshot() {
        return state;
    }

    public void restore(SuggestionStoreState snapshot) {
        dispatch(StoreAction.restore(snapshot));
    }

    public int listenerCount() {
        return listeners.size();
    }
}

package com.zzf.miku.highlight.store;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.zzf.miku.highlight.SuggestionFixtures.suggestion;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class SuggestionStoreTest {

    @Test
    void listenersHearOnlyEffectiveChanges() {
        SuggestionStore store = new SuggestionStore();
        List<Long> versions = new ArrayList<>();
        store.subscribe(state -> versions.add(state.getVersion()));

        store.dispatch(StoreAction.add(suggestion("a", 0, 5)));
        store.dispatch(StoreAction.remove("missing"));
        store.dispatch(StoreAction.remove("a"));

        assertEquals(List.of(1L, 2L), versions);
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        SuggestionStore store = new SuggestionStore();
        List<String> seen = new ArrayList<>();
        store.subscribe(state -> {
            throw new IllegalStateException("boom");
        });
        store.subscribe(state -> seen.add("second"));

        store.dispatch(StoreAction.add(suggestion("a", 0, 5)));

        assertEquals(List.of("second"), seen);
    }

    @Test
    void unsubscribeAndRestore() {
        SuggestionStore store = new SuggestionStore();
        Runnable unsubscribe = store.subscribe(state -> { });
        assertEquals(1, store.listenerCount());
        unsubscribe.run();
        assertEquals(0, store.listenerCount());

        store.dispatch(StoreAction.add(suggestion("a", 0, 5)));
        SuggestionStoreState snapshot = store.snapshot();
        store.dispatch(StoreAction.removeAll());
        store.restore(snapshot);
        assertSame(snapshot, store.getState());
    }
}

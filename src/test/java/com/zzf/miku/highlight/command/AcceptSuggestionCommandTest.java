package com.zzf.miku.highlight.command;

import com.zzf.miku.highlight.Range;
import com.zzf.miku.highlight.error.DocumentException;
import com.zzf.miku.highlight.store.StoreAction;
import com.zzf.miku.highlight.store.SuggestionStore;
import com.zzf.miku.highlight.store.SuggestionStoreState;
import com.zzf.miku.highlight.text.InMemoryDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.zzf.miku.highlight.SuggestionFixtures.suggestion;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AcceptSuggestionCommandTest {

    private InMemoryDocument document;
    private SuggestionStore store;

    @BeforeEach
    void setUp() {
        document = new InMemoryDocument("The quick brown fox.");
        store = new SuggestionStore();
    }

    @Test
    void acceptThenUndoRestoresDocumentAndStore() {
        store.dispatch(StoreAction.setAll(List.of(suggestion("s1", 4, "quick", "swift"))));
        SuggestionStoreState before = store.getState();

        AcceptSuggestionCommand command = new AcceptSuggestionCommand(
                store.getState().getHighlights().get("s1"), document, store);
        command.execute();

        assertEquals("The swift brown fox.", document.getDocument());
        assertTrue(store.getState().getHighlights().isEmpty());

        command.undo();

        assertEquals("The quick brown fox.", document.getDocument());
        assertEquals(before.getHighlights().getAll(), store.getState().getHighlights().getAll());
    }

    @Test
    void lengthChangeShiftsLaterSuggestions() {
        store.dispatch(StoreAction.setAll(List.of(
                suggestion("s1", 4, "quick", "fast"),
                suggestion("s2", 16, "fox", "cat"))));

        new AcceptSuggestionCommand(store.getState().getHighlights().get("s1"), document, store).execute();

        assertEquals("The fast brown fox.", document.getDocument());
        assertEquals(Range.of(15, 18), store.getState().getHighlights().get("s2").getRange());
    }

    @Test
    void relocatesTextThatMoved() {
        store.dispatch(StoreAction.setAll(List.of(suggestion("s1", 4, "quick", "swift"))));
        AcceptSuggestionCommand command = new AcceptSuggestionCommand(
                store.getState().getHighlights().get("s1"), document, store);
        document.updateDocument("Oh, the quick brown fox.");

        command.execute();

        assertEquals("Oh, the swift brown fox.", document.getDocument());
        assertEquals(8, command.getPosition());
    }

    @Test
    void undoFindsRevisionAfterDocumentShrankPastSearchWindow() {
        String prefix = "x".repeat(3000);
        document.updateDocument(prefix + "The quick brown fox.");
        store.dispatch(StoreAction.setAll(List.of(suggestion("s1", 3004, "quick", "swift"))));
        AcceptSuggestionCommand command = new AcceptSuggestionCommand(
                store.getState().getHighlights().get("s1"), document, store);
        command.execute();

        document.updateDocument("The swift brown fox.");
        command.undo();

        assertEquals("The quick brown fox.", document.getDocument());
    }

    @Test
    void missingTextLeavesEverythingUntouched() {
        store.dispatch(StoreAction.setAll(List.of(suggestion("s1", 4, "quick", "swift"))));
        AcceptSuggestionCommand command = new AcceptSuggestionCommand(
                store.getState().getHighlights().get("s1"), document, store);
        document.updateDocument("The slow brown fox.");

        DocumentException e = assertThrows(DocumentException.class, command::execute);

        assertTrue(e.getMessage().contains("not found"));
        assertEquals("The slow brown fox.", document.getDocument());
        assertFalse(store.getState().getHighlights().isEmpty());
    }

    @Test
    void descriptionTruncatesLongText() {
        String original = "a".repeat(40);
        document.updateDocument(original);
        AcceptSuggestionCommand command = new AcceptSuggestionCommand(
                suggestion("s1", 0, original, "b"), document, store);

        assertEquals("Accept suggestion: \"" + "a".repeat(27) + "...\" -> \"b\"", command.getDescription());
        assertEquals(AcceptSuggestionCommand.TYPE, command.getType());
    }
}

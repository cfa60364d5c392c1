package com.zzf.miku.highlight.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.miku.highlight.PositionedSuggestion;
import com.zzf.miku.highlight.Range;
import com.zzf.miku.highlight.error.SuggestionNotFoundException;
import com.zzf.miku.highlight.state.HighlightManagerContext;
import com.zzf.miku.highlight.state.ManagerState;
import com.zzf.miku.highlight.state.SuggestionState;
import com.zzf.miku.highlight.text.InMemoryDocument;
import com.zzf.miku.highlight.text.TextEdit;
import com.zzf.miku.highlight.tool.FinishReviewTool;
import com.zzf.miku.highlight.tool.HighlightTextTool;
import com.zzf.miku.highlight.tool.ToolCall;
import com.zzf.miku.highlight.tool.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.zzf.miku.highlight.SuggestionFixtures.suggestion;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ReviewSessionTest {

    private static final String DOC = "The quick brown fox.\nSecond line.";

    private final ObjectMapper mapper = new ObjectMapper();
    private InMemoryDocument document;
    private ReviewSession session;

    @BeforeEach
    void setUp() {
        document = new InMemoryDocument(DOC);
        session = new ReviewSession("review-1", document, ToolRegistry.createDefault());
    }

    private ToolCall highlight(String id, int line, int start, int end, String original, String revision) {
        ObjectNode args = mapper.createObjectNode()
                .put("line_number", line)
                .put("start_column", start)
                .put("end_column", end)
                .put("original_text", original)
                .put("suggestion_type", "economy")
                .put("observation", "could be tighter")
                .put("suggested_revision", revision);
        return new ToolCall(id, HighlightTextTool.NAME, args);
    }

    private ToolCall finish() {
        return new ToolCall("done", FinishReviewTool.NAME, mapper.createObjectNode());
    }

    private void reviewWithQuickAndFox() {
        session.requestReview();
        session.setReviewResults(List.of(
                suggestion("quick", 4, "quick", "swift"),
                suggestion("fox", 16, "fox", "cat")));
    }

    @Test
    void toolCallsProduceSuggestionsAndFinishCompletesReview() {
        assertTrue(session.requestReview());
        assertEquals(ManagerState.REVIEWING, session.getContext().getState());

        ToolBatchOutcome outcome = session.runToolCalls(List.of(
                highlight("c1", 1, 4, 9, "quick", "swift"),
                highlight("c2", 1, 6, 12, "ick br", "x"),
                finish())).join();

        assertEquals(3, outcome.getStats().getTotal());
        assertEquals(1, outcome.getRejectedIds().size());
        assertEquals(1, session.getStore().getState().getHighlights().size());
        assertEquals(ManagerState.HAS_SUGGESTIONS, session.getContext().getState());

        PositionedSuggestion positioned = session.positionedSuggestions().get(0);
        assertEquals(1, positioned.getLineNumber());
        assertEquals(5, positioned.getColumnNumber());
        assertEquals(SuggestionState.READY, session.lifecycleOf(positioned.getSuggestion().getId()).getState());
    }

    @Test
    void suggestionCapRejectsExtraHighlights() {
        session = new ReviewSession("review-2", document, ToolRegistry.createDefault(),
                ReviewSessionSettings.builder().maxSuggestions(1).build(), new DefaultSideEffectHandler());
        session.requestReview();

        ToolBatchOutcome outcome = session.runToolCalls(List.of(
                highlight("c1", 1, 4, 9, "quick", "swift"),
                highlight("c2", 2, 0, 6, "Second", "Next"))).join();

        assertEquals(1, session.getStore().getState().getHighlights().size());
        assertEquals(1, outcome.getRejectedIds().size());
        assertEquals(2, outcome.getStats().getSuccessful());
    }

    @Test
    void reviewWithNoSuggestionsReturnsToIdle() {
        session.requestReview();
        session.runToolCalls(List.of(finish())).join();

        assertEquals(ManagerState.IDLE, session.getContext().getState());
    }

    @Test
    void acceptAppliesRevisionAndUndoRestores() {
        reviewWithQuickAndFox();

        assertTrue(session.acceptSuggestion("quick"));

        assertEquals("The swift brown fox.\nSecond line.", session.getDocument());
        assertEquals(SuggestionState.COMPLETED, session.lifecycleOf("quick").getState());
        assertEquals(ManagerState.HAS_SUGGESTIONS, session.getContext().getState());

        assertTrue(session.undo());
        assertEquals(DOC, session.getDocument());
        assertEquals(2, session.getStore().getState().getHighlights().size());
        assertEquals(SuggestionState.READY, session.lifecycleOf("quick").getState());

        assertTrue(session.redo());
        assertEquals("The swift brown fox.\nSecond line.", session.getDocument());
    }

    @Test
    void acceptingLastSuggestionGoesIdle() {
        session.requestReview();
        session.setReviewResults(List.of(suggestion("quick", 4, "quick", "swift")));

        session.acceptSuggestion("quick");

        assertEquals(ManagerState.IDLE, session.getContext().getState());
    }

    @Test
    void acceptFailureMovesToErrorAndRecovers() {
        reviewWithQuickAndFox();
        document.updateDocument("Something else entirely.");

        assertFalse(session.acceptSuggestion("quick"));

        HighlightManagerContext context = session.getContext();
        assertEquals(ManagerState.ERROR, context.getState());
        assertNotNull(context.getErrorMessage());
        assertEquals("Something else entirely.", session.getDocument());

        session.recover();
        assertEquals(ManagerState.IDLE, session.getContext().getState());
        assertNull(session.getContext().getErrorMessage());
        assertTrue(session.getStore().getState().getHighlights().isEmpty());
    }

    @Test
    void unknownSuggestionIsReported() {
        reviewWithQuickAndFox();

        assertThrows(SuggestionNotFoundException.class, () -> session.acceptSuggestion("nope"));
        assertThrows(SuggestionNotFoundException.class, () -> session.dismissSuggestion("nope"));
    }

    @Test
    void dismissAndDismissAll() {
        reviewWithQuickAndFox();

        session.dismissSuggestion("quick");
        assertEquals(SuggestionState.DISMISSED, session.lifecycleOf("quick").getState());
        assertEquals(ManagerState.HAS_SUGGESTIONS, session.getContext().getState());

        assertTrue(session.dismissAllSuggestions());
        assertEquals(ManagerState.IDLE, session.getContext().getState());
        assertFalse(session.dismissAllSuggestions());

        session.undo();
        assertEquals(List.of("fox"), session.getStore().getState().getHighlights().getIds());
    }

    @Test
    void activationFollowsLifecycle() {
        reviewWithQuickAndFox();

        session.setActiveSuggestion("fox");
        assertEquals(SuggestionState.ACTIVE, session.lifecycleOf("fox").getState());
        assertEquals("fox", session.activeSuggestion().getSuggestion().getId());

        session.setActiveSuggestion("quick");
        assertEquals(SuggestionState.INACTIVE, session.lifecycleOf("fox").getState());

        session.setActiveSuggestion(null);
        assertNull(session.activeSuggestion());
        assertEquals("fox", session.suggestionAt(17).getId());
    }

    @Test
    void editsShiftAndRevalidateSuggestions() {
        reviewWithQuickAndFox();

        session.applyTextEdit(new TextEdit(10, 5, "red"));

        assertEquals("The quick red fox.\nSecond line.", session.getDocument());
        assertEquals(Range.of(14, 17), session.getStore().getState().getHighlights().get("fox").getRange());
        assertEquals(SuggestionState.VALIDATED, session.lifecycleOf("fox").getState());
        assertEquals(SuggestionState.VALIDATED, session.lifecycleOf("quick").getState());
    }

    @Test
    void editPastTheEndChangesNothing() {
        reviewWithQuickAndFox();
        String before = session.getDocument();

        assertThrows(IllegalArgumentException.class, () -> session.applyTextEdit(new TextEdit(30, 10, "")));

        assertEquals(before, session.getDocument());
        assertEquals(Range.of(16, 19), session.getStore().getState().getHighlights().get("fox").getRange());
    }

    @Test
    void editInsideSuggestionInvalidatesIt() {
        reviewWithQuickAndFox();

        session.applyTextEdit(new TextEdit(5, 2, "ee"));

        assertFalse(session.getStore().getState().getHighlights().has("quick"));
        assertEquals(SuggestionState.INVALIDATED, session.lifecycleOf("quick").getState());
        assertEquals(ManagerState.HAS_SUGGESTIONS, session.getContext().getState());
    }

    @Test
    void deletingSuggestionTextDropsIt() {
        reviewWithQuickAndFox();

        TextEdit edit = session.replaceDocument("The fox.\nSecond line.");

        assertEquals(new TextEdit(4, 12, ""), edit);
        assertFalse(session.getStore().getState().getHighlights().has("quick"));
        assertEquals(SuggestionState.INVALIDATED, session.lifecycleOf("quick").getState());
        assertEquals(Range.of(4, 7), session.getStore().getState().getHighlights().get("fox").getRange());
        assertNull(session.replaceDocument("The fox.\nSecond line."));
    }

    @Test
    void mismatchIsKeptWhenInvalidationDisabled() {
        session = new ReviewSession("review-3", document, ToolRegistry.createDefault(),
                ReviewSessionSettings.builder().invalidateOnMismatch(false).build(), new DefaultSideEffectHandler());
        reviewWithQuickAndFox();

        session.applyTextEdit(new TextEdit(5, 2, "ee"));

        assertTrue(session.getStore().getState().getHighlights().has("quick"));
        assertEquals(SuggestionState.INVALIDATED, session.lifecycleOf("quick").getState());
    }

    @Test
    void reReviewClearsAndTriggers() {
        ReviewTrigger trigger = mock(ReviewTrigger.class);
        session = new ReviewSession("review-4", document, ToolRegistry.createDefault(),
                ReviewSessionSettings.defaults(), new DefaultSideEffectHandler(trigger));
        List<ManagerState> states = new ArrayList<>();
        session.onContextChange(c -> states.add(c.getState()));
        reviewWithQuickAndFox();

        session.requestReview();

        assertTrue(session.getStore().getState().getHighlights().isEmpty());
        assertEquals(List.of(ManagerState.REVIEWING, ManagerState.HAS_SUGGESTIONS, ManagerState.REVIEWING), states);
        verify(trigger, times(2)).startReview(any(ReviewSession.class));

        session.clearAll();
        verify(trigger).cancelReview(session);
        assertEquals(ManagerState.IDLE, session.getContext().getState());
    }

    @Test
    void undoDisabledDoesNothing() {
        session = new ReviewSession("review-5", document, ToolRegistry.createDefault(),
                ReviewSessionSettings.builder().undoRedoEnabled(false).build(), new DefaultSideEffectHandler());
        reviewWithQuickAndFox();
        session.dismissSuggestion("quick");

        assertFalse(session.undo());
        assertEquals(0, session.getUndoManager().getUndoStackSize());
    }
}

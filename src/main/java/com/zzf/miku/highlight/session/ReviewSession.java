package com.zzf.miku.highlight.session;

import com.zzf.miku.highlight.PositionedSuggestion;
import com.zzf.miku.highlight.Range;
import com.zzf.miku.highlight.SuggestionHighlight;
import com.zzf.miku.highlight.command.AcceptSuggestionCommand;
import com.zzf.miku.highlight.command.Command;
import com.zzf.miku.highlight.command.DismissAllSuggestionsCommand;
import com.zzf.miku.highlight.command.DismissSuggestionCommand;
import com.zzf.miku.highlight.command.UndoManager;
import com.zzf.miku.highlight.error.SuggestionNotFoundException;
import com.zzf.miku.highlight.state.HighlightManagerContext;
import com.zzf.miku.highlight.state.HighlightManagerStateMachine;
import com.zzf.miku.highlight.state.ManagerEvent;
import com.zzf.miku.highlight.state.ManagerState;
import com.zzf.miku.highlight.state.SideEffect;
import com.zzf.miku.highlight.state.SuggestionEvent;
import com.zzf.miku.highlight.state.SuggestionState;
import com.zzf.miku.highlight.state.SuggestionWithState;
import com.zzf.miku.highlight.state.TransitionResult;
import com.zzf.miku.highlight.store.StoreAction;
import com.zzf.miku.highlight.store.SuggestionSelectors;
import com.zzf.miku.highlight.store.SuggestionStore;
import com.zzf.miku.highlight.store.SuggestionStoreState;
import com.zzf.miku.highlight.text.DocumentAccessor;
import com.zzf.miku.highlight.text.LineColumn;
import com.zzf.miku.highlight.text.LineMap;
import com.zzf.miku.highlight.text.TextEdit;
import com.zzf.miku.highlight.tool.AbortSignal;
import com.zzf.miku.highlight.tool.BatchResultStats;
import com.zzf.miku.highlight.tool.FinishReviewTool;
import com.zzf.miku.highlight.tool.HighlightTextTool;
import com.zzf.miku.highlight.tool.ToolCall;
import com.zzf.miku.highlight.tool.ToolCallResult;
import com.zzf.miku.highlight.tool.ToolContext;
import com.zzf.miku.highlight.tool.ToolExecutor;
import com.zzf.miku.highlight.tool.ToolExecutorOptions;
import com.zzf.miku.highlight.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * One document under review: the suggestion store, the manager state machine, undo history and the
 * per-suggestion lifecycle, wired together.
 * <p>
 * Public operations are serialized on the session. The document is always read through the
 * {@link DocumentAccessor} at the moment it is needed. Tool calls run through the session's
 * {@link ToolExecutor} and each result is applied as soon as it completes, so later calls in a
 * sequential batch see the highlights of earlier ones.
 */
@Slf4j
public class ReviewSession {
    private final String id;
    private final long createdAt;
    private final DocumentAccessor document;
    private final SuggestionStore store;
    private final UndoManager undoManager;
    private final ReviewSessionSettings settings;
    private final SideEffectHandler sideEffectHandler;
    private final ToolExecutor toolExecutor;
    private final SuggestionLifecycleTracker lifecycle = new SuggestionLifecycleTracker();
    private final List<Consumer<HighlightManagerContext>> contextListeners = new CopyOnWriteArrayList<>();

    private volatile HighlightManagerContext context = HighlightManagerContext.initial();
    private volatile AbortSignal abortSignal = new AbortSignal();

    public ReviewSession(String id, DocumentAccessor document, ToolRegistry registry) {
        this(id, document, registry, ReviewSessionSettings.defaults(), new DefaultSideEffectHandler());
    }

    public ReviewSession(String id, DocumentAccessor document, ToolRegistry registry,
                         ReviewSessionSettings settings, SideEffectHandler sideEffectHandler) {
        this.id = id;
        this.createdAt = System.currentTimeMillis();
        this.document = document;
        this.settings = settings == null ? ReviewSessionSettings.defaults() : settings;
        this.sideEffectHandler = sideEffectHandler == null ? new DefaultSideEffectHandler() : sideEffectHandler;
        this.store = new SuggestionStore();
        this.store.setDebugLogging(this.settings.isDebugLogging());
        this.undoManager = new UndoManager(this.settings.getUndoMaxSize());
        this.store.subscribe(state -> lifecycle.track(state.getHighlights().getAll(),
                context.getState() == ManagerState.REVIEWING));

        ToolExecutorOptions configured = this.settings.getExecutorOptions();
        ToolExecutorOptions options = configured.toBuilder()
                .onToolExecuted(result -> {
                    applyToolResult(result);
                    configured.getOnToolExecuted().accept(result);
                })
                .build();
        this.toolExecutor = new ToolExecutor(registry, this::toolContext, options);
    }

    private ToolContext toolContext() {
        return ToolContext.of(document.getDocument(), store.getState(), abortSignal);
    }

    // ---- review lifecycle ----

    /**
     * @return true when the session moved to REVIEWING
     */
    public synchronized boolean requestReview() {
        abortSignal = new AbortSignal();
        return dispatchManager(ManagerEvent.requestReview()) == ManagerState.REVIEWING;
    }

    /**
     * Replaces all suggestions with a finished review's results and completes the review.
     *
     * @return ids the store rejected because they overlapped earlier ones
     */
    public synchronized List<String> setReviewResults(List<SuggestionHighlight> suggestions) {
        SuggestionStoreState state = store.dispatch(StoreAction.setAll(suggestions));
        completeReview();
        return state.getLastRejectedIds();
    }

    public synchronized void setReviewError(String error) {
        dispatchManager(ManagerEvent.reviewFailed(error));
    }

    /**
     * Runs a sequential batch through the session's executor.
     */
    public CompletableFuture<ToolBatchOutcome> runToolCalls(List<ToolCall> calls) {
        return toolExecutor.executeBatch(calls).thenApply(this::outcome);
    }

    /**
     * Runs read-only calls concurrently.
     *
     * @throws IllegalArgumentException when a call names an unknown or mutating tool
     */
    public CompletableFuture<ToolBatchOutcome> runReadOnlyToolCalls(List<ToolCall> calls) {
        return toolExecutor.executeParallel(calls).thenApply(this::outcome);
    }

    private ToolBatchOutcome outcome(Map<String, ToolCallResult> results) {
        SuggestionStoreState state = store.getState();
        List<String> rejected = new ArrayList<>();
        for (ToolCallResult r : BatchResultStats.successful(results)) {
            if (r.getResult().getValue() instanceof SuggestionHighlight highlight
                    && !state.getHighlights().has(highlight.getId())) {
                rejected.add(highlight.getId());
            }
        }
        return new ToolBatchOutcome(results, BatchResultStats.of(results), rejected);
    }

    /**
     * Applies results produced elsewhere, in order.
     *
     * @return ids of highlights that were not added
     */
    public synchronized List<String> applyToolResults(Collection<ToolCallResult> results) {
        List<String> rejected = new ArrayList<>();
        for (ToolCallResult r : results) {
            String rejectedId = applyToolResult(r);
            if (rejectedId != null) {
                rejected.add(rejectedId);
            }
        }
        return rejected;
    }

    /**
     * @return the id of a highlight that could not be added, otherwise null
     */
    synchronized String applyToolResult(ToolCallResult result) {
        if (result.getResult().isFailure()) {
            return null;
        }
        Object value = result.getResult().getValue();
        if (HighlightTextTool.NAME.equals(result.getToolName()) && value instanceof SuggestionHighlight highlight) {
            if (store.getState().getHighlights().size() >= settings.getMaxSuggestions()) {
                log.info("session.suggestion.capped sessionId={} id={} max={}", id, highlight.getId(), settings.getMaxSuggestions());
                return highlight.getId();
            }
            SuggestionStoreState state = store.dispatch(StoreAction.add(highlight));
            return state.getHighlights().has(highlight.getId()) ? null : highlight.getId();
        }
        if (FinishReviewTool.NAME.equals(result.getToolName())) {
            completeReview();
        }
        return null;
    }

    private void completeReview() {
        lifecycle.applyAll(SuggestionEvent.REVIEW_COMPLETE);
        dispatchManager(ManagerEvent.reviewComplete(SuggestionSelectors.all(store.getState())));
    }

    // ---- user actions ----

    /**
     * Applies a suggestion's revision to the document through the undo history. A failure while
     * applying is recorded as the session error and moves the manager to ERROR.
     *
     * @return true when the revision was applied
     * @throws SuggestionNotFoundException when no suggestion has this id
     */
    public synchronized boolean acceptSuggestion(String suggestionId) {
        SuggestionStoreState before = store.getState();
        SuggestionHighlight suggestion = SuggestionSelectors.byId(before, suggestionId);
        if (suggestion == null) {
            throw new SuggestionNotFoundException(suggestionId);
        }
        dispatchManager(ManagerEvent.acceptSuggestion(suggestionId));
        lifecycle.accept(suggestionId);
        try {
            run(new AcceptSuggestionCommand(suggestion, document, store, before, settings.getSearchWindow()));
        } catch (RuntimeException e) {
            log.warn("session.accept.failed sessionId={} suggestionId={} err={}", id, suggestionId, e.getMessage());
            dispatchManager(ManagerEvent.reviewFailed(e.getMessage()));
            return false;
        }
        lifecycle.apply(suggestionId, SuggestionEvent.TEXT_APPLIED);
        dispatchManager(ManagerEvent.applyComplete(SuggestionSelectors.count(store.getState())));
        return true;
    }

    /**
     * @throws SuggestionNotFoundException when no suggestion has this id
     */
    public synchronized void dismissSuggestion(String suggestionId) {
        SuggestionHighlight suggestion = SuggestionSelectors.byId(store.getState(), suggestionId);
        if (suggestion == null) {
            throw new SuggestionNotFoundException(suggestionId);
        }
        run(new DismissSuggestionCommand(suggestion, store));
        lifecycle.apply(suggestionId, SuggestionEvent.USER_DISMISSES);
        dispatchManager(ManagerEvent.suggestionsUpdated(SuggestionSelectors.count(store.getState())));
    }

    /**
     * @return false when there was nothing to dismiss
     */
    public synchronized boolean dismissAllSuggestions() {
        if (!SuggestionSelectors.hasAny(store.getState())) {
            return false;
        }
        run(new DismissAllSuggestionsCommand(store));
        lifecycle.applyAll(SuggestionEvent.USER_DISMISSES);
        dispatchManager(ManagerEvent.clearAll());
        return true;
    }

    /**
     * Focuses a suggestion, or clears the focus with {@code null}. Unknown ids are ignored.
     */
    public synchronized void setActiveSuggestion(String suggestionId) {
        String previous = store.getState().getActiveId();
        SuggestionStoreState state = store.dispatch(StoreAction.setActive(suggestionId));
        String current = state.getActiveId();
        if (previous != null && !previous.equals(current)) {
            lifecycle.apply(previous, SuggestionEvent.USER_DEACTIVATES);
        }
        if (current != null && !current.equals(previous)) {
            lifecycle.apply(current, SuggestionEvent.USER_ACTIVATES);
        }
    }

    public SuggestionHighlight suggestionAt(int offset) {
        return SuggestionSelectors.atPoint(store.getState(), offset);
    }

    public synchronized void clearAll() {
        store.dispatch(StoreAction.removeAll());
        dispatchManager(ManagerEvent.clearAll());
        undoManager.clear();
        lifecycle.clear();
    }

    public synchronized void recover() {
        dispatchManager(ManagerEvent.recover());
    }

    public synchronized boolean undo() {
        if (!settings.isUndoRedoEnabled()) {
            return false;
        }
        boolean done = undoManager.undo();
        if (done) {
            dispatchManager(ManagerEvent.suggestionsUpdated(SuggestionSelectors.count(store.getState())));
        }
        return done;
    }

    public synchronized boolean redo() {
        if (!settings.isUndoRedoEnabled()) {
            return false;
        }
        boolean done = undoManager.redo();
        if (done) {
            dispatchManager(ManagerEvent.suggestionsUpdated(SuggestionSelectors.count(store.getState())));
        }
        return done;
    }

    private void run(Command command) {
        if (settings.isUndoRedoEnabled()) {
            undoManager.execute(command);
        } else {
            command.execute();
        }
    }

    // ---- document edits ----

    /**
     * Applies an edit to the document and then re-anchors the suggestions.
     */
    public synchronized void applyTextEdit(TextEdit edit) {
        document.updateDocument(edit.applyTo(document.getDocument()));
        handleTextChange(edit.getOffset(), edit.getDeleteCount(), edit.getInsertLength());
    }

    /**
     * Replaces the whole document, treating the difference as a single edit.
     *
     * @return the derived edit, or null when the text did not change
     */
    public synchronized TextEdit replaceDocument(String newContent) {
        TextEdit edit = TextEdit.compute(document.getDocument(), newContent);
        if (edit != null) {
            applyTextEdit(edit);
        }
        return edit;
    }

    /**
     * Re-anchors suggestions after the document was edited elsewhere; the document must already hold
     * the edited text. Surviving suggestions are checked against the live text and, when
     * {@code invalidateOnMismatch} is set, removed if their original text is gone.
     */
    public synchronized void handleTextChange(int editStart, int deleteCount, int insertLength) {
        Set<String> before = new HashSet<>(store.getState().getHighlights().getIds());
        SuggestionStoreState state = store.dispatch(StoreAction.applyEdit(editStart, deleteCount, insertLength));
        dispatchManager(ManagerEvent.textChanged(editStart, deleteCount, insertLength));

        for (String goneId : before) {
            if (!state.getHighlights().has(goneId)) {
                lifecycle.apply(goneId, SuggestionEvent.TEXT_EDIT);
                lifecycle.apply(goneId, SuggestionEvent.TEXT_CHANGED_TOO_MUCH);
            }
        }

        String text = document.getDocument();
        List<String> invalid = new ArrayList<>();
        for (SuggestionHighlight s : state.getHighlights().getAll()) {
            if (lifecycle.apply(s.getId(), SuggestionEvent.TEXT_EDIT) != SuggestionState.ADJUSTED) {
                continue;
            }
            if (stillMatches(s, text)) {
                lifecycle.apply(s.getId(), SuggestionEvent.VALIDATION_SUCCESS);
            } else {
                lifecycle.apply(s.getId(), SuggestionEvent.VALIDATION_FAILURE);
                invalid.add(s.getId());
            }
        }
        if (settings.isInvalidateOnMismatch()) {
            for (String invalidId : invalid) {
                store.dispatch(StoreAction.remove(invalidId));
            }
            if (!invalid.isEmpty()) {
                log.info("session.suggestions.invalidated sessionId={} ids={}", id, invalid);
            }
        }
        dispatchManager(ManagerEvent.suggestionsUpdated(SuggestionSelectors.count(store.getState())));
    }

    private static boolean stillMatches(SuggestionHighlight s, String text) {
        String original = s.getOriginalText();
        if (original == null || original.isEmpty()) {
            return true;
        }
        Range r = s.getRange();
        return r.getEnd() <= text.length() && text.substring(r.getStart(), r.getEnd()).equals(original);
    }

    // ---- manager plumbing ----

    private ManagerState dispatchManager(ManagerEvent event) {
        HighlightManagerContext previous = context;
        TransitionResult result = HighlightManagerStateMachine.transition(previous.getState(), event);
        HighlightManagerContext next = previous.applyTransition(event, result);
        if (settings.isDebugLogging()) {
            log.debug("manager.transition sessionId={} event={} state={}->{} effects={}",
                    id, event.getType(), previous.getState(), next.getState(), result.getSideEffects());
        }
        context = next;
        for (SideEffect effect : result.getSideEffects()) {
            sideEffectHandler.handle(effect, this);
        }
        if (previous.getState() != next.getState() || !Objects.equals(previous.getErrorMessage(), next.getErrorMessage())) {
            for (Consumer<HighlightManagerContext> listener : contextListeners) {
                try {
                    listener.accept(next);
                } catch (RuntimeException e) {
                    log.warn("session.listener.failed sessionId={} err={}", id, e.getMessage(), e);
                }
            }
        }
        return next.getState();
    }

    /**
     * Aborts tool calls that have not been dispatched yet.
     */
    public void abortPendingTools(String reason) {
        abortSignal.abort(reason);
    }

    /**
     * @return a handle that removes the listener when run
     */
    public Runnable onContextChange(Consumer<HighlightManagerContext> listener) {
        contextListeners.add(listener);
        return () -> contextListeners.remove(listener);
    }

    public Runnable onStoreChange(Consumer<SuggestionStoreState> listener) {
        return store.subscribe(listener);
    }

    // ---- views ----

    public List<PositionedSuggestion> positionedSuggestions() {
        List<SuggestionHighlight> all = SuggestionSelectors.all(store.getState());
        if (all.isEmpty()) {
            return List.of();
        }
        LineMap lineMap = new LineMap(document.getDocument());
        List<PositionedSuggestion> out = new ArrayList<>(all.size());
        for (SuggestionHighlight s : all) {
            out.add(position(s, lineMap));
        }
        return out;
    }

    public PositionedSuggestion activeSuggestion() {
        SuggestionHighlight active = SuggestionSelectors.active(store.getState());
        return active == null ? null : position(active, new LineMap(document.getDocument()));
    }

    private static PositionedSuggestion position(SuggestionHighlight s, LineMap lineMap) {
        LineColumn at = lineMap.offsetToLineColumn(s.getRange().getStart());
        return new PositionedSuggestion(s, at.getLine(), at.getColumn());
    }

    public SuggestionWithState lifecycleOf(String suggestionId) {
        return lifecycle.get(suggestionId);
    }

    public List<SuggestionWithState> lifecycles() {
        return lifecycle.getAll();
    }

    public String getId() {
        return id;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public String getDocument() {
        return document.getDocument();
    }

    public SuggestionStore getStore() {
        return store;
    }

    public UndoManager getUndoManager() {
        return undoManager;
    }

    public ToolExecutor getToolExecutor() {
        return toolExecutor;
    }

    public HighlightManagerContext getContext() {
        return context;
    }

    public ReviewSessionSettings getSettings() {
        return settings;
    }
}

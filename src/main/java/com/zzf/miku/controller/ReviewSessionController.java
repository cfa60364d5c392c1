package com.zzf.miku.controller;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.zzf.miku.api.FeatureDisabledException;
import com.zzf.miku.config.HighlightFeatureFlags;
import com.zzf.miku.highlight.session.ReviewSession;
import com.zzf.miku.highlight.session.ToolBatchOutcome;
import com.zzf.miku.highlight.state.HighlightManagerContext;
import com.zzf.miku.highlight.store.SuggestionStoreState;
import com.zzf.miku.highlight.text.TextEdit;
import com.zzf.miku.highlight.tool.ToolCall;
import com.zzf.miku.highlight.tool.ToolRegistry;
import com.zzf.miku.service.ReviewSessionRegistry;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/review")
@RequiredArgsConstructor
public class ReviewSessionController {
    private final ReviewSessionRegistry sessions;
    private final ToolRegistry toolRegistry;
    private final HighlightFeatureFlags featureFlags;

    @Data
    public static class CreateSessionRequest {
        private String content;
    }

    @Data
    public static class ToolCallsRequest {
        private List<ToolCall> calls = new ArrayList<>();
        /** Run concurrently; only read-only tools are accepted. */
        private boolean parallel;
    }

    @Data
    public static class EditRequest {
        private int offset;
        private int deleteCount;
        private String insertText = "";
    }

    @Data
    public static class DocumentRequest {
        private String content;
    }

    @Data
    public static class ReviewErrorRequest {
        private String error;
    }

    @Data
    public static class FlagRequest {
        /** null clears the override. */
        private Boolean enabled;
    }

    @GetMapping("/tools")
    public ArrayNode tools() {
        return toolRegistry.toProviderFormat();
    }

    @GetMapping("/flags")
    public Map<String, Object> flags() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("enabled", featureFlags.isEnabled());
        response.put("override", featureFlags.getOverride());
        return response;
    }

    @PutMapping("/flags")
    public Map<String, Object> updateFlags(@RequestBody FlagRequest request) {
        featureFlags.setOverride(request.getEnabled());
        return flags();
    }

    @PostMapping("/sessions")
    public Map<String, Object> create(@RequestBody(required = false) CreateSessionRequest request) {
        requireEnabled();
        ReviewSession session = sessions.create(request == null ? "" : request.getContent());
        return view(session);
    }

    @GetMapping("/sessions/{sessionId}")
    public Map<String, Object> get(@PathVariable String sessionId) {
        requireEnabled();
        return view(sessions.get(sessionId));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public Map<String, Object> delete(@PathVariable String sessionId) {
        requireEnabled();
        sessions.get(sessionId);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("sessionId", sessionId);
        response.put("removed", sessions.remove(sessionId));
        return response;
    }

    @PostMapping("/sessions/{sessionId}/review")
    public Map<String, Object> requestReview(@PathVariable String sessionId) {
        ReviewSession session = session(sessionId);
        boolean started = session.requestReview();
        Map<String, Object> response = view(session);
        response.put("started", started);
        return response;
    }

    @PostMapping("/sessions/{sessionId}/review/error")
    public Map<String, Object> reviewError(@PathVariable String sessionId, @RequestBody ReviewErrorRequest request) {
        ReviewSession session = session(sessionId);
        session.setReviewError(request.getError());
        return view(session);
    }

    @PostMapping("/sessions/{sessionId}/tool-calls")
    public Map<String, Object> toolCalls(@PathVariable String sessionId, @RequestBody ToolCallsRequest request) {
        ReviewSession session = session(sessionId);
        List<ToolCall> calls = request.getCalls() == null ? List.of() : request.getCalls();
        log.info("review.tool_calls sessionId={} count={} parallel={}", sessionId, calls.size(), request.isParallel());
        ToolBatchOutcome outcome = request.isParallel()
                ? session.runReadOnlyToolCalls(calls).join()
                : session.runToolCalls(calls).join();
        Map<String, Object> response = view(session);
        response.put("results", new ArrayList<>(outcome.getResults().values()));
        response.put("stats", outcome.getStats());
        response.put("rejectedIds", outcome.getRejectedIds());
        return response;
    }

    @PostMapping("/sessions/{sessionId}/suggestions/{suggestionId}/accept")
    public Map<String, Object> accept(@PathVariable String sessionId, @PathVariable String suggestionId) {
        ReviewSession session = session(sessionId);
        boolean applied = session.acceptSuggestion(suggestionId);
        Map<String, Object> response = view(session);
        response.put("applied", applied);
        return response;
    }

    @PostMapping("/sessions/{sessionId}/suggestions/{suggestionId}/dismiss")
    public Map<String, Object> dismiss(@PathVariable String sessionId, @PathVariable String suggestionId) {
        ReviewSession session = session(sessionId);
        session.dismissSuggestion(suggestionId);
        return view(session);
    }

    @PostMapping("/sessions/{sessionId}/suggestions/{suggestionId}/activate")
    public Map<String, Object> activate(@PathVariable String sessionId, @PathVariable String suggestionId) {
        ReviewSession session = session(sessionId);
        session.setActiveSuggestion(suggestionId);
        return view(session);
    }

    @DeleteMapping("/sessions/{sessionId}/active")
    public Map<String, Object> deactivate(@PathVariable String sessionId) {
        ReviewSession session = session(sessionId);
        session.setActiveSuggestion(null);
        return view(session);
    }

    @PostMapping("/sessions/{sessionId}/suggestions/dismiss-all")
    public Map<String, Object> dismissAll(@PathVariable String sessionId) {
        ReviewSession session = session(sessionId);
        boolean dismissed = session.dismissAllSuggestions();
        Map<String, Object> response = view(session);
        response.put("dismissed", dismissed);
        return response;
    }

    @GetMapping("/sessions/{sessionId}/suggestions/at")
    public Map<String, Object> suggestionAt(@PathVariable String sessionId, @RequestParam int offset) {
        ReviewSession session = session(sessionId);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("offset", offset);
        response.put("suggestion", session.suggestionAt(offset));
        return response;
    }

    @PostMapping("/sessions/{sessionId}/undo")
    public Map<String, Object> undo(@PathVariable String sessionId) {
        ReviewSession session = session(sessionId);
        boolean done = session.undo();
        Map<String, Object> response = view(session);
        response.put("undone", done);
        return response;
    }

    @PostMapping("/sessions/{sessionId}/redo")
    public Map<String, Object> redo(@PathVariable String sessionId) {
        ReviewSession session = session(sessionId);
        boolean done = session.redo();
        Map<String, Object> response = view(session);
        response.put("redone", done);
        return response;
    }

    @PostMapping("/sessions/{sessionId}/recover")
    public Map<String, Object> recover(@PathVariable String sessionId) {
        ReviewSession session = session(sessionId);
        session.recover();
        return view(session);
    }

    @PostMapping("/sessions/{sessionId}/clear")
    public Map<String, Object> clear(@PathVariable String sessionId) {
        ReviewSession session = session(sessionId);
        session.clearAll();
        return view(session);
    }

    @PostMapping("/sessions/{sessionId}/edits")
    public Map<String, Object> edit(@PathVariable String sessionId, @RequestBody EditRequest request) {
        ReviewSession session = session(sessionId);
        String insert = request.getInsertText() == null ? "" : request.getInsertText();
        session.applyTextEdit(new TextEdit(request.getOffset(), request.getDeleteCount(), insert));
        return view(session);
    }

    @PutMapping("/sessions/{sessionId}/document")
    public Map<String, Object> replaceDocument(@PathVariable String sessionId, @RequestBody DocumentRequest request) {
        ReviewSession session = session(sessionId);
        TextEdit edit = session.replaceDocument(request.getContent() == null ? "" : request.getContent());
        Map<String, Object> response = view(session);
        response.put("edit", edit);
        return response;
    }

    private ReviewSession session(String sessionId) {
        requireEnabled();
        return sessions.get(sessionId);
    }

    private void requireEnabled() {
        if (!featureFlags.isEnabled()) {
            throw new FeatureDisabledException("Review engine is disabled");
        }
    }

    private static Map<String, Object> view(ReviewSession session) {
        HighlightManagerContext context = session.getContext();
        SuggestionStoreState store = session.getStore().getState();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("sessionId", session.getId());
        response.put("state", context.getState());
        response.put("error", context.getErrorMessage());
        response.put("busy", context.getState().isBusy());
        response.put("canInteract", context.getState().canInteract());
        response.put("document", session.getDocument());
        response.put("version", store.getVersion());
        response.put("suggestionCount", store.getHighlights().size());
        response.put("suggestions", session.positionedSuggestions());
        response.put("activeSuggestion", session.activeSuggestion());
        response.put("lastRejectedIds", store.getLastRejectedIds());
        response.put("undo", session.getUndoManager().getState());
        response.put("lifecycle", session.lifecycles());
        return response;
    }
}

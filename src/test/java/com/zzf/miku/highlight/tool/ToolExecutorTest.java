package com.zzf.miku.highlight.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.miku.highlight.error.ToolExecutionException;
import com.zzf.miku.highlight.store.SuggestionStoreState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolExecutorTest {

    private static final String DOC = "The quick brown fox.\nSecond line.";

    private final ObjectMapper mapper = new ObjectMapper();
    private ToolRegistry registry;
    private ToolExecutor executor;
    private AbortSignal signal;

    /** Test double whose behaviour is fixed at construction. */
    private static final class StubTool implements ToolDefinition<JsonNode, String> {
        private final String name;
        private final ToolAccess access;
        private final CompletableFuture<ToolResult<String>> outcome;

        StubTool(String name, ToolAccess access, CompletableFuture<ToolResult<String>> outcome) {
            this.name = name;
            this.access = access;
            this.outcome = outcome;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getDescription() {
            return "stub";
        }

        @Override
        public ObjectNode getParametersSchema() {
            return SchemaBuilder.object().build();
        }

        @Override
        public ToolAccess getAccess() {
            return access;
        }

        @Override
        public Optional<JsonNode> parse(JsonNode arguments) {
            return Optional.of(arguments);
        }

        @Override
        public CompletableFuture<ToolResult<String>> execute(JsonNode params, ToolContext context) {
            return outcome;
        }
    }

    @BeforeEach
    void setUp() {
        registry = ToolRegistry.createDefault();
        signal = new AbortSignal();
        executor = new ToolExecutor(registry, () -> ToolContext.of(DOC, SuggestionStoreState.initial(), signal));
    }

    private ToolCall call(String id, String name, ObjectNode args) {
        return new ToolCall(id, name, args);
    }

    private ToolCall lineCall(String id, int line) {
        return call(id, GetLineContentTool.NAME, mapper.createObjectNode().put("line_number", line));
    }

    @Test
    void runsTool() {
        ToolCallResult result = executor.execute(lineCall("c1", 2)).join();

        assertEquals("c1", result.getCallId());
        assertEquals(GetLineContentTool.NAME, result.getToolName());
        assertTrue(result.getResult().isSuccess());
        assertInstanceOf(LineContent.class, result.getResult().getValue());
        assertTrue(result.getDurationMs() >= 0);
    }

    @Test
    void unknownToolListsAvailableTools() {
        ToolResult<?> result = executor.execute(call("c1", "nope", mapper.createObjectNode())).join().getResult();

        assertEquals(ToolErrorCode.UNKNOWN_TOOL, result.getCode());
        assertFalse(result.isRecoverable());
        assertEquals("Unknown tool: nope. Available tools: highlight_text, get_line_content, get_document_stats, finish_review",
                result.getError());
    }

    @Test
    void invalidParamsAreRecoverable() {
        ToolResult<?> result = executor.execute(call("c1", GetLineContentTool.NAME, mapper.createObjectNode())).join().getResult();

        assertEquals(ToolErrorCode.INVALID_PARAMS, result.getCode());
        assertTrue(result.isRecoverable());
        assertEquals("Invalid parameters for tool \"get_line_content\": {}", result.getError());
    }

    @Test
    void abortedSignalStopsDispatch() {
        signal.abort("user cancelled");

        ToolResult<?> result = executor.execute(lineCall("c1", 1)).join().getResult();

        assertEquals(ToolErrorCode.ABORTED, result.getCode());
        assertFalse(result.isRecoverable());
    }

    @Test
    void neverCompletingToolTimesOut() {
        registry.register(new StubTool("hang", ToolAccess.READ_ONLY, new CompletableFuture<>()));
        executor.setOptions(ToolExecutorOptions.builder().timeoutMs(50).build());

        ToolResult<?> result = executor.execute(call("c1", "hang", mapper.createObjectNode())).join().getResult();

        assertEquals(ToolErrorCode.TIMEOUT, result.getCode());
        assertTrue(result.isRecoverable());
        assertEquals("Tool execution timed out after 50ms", result.getError());
    }

    @Test
    void thrownErrorBecomesExecutionError() {
        registry.register(new StubTool("boom", ToolAccess.READ_ONLY,
                CompletableFuture.failedFuture(new IllegalStateException("disk on fire"))));

        ToolResult<?> result = executor.execute(call("c1", "boom", mapper.createObjectNode())).join().getResult();

        assertEquals(ToolErrorCode.EXECUTION_ERROR, result.getCode());
        assertEquals("disk on fire", result.getError());
        assertFalse(result.isRecoverable());
    }

    @Test
    void toolExecutionExceptionKeepsItsRecoverability() {
        registry.register(new StubTool("flaky", ToolAccess.READ_ONLY, CompletableFuture.failedFuture(
                new ToolExecutionException("backend busy", "flaky", null, true))));

        ToolResult<?> result = executor.execute(call("c1", "flaky", mapper.createObjectNode())).join().getResult();

        assertEquals(ToolErrorCode.EXECUTION_ERROR, result.getCode());
        assertEquals("backend busy", result.getError());
        assertTrue(result.isRecoverable());
    }

    @Test
    void listenerSeesEveryCallAndItsFailuresAreContained() {
        List<String> seen = new CopyOnWriteArrayList<>();
        executor.setOptions(ToolExecutorOptions.builder().onToolExecuted(r -> {
            seen.add(r.getCallId());
            throw new IllegalStateException("listener failure");
        }).build());

        ToolCallResult result = executor.execute(lineCall("c1", 1)).join();

        assertTrue(result.getResult().isSuccess());
        assertEquals(List.of("c1"), seen);
    }

    @Test
    void batchKeepsOrderAndContinuesOnError() {
        Map<String, ToolCallResult> results = executor.executeBatch(List.of(
                lineCall("a", 1), lineCall("b", 99), lineCall("c", 2))).join();

        assertEquals(List.of("a", "b", "c"), List.copyOf(results.keySet()));
        BatchResultStats stats = BatchResultStats.of(results);
        assertEquals(3, stats.getTotal());
        assertEquals(2, stats.getSuccessful());
        assertEquals(1, stats.getFailed());
        assertEquals(1, BatchResultStats.failed(results).size());
    }

    @Test
    void batchOfCallsWithoutIdsKeepsEveryResult() {
        Map<String, ToolCallResult> results = executor.executeBatch(List.of(
                lineCall(null, 1), lineCall("", 2), lineCall("  ", 1))).join();

        assertEquals(3, results.size());
        assertTrue(results.keySet().stream().allMatch(id -> id.startsWith("call-")));
    }

    @Test
    void batchStopsAtFirstFailureWhenAsked() {
        Map<String, ToolCallResult> results = executor.executeBatch(List.of(
                lineCall("a", 1), lineCall("b", 99), lineCall("c", 2)), false).join();

        assertEquals(List.of("a", "b"), List.copyOf(results.keySet()));
    }

    @Test
    void parallelRunsReadOnlyTools() {
        Map<String, ToolCallResult> results = executor.executeParallel(List.of(
                lineCall("a", 1),
                call("b", GetDocumentStatsTool.NAME, mapper.createObjectNode()))).join();

        assertEquals(2, results.size());
        assertTrue(results.values().stream().allMatch(r -> r.getResult().isSuccess()));
    }

    @Test
    void parallelRejectsMutatingAndUnknownTools() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> executor.executeParallel(List.of(
                lineCall("a", 1),
                call("b", FinishReviewTool.NAME, mapper.createObjectNode()),
                call("c", "nope", mapper.createObjectNode()))));

        assertEquals("Parallel execution only accepts read-only tools, rejected: finish_review, nope", e.getMessage());
    }

    @Test
    void validateDoesNotRun() {
        assertTrue(executor.validate(lineCall("a", 1)).isValid());
        assertFalse(executor.validate(call("a", "nope", mapper.createObjectNode())).isValid());
        assertEquals("Invalid parameters for tool \"get_line_content\"",
                executor.validate(call("a", GetLineContentTool.NAME, mapper.createObjectNode())).getError());
    }
}

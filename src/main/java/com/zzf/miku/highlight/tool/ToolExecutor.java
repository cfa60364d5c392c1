package com.zzf.miku.highlight.tool;

import com.zzf.miku.highlight.error.ToolExecutionException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Resolves, validates and runs tool calls against a fresh {@link ToolContext}.
 * <p>
 * Every call completes normally with a {@link ToolCallResult}; tool errors, timeouts and aborts are
 * reported as failure results rather than exceptional futures. The abort signal is checked once,
 * before dispatch. A timeout completes the call but does not interrupt the tool.
 */
@Slf4j
public class ToolExecutor {
    private final ToolRegistry registry;
    private final Executor executor;
    private volatile Supplier<ToolContext> contextProvider;
    private volatile ToolExecutorOptions options;

    public ToolExecutor(ToolRegistry registry, Supplier<ToolContext> contextProvider) {
        this(registry, contextProvider, ToolExecutorOptions.defaults());
    }

    public ToolExecutor(ToolRegistry registry, Supplier<ToolContext> contextProvider, ToolExecutorOptions options) {
        this(registry, contextProvider, options, ForkJoinPool.commonPool());
    }

    public ToolExecutor(ToolRegistry registry, Supplier<ToolContext> contextProvider,
                        ToolExecutorOptions options, Executor executor) {
        if (registry == null || contextProvider == null || executor == null) {
            throw new IllegalArgumentException("registry, contextProvider and executor are required");
        }
        this.registry = registry;
        this.contextProvider = contextProvider;
        this.options = options == null ? ToolExecutorOptions.defaults() : options;
        this.executor = executor;
    }

    public CompletableFuture<ToolCallResult> execute(ToolCall call) {
        long t0 = System.nanoTime();
        ToolExecutorOptions opts = options;
        log.info("tool.call callId={} tool={}", call.getId(), call.getName());
        CompletableFuture<ToolResult<?>> pending;
        try {
            pending = dispatch(call, opts);
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }
        return pending.handle((result, error) -> {
            ToolResult<?> out = error == null ? result : failureFor(error, opts);
            if (out == null) {
                out = ToolResult.failure("Tool returned no result", false, ToolErrorCode.EXECUTION_ERROR);
            }
            long durationMs = (System.nanoTime() - t0) / 1_000_000L;
            ToolCallResult callResult = new ToolCallResult(call.getId(), call.getName(), out, durationMs);
            if (out.isSuccess()) {
                log.info("tool.result callId={} tool={} success=true durationMs={}", call.getId(), call.getName(), durationMs);
            } else {
                log.info("tool.result callId={} tool={} success=false code={} recoverable={} durationMs={}",
                        call.getId(), call.getName(), out.getCode(), out.getRecoverable(), durationMs);
            }
            notifyListener(opts, callResult);
            return callResult;
        });
    }

    private CompletableFuture<ToolResult<?>> dispatch(ToolCall call, ToolExecutorOptions opts) {
        ToolDefinition<?, ?> tool = registry.get(call.getName());
        if (tool == null) {
            return CompletableFuture.completedFuture(ToolResult.failure(
                    "Unknown tool: " + call.getName() + ". Available tools: " + String.join(", ", registry.getNames()),
                    false, ToolErrorCode.UNKNOWN_TOOL));
        }
        return run(tool, call, opts);
    }

    private <P, R> CompletableFuture<ToolResult<?>> run(ToolDefinition<P, R> tool, ToolCall call, ToolExecutorOptions opts) {
        Optional<P> params = tool.parse(call.getArguments());
        if (params.isEmpty()) {
            return CompletableFuture.completedFuture(ToolResult.failure(
                    "Invalid parameters for tool \"" + call.getName() + "\": " + call.getArguments(),
                    true, ToolErrorCode.INVALID_PARAMS));
        }
        ToolContext context = contextProvider.get();
        if (context.isAborted()) {
            return CompletableFuture.completedFuture(aborted());
        }
        P p = params.get();
        return CompletableFuture.supplyAsync(() -> tool.execute(p, context), executor)
                .thenCompose(Function.identity())
                .orTimeout(opts.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .thenApply(result -> (ToolResult<?>) result);
    }

    private static ToolResult<?> failureFor(Throwable error, ToolExecutorOptions opts) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return ToolResult.failure("Tool execution timed out after " + opts.getTimeoutMs() + "ms", true, ToolErrorCode.TIMEOUT);
        }
        if (cause instanceof CancellationException) {
            return aborted();
        }
        log.warn("tool.fail err={}", cause.toString());
        String message = cause.getMessage() == null ? cause.toString() : cause.getMessage();
        if (cause instanceof ToolExecutionException toolError) {
            return ToolResult.failure(message, toolError.isRecoverable(), ToolErrorCode.EXECUTION_ERROR);
        }
        return ToolResult.failure(message, false, ToolErrorCode.EXECUTION_ERROR);
    }

    private static ToolResult<?> aborted() {
        return ToolResult.failure("Tool execution was aborted", false, ToolErrorCode.ABORTED);
    }

    private static void notifyListener(ToolExecutorOptions opts, ToolCallResult result) {
        try {
            opts.getOnToolExecuted().accept(result);
        } catch (RuntimeException e) {
            log.warn("tool.listener.fail callId={} err={}", result.getCallId(), e.toString());
        }
    }

    /**
     * Runs calls one after another, keyed by call id in call order.
     */
    public CompletableFuture<Map<String, ToolCallResult>> executeBatch(List<ToolCall> calls) {
        return executeBatch(calls, options.isContinueOnError());
    }

    public CompletableFuture<Map<String, ToolCallResult>> executeBatch(List<ToolCall> calls, boolean continueOnError) {
        Map<String, ToolCallResult> results = new LinkedHashMap<>();
        CompletableFuture<Boolean> chain = CompletableFuture.completedFuture(Boolean.TRUE);
        for (ToolCall call : calls) {
            chain = chain.thenCompose(keepGoing -> {
                if (!keepGoing) {
                    return CompletableFuture.completedFuture(Boolean.FALSE);
                }
                return execute(call).thenApply(r -> {
                    results.put(call.getId(), r);
                    return continueOnError || r.getResult().isSuccess();
                });
            });
        }
        return chain.thenApply(done -> results);
    }

    /**
     * Runs read-only calls concurrently.
     *
     * @throws IllegalArgumentException when any call names an unknown or mutating tool; nothing runs
     */
    public CompletableFuture<Map<String, ToolCallResult>> executeParallel(List<ToolCall> calls) {
        List<String> rejected = new ArrayList<>();
        for (ToolCall call : calls) {
            ToolDefinition<?, ?> tool = registry.get(call.getName());
            if (tool == null || tool.getAccess() != ToolAccess.READ_ONLY) {
                rejected.add(call.getName());
            }
        }
        if (!rejected.isEmpty()) {
            throw new IllegalArgumentException("Parallel execution only accepts read-only tools, rejected: " + String.join(", ", rejected));
        }
        List<CompletableFuture<ToolCallResult>> futures = calls.stream().map(this::execute).toList();
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).thenApply(done -> {
            Map<String, ToolCallResult> results = new LinkedHashMap<>();
            for (CompletableFuture<ToolCallResult> f : futures) {
                ToolCallResult r = f.join();
                results.put(r.getCallId(), r);
            }
            return results;
        });
    }

    /**
     * Checks that the tool exists and the arguments parse, without running anything.
     */
    public ValidationResult validate(ToolCall call) {
        ToolDefinition<?, ?> tool = registry.get(call.getName());
        if (tool == null) {
            return ValidationResult.invalid("Unknown tool: " + call.getName());
        }
        if (tool.parse(call.getArguments()).isEmpty()) {
            return ValidationResult.invalid("Invalid parameters for tool \"" + call.getName() + "\"");
        }
        return ValidationResult.ok();
    }

    public ToolRegistry getRegistry() {
        return registry;
    }

    public void setContextProvider(Supplier<ToolContext> contextProvider) {
        if (contextProvider == null) {
            throw new IllegalArgumentException("contextProvider is required");
        }
        this.contextProvider = contextProvider;
    }

    public ToolExecutorOptions getOptions() {
        return options;
    }

    public void setOptions(ToolExecutorOptions options) {
        this.options = options == null ? ToolExecutorOptions.defaults() : options;
    }
}

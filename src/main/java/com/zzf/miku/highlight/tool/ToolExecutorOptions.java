package com.zzf.miku.highlight.tool;

import lombok.Builder;
import lombok.Value;

import java.util.function.Consumer;

@Value
@Builder(toBuilder = true)
public class ToolExecutorOptions {
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;

    @Builder.Default
    long timeoutMs = DEFAULT_TIMEOUT_MS;
    /** When false a sequential batch stops after the first failed call. */
    @Builder.Default
    boolean continueOnError = true;
    /** Called once per finished call, successful or not. */
    @Builder.Default
    Consumer<ToolCallResult> onToolExecuted = result -> { };

    public static ToolExecutorOptions defaults() {
        return builder().build();
    }
}

package com.zzf.miku.highlight.session;

import com.zzf.miku.highlight.command.TextLocator;
import com.zzf.miku.highlight.command.UndoManager;
import com.zzf.miku.highlight.tool.ToolExecutorOptions;
import lombok.Builder;
import lombok.Value;

/**
 * Per-session tunables, usually derived from {@code miku.highlight.*} properties.
 */
@Value
@Builder(toBuilder = true)
public class ReviewSessionSettings {
    @Builder.Default
    int undoMaxSize = UndoManager.DEFAULT_MAX_SIZE;
    @Builder.Default
    int searchWindow = TextLocator.DEFAULT_SEARCH_WINDOW;
    /** Suggestions beyond this count are rejected when tool results are applied. */
    @Builder.Default
    int maxSuggestions = 100;
    @Builder.Default
    boolean invalidateOnMismatch = true;
    @Builder.Default
    boolean undoRedoEnabled = true;
    @Builder.Default
    boolean debugLogging = false;
    @Builder.Default
    ToolExecutorOptions executorOptions = ToolExecutorOptions.defaults();

    public static ReviewSessionSettings defaults() {
        return builder().build();
    }
}

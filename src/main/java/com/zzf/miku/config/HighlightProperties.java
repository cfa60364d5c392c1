package com.zzf.miku.config;

import com.zzf.miku.highlight.command.TextLocator;
import com.zzf.miku.highlight.command.UndoManager;
import com.zzf.miku.highlight.session.ReviewSessionSettings;
import com.zzf.miku.highlight.tool.ToolExecutorOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "miku.highlight")
public class HighlightProperties {
    /** Default for the feature flag when no override, system property or env var is set. */
    private boolean enabled = false;
    private long toolTimeoutMs = ToolExecutorOptions.DEFAULT_TIMEOUT_MS;
    private boolean continueOnError = true;
    private int undoMaxSize = UndoManager.DEFAULT_MAX_SIZE;
    private int maxSuggestions = 100;
    private int searchWindow = TextLocator.DEFAULT_SEARCH_WINDOW;
    private boolean debugLogging = false;
    private boolean undoRedoEnabled = true;
    private boolean invalidateOnMismatch = true;
    private int maxSessions = 256;

    public ReviewSessionSettings toSessionSettings() {
        return ReviewSessionSettings.builder()
                .undoMaxSize(undoMaxSize)
                .searchWindow(searchWindow)
                .maxSuggestions(maxSuggestions)
                .invalidateOnMismatch(invalidateOnMismatch)
                .undoRedoEnabled(undoRedoEnabled)
                .debugLogging(debugLogging)
                .executorOptions(ToolExecutorOptions.builder()
                        .timeoutMs(toolTimeoutMs)
                        .continueOnError(continueOnError)
                        .build())
                .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getToolTimeoutMs() {
        return toolTimeoutMs;
    }

    public void setToolTimeoutMs(long toolTimeoutMs) {
        this.toolTimeoutMs = toolTimeoutMs;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public void setContinueOnError(boolean continueOnError) {
        this.continueOnError = continueOnError;
    }

    public int getUndoMaxSize() {
        return undoMaxSize;
    }

    public void setUndoMaxSize(int undoMaxSize) {
        this.undoMaxSize = undoMaxSize;
    }

    public int getMaxSuggestions() {
        return maxSuggestions;
    }

    public void setMaxSuggestions(int maxSuggestions) {
        this.maxSuggestions = maxSuggestions;
    }

    public int getSearchWindow() {
        return searchWindow;
    }

    public void setSearchWindow(int searchWindow) {
        this.searchWindow = searchWindow;
    }

    public boolean isDebugLogging() {
        return debugLogging;
    }

    public void setDebugLogging(boolean debugLogging) {
        this.debugLogging = debugLogging;
    }

    public boolean isUndoRedoEnabled() {
        return undoRedoEnabled;
    }

    public void setUndoRedoEnabled(boolean undoRedoEnabled) {
        this.undoRedoEnabled = undoRedoEnabled;
    }

    public boolean isInvalidateOnMismatch() {
        return invalidateOnMismatch;
    }

    public void setInvalidateOnMismatch(boolean invalidateOnMismatch) {
        this.invalidateOnMismatch = invalidateOnMismatch;
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public void setMaxSessions(int maxSessions) {
        this.maxSessions = maxSessions;
    }
}

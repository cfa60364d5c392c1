package com.zzf.miku.highlight.error;

public class ToolExecutionException extends HighlightException {
    private final String toolName;
    private final Object params;
    private final boolean recoverable;

    public ToolExecutionException(String message, String toolName, Object params) {
        this(message, toolName, params, true);
    }

    public ToolExecutionException(String message, String toolName, Object params, boolean recoverable) {
        super(message);
        this.toolName = toolName;
        this.params = params;
        this.recoverable = recoverable;
    }

    @Override
    public String getCode() {
        return "TOOL_EXECUTION";
    }

    @Override
    public boolean isRecoverable() {
        return recoverable;
    }

    public String getToolName() {
        return toolName;
    }

    public Object getParams() {
        return params;
    }
}

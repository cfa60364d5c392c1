package com.zzf.miku.highlight.tool;

import lombok.Value;

@Value
public class ToolCallResult {
    String callId;
    String toolName;
    ToolResult<?> result;
    long durationMs;
}

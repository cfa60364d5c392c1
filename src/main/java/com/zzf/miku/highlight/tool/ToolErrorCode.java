package com.zzf.miku.highlight.tool;

public enum ToolErrorCode {
    LINE_OUT_OF_BOUNDS,
    COLUMN_OUT_OF_BOUNDS,
    TEXT_MISMATCH,
    UNKNOWN_TOOL,
    INVALID_PARAMS,
    TIMEOUT,
    ABORTED,
    EXECUTION_ERROR
}

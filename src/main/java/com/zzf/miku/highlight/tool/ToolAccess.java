package com.zzf.miku.highlight.tool;

/**
 * Whether a tool's result is meant to change session state. Only read-only tools may run in parallel.
 */
public enum ToolAccess {
    READ_ONLY,
    MUTATING
}

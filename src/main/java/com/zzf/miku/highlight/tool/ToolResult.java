package com.zzf.miku.highlight.tool;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one tool execution. A success carries a value and a human readable message; a failure
 * carries an error message, whether the agent can retry, and an optional {@link ToolErrorCode}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ToolResult<T> {
    private final boolean success;
    private final T value;
    private final String message;
    private final String error;
    private final Boolean recoverable;
    private final ToolErrorCode code;

    private ToolResult(boolean success, T value, String message, String error, Boolean recoverable, ToolErrorCode code) {
        this.success = success;
        this.value = value;
        this.message = message;
        this.error = error;
        this.recoverable = recoverable;
        this.code = code;
    }

    public static <T> ToolResult<T> success(T value, String message) {
        return new ToolResult<>(true, value, message == null ? "" : message, null, null, null);
    }

    public static <T> ToolResult<T> failure(String error, boolean recoverable, ToolErrorCode code) {
        return new ToolResult<>(false, null, null, error == null ? "" : error, recoverable, code);
    }

    public boolean isSuccess() {
        return success;
    }

    @JsonIgnore
    public boolean isFailure() {
        return !success;
    }

    public T getValue() {
        return value;
    }

    public String getMessage() {
        return message;
    }

    public String getError() {
        return error;
    }

    @JsonProperty("recoverable")
    public Boolean getRecoverable() {
        return recoverable;
    }

    @JsonIgnore
    public boolean isRecoverable() {
        return recoverable != null && recoverable;
    }

    public ToolErrorCode getCode() {
        return code;
    }

    @Override
    public String toString() {
        return success
                ? "ToolResult{success, message=" + message + "}"
                : "ToolResult{failure, code=" + code + ", recoverable=" + recoverable + ", error=" + error + "}";
    }
}

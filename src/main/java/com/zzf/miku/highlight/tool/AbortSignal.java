package com.zzf.miku.highlight.tool;

/**
 * Cooperative cancellation flag shared between the caller and a running batch.
 */
public final class AbortSignal {
    private volatile boolean aborted;
    private volatile String reason;

    public void abort() {
        abort("aborted");
    }

    public void abort(String reason) {
        this.reason = reason;
        this.aborted = true;
    }

    public boolean isAborted() {
        return aborted;
    }

    public String getReason() {
        return reason;
    }
}

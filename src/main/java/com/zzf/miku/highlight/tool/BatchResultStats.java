package com.zzf.miku.highlight.tool;

import lombok.Value;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Aggregate counts over the results of one batch.
 */
@Value
public class BatchResultStats {
    int total;
    int successful;
    int failed;
    long totalDurationMs;
    long averageDurationMs;

    public static BatchResultStats of(Map<String, ToolCallResult> results) {
        return of(results.values());
    }

    public static BatchResultStats of(Collection<ToolCallResult> results) {
        int total = results.size();
        int successful = 0;
        long duration = 0;
        for (ToolCallResult r : results) {
            if (r.getResult().isSuccess()) {
                successful++;
            }
            duration += r.getDurationMs();
        }
        long average = total > 0 ? Math.round((double) duration / total) : 0;
        return new BatchResultStats(total, successful, total - successful, duration, average);
    }

    public static List<ToolCallResult> successful(Map<String, ToolCallResult> results) {
        return results.values().stream().filter(r -> r.getResult().isSuccess()).toList();
    }

    public static List<ToolCallResult> failed(Map<String, ToolCallResult> results) {
        return results.values().stream().filter(r -> r.getResult().isFailure()).toList();
    }
}

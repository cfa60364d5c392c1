package com.zzf.miku.highlight.session;

import com.zzf.miku.highlight.tool.BatchResultStats;
import com.zzf.miku.highlight.tool.ToolCallResult;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Results of one tool batch run through a session. {@code rejectedIds} lists highlights the tools
 * produced that the store did not keep.
 */
@Value
public class ToolBatchOutcome {
    Map<String, ToolCallResult> results;
    BatchResultStats stats;
    List<String> rejectedIds;
}

package com.zzf.miku.highlight.tool;

import lombok.Value;

@Value
public class GetLineContentParams {
    int lineNumber;
    /** 0 when absent. */
    int contextLines;
}

package com.zzf.miku.highlight.tool;

import lombok.Value;

@Value
public class LineContent {
    int lineNumber;
    String content;
    int length;
    int startOffset;
    int endOffset;
}

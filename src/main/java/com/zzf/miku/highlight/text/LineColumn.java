package com.zzf.miku.highlight.text;

import lombok.Value;

/**
 * 1-indexed line and column.
 */
@Value
public class LineColumn {
    int line;
    int column;
}

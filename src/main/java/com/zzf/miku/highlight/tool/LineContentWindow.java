package com.zzf.miku.highlight.tool;

import lombok.Value;

import java.util.List;

/**
 * A line plus up to N neighbouring lines on each side, clipped to the document.
 */
@Value
public class LineContentWindow {
    LineContent mainLine;
    List<LineContent> before;
    List<LineContent> after;
}

package com.zzf.miku.highlight;

import java.util.Map;

/**
 * Positioned annotation over the document.
 */
public interface Highlight {

    String getId();

    Range getRange();

    HighlightCategory getCategory();

    HighlightPriority getPriority();

    Map<String, Object> getMetadata();
}

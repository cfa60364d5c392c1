package com.zzf.miku.highlight.tool;

import com.zzf.miku.highlight.HighlightCategory;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HighlightTextParams {
    int lineNumber;
    int startColumn;
    int endColumn;
    String originalText;
    HighlightCategory suggestionType;
    String observation;
    String suggestedRevision;
    Double confidence;
}

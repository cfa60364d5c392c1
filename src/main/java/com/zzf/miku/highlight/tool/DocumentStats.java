package com.zzf.miku.highlight.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Counts reported by get_document_stats. {@code minLineLength} ignores empty lines.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentStats {
    int characterCount;
    int wordCount;
    int lineCount;
    int paragraphCount;
    int averageLineLength;
    int maxLineLength;
    int minLineLength;
    int emptyLineCount;
    int estimatedReadingTimeMinutes;
    List<LineDetail> lineDetails;

    @Value
    public static class LineDetail {
        int lineNumber;
        int length;
        int wordCount;
        boolean empty;
    }
}

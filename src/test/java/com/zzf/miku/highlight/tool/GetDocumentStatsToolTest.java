package com.zzf.miku.highlight.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.miku.highlight.store.SuggestionStoreState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GetDocumentStatsToolTest {

    private final GetDocumentStatsTool tool = new GetDocumentStatsTool();

    @Test
    void emptyDocument() {
        DocumentStats stats = GetDocumentStatsTool.compute(DocumentContext.of(""), false);

        assertEquals(0, stats.getWordCount());
        assertEquals(1, stats.getLineCount());
        assertEquals(0, stats.getParagraphCount());
        assertEquals(0, stats.getEstimatedReadingTimeMinutes());
        assertEquals(0, stats.getMinLineLength());
        assertEquals(1, stats.getEmptyLineCount());
        assertNull(stats.getLineDetails());
    }

    @Test
    void countsWordsLinesAndParagraphs() {
        DocumentStats stats = GetDocumentStatsTool.compute(DocumentContext.of("One two three.\nFour\n\n  Five six"), true);

        assertEquals(6, stats.getWordCount());
        assertEquals(4, stats.getLineCount());
        assertEquals(2, stats.getParagraphCount());
        assertEquals(14, stats.getMaxLineLength());
        assertEquals(4, stats.getMinLineLength());
        assertEquals(1, stats.getEmptyLineCount());
        assertEquals(7, stats.getAverageLineLength());
        assertEquals(1, stats.getEstimatedReadingTimeMinutes());
        assertEquals(4, stats.getLineDetails().size());
        assertTrue(stats.getLineDetails().get(2).isEmpty());
        assertEquals(2, stats.getLineDetails().get(3).getWordCount());
    }

    @Test
    void readingTimeRoundsUp() {
        String doc = "word ".repeat(226);

        assertEquals(2, GetDocumentStatsTool.compute(DocumentContext.of(doc), false).getEstimatedReadingTimeMinutes());
    }

    @Test
    void executeReportsSummaryMessage() {
        ObjectMapper mapper = new ObjectMapper();
        Boolean details = tool.parse(mapper.createObjectNode()).orElseThrow();
        ToolResult<DocumentStats> result = tool.execute(details, ToolContext.of("a b\n\nc", SuggestionStoreState.initial())).join();

        assertFalse(details);
        assertEquals("Document: 3 words, 3 lines, 2 paragraphs (~1 min read)", result.getMessage());
        assertTrue(tool.parse(mapper.createObjectNode().put("include_line_details", "yes")).isEmpty());
        assertEquals(Boolean.FALSE, tool.parse(null).orElseThrow());
    }
}

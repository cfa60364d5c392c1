package com.zzf.miku.highlight.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.miku.highlight.HighlightCategory;
import com.zzf.miku.highlight.Range;
import com.zzf.miku.highlight.SuggestionHighlight;
import com.zzf.miku.highlight.store.SuggestionStoreState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HighlightTextToolTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HighlightTextTool tool = new HighlightTextTool();

    private ObjectNode args(int line, int start, int end, String original) {
        ObjectNode node = mapper.createObjectNode();
        node.put("line_number", line);
        node.put("start_column", start);
        node.put("end_column", end);
        node.put("original_text", original);
        node.put("suggestion_type", "clarity");
        node.put("observation", "vague");
        node.put("suggested_revision", "better");
        return node;
    }

    private ToolResult<SuggestionHighlight> run(String doc, ObjectNode args) {
        HighlightTextParams params = tool.parse(args).orElseThrow();
        return tool.execute(params, ToolContext.of(doc, SuggestionStoreState.initial())).join();
    }

    @Test
    void highlightsExactColumns() {
        ToolResult<SuggestionHighlight> result = run("The fox", args(1, 0, 3, "The"));

        assertTrue(result.isSuccess());
        SuggestionHighlight highlight = result.getValue();
        assertEquals(Range.of(0, 3), highlight.getRange());
        assertEquals(HighlightCategory.CLARITY, highlight.getCategory());
        assertEquals("The", highlight.getOriginalText());
        assertEquals("vague", highlight.getObservation());
        assertEquals("better", highlight.getSuggestedRevision());
        assertNotNull(highlight.getId());
        assertEquals("Highlighted \"The\" at line 1, columns 0-3.", result.getMessage());
    }

    @Test
    void offsetsIncludePrecedingLines() {
        ToolResult<SuggestionHighlight> result = run("first\nsecond line", args(2, 7, 11, "line"));

        assertEquals(Range.of(13, 17), result.getValue().getRange());
    }

    @Test
    void relocatesTextOnTheSameLine() {
        ToolResult<SuggestionHighlight> result = run("Hello world", args(1, 0, 5, "world"));

        assertTrue(result.isSuccess());
        assertEquals(Range.of(6, 11), result.getValue().getRange());
        assertTrue(result.getMessage().endsWith("Note: Original position was 0-5."), result.getMessage());
    }

    @Test
    void reportsMismatchWhenTextIsNotOnLine() {
        ToolResult<SuggestionHighlight> result = run("Hello world", args(1, 0, 5, "earth"));

        assertFalse(result.isSuccess());
        assertEquals(ToolErrorCode.TEXT_MISMATCH, result.getCode());
        assertTrue(result.isRecoverable());
        assertTrue(result.getError().contains("Found \"Hello\" instead"));
    }

    @Test
    void boundsErrors() {
        ToolResult<SuggestionHighlight> line = run("one\ntwo", args(3, 0, 1, "x"));
        assertEquals(ToolErrorCode.LINE_OUT_OF_BOUNDS, line.getCode());
        assertEquals("Line 3 does not exist. Document has 2 lines.", line.getError());

        ToolResult<SuggestionHighlight> start = run("one", args(1, 3, 4, "x"));
        assertEquals(ToolErrorCode.COLUMN_OUT_OF_BOUNDS, start.getCode());
        assertEquals("Start column 3 is out of bounds. Line 1 has 3 characters (0-2).", start.getError());

        ToolResult<SuggestionHighlight> end = run("one", args(1, 0, 9, "one"));
        assertEquals(ToolErrorCode.COLUMN_OUT_OF_BOUNDS, end.getCode());
    }

    @Test
    void parseRejectsMalformedArguments() {
        assertTrue(tool.parse(args(1, 3, 3, "x")).isEmpty());
        assertTrue(tool.parse(args(0, 0, 1, "x")).isEmpty());
        assertTrue(tool.parse(args(1, 0, 1, "")).isEmpty());
        assertTrue(tool.parse(args(1, 0, 1, "x").put("suggestion_type", "search")).isEmpty());
        assertTrue(tool.parse(args(1, 0, 1, "x").put("confidence", 1.5)).isEmpty());
        assertTrue(tool.parse(mapper.createArrayNode()).isEmpty());

        ObjectNode missing = args(1, 0, 1, "x");
        missing.remove("observation");
        assertTrue(tool.parse(missing).isEmpty());

        assertEquals(0.8, tool.parse(args(1, 0, 1, "x").put("confidence", 0.8)).orElseThrow().getConfidence());
    }

    @Test
    void providerFormatListsRequiredFields() {
        ObjectNode format = tool.toProviderFormat();

        assertEquals("highlight_text", format.get("name").asText());
        assertEquals("object", format.at("/parameters/type").asText());
        assertEquals(7, format.at("/parameters/required").size());
        assertEquals(5, format.at("/parameters/properties/suggestion_type/enum").size());
    }
}

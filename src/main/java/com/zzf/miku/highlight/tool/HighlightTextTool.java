package com.zzf.miku.highlight.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.miku.highlight.HighlightCategory;
import com.zzf.miku.highlight.HighlightIds;
import com.zzf.miku.highlight.HighlightPriority;
import com.zzf.miku.highlight.Range;
import com.zzf.miku.highlight.SuggestionHighlight;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * highlight_text: turns a line/column claim from the agent into a positioned suggestion.
 * <p>
 * The text at the claimed columns must equal {@code original_text}. When it does not, the same line
 * is searched and a match elsewhere on it is accepted at the adjusted position.
 */
@Slf4j
@Component
public class HighlightTextTool implements ToolDefinition<HighlightTextParams, SuggestionHighlight> {
    public static final String NAME = "highlight_text";

    private static final List<String> CATEGORY_NAMES = HighlightCategory.suggestionCategories().stream()
            .map(HighlightCategory::wireName)
            .collect(Collectors.toList());

    private static final ObjectNode SCHEMA = SchemaBuilder.object()
            .integer("line_number", "The 1-indexed line number where the text begins", 1, null)
            .integer("start_column", "The 0-indexed column where the highlight starts within the line", 0, null)
            .integer("end_column", "The 0-indexed column where the highlight ends within the line", 1, null)
            .nonEmptyString("original_text", "The exact text being highlighted (must match document content)")
            .enumeration("suggestion_type", "The category of suggestion", CATEGORY_NAMES)
            .string("observation", "Explanation of why this text needs attention")
            .string("suggested_revision", "The improved version of the text")
            .number("confidence", "Confidence level 0-1 indicating how confident you are (optional)", 0, 1)
            .required("line_number", "start_column", "end_column", "original_text", "suggestion_type",
                    "observation", "suggested_revision")
            .build();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Highlight a specific portion of text with a suggestion for improvement.\n\n"
                + "Guidelines:\n"
                + "- line_number is 1-indexed (first line is 1)\n"
                + "- start_column and end_column are 0-indexed within the line\n"
                + "- original_text MUST exactly match the text at the specified position\n"
                + "- suggestion_type must be one of: " + String.join(", ", CATEGORY_NAMES) + "\n"
                + "- observation explains WHY the text needs attention\n"
                + "- suggested_revision is the improved version of the text\n"
                + "- confidence (optional) is 0-1 indicating how confident you are\n\n"
                + "The tool will attempt to find the text if the columns are slightly off, but the\n"
                + "original_text must appear somewhere on the specified line.";
    }

    @Override
    public ObjectNode getParametersSchema() {
        return SCHEMA.deepCopy();
    }

    @Override
    public ToolAccess getAccess() {
        return ToolAccess.MUTATING;
    }

    @Override
    public Optional<HighlightTextParams> parse(JsonNode args) {
        if (args == null || !args.isObject()) {
            return Optional.empty();
        }
        Integer line = ToolArguments.positiveInt(args, "line_number");
        Integer start = ToolArguments.nonNegativeInt(args, "start_column");
        Integer end = ToolArguments.nonNegativeInt(args, "end_column");
        if (line == null || start == null || end == null || end <= start) {
            return Optional.empty();
        }
        String original = ToolArguments.nonEmptyString(args, "original_text");
        String type = ToolArguments.oneOf(args, "suggestion_type", CATEGORY_NAMES);
        String observation = ToolArguments.string(args, "observation");
        String revision = ToolArguments.string(args, "suggested_revision");
        if (original == null || type == null || observation == null || revision == null) {
            return Optional.empty();
        }
        Double confidence = null;
        if (!ToolArguments.isAbsent(args, "confidence")) {
            confidence = ToolArguments.normalizedNumber(args, "confidence");
            if (confidence == null) {
                return Optional.empty();
            }
        }
        return Optional.of(HighlightTextParams.builder()
                .lineNumber(line)
                .startColumn(start)
                .endColumn(end)
                .originalText(original)
                .suggestionType(HighlightCategory.fromWireName(type))
                .observation(observation)
                .suggestedRevision(revision)
                .confidence(confidence)
                .build());
    }

    @Override
    public CompletableFuture<ToolResult<SuggestionHighlight>> execute(HighlightTextParams params, ToolContext context) {
        return CompletableFuture.completedFuture(highlight(params, context.getDocument()));
    }

    ToolResult<SuggestionHighlight> highlight(HighlightTextParams p, DocumentContext document) {
        List<String> lines = document.getLines();
        int lineNumber = p.getLineNumber();
        if (lineNumber - 1 >= lines.size()) {
            return ToolResult.failure("Line " + lineNumber + " does not exist. Document has " + lines.size() + " lines.",
                    true, ToolErrorCode.LINE_OUT_OF_BOUNDS);
        }
        String line = lines.get(lineNumber - 1);
        int start = p.getStartColumn();
        int end = p.getEndColumn();
        if (start >= line.length()) {
            return ToolResult.failure("Start column " + start + " is out of bounds. Line " + lineNumber + " has "
                    + line.length() + " characters (0-" + (line.length() - 1) + ").", true, ToolErrorCode.COLUMN_OUT_OF_BOUNDS);
        }
        if (end > line.length()) {
            return ToolResult.failure("End column " + end + " is out of bounds. Line " + lineNumber + " has "
                    + line.length() + " characters.", true, ToolErrorCode.COLUMN_OUT_OF_BOUNDS);
        }

        int lineStart = document.getLineMap().getLineStart(lineNumber);
        String original = p.getOriginalText();
        String actual = line.substring(start, end);
        if (actual.equals(original)) {
            return ToolResult.success(build(p, Range.of(lineStart + start, lineStart + end)),
                    "Highlighted \"" + truncate(original, 30) + "\" at line " + lineNumber + ", columns " + start + "-" + end + ".");
        }

        int found = line.indexOf(original);
        if (found == -1) {
            return ToolResult.failure("Text \"" + original + "\" not found at line " + lineNumber + ", columns " + start + "-" + end
                            + ". Found \"" + actual + "\" instead. The text also doesn't appear elsewhere on line " + lineNumber + ".",
                    true, ToolErrorCode.TEXT_MISMATCH);
        }
        int foundEnd = found + original.length();
        log.debug("highlight_text.relocated line={} claimed={}-{} actual={}-{}", lineNumber, start, end, found, foundEnd);
        return ToolResult.success(build(p, Range.of(lineStart + found, lineStart + foundEnd)),
                "Highlighted \"" + truncate(original, 30) + "\" at adjusted position (line " + lineNumber + ", columns "
                        + found + "-" + foundEnd + "). Note: Original position was " + start + "-" + end + ".");
    }

    private static SuggestionHighlight build(HighlightTextParams p, Range range) {
        return SuggestionHighlight.builder()
                .id(HighlightIds.suggestionId())
                .range(range)
                .category(p.getSuggestionType())
                .priority(HighlightPriority.MEDIUM)
                .originalText(p.getOriginalText())
                .observation(p.getObservation())
                .suggestedRevision(p.getSuggestedRevision())
                .confidence(p.getConfidence())
                .build();
    }

    static String truncate(String s, int maxLength) {
        return s.length() <= maxLength ? s : s.substring(0, maxLength - 3) + "...";
    }
}

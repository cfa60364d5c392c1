package com.zzf.miku.highlight.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

@Component
public class GetDocumentStatsTool implements ToolDefinition<Boolean, DocumentStats> {
    public static final String NAME = "get_document_stats";
    static final int WORDS_PER_MINUTE = 225;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");

    private static final ObjectNode SCHEMA = SchemaBuilder.object()
            .bool("include_line_details", "Include per-line length and word counts", false)
            .build();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Get statistics about the document being analyzed.\n\n"
                + "Returns:\n"
                + "- characterCount: Total number of characters\n"
                + "- wordCount: Total number of words\n"
                + "- lineCount: Total number of lines\n"
                + "- paragraphCount: Number of paragraphs\n"
                + "- averageLineLength: Average characters per line\n"
                + "- maxLineLength: Longest line in characters\n"
                + "- minLineLength: Shortest non-empty line\n"
                + "- emptyLineCount: Number of empty lines\n"
                + "- estimatedReadingTimeMinutes: Approximate reading time\n\n"
                + "Use this tool at the start of a review to understand document size and structure.";
    }

    @Override
    public ObjectNode getParametersSchema() {
        return SCHEMA.deepCopy();
    }

    @Override
    public ToolAccess getAccess() {
        return ToolAccess.READ_ONLY;
    }

    /**
     * The parsed value is the {@code include_line_details} flag.
     */
    @Override
    public Optional<Boolean> parse(JsonNode args) {
        if (args == null || args.isNull() || args.isMissingNode()) {
            return Optional.of(Boolean.FALSE);
        }
        if (!args.isObject()) {
            return Optional.empty();
        }
        if (ToolArguments.isAbsent(args, "include_line_details")) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.ofNullable(ToolArguments.bool(args, "include_line_details"));
    }

    @Override
    public CompletableFuture<ToolResult<DocumentStats>> execute(Boolean includeLineDetails, ToolContext context) {
        DocumentStats stats = compute(context.getDocument(), Boolean.TRUE.equals(includeLineDetails));
        return CompletableFuture.completedFuture(ToolResult.success(stats,
                "Document: " + stats.getWordCount() + " words, " + stats.getLineCount() + " lines, "
                        + stats.getParagraphCount() + " paragraphs (~" + stats.getEstimatedReadingTimeMinutes() + " min read)"));
    }

    static DocumentStats compute(DocumentContext document, boolean includeLineDetails) {
        String content = document.getContent();
        List<String> lines = document.getLines();
        int words = countWords(content);

        long total = 0;
        int max = 0;
        int min = Integer.MAX_VALUE;
        int empty = 0;
        List<DocumentStats.LineDetail> details = includeLineDetails ? new ArrayList<>() : null;
        for (int i = 0; i < lines.size(); i++) {
            int length = lines.get(i).length();
            total += length;
            if (length == 0) {
                empty++;
            } else {
                max = Math.max(max, length);
                min = Math.min(min, length);
            }
            if (details != null) {
                details.add(new DocumentStats.LineDetail(i + 1, length, countWords(lines.get(i)), length == 0));
            }
        }
        if (min == Integer.MAX_VALUE) {
            min = 0;
        }
        int average = lines.isEmpty() ? 0 : (int) Math.round((double) total / lines.size());

        return DocumentStats.builder()
                .characterCount(content.length())
                .wordCount(words)
                .lineCount(lines.size())
                .paragraphCount(countParagraphs(content))
                .averageLineLength(average)
                .maxLineLength(max)
                .minLineLength(min)
                .emptyLineCount(empty)
                .estimatedReadingTimeMinutes((int) Math.ceil(words / (double) WORDS_PER_MINUTE))
                .lineDetails(details)
                .build();
    }

    static int countWords(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (String word : WHITESPACE.split(text)) {
            if (!word.isEmpty()) {
                count++;
            }
        }
        return count;
    }

    static int countParagraphs(String text) {
        if (text.trim().isEmpty()) {
            return 0;
        }
        int count = 0;
        for (String p : PARAGRAPH_BREAK.split(text)) {
            if (!p.trim().isEmpty()) {
                count++;
            }
        }
        return count;
    }
}

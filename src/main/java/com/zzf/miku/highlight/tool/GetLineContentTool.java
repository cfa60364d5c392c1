package com.zzf.miku.highlight.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * get_line_content: one line with its offsets, or a window around it when {@code context_lines > 0}.
 * The success value is a {@link LineContent} or a {@link LineContentWindow}.
 */
@Component
public class GetLineContentTool implements ToolDefinition<GetLineContentParams, Object> {
    public static final String NAME = "get_line_content";
    public static final int MAX_CONTEXT_LINES = 10;

    private static final ObjectNode SCHEMA = SchemaBuilder.object()
            .integer("line_number", "The 1-indexed line number to retrieve", 1, null)
            .integer("context_lines", "Optional: number of surrounding lines to include (e.g., 2 means 2 lines before and 2 after)",
                    0, MAX_CONTEXT_LINES)
            .required("line_number")
            .build();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Retrieve the content of a specific line from the document.\n\n"
                + "Use this tool to:\n"
                + "- Verify the exact text before creating a highlight\n"
                + "- Get context around a line you're analyzing\n"
                + "- Check the length and position of text\n\n"
                + "- line_number: 1-indexed line number (first line is 1)\n"
                + "- context_lines: (optional) number of surrounding lines to include, at most " + MAX_CONTEXT_LINES + "\n\n"
                + "Returns line content, length, and character offsets.";
    }

    @Override
    public ObjectNode getParametersSchema() {
        return SCHEMA.deepCopy();
    }

    @Override
    public ToolAccess getAccess() {
        return ToolAccess.READ_ONLY;
    }

    @Override
    public Optional<GetLineContentParams> parse(JsonNode args) {
        if (args == null || !args.isObject()) {
            return Optional.empty();
        }
        Integer line = ToolArguments.positiveInt(args, "line_number");
        if (line == null) {
            return Optional.empty();
        }
        int context = 0;
        if (!ToolArguments.isAbsent(args, "context_lines")) {
            Integer c = ToolArguments.nonNegativeInt(args, "context_lines");
            if (c == null || c > MAX_CONTEXT_LINES) {
                return Optional.empty();
            }
            context = c;
        }
        return Optional.of(new GetLineContentParams(line, context));
    }

    @Override
    public CompletableFuture<ToolResult<Object>> execute(GetLineContentParams params, ToolContext context) {
        DocumentContext document = context.getDocument();
        List<String> lines = document.getLines();
        int lineNumber = params.getLineNumber();
        if (lineNumber > lines.size()) {
            return CompletableFuture.completedFuture(ToolResult.failure(
                    "Line " + lineNumber + " does not exist. Document has " + lines.size() + " lines.",
                    true, ToolErrorCode.LINE_OUT_OF_BOUNDS));
        }
        String content = lines.get(lineNumber - 1);
        LineContent main = lineContent(document, lineNumber);
        int n = params.getContextLines();
        if (n == 0) {
            return CompletableFuture.completedFuture(ToolResult.success(main,
                    "Line " + lineNumber + ": \"" + HighlightTextTool.truncate(content, 50) + "\" (" + content.length() + " chars)"));
        }

        List<LineContent> before = new ArrayList<>();
        for (int i = Math.max(1, lineNumber - n); i < lineNumber; i++) {
            before.add(lineContent(document, i));
        }
        List<LineContent> after = new ArrayList<>();
        for (int i = lineNumber + 1; i <= Math.min(lines.size(), lineNumber + n); i++) {
            after.add(lineContent(document, i));
        }
        return CompletableFuture.completedFuture(ToolResult.success(new LineContentWindow(main, before, after),
                "Line " + lineNumber + " with " + before.size() + " lines before and " + after.size() + " lines after"));
    }

    private static LineContent lineContent(DocumentContext document, int lineNumber) {
        String content = document.getLines().get(lineNumber - 1);
        int start = document.getLineMap().getLineStart(lineNumber);
        return new LineContent(lineNumber, content, content.length(), start, start + content.length());
    }
}

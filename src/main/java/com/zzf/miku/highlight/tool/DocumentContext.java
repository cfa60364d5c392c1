package com.zzf.miku.highlight.tool;

import com.zzf.miku.highlight.text.LineMap;

import java.util.List;

/**
 * One version of the document as tools see it.
 */
public final class DocumentContext {
    private final String content;
    private final List<String> lines;
    private final LineMap lineMap;

    private DocumentContext(String content, List<String> lines, LineMap lineMap) {
        this.content = content;
        this.lines = lines;
        this.lineMap = lineMap;
    }

    public static DocumentContext of(String content) {
        LineMap lineMap = new LineMap(content);
        return new DocumentContext(lineMap.getText(), List.copyOf(lineMap.getLines()), lineMap);
    }

    public String getContent() {
        return content;
    }

    public List<String> getLines() {
        return lines;
    }

    public LineMap getLineMap() {
        return lineMap;
    }
}

package com.zzf.miku.highlight.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Offset/line lookup table for one version of a document. Lines are split on {@code '\n'} only,
 * so an empty document has one empty line and a trailing newline adds an empty last line.
 */
public final class LineMap {
    private final String text;
    private final int[] lineStarts;

    public LineMap(String text) {
        this.text = text == null ? "" : text;
        this.lineStarts = computeLineStarts(this.text);
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Offsets outside the document are clamped to it first.
     */
    public LineColumn offsetToLineColumn(int offset) {
        int clamped = Math.max(0, Math.min(offset, text.length()));
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= clamped) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return new LineColumn(low + 1, clamped - lineStarts[low] + 1);
    }

    /**
     * Line and column are clamped into the document; column {@code lineLength + 1} addresses the line end.
     */
    public int lineColumnToOffset(int line, int column) {
        int lineIndex = Math.max(0, Math.min(line - 1, lineStarts.length - 1));
        int lineStart = lineStarts[lineIndex];
        int lineLength = lineEnd(lineIndex) - lineStart + 1;
        int col = Math.max(1, Math.min(column, lineLength));
        return lineStart + col - 1;
    }

    public int lineColumnToOffset(LineColumn position) {
        return lineColumnToOffset(position.getLine(), position.getColumn());
    }

    /**
     * @return the line without its newline, or an empty string for a line outside the document
     */
    public String getLine(int lineNumber) {
        int lineIndex = lineNumber - 1;
        if (lineIndex < 0 || lineIndex >= lineStarts.length) {
            return "";
        }
        return text.substring(lineStarts[lineIndex], lineEnd(lineIndex));
    }

    public int getLineStart(int lineNumber) {
        return lineColumnToOffset(lineNumber, 1);
    }

    public int getLineCount() {
        return lineStarts.length;
    }

    public List<String> getLines() {
        List<String> lines = new ArrayList<>(lineStarts.length);
        for (int i = 1; i <= lineStarts.length; i++) {
            lines.add(getLine(i));
        }
        return lines;
    }

    public String getText() {
        return text;
    }

    private int lineEnd(int lineIndex) {
        return lineIndex + 1 < lineStarts.length ? lineStarts[lineIndex + 1] - 1 : text.length();
    }
}

package com.zzf.miku.highlight.command;

/**
 * Finds where a piece of text ended up after the document moved under it.
 */
public final class TextLocator {
    public static final int DEFAULT_SEARCH_WINDOW = 1000;

    private TextLocator() {}

    /**
     * Tries the hint itself, then the first match within {@code window} characters after it, then the
     * last match within {@code window} characters before it, then anywhere in the document.
     *
     * @return the offset of the match, or -1
     */
    public static int find(String doc, String text, int hint, int window) {
        if (hint >= 0 && hint + text.length() <= doc.length() && doc.startsWith(text, hint)) {
            return hint;
        }

        int forwardStart = Math.max(0, hint);
        int forwardEnd = Math.min(doc.length(), hint + window);
        int forward = doc.indexOf(text, forwardStart);
        if (forward != -1 && forward < forwardEnd) {
            return forward;
        }

        int backwardStart = Math.min(doc.length(), Math.max(0, hint - window));
        int backwardEnd = Math.min(doc.length(), Math.max(backwardStart, hint + text.length()));
        if (backwardStart < backwardEnd) {
            int backward = doc.substring(backwardStart, backwardEnd).lastIndexOf(text);
            if (backward != -1) {
                return backwardStart + backward;
            }
        }

        return doc.indexOf(text);
    }
}

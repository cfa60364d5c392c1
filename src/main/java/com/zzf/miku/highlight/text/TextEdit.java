package com.zzf.miku.highlight.text;

import lombok.Value;

/**
 * A single contiguous replacement: {@code deleteCount} characters at {@code offset} replaced by {@code insertText}.
 */
@Value
public class TextEdit {
    int offset;
    int deleteCount;
    String insertText;

    public TextEdit(int offset, int deleteCount, String insertText) {
        if (offset < 0 || deleteCount < 0) {
            throw new IllegalArgumentException("Edit offset and delete count must be non-negative, got offset="
                    + offset + " deleteCount=" + deleteCount);
        }
        if (insertText == null) {
            throw new IllegalArgumentException("Edit insert text must not be null");
        }
        this.offset = offset;
        this.deleteCount = deleteCount;
        this.insertText = insertText;
    }

    public int getInsertLength() {
        return insertText.length();
    }

    public int delta() {
        return insertText.length() - deleteCount;
    }

    public String applyTo(String text) {
        if (offset + deleteCount > text.length()) {
            throw new IllegalArgumentException("Edit [" + offset + ", " + (offset + deleteCount)
                    + ") is outside a document of length " + text.length());
        }
        return text.substring(0, offset) + insertText + text.substring(offset + deleteCount);
    }

    /**
     * Derives the one edit that turns {@code oldText} into {@code newText} by trimming the common
     * prefix and the common suffix. The suffix never reaches back into the prefix.
     *
     * @return the edit, or {@code null} when the texts are equal
     */
    public static TextEdit compute(String oldText, String newText) {
        if (oldText.equals(newText)) {
            return null;
        }
        int oldLen = oldText.length();
        int newLen = newText.length();
        int prefix = 0;
        int maxPrefix = Math.min(oldLen, newLen);
        while (prefix < maxPrefix && oldText.charAt(prefix) == newText.charAt(prefix)) {
            prefix++;
        }
        int suffix = 0;
        int maxSuffix = Math.min(oldLen - prefix, newLen - prefix);
        while (suffix < maxSuffix && oldText.charAt(oldLen - 1 - suffix) == newText.charAt(newLen - 1 - suffix)) {
            suffix++;
        }
        return new TextEdit(prefix, oldLen - prefix - suffix, newText.substring(prefix, newLen - suffix));
    }
}

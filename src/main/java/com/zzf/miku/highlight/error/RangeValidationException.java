package com.zzf.miku.highlight.error;

/**
 * Raised when an interval violates {@code 0 <= start <= end}, or when text at a range does not
 * match what a caller expected to find there.
 */
public class RangeValidationException extends HighlightException {
    private final int start;
    private final int end;
    private final String expectedText;
    private final String actualText;

    public RangeValidationException(String message, int start, int end) {
        this(message, start, end, null, null);
    }

    public RangeValidationException(String message, int start, int end, String expectedText, String actualText) {
        super(message);
        this.start = start;
        this.end = end;
        this.expectedText = expectedText;
        this.actualText = actualText;
    }

    @Override
    public String getCode() {
        return "RANGE_VALIDATION";
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getExpectedText() {
        return expectedText;
    }

    public String getActualText() {
        return actualText;
    }
}

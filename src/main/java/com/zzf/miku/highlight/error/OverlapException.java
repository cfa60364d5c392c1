package com.zzf.miku.highlight.error;

import com.zzf.miku.highlight.Range;

import java.util.List;

public class OverlapException extends HighlightException {
    private final Range newRange;
    private final List<Range> existingRanges;

    public OverlapException(String message, Range newRange, List<Range> existingRanges) {
        super(message);
        this.newRange = newRange;
        this.existingRanges = existingRanges == null ? List.of() : List.copyOf(existingRanges);
    }

    @Override
    public String getCode() {
        return "OVERLAP";
    }

    @Override
    public boolean isRecoverable() {
        return true;
    }

    public Range getNewRange() {
        return newRange;
    }

    public List<Range> getExistingRanges() {
        return existingRanges;
    }
}

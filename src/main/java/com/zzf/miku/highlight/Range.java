package com.zzf.miku.highlight;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.zzf.miku.highlight.error.RangeValidationException;

import java.util.Comparator;
import java.util.Objects;

/**
 * Immutable half-open character interval {@code [start, end)}.
 * <p>
 * Instances can only be obtained through {@link #of(int, int)}, which enforces
 * {@code start >= 0} and {@code end >= start}.
 */
public final class Range {
    public static final Comparator<Range> BY_START = Range::compareByStart;

    private final int start;
    private final int end;

    private Range(int start, int end) {
        this.start = start;
        this.end = end;
    }

    @JsonCreator
    public static Range of(@JsonProperty("start") int start, @JsonProperty("end") int end) {
        if (start < 0) {
            throw new RangeValidationException("Invalid range: start must be non-negative, got " + start, start, end);
        }
        if (end < start) {
            throw new RangeValidationException("Invalid range: end (" + end + ") must be >= start (" + start + ")", start, end);
        }
        return new Range(start, end);
    }

    public static boolean isValid(int start, int end) {
        return start >= 0 && end >= start;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Adjacent ranges ({@code [0,10)} and {@code [10,20)}) do not overlap.
     */
    public boolean overlaps(Range other) {
        return start < other.end && other.start < end;
    }

    public boolean contains(Range other) {
        return start <= other.start && end >= other.end;
    }

    public boolean containsPoint(int point) {
        return point >= start && point < end;
    }

    /**
     * Maps this range through a single text edit.
     *
     * @param editStart    offset where the edit begins
     * @param deleteCount  number of characters removed at {@code editStart}
     * @param insertLength number of characters inserted at {@code editStart}
     * @return the adjusted range, or {@code null} when the edit deleted the range
     */
    public Range applyEdit(int editStart, int deleteCount, int insertLength) {
        int editEnd = editStart + deleteCount;
        int delta = insertLength - deleteCount;

        if (end <= editStart) {
            return this;
        }
        if (start >= editEnd) {
            return delta == 0 ? this : Range.of(start + delta, end + delta);
        }
        if (start >= editStart && end <= editEnd) {
            return null;
        }
        if (start <= editStart && end >= editEnd) {
            return Range.of(start, end + delta);
        }
        if (start < editStart && end <= editEnd) {
            int newEnd = editStart;
            if (newEnd <= start) {
                return null;
            }
            return Range.of(start, newEnd);
        }
        if (start >= editStart && start < editEnd && end > editEnd) {
            int newStart = editStart + insertLength;
            int newEnd = end + delta;
            if (newEnd <= newStart) {
                return null;
            }
            return Range.of(newStart, newEnd);
        }
        return this;
    }

    /**
     * @return the shared span, or {@code null} when the ranges do not overlap
     */
    public Range intersection(Range other) {
        if (!overlaps(other)) {
            return null;
        }
        return Range.of(Math.max(start, other.start), Math.min(end, other.end));
    }

    /**
     * @return the covering span of two overlapping or adjacent ranges, otherwise {@code null}
     */
    public Range union(Range other) {
        if (end < other.start || other.end < start) {
            return null;
        }
        return Range.of(Math.min(start, other.start), Math.max(end, other.end));
    }

    public static int compareByStart(Range a, Range b) {
        return Integer.compare(a.start, b.start);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Range)) {
            return false;
        }
        Range other = (Range) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}

package com.zzf.miku.highlight;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RangePropertiesTest {

    @Property
    void editResultIsNullOrValid(@ForAll @IntRange(max = 200) int start, @ForAll @IntRange(max = 50) int length,
                                 @ForAll @IntRange(max = 250) int editStart, @ForAll @IntRange(max = 60) int deleteCount,
                                 @ForAll @IntRange(max = 60) int insertLength) {
        Range adjusted = Range.of(start, start + length).applyEdit(editStart, deleteCount, insertLength);
        if (adjusted != null) {
            assertTrue(adjusted.getStart() >= 0);
            assertTrue(adjusted.getEnd() >= adjusted.getStart());
        }
    }

    @Property
    void editAtOrAfterEndLeavesRangeUntouched(@ForAll @IntRange(max = 200) int start, @ForAll @IntRange(max = 50) int length,
                                              @ForAll @IntRange(max = 40) int gap, @ForAll @IntRange(max = 60) int deleteCount,
                                              @ForAll @IntRange(max = 60) int insertLength) {
        Range r = Range.of(start, start + length);
        assertSame(r, r.applyEdit(r.getEnd() + gap, deleteCount, insertLength));
    }

    @Property
    void insertionBeforeShiftsByInsertedLength(@ForAll @IntRange(min = 1, max = 200) int start,
                                               @ForAll @IntRange(max = 50) int length,
                                               @ForAll @IntRange(min = 1, max = 60) int insertLength) {
        Range r = Range.of(start, start + length);
        Range shifted = r.applyEdit(start - 1, 0, insertLength);
        assertEquals(Range.of(start + insertLength, start + length + insertLength), shifted);
    }

    @Property
    void overlapIsSymmetric(@ForAll @IntRange(max = 100) int a, @ForAll @IntRange(max = 30) int la,
                            @ForAll @IntRange(max = 100) int b, @ForAll @IntRange(max = 30) int lb) {
        Range x = Range.of(a, a + la);
        Range y = Range.of(b, b + lb);
        assertEquals(x.overlaps(y), y.overlaps(x));
        Range i = x.intersection(y);
        if (i != null) {
            assertTrue(x.contains(i) && y.contains(i));
        }
    }
}

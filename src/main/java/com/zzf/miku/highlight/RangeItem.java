package com.zzf.miku.highlight;

/**
 * Anything that can live in a {@link RangeIndex}: a stable id plus a span.
 * {@link #withRange(Range)} gives the index a way to rebuild an item after an edit moved it.
 */
public interface RangeItem<T extends RangeItem<T>> {

    String getId();

    Range getRange();

    T withRange(Range range);

    /**
     * Weight used by {@link OverlapStrategy#KEEP_HIGHER_PRIORITY}.
     */
    default int priorityWeight() {
        return HighlightPriority.MEDIUM.getWeight();
    }
}

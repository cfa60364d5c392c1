package com.zzf.miku.highlight;

public enum OverlapStrategy {
    /** Earliest input wins; later overlapping inputs are rejected. */
    KEEP_FIRST,
    /** A strictly higher priority evicts every active item it overlaps. Ties keep the incumbent. */
    KEEP_HIGHER_PRIORITY,
    REJECT_ALL
}

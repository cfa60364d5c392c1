package com.zzf.miku.highlight;

import java.util.List;
import java.util.Map;

public final class FromArrayResult<T extends RangeItem<T>> {
    private final RangeIndex<T> index;
    private final List<T> rejected;
    private final Map<String, List<String>> overlapGroups;

    public FromArrayResult(RangeIndex<T> index, List<T> rejected, Map<String, List<String>> overlapGroups) {
        this.index = index;
        this.rejected = List.copyOf(rejected);
        this.overlapGroups = Map.copyOf(overlapGroups);
    }

    public RangeIndex<T> getIndex() {
        return index;
    }

    public List<T> getRejected() {
        return rejected;
    }

    public Map<String, List<String>> getOverlapGroups() {
        return overlapGroups;
    }
}

package com.zzf.miku.highlight;

import com.zzf.miku.highlight.error.OverlapException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Immutable, overlap-free collection of ranged items keyed by id.
 * <p>
 * Items are kept sorted by {@code (start, end)}. Because no two stored ranges overlap, ends are
 * non-decreasing in that order as well, which is what lets {@link #queryPoint(int)} and
 * {@link #queryRange(Range)} binary search on either bound. Every mutator returns a new index.
 */
public final class RangeIndex<T extends RangeItem<T>> {
    private static final Comparator<RangeItem<?>> ORDER =
            Comparator.<RangeItem<?>>comparingInt(i -> i.getRange().getStart()).thenComparingInt(i -> i.getRange().getEnd());

    private final List<T> items;
    private final Map<String, Integer> idIndex;

    private RangeIndex(List<T> sortedItems) {
        this.items = Collections.unmodifiableList(sortedItems);
        Map<String, Integer> ids = new HashMap<>(sortedItems.size() * 2);
        for (int i = 0; i < sortedItems.size(); i++) {
            ids.put(sortedItems.get(i).getId(), i);
        }
        this.idIndex = ids;
    }

    public static <T extends RangeItem<T>> RangeIndex<T> empty() {
        return new RangeIndex<T>(new ArrayList<T>());
    }

    public static <T extends RangeItem<T>> FromArrayResult<T> fromArray(List<T> items) {
        return fromArray(items, OverlapStrategy.KEEP_FIRST);
    }

    /**
     * Bulk-builds an index, resolving overlaps with the given strategy.
     * <p>
     * {@link OverlapStrategy#KEEP_FIRST} walks the input in order and skips any item that overlaps an
     * already accepted one, so the earliest input always wins regardless of position.
     * {@link OverlapStrategy#KEEP_HIGHER_PRIORITY} sweeps by position and lets a strictly higher
     * priority evict the items it overlaps. {@link OverlapStrategy#REJECT_ALL} keeps only items that
     * overlap nothing else in the input. Items repeating an id already accepted are rejected.
     */
    public static <T extends RangeItem<T>> FromArrayResult<T> fromArray(List<T> items, OverlapStrategy strategy) {
        if (items == null || items.isEmpty()) {
            return new FromArrayResult<T>(RangeIndex.<T>empty(), List.<T>of(), Map.of());
        }
        Map<String, List<String>> overlapGroups = detectOverlaps(items);
        OverlapStrategy s = strategy == null ? OverlapStrategy.KEEP_FIRST : strategy;
        switch (s) {
            case KEEP_HIGHER_PRIORITY:
                return keepHigherPriority(items, overlapGroups);
            case REJECT_ALL:
                return rejectAll(items, overlapGroups);
            case KEEP_FIRST:
            default:
                return keepFirst(items, overlapGroups);
        }
    }

    private static <T extends RangeItem<T>> FromArrayResult<T> keepFirst(List<T> items, Map<String, List<String>> groups) {
        List<T> kept = new ArrayList<>();
        Set<String> keptIds = new HashSet<>();
        List<T> rejected = new ArrayList<>();
        for (T item : items) {
            if (keptIds.contains(item.getId()) || !queryRange(kept, item.getRange()).isEmpty()) {
                rejected.add(item);
                continue;
            }
            kept.add(insertionPoint(kept, item), item);
            keptIds.add(item.getId());
        }
        return new FromArrayResult<>(new RangeIndex<>(kept), rejected, groups);
    }

    private static <T extends RangeItem<T>> FromArrayResult<T> keepHigherPriority(List<T> items, Map<String, List<String>> groups) {
        List<SweepEvent<T>> events = sweepEvents(items);
        Map<Integer, T> active = new LinkedHashMap<>();
        Set<Integer> accepted = new HashSet<>();
        Set<String> acceptedIds = new HashSet<>();
        List<T> rejected = new ArrayList<>();
        for (SweepEvent<T> event : events) {
            if (!event.start) {
                active.remove(event.inputIndex);
                continue;
            }
            T item = event.item;
            if (acceptedIds.contains(item.getId())) {
                rejected.add(item);
                continue;
            }
            List<Integer> conflicting = new ArrayList<>();
            boolean outranked = false;
            for (Map.Entry<Integer, T> entry : active.entrySet()) {
                if (entry.getValue().getRange().overlaps(item.getRange())) {
                    conflicting.add(entry.getKey());
                    if (entry.getValue().priorityWeight() >= item.priorityWeight()) {
                        outranked = true;
                    }
                }
            }
            if (outranked) {
                rejected.add(item);
                continue;
            }
            for (Integer idx : conflicting) {
                T evicted = active.remove(idx);
                accepted.remove(idx);
                acceptedIds.remove(evicted.getId());
                rejected.add(evicted);
            }
            active.put(event.inputIndex, item);
            accepted.add(event.inputIndex);
            acceptedIds.add(item.getId());
        }
        List<T> kept = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            if (accepted.contains(i)) {
                kept.add(items.get(i));
            }
        }
        kept.sort(ORDER);
        return new FromArrayResult<>(new RangeIndex<>(kept), rejected, groups);
    }

    private static <T extends RangeItem<T>> FromArrayResult<T> rejectAll(List<T> items, Map<String, List<String>> groups) {
        List<T> kept = new ArrayList<>();
        Set<String> keptIds = new HashSet<>();
        List<T> rejected = new ArrayList<>();
        for (T item : items) {
            if (groups.containsKey(item.getId()) || keptIds.contains(item.getId())) {
                rejected.add(item);
            } else {
                kept.add(item);
                keptIds.add(item.getId());
            }
        }
        kept.sort(ORDER);
        return new FromArrayResult<>(new RangeIndex<>(kept), rejected, groups);
    }

    /**
     * Finds every overlapping pair in the input with a position sweep.
     *
     * @return id to the ids it overlaps, containing only ids that overlap something
     */
    public static <T extends RangeItem<T>> Map<String, List<String>> detectOverlaps(List<T> items) {
        Map<String, List<String>> overlaps = new LinkedHashMap<>();
        if (items == null || items.size() < 2) {
            return overlaps;
        }
        Map<Integer, T> active = new LinkedHashMap<>();
        for (SweepEvent<T> event : sweepEvents(items)) {
            if (!event.start) {
                active.remove(event.inputIndex);
                continue;
            }
            for (T other : active.values()) {
                if (other.getRange().overlaps(event.item.getRange())) {
                    overlaps.computeIfAbsent(event.item.getId(), k -> new ArrayList<>()).add(other.getId());
                    overlaps.computeIfAbsent(other.getId(), k -> new ArrayList<>()).add(event.item.getId());
                }
            }
            active.put(event.inputIndex, event.item);
        }
        return overlaps;
    }

    // Ends sort before starts at the same position so adjacent ranges never meet in the active set.
    // An empty range emits its start before its own end.
    private static <T extends RangeItem<T>> List<SweepEvent<T>> sweepEvents(List<T> items) {
        List<SweepEvent<T>> events = new ArrayList<>(items.size() * 2);
        for (int i = 0; i < items.size(); i++) {
            T item = items.get(i);
            events.add(new SweepEvent<>(item.getRange().getStart(), true, item, i));
            events.add(new SweepEvent<>(item.getRange().getEnd(), false, item, i));
        }
        events.sort((a, b) -> {
            if (a.pos != b.pos) {
                return Integer.compare(a.pos, b.pos);
            }
            if (a.inputIndex == b.inputIndex) {
                return a.start ? -1 : 1;
            }
            if (a.start != b.start) {
                return a.start ? 1 : -1;
            }
            return Integer.compare(a.inputIndex, b.inputIndex);
        });
        return events;
    }

    public T get(String id) {
        Integer idx = id == null ? null : idIndex.get(id);
        return idx == null ? null : items.get(idx);
    }

    public boolean has(String id) {
        return id != null && idIndex.containsKey(id);
    }

    /**
     * @return items sorted by start, unmodifiable
     */
    public List<T> getAll() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public List<String> getIds() {
        return items.stream().map(RangeItem::getId).collect(Collectors.toList());
    }

    /**
     * @return a new index with {@code item} inserted
     * @throws OverlapException when the item overlaps a stored one
     * @throws IllegalArgumentException when the id is already stored
     */
    public RangeIndex<T> add(T item) {
        List<T> overlapping = queryRange(item.getRange());
        if (!overlapping.isEmpty()) {
            throw new OverlapException(
                    "Cannot add item " + item.getId() + ": overlaps with "
                            + overlapping.stream().map(RangeItem::getId).collect(Collectors.joining(", ")),
                    item.getRange(),
                    overlapping.stream().map(RangeItem::getRange).collect(Collectors.toList()));
        }
        if (has(item.getId())) {
            throw new IllegalArgumentException("Duplicate id: " + item.getId());
        }
        List<T> next = new ArrayList<>(items);
        next.add(insertionPoint(items, item), item);
        return new RangeIndex<>(next);
    }

    /**
     * @return a new index without {@code id}, or this instance when the id is absent
     */
    public RangeIndex<T> delete(String id) {
        Integer idx = id == null ? null : idIndex.get(id);
        if (idx == null) {
            return this;
        }
        List<T> next = new ArrayList<>(items);
        next.remove((int) idx);
        return new RangeIndex<>(next);
    }

    public List<T> queryPoint(int point) {
        if (items.isEmpty()) {
            return List.of();
        }
        int left = 0;
        int right = items.size() - 1;
        int startIdx = -1;
        while (left <= right) {
            int mid = (left + right) >>> 1;
            if (items.get(mid).getRange().getStart() <= point) {
                startIdx = mid;
                left = mid + 1;
            } else {
                right = mid - 1;
            }
        }
        if (startIdx < 0) {
            return List.of();
        }
        List<T> results = new ArrayList<>();
        for (int i = startIdx; i >= 0; i--) {
            T item = items.get(i);
            if (item.getRange().getEnd() <= point) {
                break;
            }
            if (item.getRange().containsPoint(point)) {
                results.add(0, item);
            }
        }
        return results;
    }

    public List<T> queryRange(Range range) {
        return queryRange(items, range);
    }

    private static <T extends RangeItem<T>> List<T> queryRange(List<T> sorted, Range range) {
        if (sorted.isEmpty()) {
            return List.of();
        }
        int left = 0;
        int right = sorted.size() - 1;
        while (left <= right) {
            int mid = (left + right) >>> 1;
            if (sorted.get(mid).getRange().getEnd() <= range.getStart()) {
                left = mid + 1;
            } else {
                right = mid - 1;
            }
        }
        List<T> results = new ArrayList<>();
        for (int i = left; i < sorted.size(); i++) {
            T item = sorted.get(i);
            if (item.getRange().getStart() >= range.getEnd()) {
                break;
            }
            if (item.getRange().overlaps(range)) {
                results.add(item);
            }
        }
        return results;
    }

    public List<String> wouldOverlap(Range range) {
        return queryRange(range).stream().map(RangeItem::getId).collect(Collectors.toList());
    }

    /**
     * Maps every stored range through {@link Range#applyEdit(int, int, int)} and drops the ones
     * the edit deleted. Relative order is preserved.
     */
    public RangeIndex<T> applyEdit(int editStart, int deleteCount, int insertLength) {
        List<T> next = new ArrayList<>(items.size());
        for (T item : items) {
            Range moved = item.getRange().applyEdit(editStart, deleteCount, insertLength);
            if (moved == null) {
                continue;
            }
            next.add(moved.equals(item.getRange()) ? item : item.withRange(moved));
        }
        next.sort(ORDER);
        return new RangeIndex<>(next);
    }

    public RangeIndex<T> filter(Predicate<? super T> predicate) {
        return new RangeIndex<>(items.stream().filter(predicate).collect(Collectors.toCollection(ArrayList::new)));
    }

    public RangeIndex<T> copy() {
        return new RangeIndex<>(new ArrayList<>(items));
    }

    private static <T extends RangeItem<T>> int insertionPoint(List<T> sorted, T item) {
        int pos = 0;
        while (pos < sorted.size() && ORDER.compare(sorted.get(pos), item) < 0) {
            pos++;
        }
        return pos;
    }

    @Override
    public String toString() {
        return "RangeIndex" + items.stream().map(i -> i.getId() + i.getRange()).collect(Collectors.toList());
    }

    private static final class SweepEvent<T> {
        private final int pos;
        private final boolean start;
        private final T item;
        private final int inputIndex;

        private SweepEvent(int pos, boolean start, T item, int inputIndex) {
            this.pos = pos;
            this.start = start;
            this.item = item;
            this.inputIndex = inputIndex;
        }
    }
}

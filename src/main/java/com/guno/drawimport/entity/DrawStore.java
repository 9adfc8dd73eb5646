package com.guno.drawimport.entity;

import com.guno.drawimport.util.PeriodOrder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable period -> record mapping, ascending by numeric period. Only the reconciler
 * produces changed copies; nothing ever removes a period.
 */
public final class DrawStore {

    private static final DrawStore EMPTY = new DrawStore(new TreeMap<>(PeriodOrder.ASCENDING));

    private final SortedMap<String, DrawRecord> records;

    private DrawStore(SortedMap<String, DrawRecord> records) {
        this.records = Collections.unmodifiableSortedMap(records);
    }

    public static DrawStore empty() {
        return EMPTY;
    }

    /**
     * Build from records in the given order. A later record for an already seen period is kept
     * only when it is complete and the earlier one is not.
     */
    public static DrawStore of(Collection<DrawRecord> records) {
        TreeMap<String, DrawRecord> map = new TreeMap<>(PeriodOrder.ASCENDING);
        for (DrawRecord r : records) {
            DrawRecord prev = map.get(r.getPeriod());
            if (prev == null || (!prev.isComplete() && r.isComplete())) {
                map.put(r.getPeriod(), r);
            }
        }
        return new DrawStore(map);
    }

    public Optional<DrawRecord> get(String period) {
        return Optional.ofNullable(records.get(period));
    }

    public boolean contains(String period) {
        return records.containsKey(period);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Records in ascending period order.
     */
    public List<DrawRecord> toList() {
        return new ArrayList<>(records.values());
    }

    public Optional<String> maxPeriod() {
        return records.isEmpty() ? Optional.empty() : Optional.of(records.lastKey());
    }

    /**
     * Mutable copy for the reconciler, same ordering.
     */
    public TreeMap<String, DrawRecord> mutableCopy() {
        return new TreeMap<>(records);
    }

    public static DrawStore fromSorted(TreeMap<String, DrawRecord> records) {
        TreeMap<String, DrawRecord> copy = new TreeMap<>(PeriodOrder.ASCENDING);
        copy.putAll(records);
        return new DrawStore(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DrawStore)) return false;
        return records.equals(((DrawStore) o).records);
    }

    @Override
    public int hashCode() {
        return records.hashCode();
    }

    @Override
    public String toString() {
        return "DrawStore[size=" + records.size() + ", max=" + maxPeriod().orElse("-") + "]";
    }
}

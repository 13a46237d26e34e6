package com.example.tiltbatch.metadata;

import com.example.tiltbatch.WorkItem;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Immutable record of completed work items, keyed by output path. Rows keep their insertion order
 * and no two rows share an output path; the first occurrence wins.
 */
public final class DoneTable {
    private static final DoneTable EMPTY = new DoneTable(Map.of());

    private final Map<String, DoneRecord> rows;

    private DoneTable(Map<String, DoneRecord> rows) {
        this.rows = rows;
    }

    public static DoneTable empty() {
        return EMPTY;
    }

    /**
     * Builds a table from possibly duplicated rows.
     */
    public static DoneTable of(Collection<DoneRecord> records) {
        Map<String, DoneRecord> deduplicated = new LinkedHashMap<>();
        for (DoneRecord record : records) {
            deduplicated.putIfAbsent(record.output(), record);
        }
        return new DoneTable(deduplicated);
    }

    public DoneTable append(DoneRecord record) {
        if (rows.containsKey(record.output())) {
            return this;
        }
        Map<String, DoneRecord> next = new LinkedHashMap<>(rows);
        next.put(record.output(), record);
        return new DoneTable(next);
    }

    public DoneTable append(WorkItem item) {
        return append(DoneRecord.from(item));
    }

    /**
     * Returns a table without the rows matching the predicate.
     */
    public DoneTable remove(Predicate<DoneRecord> predicate) {
        Map<String, DoneRecord> next = new LinkedHashMap<>();
        rows.forEach((output, record) -> {
            if (!predicate.test(record)) {
                next.put(output, record);
            }
        });
        return next.size() == rows.size() ? this : new DoneTable(next);
    }

    public boolean contains(String output) {
        return rows.containsKey(output);
    }

    public boolean contains(WorkItem item) {
        return contains(item.outputKey());
    }

    public List<DoneRecord> records() {
        return List.copyOf(rows.values());
    }

    public List<DoneRecord> recordsForSeries(int seriesId) {
        List<DoneRecord> matching = new ArrayList<>();
        for (DoneRecord record : rows.values()) {
            if (record.seriesId() == seriesId) {
                matching.add(record);
            }
        }
        return matching;
    }

    public SortedSet<Integer> seriesIds() {
        SortedSet<Integer> ids = new TreeSet<>();
        rows.values().forEach(record -> ids.add(record.seriesId()));
        return ids;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DoneTable that)) {
            return false;
        }
        return records().equals(that.records());
    }

    @Override
    public int hashCode() {
        return records().hashCode();
    }

    @Override
    public String toString() {
        return "DoneTable" + rows.keySet();
    }
}

package com.example.tiltbatch.metadata;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk layout of a done table: one list per column, row {@code i} spread across index {@code i}.
 */
public record DoneTableDocument(
        @JsonProperty("output") List<String> output,
        @JsonProperty("ts") List<Integer> seriesIds,
        @JsonProperty("sub_index") List<Integer> subIndices,
        @JsonProperty("sources") List<List<String>> sources
) {
    public static DoneTableDocument from(DoneTable table) {
        List<String> output = new ArrayList<>();
        List<Integer> seriesIds = new ArrayList<>();
        List<Integer> subIndices = new ArrayList<>();
        List<List<String>> sources = new ArrayList<>();
        for (DoneRecord record : table.records()) {
            output.add(record.output());
            seriesIds.add(record.seriesId());
            subIndices.add(record.subIndex());
            sources.add(record.sources());
        }
        return new DoneTableDocument(output, seriesIds, subIndices, sources);
    }

    /**
     * Zips the columns back into rows.
     *
     * @throws IllegalStateException if the columns disagree in length or a key column holds a null
     */
    public List<DoneRecord> toRecords() {
        List<String> outputs = orEmpty(output);
        List<Integer> series = orEmpty(seriesIds);
        List<Integer> subs = orEmpty(subIndices);
        int size = outputs.size();
        if (series.size() != size || subs.size() != size || (sources != null && sources.size() != size)) {
            throw new IllegalStateException("Done table columns have different lengths.");
        }
        List<DoneRecord> records = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            if (outputs.get(i) == null || series.get(i) == null || subs.get(i) == null) {
                throw new IllegalStateException("Done table row " + i + " is incomplete.");
            }
            records.add(new DoneRecord(
                    outputs.get(i),
                    series.get(i),
                    subs.get(i),
                    sources == null ? List.of() : sources.get(i)
            ));
        }
        return records;
    }

    private static <T> List<T> orEmpty(List<T> column) {
        return column == null ? List.of() : column;
    }
}

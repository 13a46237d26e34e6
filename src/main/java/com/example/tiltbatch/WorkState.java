package com.example.tiltbatch;

import com.example.tiltbatch.metadata.DoneTable;

import java.util.List;

/**
 * Pending items and done table at one observable point of a stage. No item of {@code pending}
 * has its output in {@code done}.
 */
public record WorkState(
        List<WorkItem> pending,
        DoneTable done
) {
    public WorkState {
        pending = List.copyOf(pending);
    }
}

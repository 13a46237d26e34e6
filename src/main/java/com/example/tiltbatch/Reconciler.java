package com.example.tiltbatch;

import com.example.tiltbatch.metadata.DoneRecord;
import com.example.tiltbatch.metadata.DoneTable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Derives the authoritative pending list of a stage from its scope, its done table and what
 * exists on disk. Both operations are pure: they return new values and never touch the inputs.
 */
public final class Reconciler {
    private final Predicate<Path> exists;

    /**
     * @param exists filesystem existence check over output paths
     */
    public Reconciler(Predicate<Path> exists) {
        this.exists = exists;
    }

    /**
     * Reconciles candidates against the done table.
     *
     * <p>Done rows whose output is missing are reinstated only when their series is in scope;
     * rows of other series stay recorded even if their file is gone.
     *
     * <p>Adopted outputs are done like recorded ones, so a stage whose every candidate was found on
     * disk reports {@code ALL_DONE} even when its table was empty before.
     */
    public ReconcileResult reconcile(ScopeSpecification scope, DoneTable previous, List<WorkItem> candidates) {
        DoneTable done = DoneTable.of(previous.records());

        DoneTable afterReinstatement = done.remove(record ->
                scope.contains(record.seriesId()) && !exists.test(record.outputPath()));
        int reinstated = done.size() - afterReinstatement.size();
        done = afterReinstatement;

        List<WorkItem> scoped = candidates.stream()
                .filter(item -> scope.contains(item.seriesId()))
                .sorted(WorkItem.ORDER)
                .toList();

        List<WorkItem> pending = new ArrayList<>();
        int skipped = 0;
        int adopted = 0;
        for (WorkItem item : scoped) {
            if (done.contains(item)) {
                skipped++;
            } else if (exists.test(item.output())) {
                done = done.append(item);
                adopted++;
            } else {
                pending.add(item);
            }
        }

        ReconcileResult.Status status;
        if (scoped.isEmpty()) {
            status = ReconcileResult.Status.NOTHING_DECLARED;
        } else if (pending.isEmpty()) {
            status = ReconcileResult.Status.ALL_DONE;
        } else {
            status = ReconcileResult.Status.WORK_PENDING;
        }
        return new ReconcileResult(new WorkState(pending, done), reinstated, skipped, adopted, status);
    }

    /**
     * Moves a single item from pending to done if its output now exists; otherwise returns the
     * state unchanged.
     */
    public WorkState settle(WorkState state, WorkItem item) {
        if (!exists.test(item.output())) {
            return state;
        }
        String key = item.outputKey();
        List<WorkItem> pending = state.pending().stream()
                .filter(candidate -> !candidate.outputKey().equals(key))
                .toList();
        return new WorkState(pending, state.done().append(DoneRecord.from(item)));
    }
}

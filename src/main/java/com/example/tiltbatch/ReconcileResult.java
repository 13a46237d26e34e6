package com.example.tiltbatch;

/**
 * Outcome of reconciling one stage.
 *
 * @param state      pending list and updated done table
 * @param reinstated done rows dropped because their in-scope output vanished
 * @param skipped    candidates left out because they are already recorded as done
 * @param adopted    candidates recorded as done because their output already existed
 * @param status     whether there is anything to dispatch
 */
public record ReconcileResult(
        WorkState state,
        int reinstated,
        int skipped,
        int adopted,
        Status status
) {
    public enum Status {
        /** At least one item has to run. */
        WORK_PENDING,
        /** Every in-scope item is already done. */
        ALL_DONE,
        /** The scope selects no candidate at all. */
        NOTHING_DECLARED
    }

    public boolean shouldDispatch() {
        return status == Status.WORK_PENDING;
    }
}

package com.example.tiltbatch.stage;

import com.example.tiltbatch.DataIntegrityException;
import com.example.tiltbatch.ScopeSpecification;
import com.example.tiltbatch.WorkItem;
import com.example.tiltbatch.metadata.DoneTable;

import java.io.IOException;
import java.util.List;

/**
 * One reconcile-then-dispatch round of the pipeline.
 */
public interface Stage {
    /**
     * Name used in logs, errors and on the command line.
     */
    String name();

    /**
     * Suffix of the stage's done table file, {@code <project>_<suffix>_mdout.json}.
     */
    String tableSuffix();

    /**
     * Builds every candidate item of the given series.
     *
     * @param scope    resolved scope of this stage
     * @param upstream done table of the previous stage, empty for the first stage
     * @throws DataIntegrityException if an item's identity cannot be derived
     */
    List<WorkItem> candidates(ScopeSpecification scope, DoneTable upstream) throws DataIntegrityException;

    /**
     * Returns the argument list for one assigned item. May write the auxiliary files the tool
     * reads; it is always called from the controlling thread.
     */
    List<String> command(WorkItem item) throws IOException;
}

package com.example.tiltbatch;

import com.example.tiltbatch.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one external invocation per pending item in chunks of bounded size.
 *
 * <p>All items of a chunk are launched in order, then harvested in the same order regardless of
 * which process finishes first. Every successful harvest is checkpointed before the next one, and
 * the next chunk starts only after the whole chunk was harvested. The first failed harvest aborts
 * the round: nothing else is started, and processes already running in the chunk are left alone.
 */
public final class JobDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobDispatcher.class);

    private final CommandRunner runner;
    private final Reconciler reconciler;
    private final MetadataStore store;

    public JobDispatcher(CommandRunner runner, Reconciler reconciler, MetadataStore store) {
        this.runner = runner;
        this.reconciler = reconciler;
        this.store = store;
    }

    /**
     * Dispatches the assigned items.
     *
     * @param stage       stage building each item's command
     * @param state       reconciled state the items came from
     * @param assigned    pending items in launch order, bound to devices
     * @param concurrency maximum chunk size
     * @throws ExternalToolException if an invocation fails; the done table keeps every item
     *                               harvested before it
     */
    public DispatchReport dispatch(Stage stage, WorkState state, List<WorkItem> assigned, int concurrency)
            throws ExternalToolException, IOException, InterruptedException {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be positive, got " + concurrency);
        }
        WorkState current = state;
        int chunks = 0;
        int launched = 0;
        int completed = 0;
        int unconfirmed = 0;
        int totalChunks = (assigned.size() + concurrency - 1) / concurrency;

        for (int from = 0; from < assigned.size(); from += concurrency) {
            List<WorkItem> chunk = assigned.subList(from, Math.min(from + concurrency, assigned.size()));
            chunks++;
            LOGGER.info("[{}] Chunk {}/{}: launching {} item(s)", stage.name(), chunks, totalChunks, chunk.size());

            List<Launch> launches = launch(stage, chunk);
            launched += (int) launches.stream().filter(Launch::started).count();

            for (Launch launch : launches) {
                CommandResult result = launch.handle().await();
                WorkItem item = launch.item();
                if (result.failed()) {
                    LOGGER.error("[{}] Series {} item {} failed on device {}",
                            stage.name(), item.seriesId(), item.subIndex(), item.deviceId());
                    throw new ExternalToolException(stage.name(), item, result);
                }
                WorkState settled = reconciler.settle(current, item);
                if (settled == current) {
                    unconfirmed++;
                    LOGGER.warn("[{}] Tool finished for series {} item {} but {} is missing; it stays pending.",
                            stage.name(), item.seriesId(), item.subIndex(), item.output());
                    continue;
                }
                current = settled;
                store.save(current.done());
                completed++;
            }
        }
        return new DispatchReport(current, chunks, launched, completed, unconfirmed);
    }

    /**
     * Starts the chunk's invocations in order. Failing to prepare or start an item ends the
     * launching; the failure is reported when its turn to be harvested comes, after the items
     * launched before it.
     */
    private List<Launch> launch(Stage stage, List<WorkItem> chunk) {
        List<Launch> launches = new ArrayList<>(chunk.size());
        for (WorkItem item : chunk) {
            List<String> command;
            try {
                command = stage.command(item);
            } catch (IOException ex) {
                launches.add(notStarted(item, "Failed to prepare " + item.output() + ": " + ex.getMessage()));
                break;
            }
            try {
                launches.add(new Launch(item, runner.start(command), true));
            } catch (IOException ex) {
                launches.add(notStarted(item, "Failed to start " + command.get(0) + ": " + ex.getMessage()));
                break;
            }
        }
        return launches;
    }

    private static Launch notStarted(WorkItem item, String reason) {
        CommandResult failure = new CommandResult(-1, "", reason);
        return new Launch(item, () -> failure, false);
    }

    private record Launch(WorkItem item, CommandRunner.RunningCommand handle, boolean started) {
    }
}

package com.example.tiltbatch;

import com.example.tiltbatch.metadata.DoneTable;
import com.example.tiltbatch.metadata.MasterMetadata;
import com.example.tiltbatch.stage.AlignStage;
import com.example.tiltbatch.stage.MotionCorrStage;
import com.example.tiltbatch.stage.Stage;
import com.example.tiltbatch.stage.StackStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Runs the stages in pipeline order. Each stage reconciles its own done table, then dispatches
 * what is pending over the devices that are free at that moment.
 *
 * <p>The first stage is scoped by the configured process list. Every later stage is scoped to the
 * series its predecessor has completed and it has not.
 */
public final class PipelineRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineRunner.class);

    private final PipelineConfig config;
    private final MasterMetadata master;
    private final List<Stage> stages;
    private final CommandRunner commandRunner;
    private final DeviceQuery deviceQuery;
    private final CheckpointMirror mirror;
    private final Reconciler reconciler;

    public PipelineRunner(PipelineConfig config,
                          MasterMetadata master,
                          CommandRunner commandRunner,
                          DeviceQuery deviceQuery,
                          CheckpointMirror mirror) {
        this(config, master, defaultStages(config, master), commandRunner, deviceQuery, mirror, Files::isRegularFile);
    }

    PipelineRunner(PipelineConfig config,
                   MasterMetadata master,
                   List<Stage> stages,
                   CommandRunner commandRunner,
                   DeviceQuery deviceQuery,
                   CheckpointMirror mirror,
                   Predicate<Path> exists) {
        this.config = config;
        this.master = master;
        this.stages = List.copyOf(stages);
        this.commandRunner = commandRunner;
        this.deviceQuery = deviceQuery;
        this.mirror = mirror == null ? CheckpointMirror.NONE : mirror;
        this.reconciler = new Reconciler(exists);
    }

    /**
     * The motion correction, stacking and alignment stages, in that order.
     */
    public static List<Stage> defaultStages(PipelineConfig config, MasterMetadata master) {
        return List.of(
                new MotionCorrStage(master, config.motionCorr()),
                new StackStage(master, config.newstackExecutable(), config.seriesLayout()),
                new AlignStage(config.align(), config.seriesLayout())
        );
    }

    public List<String> stageNames() {
        return stages.stream().map(Stage::name).toList();
    }

    /**
     * Runs every stage.
     */
    public List<StageOutcome> run() throws PipelineException, IOException, InterruptedException {
        return run(List.of());
    }

    /**
     * Runs the named stages, or all of them when no name is given. Unselected stages still
     * provide their done table to the stage after them.
     *
     * @throws ConfigurationException if a name matches no stage
     */
    public List<StageOutcome> run(Collection<String> selected) throws PipelineException, IOException, InterruptedException {
        for (String name : selected) {
            if (!stageNames().contains(name)) {
                throw new ConfigurationException("Unknown stage " + name + "; expected one of " + stageNames());
            }
        }

        List<StageOutcome> outcomes = new ArrayList<>();
        DoneTable upstream = DoneTable.empty();
        for (int index = 0; index < stages.size(); index++) {
            Stage stage = stages.get(index);
            MetadataStore store = new MetadataStore(config.doneTablePath(stage.tableSuffix()), mirror);
            DoneTable done = store.load();
            if (!selected.isEmpty() && !selected.contains(stage.name())) {
                upstream = done;
                continue;
            }
            ScopeSpecification scope = index == 0
                    ? config.scope().resolve(master.knownSeries())
                    : deriveScope(upstream, done);
            StageOutcome outcome = runStage(stage, store, scope, done, upstream);
            outcomes.add(outcome);
            upstream = outcome.dispatch()
                    .map(report -> report.state().done())
                    .orElse(outcome.reconcile().state().done());
        }
        return outcomes;
    }

    private StageOutcome runStage(Stage stage,
                                  MetadataStore store,
                                  ScopeSpecification scope,
                                  DoneTable done,
                                  DoneTable upstream)
            throws PipelineException, IOException, InterruptedException {
        LOGGER.info("[{}] Reconciling series {}", stage.name(), scope);
        List<WorkItem> candidates = stage.candidates(scope, upstream);
        ReconcileResult result = reconciler.reconcile(scope, done, candidates);

        if (result.reinstated() > 0) {
            LOGGER.info("[{}] {} item(s) in record missing in folder. Will be added back for processing.",
                    stage.name(), result.reinstated());
        }
        if (result.adopted() > 0) {
            LOGGER.info("[{}] {} item(s) found on disk without a record. Recorded as done.",
                    stage.name(), result.adopted());
        }
        if (result.reinstated() > 0 || result.adopted() > 0) {
            store.save(result.state().done());
        }

        switch (result.status()) {
            case NOTHING_DECLARED -> {
                LOGGER.info("[{}] No item declared in scope. Nothing will be done.", stage.name());
                return new StageOutcome(stage.name(), scope, result, Optional.empty());
            }
            case ALL_DONE -> {
                LOGGER.info("[{}] All specified items had been processed. Nothing will be done.", stage.name());
                return new StageOutcome(stage.name(), scope, result, Optional.empty());
            }
            default -> {
                if (result.skipped() > 0) {
                    LOGGER.info("[{}] {} item(s) had been processed and will be omitted.", stage.name(), result.skipped());
                }
            }
        }

        WorkState state = result.state();
        ResourcePool pool = ResourcePool.discover(deviceQuery);
        List<WorkItem> assigned = pool.assign(state.pending());
        int concurrency = pool.concurrency(config.jobsPerDevice());
        LOGGER.info("[{}] Dispatching {} item(s), {} at a time", stage.name(), assigned.size(), concurrency);

        JobDispatcher dispatcher = new JobDispatcher(commandRunner, reconciler, store);
        DispatchReport report = dispatcher.dispatch(stage, state, assigned, concurrency);
        LOGGER.info("[{}] Completed {} item(s) in {} chunk(s); {} still pending.",
                stage.name(), report.completed(), report.chunks(), report.state().pending().size());
        return new StageOutcome(stage.name(), scope, result, Optional.of(report));
    }

    /**
     * Series the previous stage completed that this stage has not.
     */
    static ScopeSpecification deriveScope(DoneTable upstream, DoneTable own) {
        SortedSet<Integer> series = new TreeSet<>(upstream.seriesIds());
        Set<Integer> finished = own.seriesIds();
        series.removeAll(finished);
        return ScopeSpecification.of(series);
    }
}

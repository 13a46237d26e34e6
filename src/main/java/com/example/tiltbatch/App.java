package com.example.tiltbatch;

import com.example.tiltbatch.metadata.MasterMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) {
        int status = execute(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs one command line and returns the process exit status.
     */
    static int execute(String[] args) {
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar tilt-batch.jar <config.json> [run [stage...] | cleanup]");
            return 1;
        }
        Path configPath = Path.of(args[0]);
        String command = args.length > 1 ? args[1] : "run";
        try {
            PipelineConfig config = new ConfigLoader().load(configPath);
            switch (command) {
                case "run" -> run(config, Arrays.asList(args).subList(Math.min(2, args.length), args.length));
                case "cleanup" -> new Cleanup(config).run();
                default -> {
                    LOGGER.error("Unknown command {}; expected run or cleanup", command);
                    return 1;
                }
            }
            return 0;
        } catch (PipelineException ex) {
            LOGGER.error("{}: {}", ex.getClass().getSimpleName(), ex.getMessage());
            return 1;
        } catch (IOException ex) {
            LOGGER.error("I/O failure: {}", ex.getMessage(), ex);
            return 1;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.error("Interrupted while waiting for an external tool.", ex);
            return 1;
        }
    }

    private static void run(PipelineConfig config, List<String> stages)
            throws PipelineException, IOException, InterruptedException {
        MasterMetadata master = new MasterMetadataLoader().load(config.masterMetadataPath());
        CheckpointMirror mirror = CheckpointMirror.NONE;
        if (config.s3SyncEnabled()) {
            mirror = new S3CheckpointMirror(
                    config.workDirectory(),
                    config.s3Bucket().orElseThrow(),
                    config.s3Prefix().orElse(""),
                    config.s3Region()
            );
        }
        try {
            CommandRunner commandRunner = new ProcessCommandRunner(config.workDirectory());
            PipelineRunner runner = new PipelineRunner(
                    config,
                    master,
                    commandRunner,
                    new NvidiaSmiDeviceQuery(commandRunner, config.deviceQueryExecutable()),
                    mirror
            );
            runner.run(stages);
            LOGGER.info("Pipeline run completed.");
        } finally {
            mirror.close();
        }
    }
}

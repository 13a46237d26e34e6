package com.example.tiltbatch;

/**
 * An external tool exited non-zero or wrote to its error stream.
 */
public class ExternalToolException extends PipelineException {
    private static final long serialVersionUID = 1L;

    private final String stage;
    private final transient WorkItem item;
    private final transient CommandResult result;

    public ExternalToolException(String stage, WorkItem item, CommandResult result) {
        super(describe(stage, item, result));
        this.stage = stage;
        this.item = item;
        this.result = result;
    }

    public String stage() {
        return stage;
    }

    public WorkItem item() {
        return item;
    }

    public CommandResult result() {
        return result;
    }

    private static String describe(String stage, WorkItem item, CommandResult result) {
        StringBuilder builder = new StringBuilder()
                .append("Stage ").append(stage)
                .append(": tool failed for series ").append(item.seriesId())
                .append(" item ").append(item.subIndex())
                .append(" on device ").append(item.deviceId())
                .append(" (exit ").append(result.exitCode()).append(")");
        if (!result.stdout().isBlank()) {
            builder.append("\nstdout:\n").append(result.stdout().strip());
        }
        if (!result.stderr().isBlank()) {
            builder.append("\nstderr:\n").append(result.stderr().strip());
        }
        return builder.toString();
    }
}

package com.example.tiltbatch;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Queries GPUs through {@code nvidia-smi}.
 */
public final class NvidiaSmiDeviceQuery implements DeviceQuery {
    private final CommandRunner runner;
    private final String executable;

    public NvidiaSmiDeviceQuery(CommandRunner runner, String executable) {
        this.runner = runner;
        this.executable = executable;
    }

    @Override
    public String listDevices() throws ResourceUnavailableException {
        return query("--list-gpus");
    }

    @Override
    public String listBusyDevices() throws ResourceUnavailableException {
        return query("--query-compute-apps=gpu_uuid", "--format=csv");
    }

    private String query(String... arguments) throws ResourceUnavailableException {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(List.of(arguments));
        CommandResult result;
        try {
            result = runner.run(command);
        } catch (IOException ex) {
            throw new ResourceUnavailableException("Failed to run " + executable, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ResourceUnavailableException("Interrupted while querying devices", ex);
        }
        if (result.exitCode() != 0) {
            throw new ResourceUnavailableException(executable + " returned an error (exit "
                    + result.exitCode() + "): " + result.stderr().strip());
        }
        return result.stdout();
    }
}

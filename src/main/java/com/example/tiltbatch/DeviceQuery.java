package com.example.tiltbatch;

/**
 * The two textual device enumerations the resource pool is built from.
 */
public interface DeviceQuery {
    /**
     * Lists every device, one per line, as {@code GPU <id>: <name> (UUID: <uuid>)}.
     */
    String listDevices() throws ResourceUnavailableException;

    /**
     * Lists the UUIDs of devices hosting a compute process, one per line after a header line.
     */
    String listBusyDevices() throws ResourceUnavailableException;
}

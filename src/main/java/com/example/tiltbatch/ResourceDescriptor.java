package com.example.tiltbatch;

/**
 * A compute device and whether any process on the machine currently runs a job on it.
 */
public record ResourceDescriptor(
        String deviceId,
        String uuid,
        boolean busy
) {
}

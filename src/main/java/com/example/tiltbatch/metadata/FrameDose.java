package com.example.tiltbatch.metadata;

/**
 * Frame integration details of one movie, present when the acquisition mdoc was read.
 */
public record FrameDose(
        int numFrames,
        int dsFactor,
        double dosePerFrame
) {
}

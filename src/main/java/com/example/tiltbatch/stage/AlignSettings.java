package com.example.tiltbatch.stage;

import java.util.List;

/**
 * batchruntomo alignment settings, rendered into a directive file per series.
 */
public record AlignSettings(
        String executable,
        int cpuCount,
        boolean useRawtlt,
        double pixelSize,
        double rotationAngle,
        double goldSize,
        String adocTemplate,
        int stackBinFactor,
        boolean deleteOldFiles,
        boolean removeXrays,
        int coarseAlignBinFactor,
        List<Integer> patchSize,
        List<Integer> numPatches,
        List<Integer> shiftLimits,
        int numIterations,
        boolean adjustTiltAngles,
        int numSurfaces,
        MagOption magOption,
        TiltOption tiltOption,
        RotationOption rotationOption,
        BeamTiltOption beamTiltOption,
        boolean robustFitting,
        boolean weightAllContours
) {
    public AlignSettings {
        patchSize = List.copyOf(patchSize);
        numPatches = List.copyOf(numPatches);
        shiftLimits = List.copyOf(shiftLimits);
    }

    /**
     * Option of a tiltalign solver variable, mapped to its numeric code.
     */
    public interface SolverOption {
        int code();
    }

    public enum MagOption implements SolverOption {
        ALL(1), GROUP(3), FIXED(0);

        private final int code;

        MagOption(int code) {
            this.code = code;
        }

        @Override
        public int code() {
            return code;
        }
    }

    public enum TiltOption implements SolverOption {
        ALL(1), GROUP(5), FIXED(0);

        private final int code;

        TiltOption(int code) {
            this.code = code;
        }

        @Override
        public int code() {
            return code;
        }
    }

    public enum RotationOption implements SolverOption {
        ALL(1), GROUP(3), ONE(-1), FIXED(0);

        private final int code;

        RotationOption(int code) {
            this.code = code;
        }

        @Override
        public int code() {
            return code;
        }
    }

    public enum BeamTiltOption implements SolverOption {
        ALL(2), GROUP(5), FIXED(0);

        private final int code;

        BeamTiltOption(int code) {
            this.code = code;
        }

        @Override
        public int code() {
            return code;
        }
    }
}

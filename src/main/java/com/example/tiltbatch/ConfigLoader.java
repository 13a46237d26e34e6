package com.example.tiltbatch;

import com.example.tiltbatch.stage.AlignSettings;
import com.example.tiltbatch.stage.MotionCorrSettings;
import com.example.tiltbatch.stage.SeriesLayout;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class ConfigLoader {
    private static final int DEFAULT_JOBS_PER_DEVICE = 1;
    private static final String DEFAULT_DEVICE_QUERY = "nvidia-smi";
    private static final List<String> SUPPORTED_FILE_TYPES = List.of("tif", "mrc", "eer");
    private static final List<Integer> DEFAULT_MC2_PATCH = List.of(5, 5, 20);
    private static final List<Integer> DEFAULT_PATCH_SIZE = List.of(680, 680);
    private static final List<Integer> DEFAULT_NUM_PATCHES = List.of(24, 24);
    private static final List<Integer> DEFAULT_SHIFT_LIMITS = List.of(2, 2);
    private static final String ILLEGAL_NAME_CHARACTERS = "<>:\"/\\|?*";

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Reads and validates a config file. Relative paths are resolved against the work directory,
     * which itself defaults to the directory holding the config file.
     *
     * @throws ConfigurationException if the file is absent, unreadable as JSON, or fails validation
     */
    public PipelineConfig load(Path path) throws IOException, ConfigurationException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Config file not found: " + path);
        }
        RawConfig raw;
        try {
            raw = mapper.readValue(path.toFile(), RawConfig.class);
        } catch (JacksonException ex) {
            throw new ConfigurationException("Config file " + path + " is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
        if (raw == null) {
            throw new ConfigurationException("Config file " + path + " is empty.");
        }

        String projectName = validProjectName(raw.projectName);
        Path configDirectory = path.toAbsolutePath().getParent();
        Path workDirectory = raw.workDirectory == null || raw.workDirectory.isBlank()
                ? configDirectory
                : configDirectory.resolve(raw.workDirectory).normalize();

        ScopeSpecification scope = raw.processList == null
                ? ScopeSpecification.all()
                : ScopeSpecification.of(raw.processList);
        int jobsPerDevice = positive(raw.jobsPerDevice, DEFAULT_JOBS_PER_DEVICE, "jobsPerDevice");
        String deviceQuery = optionalString(raw.deviceQueryExecutable, DEFAULT_DEVICE_QUERY);

        MotionCorrSettings motionCorr = motionCorr(raw.motionCorr, projectName, workDirectory);
        RawStack stack = raw.stack == null ? new RawStack() : raw.stack;
        SeriesLayout layout = new SeriesLayout(
                workDirectory.resolve(optionalString(stack.outputDirectory, "stacks")).normalize(),
                stripTrailing(optionalString(stack.rootName, projectName), '_'),
                stack.suffix == null ? "" : stack.suffix
        );
        AlignSettings align = align(raw.align, motionCorr);

        boolean s3SyncEnabled = raw.s3SyncEnabled != null && raw.s3SyncEnabled;
        Optional<String> s3Bucket = Optional.ofNullable(raw.s3Bucket).filter(value -> !value.isBlank());
        Optional<String> s3Prefix = Optional.ofNullable(raw.s3Prefix).filter(value -> !value.isBlank());
        Optional<String> s3Region = Optional.ofNullable(raw.s3Region).filter(value -> !value.isBlank());
        if (s3SyncEnabled && s3Bucket.isEmpty()) {
            throw new ConfigurationException("s3Bucket is required when s3SyncEnabled is true.");
        }

        return new PipelineConfig(
                projectName,
                workDirectory,
                scope,
                jobsPerDevice,
                deviceQuery,
                motionCorr,
                optionalString(stack.executable, "newstack"),
                layout,
                align,
                s3SyncEnabled,
                s3Bucket,
                s3Prefix,
                s3Region
        );
    }

    private MotionCorrSettings motionCorr(RawMotionCorr raw, String projectName, Path workDirectory)
            throws ConfigurationException {
        if (raw == null) {
            throw new ConfigurationException("Config must include a motionCorr section.");
        }
        if (raw.pixelSize == null || raw.pixelSize <= 0) {
            throw new ConfigurationException("motionCorr.pixelSize must be a positive number.");
        }
        String fileType = optionalString(raw.inputFileType, "tif").toLowerCase(Locale.ROOT);
        if (!SUPPORTED_FILE_TYPES.contains(fileType)) {
            throw new ConfigurationException("motionCorr.inputFileType must be one of "
                    + SUPPORTED_FILE_TYPES + ", got " + raw.inputFileType);
        }
        List<Integer> patch = raw.patchSize == null || raw.patchSize.isEmpty() ? DEFAULT_MC2_PATCH : raw.patchSize;
        double desired = raw.desiredPixelSize != null && raw.desiredPixelSize > 0
                ? raw.desiredPixelSize
                : raw.pixelSize;
        return new MotionCorrSettings(
                optionalString(raw.executable, "MotionCor2"),
                workDirectory.resolve(optionalString(raw.outputDirectory, "motioncor")).normalize(),
                optionalString(raw.outputPrefix, projectName),
                fileType,
                optionalString(raw.gainReference, "nogain"),
                raw.pixelSize,
                desired,
                raw.tolerance != null ? raw.tolerance : 0.5,
                patch,
                positive(raw.maxIterations, 10, "motionCorr.maxIterations"),
                raw.useSubgroups == null || raw.useSubgroups,
                raw.discardFramesTop == null ? 0 : raw.discardFramesTop,
                raw.discardFramesBottom == null ? 0 : raw.discardFramesBottom,
                raw.gpuMemoryUsage != null ? raw.gpuMemoryUsage : 1.0
        );
    }

    private AlignSettings align(RawAlign raw, MotionCorrSettings motionCorr) throws ConfigurationException {
        RawAlign align = raw == null ? new RawAlign() : raw;
        if (align.adocTemplate == null || align.adocTemplate.isBlank()) {
            throw new ConfigurationException("align.adocTemplate is required.");
        }
        return new AlignSettings(
                optionalString(align.executable, "batchruntomo"),
                positive(align.cpuCount, Math.max(1, Runtime.getRuntime().availableProcessors()), "align.cpuCount"),
                align.useRawtlt == null || align.useRawtlt,
                align.pixelSize != null && align.pixelSize > 0 ? align.pixelSize : motionCorr.desiredPixelSize(),
                align.rotationAngle == null ? 0.0 : align.rotationAngle,
                align.goldSize == null ? 0.0 : align.goldSize,
                align.adocTemplate,
                positive(align.stackBinFactor, 4, "align.stackBinFactor"),
                align.deleteOldFiles != null && align.deleteOldFiles,
                align.removeXrays == null || align.removeXrays,
                positive(align.coarseAlignBinFactor, 4, "align.coarseAlignBinFactor"),
                pair(align.patchSize, DEFAULT_PATCH_SIZE, "align.patchSize"),
                pair(align.numPatches, DEFAULT_NUM_PATCHES, "align.numPatches"),
                pair(align.shiftLimits, DEFAULT_SHIFT_LIMITS, "align.shiftLimits"),
                positive(align.numIterations, 4, "align.numIterations"),
                align.adjustTiltAngles == null || align.adjustTiltAngles,
                positive(align.numSurfaces, 1, "align.numSurfaces"),
                option(AlignSettings.MagOption.class, align.magOption, AlignSettings.MagOption.FIXED, "align.magOption"),
                option(AlignSettings.TiltOption.class, align.tiltOption, AlignSettings.TiltOption.FIXED, "align.tiltOption"),
                option(AlignSettings.RotationOption.class, align.rotationOption, AlignSettings.RotationOption.GROUP, "align.rotationOption"),
                option(AlignSettings.BeamTiltOption.class, align.beamTiltOption, AlignSettings.BeamTiltOption.FIXED, "align.beamTiltOption"),
                align.robustFitting != null && align.robustFitting,
                align.weightAllContours == null || align.weightAllContours
        );
    }

    private String validProjectName(String projectName) throws ConfigurationException {
        if (projectName == null || projectName.isBlank()) {
            throw new ConfigurationException("Config must include a projectName.");
        }
        for (char c : ILLEGAL_NAME_CHARACTERS.toCharArray()) {
            if (projectName.indexOf(c) >= 0) {
                throw new ConfigurationException("Illegal character (" + c + ") found in project name " + projectName);
            }
        }
        return projectName;
    }

    private <E extends Enum<E>> E option(Class<E> type, String value, E fallback, String field)
            throws ConfigurationException {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Enum.valueOf(type, value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            List<String> allowed = new ArrayList<>();
            for (E constant : type.getEnumConstants()) {
                allowed.add(constant.name().toLowerCase(Locale.ROOT));
            }
            throw new ConfigurationException(field + " must be one of " + allowed + ", got " + value);
        }
    }

    private List<Integer> pair(List<Integer> value, List<Integer> fallback, String field) throws ConfigurationException {
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        if (value.size() != 2 || value.contains(null)) {
            throw new ConfigurationException(field + " must hold exactly two numbers (x, y).");
        }
        return List.copyOf(value);
    }

    private int positive(Integer value, int fallback, String field) throws ConfigurationException {
        if (value == null) {
            return fallback;
        }
        if (value <= 0) {
            throw new ConfigurationException(field + " must be positive, got " + value);
        }
        return value;
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private String stripTrailing(String value, char trailing) {
        String stripped = value;
        while (stripped.length() > 1 && stripped.charAt(stripped.length() - 1) == trailing) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        return stripped;
    }

    private static class RawConfig {
        public String projectName;
        public String workDirectory;
        public List<Integer> processList;
        public Integer jobsPerDevice;
        public String deviceQueryExecutable;
        public RawMotionCorr motionCorr;
        public RawStack stack;
        public RawAlign align;
        public Boolean s3SyncEnabled;
        public String s3Bucket;
        public String s3Prefix;
        public String s3Region;
    }

    private static class RawMotionCorr {
        public String executable;
        public String outputDirectory;
        public String outputPrefix;
        public String inputFileType;
        public String gainReference;
        public Double pixelSize;
        public Double desiredPixelSize;
        public Double tolerance;
        public List<Integer> patchSize;
        public Integer maxIterations;
        public Boolean useSubgroups;
        public Integer discardFramesTop;
        public Integer discardFramesBottom;
        public Double gpuMemoryUsage;
    }

    private static class RawStack {
        public String executable;
        public String outputDirectory;
        public String rootName;
        public String suffix;
    }

    private static class RawAlign {
        public String executable;
        public Integer cpuCount;
        public Boolean useRawtlt;
        public Double pixelSize;
        public Double rotationAngle;
        public Double goldSize;
        public String adocTemplate;
        public Integer stackBinFactor;
        public Boolean deleteOldFiles;
        public Boolean removeXrays;
        public Integer coarseAlignBinFactor;
        public List<Integer> patchSize;
        public List<Integer> numPatches;
        public List<Integer> shiftLimits;
        public Integer numIterations;
        public Boolean adjustTiltAngles;
        public Integer numSurfaces;
        public String magOption;
        public String tiltOption;
        public String rotationOption;
        public String beamTiltOption;
        public Boolean robustFitting;
        public Boolean weightAllContours;
    }
}

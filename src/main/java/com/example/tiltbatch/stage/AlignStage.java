package com.example.tiltbatch.stage;

import com.example.tiltbatch.ScopeSpecification;
import com.example.tiltbatch.WorkItem;
import com.example.tiltbatch.metadata.DoneRecord;
import com.example.tiltbatch.metadata.DoneTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Aligns each series' stack with IMOD batchruntomo, steps 0 to 8.
 */
public final class AlignStage implements Stage {
    private final AlignSettings settings;
    private final SeriesLayout layout;

    public AlignStage(AlignSettings settings, SeriesLayout layout) {
        this.settings = settings;
        this.layout = layout;
    }

    @Override
    public String name() {
        return "align";
    }

    @Override
    public String tableSuffix() {
        return "align";
    }

    @Override
    public List<WorkItem> candidates(ScopeSpecification scope, DoneTable upstream) {
        List<WorkItem> candidates = new ArrayList<>();
        for (int seriesId : upstream.seriesIds()) {
            if (!scope.contains(seriesId)) {
                continue;
            }
            List<Path> stacks = upstream.recordsForSeries(seriesId).stream().map(DoneRecord::outputPath).toList();
            candidates.add(new WorkItem(seriesId, 0, stacks, layout.alignedFile(seriesId)));
        }
        return candidates;
    }

    @Override
    public List<String> command(WorkItem item) throws IOException {
        int seriesId = item.seriesId();
        Path folder = layout.seriesFolder(seriesId);
        Files.createDirectories(folder);
        Path directives = layout.seriesFile(seriesId, "_align.adoc");
        Files.write(directives, directives());

        return List.of(
                settings.executable(),
                "-CPUMachineList", String.valueOf(settings.cpuCount()),
                "-GPUMachineList", gpuNumber(item.deviceId()),
                "-DirectiveFile", directives.toString(),
                "-RootName", layout.seriesName(seriesId),
                "-CurrentLocation", folder.toString(),
                "-StartingStep", "0",
                "-EndingStep", "8"
        );
    }

    /**
     * Renders the batch directive lines.
     */
    List<String> directives() {
        return List.of(
                "setupset.currentStackExt = st",
                "setupset.copyarg.stackext = st",
                "setupset.copyarg.userawtlt = " + flag(settings.useRawtlt()),
                "setupset.copyarg.pixel = " + settings.pixelSize(),
                "setupset.copyarg.rotation = " + settings.rotationAngle(),
                "setupset.copyarg.gold = " + settings.goldSize(),
                "setupset.systemTemplate = " + settings.adocTemplate(),
                "",
                "runtime.Excludeviews.any.deleteOldFiles = " + flag(settings.deleteOldFiles()),
                "runtime.Preprocessing.any.removeXrays = " + flag(settings.removeXrays()),
                "",
                "comparam.prenewst.newstack.BinByFactor = " + settings.coarseAlignBinFactor(),
                "",
                "runtime.Fiducials.any.trackingMethod = 1",
                "",
                "comparam.xcorr_pt.tiltxcorr.SizeOfPatchesXandY = " + joined(settings.patchSize()),
                "comparam.xcorr_pt.tiltxcorr.NumberOfPatchesXandY = " + joined(settings.numPatches()),
                "comparam.xcorr_pt.tiltxcorr.ShiftLimitsXandY = " + joined(settings.shiftLimits()),
                "comparam.xcorr_pt.tiltxcorr.IterateCorrelations = " + settings.numIterations(),
                "runtime.PatchTracking.any.adjustTiltAngles = " + flag(settings.adjustTiltAngles()),
                "comparam.xcorr_pt.imodchopconts.LengthOfPieces = -1",
                "",
                "comparam.align.tiltalign.SurfacesToAnalyze = " + settings.numSurfaces(),
                "comparam.align.tiltalign.MagOption = " + settings.magOption().code(),
                "comparam.align.tiltalign.TiltOption = " + settings.tiltOption().code(),
                "comparam.align.tiltalign.RotOption = " + settings.rotationOption().code(),
                "comparam.align.tiltalign.BeamTiltOption = " + settings.beamTiltOption().code(),
                "comparam.align.tiltalign.RobustFitting = " + flag(settings.robustFitting()),
                "comparam.align.tiltalign.WeightWholeTracks = " + flag(settings.weightAllContours()),
                "",
                "runtime.AlignedStack.any.binByFactor = " + settings.stackBinFactor()
        );
    }

    /**
     * batchruntomo numbers GPUs from 1; device ids from the pool start at 0.
     */
    static String gpuNumber(String deviceId) {
        try {
            return String.valueOf(Integer.parseInt(deviceId.strip()) + 1);
        } catch (NumberFormatException ex) {
            return deviceId;
        }
    }

    private static String flag(boolean value) {
        return value ? "1" : "0";
    }

    private static String joined(List<Integer> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
}

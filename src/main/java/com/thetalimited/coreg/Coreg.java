package com.thetalimited.coreg;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.coreg.engine.CorrectionApplier;
import com.thetalimited.coreg.engine.GridReconciler;
import com.thetalimited.coreg.engine.PhaseCorrelation;
import com.thetalimited.coreg.engine.PhaseCorrelator;
import com.thetalimited.coreg.engine.Reconciliation;
import com.thetalimited.coreg.engine.SampleWindow;
import com.thetalimited.coreg.engine.ShiftValidator;
import com.thetalimited.coreg.engine.WindowSelector;
import com.thetalimited.coreg.engine.WindowSpec;
import com.thetalimited.coreg.io.RasterFormats;
import com.thetalimited.coreg.io.RasterSource;
import com.thetalimited.coreg.io.RasterWriter;
import com.thetalimited.coreg.raster.BinaryMask;
import com.thetalimited.coreg.raster.Raster;

/**
 * Global co-registration of a target image to a reference image.
 *
 * <pre>
 *   Coreg cr = new Coreg(RasterSource.fromPath(ref), RasterSource.fromPath(tgt), config);
 *   ShiftResult shift = cr.calculateSpatialShifts();
 *   DeshiftResult out = cr.correctShifts();
 * </pre>
 *
 * The constructor validates the configuration, loads both images and checks
 * that they can be compared at all. {@link #calculateSpatialShifts()} runs
 * window selection, phase correlation and validation;
 * {@link #correctShifts()} applies the shift and writes the output if a
 * {@code pathOut} was configured.
 *
 * <p>Instances are not thread safe. Independent instances may run in parallel.</p>
 */
public class Coreg
{
    private static final Logger log = LoggerFactory.getLogger(Coreg.class);

    private final CoregConfig config;
    private final RasterSource referenceSource, targetSource;
    private final Raster reference, target;
    private final Reconciliation reconciliation;
    private final Path pathOut;
    private final List<String> advisories = new ArrayList<>();

    private ShiftResult shiftResult;
    private DeshiftResult deshiftResult;

    /**
     * @throws CoregException CONFIGURATION for inconsistent settings, NO_VALID_DATA if an
     *         image holds no valid pixel, DATUM_MISMATCH or PROJECTION_MISMATCH if the
     *         images cannot be compared
     * @throws IOException if an input cannot be read
     */
    public Coreg(RasterSource reference, RasterSource target, CoregConfig config) throws IOException
    {
        this.config = config;
        this.referenceSource = reference;
        this.targetSource = target;
        this.pathOut = resolvePathOut(reference, target, config);

        this.reference = prepare(reference.toMemory(), "reference", config.getRefBand(),
                                 config.getNodataRef(), config.getBadDataMaskRef(), config.getCloudMaskRef());
        this.target = prepare(target.toMemory(), "target", config.getTgtBand(),
                              config.getNodataTgt(), config.getBadDataMaskTgt(), config.getCloudMaskTgt());

        requireValidData(this.reference, config.getRefBand(), "reference");
        requireValidData(this.target, config.getTgtBand(), "target");

        this.reconciliation = new GridReconciler().reconcile(this.reference, this.target);
        for (String a : reconciliation.getAdvisories()) advise(advisories, a);
    }

    private static Path resolvePathOut(RasterSource reference, RasterSource target, CoregConfig config)
    {
        String p = config.getPathOut();
        if (p == null || p.trim().isEmpty()) return null;

        Path out;
        if (config.isAutoPathOut()) {
            if (target.getName() == null) {
                throw new CoregException(FailureKind.CONFIGURATION,
                    "pathOut='auto' needs a target image with a name; give an explicit output path for in-memory targets");
            }
            RasterWriter writer = RasterFormats.writerFor(config.getFormatOut());
            String refName = reference.getName() != null ? reference.getName() : "reference";
            String fileName = target.getName() + "__shifted_to__" + refName + "." + writer.getExtension();
            Path dir = target.isFileBacked() ? target.getPath().toAbsolutePath().getParent() : null;
            out = dir != null ? dir.resolve(fileName) : Paths.get(fileName);
        } else {
            out = Paths.get(p.trim());
        }
        if (target.isFileBacked() && out.toAbsolutePath().normalize().equals(target.getPath().toAbsolutePath().normalize())) {
            throw new CoregException(FailureKind.CONFIGURATION, "output path " + out + " would overwrite the target image");
        }
        return out;
    }

    // apply nodata override and bad data mask, check band number and mask shapes
    private static Raster prepare(Raster raster, String which, int band, Double nodataOverride,
                                  BinaryMask badData, BinaryMask cloudMask)
    {
        if (band > raster.getBandCount()) {
            throw new CoregException(FailureKind.CONFIGURATION,
                which + " band " + band + " requested but the image has " + raster.getBandCount() + " band(s)");
        }
        checkMask(raster, badData, which + " bad data mask");
        checkMask(raster, cloudMask, which + " cloud mask");
        Double noData = nodataOverride != null ? nodataOverride : raster.getNoData();
        if (nodataOverride == null && badData == null) return raster;
        return raster.withNoDataAndMask(noData, badData);
    }

    private static void checkMask(Raster raster, BinaryMask mask, String what)
    {
        if (mask != null && !mask.matches(raster)) {
            throw new CoregException(FailureKind.CONFIGURATION, what + " is " + mask.getCols() + "x" + mask.getRows()
                + " px but the image is " + raster.getCols() + "x" + raster.getRows() + " px");
        }
    }

    private static void requireValidData(Raster raster, int band, String which)
    {
        if (raster.getValidDataBounds(band - 1) == null) {
            throw new CoregException(FailureKind.NO_VALID_DATA,
                "the " + which + " image contains only nodata values (band " + band + ", nodata="
                + raster.getNoData() + ")");
        }
    }

    /**
     * Detect the shift of the target relative to the reference.
     *
     * @return the result; a failed result only if {@code ignoreErrors} is set
     * @throws CoregException NO_VALID_DATA, OUT_OF_BOUNDS, OBSCURED_WINDOW or IMPLAUSIBLE_SHIFT
     *         unless {@code ignoreErrors} is set
     */
    public ShiftResult calculateSpatialShifts()
    {
        shiftResult = null;
        List<String> runAdvisories = new ArrayList<>(advisories);
        CoregDiagnostics diagnostics = config.getDiagnostics();
        try {
            WindowSelector selector = new WindowSelector(reference, target, reconciliation, config);
            WindowSpec spec = selector.select(config.getWindowPosition(), runAdvisories);

            PhaseCorrelator correlator = new PhaseCorrelator(config.getWindowFunction(), config.getAmbiguityRatio(),
                                                             config.getMaxIterations());
            SampleWindow[] first = new SampleWindow[1];
            PhaseCorrelation pc = correlator.estimate(
                (shiftCol, shiftRow) -> selector.extract(spec, shiftCol, shiftRow),
                (iteration, window, corr) -> {
                    if (iteration == 1) first[0] = window;
                    observe(() -> diagnostics.onSampleWindow(window, iteration));
                    observe(() -> diagnostics.onCrossPowerSpectrum(corr.getSurface(), iteration));
                });

            SampleWindow after = extractQuietly(selector, spec, pc.getDx(), pc.getDy());
            double maxShift = config.getMaxShift() != null ? config.getMaxShift()
                : ShiftValidator.defaultMaxShift(reconciliation.getAnalysisGrid());

            shiftResult = new ShiftValidator(config.getMinReliability())
                .validate(pc, spec, reconciliation.getAnalysisGrid(), maxShift, first[0], after, runAdvisories);
        } catch (CoregException e) {
            shiftResult = ShiftResult.failure(e, runAdvisories);
            log.warn("shift detection failed: {}", e.getMessage());
            if (!config.isIgnoreErrors()) {
                throw e;
            }
        } finally {
            advisories.clear();
            advisories.addAll(runAdvisories);
            if (shiftResult != null) {
                ShiftResult r = shiftResult;
                observe(() -> diagnostics.onShiftResult(r));
            }
        }

        if (config.isVerbose() && shiftResult.isSuccess()) {
            log.info("shift in pixels: x={} y={}, in map units: x={} y={}, reliability {}%",
                     shiftResult.getDxPx(), shiftResult.getDyPx(), shiftResult.getDxMap(), shiftResult.getDyMap(),
                     Math.round(shiftResult.getReliability()));
        }
        return shiftResult;
    }

    // window with the target at the estimated displacement, for scoring only
    private static SampleWindow extractQuietly(WindowSelector selector, WindowSpec spec, double dx, double dy)
    {
        try {
            return selector.extract(spec, dx, dy);
        } catch (CoregException e) {
            log.debug("no corrected window for similarity check: {}", e.getMessage());
            return null;
        }
    }

    private static void observe(Runnable hook)
    {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("diagnostics hook failed: {}", e.toString());
        }
    }

    /**
     * Apply the detected shift to the target and write it to {@code pathOut}
     * if one was configured.
     *
     * @throws IllegalStateException if no successful shift has been calculated
     * @throws IOException if the output cannot be written; no partial file is left behind
     */
    public DeshiftResult correctShifts() throws IOException
    {
        if (shiftResult == null || !shiftResult.isSuccess()) {
            throw new IllegalStateException("correctShifts() needs a successful calculateSpatialShifts() run"
                + (shiftResult != null ? ", last run failed with " + shiftResult.getFailureKind() : ""));
        }
        DeshiftResult result = new CorrectionApplier(config.getProgress())
            .apply(target, reconciliation, shiftResult, config.isAlignGrids(), config.getResamplingDeshift());

        if (pathOut != null) {
            RasterFormats.writerFor(config.getFormatOut()).write(result.getRaster(), pathOut,
                                                                 config.getCreationOptions());
            result = result.withPathOut(pathOut);
        }
        deshiftResult = result;
        return result;
    }

    public boolean isSuccess()
    {
        return shiftResult != null && shiftResult.isSuccess();
    }

    public ShiftResult getShiftResult() { return shiftResult; }
    public DeshiftResult getDeshiftResult() { return deshiftResult; }
    public Reconciliation getReconciliation() { return reconciliation; }
    public List<String> getAdvisories() { return Collections.unmodifiableList(advisories); }
    public Raster getReference() { return reference; }
    public Raster getTarget() { return target; }
    public Path getPathOut() { return pathOut; }
    public CoregConfig getConfig() { return config; }

    @Override
    public String toString()
    {
        return "Coreg[reference=" + referenceSource + ", target=" + targetSource + "]";
    }

    static void advise(List<String> list, String message)
    {
        list.add(message);
        log.warn(message);
    }
}

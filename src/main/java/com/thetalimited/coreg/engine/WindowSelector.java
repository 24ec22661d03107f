package com.thetalimited.coreg.engine;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.coreg.CoregConfig;
import com.thetalimited.coreg.CoregException;
import com.thetalimited.coreg.FailureKind;
import com.thetalimited.coreg.WindowPosition;
import com.thetalimited.coreg.geo.Bounds;
import com.thetalimited.coreg.geo.GeoTransform;
import com.thetalimited.coreg.geo.Projections;
import com.thetalimited.coreg.raster.Raster;

/**
 * Chooses the matching window inside the mutual overlap of reference and
 * target and cuts equal shaped sample windows out of both.
 *
 * <p>The overlap is the intersection of the bounding boxes of the valid
 * (non-nodata) pixels of both images, expressed in the reference projection.</p>
 */
public class WindowSelector
{
    private static final Logger log = LoggerFactory.getLogger(WindowSelector.class);

    private final Raster reference, target;
    private final Reconciliation rec;
    private final CoregConfig config;
    private final GeoTransform grid;
    private final GridSampler refSampler, tgtSampler;
    private final GridSampler refCloudSampler, tgtCloudSampler;
    private final Bounds overlap;

    /**
     * @throws CoregException NO_VALID_DATA if a band holds no valid pixel,
     *         OUT_OF_BOUNDS if the images do not overlap
     */
    public WindowSelector(Raster reference, Raster target, Reconciliation rec, CoregConfig config)
    {
        this.reference = reference;
        this.target = target;
        this.rec = rec;
        this.config = config;
        this.grid = rec.getAnalysisGrid();

        int refBand = config.getRefBand() - 1, tgtBand = config.getTgtBand() - 1;
        this.refSampler = new GridSampler(reference, refBand, grid, rec.getProjection(), false,
                                          config.getResamplingCalc());
        this.tgtSampler = new GridSampler(target, tgtBand, grid, rec.getProjection(), rec.needsReprojection(),
                                          config.getResamplingCalc());
        this.refCloudSampler = config.getCloudMaskRef() == null ? null
            : GridSampler.forMask(reference, config.getCloudMaskRef(), grid, rec.getProjection(), false);
        this.tgtCloudSampler = config.getCloudMaskTgt() == null ? null
            : GridSampler.forMask(target, config.getCloudMaskTgt(), grid, rec.getProjection(), rec.needsReprojection());

        this.overlap = computeOverlap(refBand, tgtBand);
    }

    private Bounds computeOverlap(int refBand, int tgtBand)
    {
        Bounds refValid = reference.getValidDataBounds(refBand);
        Bounds tgtValid = target.getValidDataBounds(tgtBand);
        if (refValid == null || tgtValid == null) {
            throw new CoregException(FailureKind.NO_VALID_DATA,
                (refValid == null ? "reference" : "target") + " image contains no valid data");
        }
        if (rec.needsReprojection()) {
            tgtValid = Projections.transformBounds(tgtValid, target.getProjection(), rec.getProjection());
        }
        Bounds ov = refValid.intersection(tgtValid);
        if (ov.isEmpty()) {
            throw new CoregException(FailureKind.OUT_OF_BOUNDS,
                "reference and target image do not overlap (reference " + refValid + ", target " + tgtValid + ")");
        }
        log.debug("mutual overlap: {}", ov);
        return ov;
    }

    public Bounds getOverlap()
    {
        return overlap;
    }

    /**
     * Resolve the window centre and size.
     *
     * @param position requested centre or null for the centre of the overlap
     * @param advisories receives the small-window advisory
     * @throws CoregException OUT_OF_BOUNDS if the centre or the full window lies outside the overlap
     */
    public WindowSpec select(WindowPosition position, List<String> advisories)
    {
        double cx, cy;
        if (position == null) {
            double[] c = overlap.getCenter();
            cx = c[0];
            cy = c[1];
        } else if (position.isPixelCoordinates()) {
            double[] w = reference.getGeoTransform().worldFromPixel(position.getX(), position.getY());
            cx = w[0];
            cy = w[1];
        } else {
            cx = position.getX();
            cy = position.getY();
        }
        if (!overlap.contains(cx, cy)) {
            throw new CoregException(FailureKind.OUT_OF_BOUNDS, String.format(
                "window position (%.4f, %.4f) is outside of the overlap area %s", cx, cy, overlap));
        }

        double[] p = grid.pixelFromWorld(cx, cy);
        int cc = (int) Math.floor(p[0]), cr = (int) Math.floor(p[1]);

        int width, height;
        if (config.isAutoWindowSize()) {
            width = height = autoWindowSize(cc, cr);
        } else {
            width = config.getWindowWidth();
            height = config.getWindowHeight();
            if (Math.min(width, height) < config.getSmallWindowThreshold()) {
                String msg = "window size " + width + "x" + height + " is a rather small value; sub-pixel accuracy "
                    + "degrades below " + config.getSmallWindowThreshold() + " px";
                advisories.add(msg);
                log.warn(msg);
            }
        }

        WindowSpec spec = new WindowSpec(cx, cy, width, height, cc - width / 2, cr - height / 2, grid);
        double tol = 1e-6 * Math.max(grid.getXRes(), grid.getYRes());
        if (!overlap.contains(spec.getBounds(), tol)) {
            throw new CoregException(FailureKind.OUT_OF_BOUNDS, "matching window " + spec.getBounds()
                + " exceeds the overlap area " + overlap + "; choose a smaller window or another position");
        }
        log.info("matching window: {}", spec);
        return spec;
    }

    /**
     * odd(round(maxDim * fraction)), clamped to [MIN_WINDOW_SIZE, min(maxAutoWindowSize,
     * largest odd square around the centre pixel that fits the overlap)].
     */
    int autoWindowSize(int cc, int cr)
    {
        int maxDim = Math.max(Math.max(reference.getCols(), reference.getRows()),
                              Math.max(target.getCols(), target.getRows()));
        int size = makeOdd((int) Math.round(maxDim * config.getAutoWindowFraction()));

        double[] a = grid.pixelFromWorld(overlap.minX, overlap.maxY);
        double[] b = grid.pixelFromWorld(overlap.maxX, overlap.minY);
        double colMin = Math.min(a[0], b[0]), colMax = Math.max(a[0], b[0]);
        double rowMin = Math.min(a[1], b[1]), rowMax = Math.max(a[1], b[1]);
        double eps = 1e-6;
        int hx = (int) Math.floor(Math.min(cc - colMin, colMax - cc - 1) + eps);
        int hy = (int) Math.floor(Math.min(cr - rowMin, rowMax - cr - 1) + eps);
        int fit = 2 * Math.max(0, Math.min(hx, hy)) + 1;

        int upper = Math.min(config.getMaxAutoWindowSize(), fit);
        if (upper % 2 == 0) upper--;
        size = Math.min(size, upper);
        if (size < CoregConfig.MIN_WINDOW_SIZE) size = makeOdd(CoregConfig.MIN_WINDOW_SIZE);
        log.debug("auto window size {} (largest fitting {})", size, fit);
        return size;
    }

    private static int makeOdd(int n)
    {
        return n % 2 == 0 ? n + 1 : n;
    }

    /**
     * Cut the sample windows. The target is sampled {@code (shiftCol, shiftRow)}
     * analysis pixels away from the reference window.
     *
     * @throws CoregException OUT_OF_BOUNDS if the shifted target window leaves the target image,
     *         NO_VALID_DATA if a window has too much nodata,
     *         OBSCURED_WINDOW if the window centre or too large a share of it is masked as cloud
     */
    public SampleWindow extract(WindowSpec spec, double shiftCol, double shiftRow)
    {
        int w = spec.getWidth(), h = spec.getHeight(), c0 = spec.getCol0(), r0 = spec.getRow0();

        if (!tgtSampler.covers(c0, r0, w, h, shiftCol, shiftRow)) {
            throw new CoregException(FailureKind.OUT_OF_BOUNDS, String.format(
                "target window shifted by (%.2f, %.2f) px exceeds the target image; "
                + "choose another window position", shiftCol, shiftRow));
        }

        double[][] ref = refSampler.window(c0, r0, w, h, 0, 0);
        double[][] tgt = tgtSampler.window(c0, r0, w, h, shiftCol, shiftRow);

        double refNodata = nanFraction(ref), tgtNodata = nanFraction(tgt);
        double maxNodata = config.getMaxNodataFraction();
        if (refNodata >= maxNodata || tgtNodata >= maxNodata) {
            String which = refNodata >= maxNodata ? "reference" : "target";
            throw new CoregException(FailureKind.NO_VALID_DATA, String.format(
                "the %s matching window contains %.1f%% nodata pixels; choose another window position",
                which, 100.0 * Math.max(refNodata, tgtNodata)));
        }

        double obscured = 0.0;
        if (refCloudSampler != null || tgtCloudSampler != null) {
            boolean[][] cloudy = new boolean[h][w];
            markCloudy(cloudy, refCloudSampler, spec, 0, 0);
            markCloudy(cloudy, tgtCloudSampler, spec, shiftCol, shiftRow);
            long n = 0;
            for (boolean[] row : cloudy) for (boolean b : row) if (b) n++;
            obscured = (double) n / ((double) w * h);
            if (cloudy[h / 2][w / 2]) {
                throw new CoregException(FailureKind.OBSCURED_WINDOW,
                    "the centre of the matching window is covered by the cloud/quality mask");
            }
            if (obscured > config.getMaxObscuredFraction()) {
                throw new CoregException(FailureKind.OBSCURED_WINDOW, String.format(
                    "%.1f%% of the matching window is covered by the cloud/quality mask (allowed %.1f%%)",
                    100.0 * obscured, 100.0 * config.getMaxObscuredFraction()));
            }
        }

        fillWithMean(ref);
        fillWithMean(tgt);
        return new SampleWindow(ref, tgt, spec.getWindowGrid(), refNodata, tgtNodata, obscured,
                                shiftCol, shiftRow);
    }

    private static void markCloudy(boolean[][] cloudy, GridSampler mask, WindowSpec spec, double sc, double sr)
    {
        if (mask == null) return;
        double[][] m = mask.window(spec.getCol0(), spec.getRow0(), spec.getWidth(), spec.getHeight(), sc, sr);
        for (int r = 0; r < m.length; r++) {
            for (int c = 0; c < m[r].length; c++) {
                if (m[r][c] > 0.5) cloudy[r][c] = true;
            }
        }
    }

    static double nanFraction(double[][] a)
    {
        long n = 0, total = 0;
        for (double[] row : a) {
            for (double v : row) {
                if (Double.isNaN(v)) n++;
                total++;
            }
        }
        return (double) n / total;
    }

    static void fillWithMean(double[][] a)
    {
        double sum = 0.0;
        long n = 0;
        for (double[] row : a) {
            for (double v : row) {
                if (!Double.isNaN(v)) {
                    sum += v;
                    n++;
                }
            }
        }
        double mean = n > 0 ? sum / n : 0.0;
        for (double[] row : a) {
            for (int c = 0; c < row.length; c++) {
                if (Double.isNaN(row[c])) row[c] = mean;
            }
        }
    }
}

package com.thetalimited.coreg.engine;

import org.locationtech.proj4j.CoordinateTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.coreg.DeshiftResult;
import com.thetalimited.coreg.ProgressListener;
import com.thetalimited.coreg.ShiftResult;
import com.thetalimited.coreg.geo.Bounds;
import com.thetalimited.coreg.geo.GeoTransform;
import com.thetalimited.coreg.geo.Projections;
import com.thetalimited.coreg.geo.ResamplingMethod;
import com.thetalimited.coreg.raster.Raster;

/**
 * Applies a detected shift to the target raster, either by moving its
 * geotransform or by resampling it onto the reference grid.
 */
public class CorrectionApplier
{
    private static final Logger log = LoggerFactory.getLogger(CorrectionApplier.class);

    private final ProgressListener progress;

    public CorrectionApplier(ProgressListener progress)
    {
        this.progress = progress;
    }

    public DeshiftResult apply(Raster target, Reconciliation rec, ShiftResult shift, boolean alignGrids,
                               ResamplingMethod method)
    {
        if (!shift.isSuccess()) {
            throw new IllegalStateException("cannot correct with a failed shift result: " + shift.getMessage());
        }
        return alignGrids ? resampleToReferenceGrid(target, rec, shift, method) : translate(target, rec, shift);
    }

    /**
     * Moves the target origin by the map shift. Pixel values are untouched.
     */
    DeshiftResult translate(Raster target, Reconciliation rec, ShiftResult shift)
    {
        double[] d = shiftInTargetUnits(target, rec, shift);
        GeoTransform gt = target.getGeoTransform().translate(d[0], d[1]);
        Raster out = target.derive(target.copyBands(), gt).build();
        boolean matches = !rec.needsReprojection() && !rec.isReferenceResampled()
            && gt.isGridAlignedWith(rec.getAnalysisGrid());
        log.info("corrected target geotransform {} -> {}", target.getGeoTransform(), gt);
        return new DeshiftResult(out, true, false, matches, null);
    }

    /**
     * Resamples the shifted target onto the analysis (reference) grid. The
     * output covers the target's own footprint snapped outwards to that grid;
     * content moved in from beyond the target edge becomes nodata.
     */
    DeshiftResult resampleToReferenceGrid(Raster target, Reconciliation rec, ShiftResult shift,
                                          ResamplingMethod method)
    {
        GeoTransform grid = rec.getAnalysisGrid();
        double dx = shift.getDxMap(), dy = shift.getDyMap();

        Bounds fp = target.getFootprint();
        if (rec.needsReprojection()) {
            fp = Projections.transformBounds(fp, target.getProjection(), rec.getProjection());
        }

        double[] a = grid.pixelFromWorld(fp.minX, fp.maxY);
        double[] b = grid.pixelFromWorld(fp.maxX, fp.minY);
        double eps = 1e-6;
        int colMin = (int) Math.floor(Math.min(a[0], b[0]) + eps);
        int colMax = (int) Math.ceil(Math.max(a[0], b[0]) - eps);
        int rowMin = (int) Math.floor(Math.min(a[1], b[1]) + eps);
        int rowMax = (int) Math.ceil(Math.max(a[1], b[1]) - eps);
        int cols = colMax - colMin, rows = rowMax - rowMin;
        GeoTransform outGt = grid.withOriginAtPixel(colMin, rowMin);

        Double noData = target.getNoData();
        double fill = noData != null ? noData : (target.getDataType().isFloatingPoint() ? Double.NaN : 0.0);

        int bandCount = target.getBandCount();
        double[][][] bands = new double[bandCount][rows][cols];
        for (int band = 0; band < bandCount; band++) {
            GridSampler sampler = new GridSampler(target, band, grid, rec.getProjection(),
                                                  rec.needsReprojection(), method);
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    double[] w = outGt.worldFromPixel(c + 0.5, r + 0.5);
                    double v = sampler.sampleWorld(w[0] - dx, w[1] - dy);
                    bands[band][r][c] = Double.isNaN(v) ? fill : v;
                }
                progress.onProgress("resampling", (band * (double) rows + r + 1) / ((double) bandCount * rows));
            }
        }

        Raster out = Raster.builder(bands)
            .geoTransform(outGt)
            .projection(rec.getProjection())
            .noData(fill)
            .dataType(target.getDataType())
            .build();
        log.info("resampled target onto the reference grid: {}x{} px, gt={} ({})", cols, rows, outGt, method);
        return new DeshiftResult(out, true, true, !rec.isReferenceResampled(), null);
    }

    // the map shift expressed in target projection units
    static double[] shiftInTargetUnits(Raster target, Reconciliation rec, ShiftResult shift)
    {
        double dx = shift.getDxMap(), dy = shift.getDyMap();
        if (!rec.needsReprojection()) return new double[] { dx, dy };

        CoordinateTransform ct = Projections.createTransform(rec.getProjection(), target.getProjection());
        double cx = shift.getWindowCenterX(), cy = shift.getWindowCenterY();
        double[] p0 = Projections.transform(ct, cx, cy);
        double[] p1 = Projections.transform(ct, cx + dx, cy + dy);
        return new double[] { p1[0] - p0[0], p1[1] - p0[1] };
    }
}

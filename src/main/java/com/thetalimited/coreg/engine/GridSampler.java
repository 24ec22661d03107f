package com.thetalimited.coreg.engine;

import org.locationtech.proj4j.CoordinateTransform;

import com.thetalimited.coreg.geo.GeoTransform;
import com.thetalimited.coreg.geo.Interpolation;
import com.thetalimited.coreg.geo.Projections;
import com.thetalimited.coreg.geo.ResamplingMethod;
import com.thetalimited.coreg.raster.BinaryMask;
import com.thetalimited.coreg.raster.DataType;
import com.thetalimited.coreg.raster.Raster;

/**
 * Samples one band of a raster at positions given on another grid (the
 * analysis grid or an output grid), reprojecting each point if the two live
 * in different projections.
 *
 * <p>Grid positions use geotransform pixel coordinates, so the centre of
 * grid pixel {@code (c, r)} is {@code (c + 0.5, r + 0.5)}. Missing values
 * (outside the source, nodata, bad data mask) come back as {@code NaN}.</p>
 */
public final class GridSampler
{
    private static final double INTEGER_TOLERANCE = 1e-9;

    private final Raster source;
    private final double[][] band;
    private final GeoTransform grid;
    private final CoordinateTransform toSource;
    private final ResamplingMethod method;
    private final boolean aligned;
    private final int colOffset, rowOffset;

    /**
     * @param bandIndex      zero based band of {@code source}
     * @param grid           grid the positions refer to
     * @param gridProjection projection of {@code grid}; only used when {@code reproject} is set
     */
    public GridSampler(Raster source, int bandIndex, GeoTransform grid, String gridProjection,
                       boolean reproject, ResamplingMethod method)
    {
        this.source = source;
        this.band = maskedBand(source, bandIndex);
        this.grid = grid;
        this.method = method;
        this.toSource = reproject ? Projections.createTransform(gridProjection, source.getProjection()) : null;
        this.aligned = !reproject && source.getGeoTransform().isGridAlignedWith(grid);
        if (aligned) {
            double[] p = source.getGeoTransform().pixelFromWorld(grid.getOriginX(), grid.getOriginY());
            this.colOffset = (int) Math.rint(p[0]);
            this.rowOffset = (int) Math.rint(p[1]);
        } else {
            this.colOffset = 0;
            this.rowOffset = 0;
        }
    }

    // sampler over a quality mask of 'owner'; set pixels read as 1.0
    public static GridSampler forMask(Raster owner, BinaryMask mask, GeoTransform grid, String gridProjection,
                                      boolean reproject)
    {
        double[][] values = new double[mask.getRows()][mask.getCols()];
        for (int r = 0; r < values.length; r++) {
            for (int c = 0; c < values[r].length; c++) values[r][c] = mask.isSet(r, c) ? 1.0 : 0.0;
        }
        Raster m = Raster.builder(values)
            .geoTransform(owner.getGeoTransform())
            .projection(owner.getProjection())
            .dataType(DataType.UINT8)
            .build();
        return new GridSampler(m, 0, grid, gridProjection, reproject, ResamplingMethod.NEAREST);
    }

    // true if whole pixels of the source can be copied without interpolation
    public boolean isAligned()
    {
        return aligned;
    }

    public double sampleWorld(double x, double y)
    {
        double sx = x, sy = y;
        if (toSource != null) {
            double[] p = Projections.transform(toSource, x, y);
            sx = p[0];
            sy = p[1];
        }
        double[] px = source.getGeoTransform().pixelFromWorld(sx, sy);
        return Interpolation.sample(band, px[0] - 0.5, px[1] - 0.5, method, null);
    }

    public double sampleGrid(double col, double row)
    {
        if (aligned) {
            double ci = col - 0.5, ri = row - 0.5;
            if (isInteger(ci) && isInteger(ri)) {
                int c = (int) Math.rint(ci) + colOffset, r = (int) Math.rint(ri) + rowOffset;
                if (r < 0 || c < 0 || r >= band.length || c >= band[0].length) return Double.NaN;
                return band[r][c];
            }
        }
        double[] w = grid.worldFromPixel(col, row);
        return sampleWorld(w[0], w[1]);
    }

    /**
     * Window of {@code width x height} grid pixels starting at grid pixel
     * {@code (col0, row0)}, with every position moved by {@code (shiftCol, shiftRow)}.
     */
    public double[][] window(int col0, int row0, int width, int height, double shiftCol, double shiftRow)
    {
        double[][] out = new double[height][width];
        for (int j = 0; j < height; j++) {
            for (int i = 0; i < width; i++) {
                out[j][i] = sampleGrid(col0 + i + 0.5 + shiftCol, row0 + j + 0.5 + shiftRow);
            }
        }
        return out;
    }

    /**
     * True if the corners of the (shifted) window fall inside the source image.
     */
    public boolean covers(int col0, int row0, int width, int height, double shiftCol, double shiftRow)
    {
        double[][] corners = {
            { col0 + shiftCol, row0 + shiftRow }, { col0 + width + shiftCol, row0 + shiftRow },
            { col0 + shiftCol, row0 + height + shiftRow }, { col0 + width + shiftCol, row0 + height + shiftRow }
        };
        GeoTransform sgt = source.getGeoTransform();
        double tol = 1e-6;
        for (double[] corner : corners) {
            double[] w = grid.worldFromPixel(corner[0], corner[1]);
            if (toSource != null) w = Projections.transform(toSource, w[0], w[1]);
            double[] p = sgt.pixelFromWorld(w[0], w[1]);
            if (p[0] < -tol || p[1] < -tol || p[0] > source.getCols() + tol || p[1] > source.getRows() + tol) {
                return false;
            }
        }
        return true;
    }

    private static boolean isInteger(double v)
    {
        return Math.abs(v - Math.rint(v)) < INTEGER_TOLERANCE;
    }

    // band with nodata and masked pixels turned into NaN
    private static double[][] maskedBand(Raster raster, int bandIndex)
    {
        double[][] src = raster.getBand(bandIndex);
        if (raster.getNoData() == null && raster.getBadDataMask() == null) return src;
        double[][] out = new double[raster.getRows()][raster.getCols()];
        for (int r = 0; r < out.length; r++) {
            for (int c = 0; c < out[r].length; c++) {
                out[r][c] = raster.isNoData(bandIndex, r, c) ? Double.NaN : src[r][c];
            }
        }
        return out;
    }
}

package com.thetalimited.coreg;

import java.nio.file.Path;

import com.thetalimited.coreg.geo.GeoTransform;
import com.thetalimited.coreg.raster.Raster;

/**
 * The corrected target raster together with how it was produced.
 */
public final class DeshiftResult
{
    private final Raster raster;
    private final boolean shifted;
    private final boolean resampled;
    private final boolean gridMatchesReference;
    private final Path pathOut;

    public DeshiftResult(Raster raster, boolean shifted, boolean resampled, boolean gridMatchesReference,
                         Path pathOut)
    {
        this.raster = raster;
        this.shifted = shifted;
        this.resampled = resampled;
        this.gridMatchesReference = gridMatchesReference;
        this.pathOut = pathOut;
    }

    public DeshiftResult withPathOut(Path path)
    {
        return new DeshiftResult(raster, shifted, resampled, gridMatchesReference, path);
    }

    public boolean isShifted() { return shifted; }
    public boolean isResampled() { return resampled; }

    // true if the output pixel grid coincides with the reference pixel grid
    public boolean isGridMatchingReference() { return gridMatchesReference; }

    public Raster getRaster() { return raster; }

    // band stacked output samples; do not modify
    public double[][][] getArray()
    {
        double[][][] out = new double[raster.getBandCount()][][];
        for (int b = 0; b < out.length; b++) out[b] = raster.getBand(b);
        return out;
    }

    public GeoTransform getGeoTransform() { return raster.getGeoTransform(); }
    public String getProjection() { return raster.getProjection(); }
    public Double getNoData() { return raster.getNoData(); }

    // null if nothing was written
    public Path getPathOut() { return pathOut; }

    @Override
    public String toString()
    {
        return "DeshiftResult[shifted=" + shifted + ", resampled=" + resampled + ", gt=" + getGeoTransform()
            + (pathOut != null ? ", out=" + pathOut : "") + "]";
    }
}

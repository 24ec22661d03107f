package com.thetalimited.coreg.engine;

import com.thetalimited.coreg.geo.Bounds;
import com.thetalimited.coreg.geo.GeoTransform;

/**
 * Equal shaped reference and target arrays on the analysis grid, ready for
 * matching. Nodata pixels have already been replaced by the window mean.
 */
public final class SampleWindow
{
    private final double[][] reference;
    private final double[][] target;
    private final GeoTransform grid;
    private final double refNodataFraction, tgtNodataFraction;
    private final double obscuredFraction;
    private final double shiftCol, shiftRow;

    SampleWindow(double[][] reference, double[][] target, GeoTransform grid,
                 double refNodataFraction, double tgtNodataFraction, double obscuredFraction,
                 double shiftCol, double shiftRow)
    {
        if (reference.length != target.length || reference[0].length != target[0].length) {
            throw new IllegalArgumentException("reference and target windows differ in shape");
        }
        this.reference = reference;
        this.target = target;
        this.grid = grid;
        this.refNodataFraction = refNodataFraction;
        this.tgtNodataFraction = tgtNodataFraction;
        this.obscuredFraction = obscuredFraction;
        this.shiftCol = shiftCol;
        this.shiftRow = shiftRow;
    }

    public double[][] getReference() { return reference; }
    public double[][] getTarget() { return target; }
    public int getRows() { return reference.length; }
    public int getCols() { return reference[0].length; }

    // geotransform of the window itself, origin at its upper left corner
    public GeoTransform getGrid() { return grid; }

    public Bounds getBounds()
    {
        return grid.footprint(getCols(), getRows());
    }

    public double getResolutionX() { return grid.getXRes(); }
    public double getResolutionY() { return grid.getYRes(); }

    public double getRefNodataFraction() { return refNodataFraction; }
    public double getTgtNodataFraction() { return tgtNodataFraction; }
    public double getObscuredFraction() { return obscuredFraction; }

    // offset, in analysis pixels, at which the target was sampled
    public double getShiftCol() { return shiftCol; }
    public double getShiftRow() { return shiftRow; }

    // both windows hold at least one pixel that is not nodata
    public boolean hasValidData()
    {
        return refNodataFraction < 1.0 && tgtNodataFraction < 1.0;
    }

    // some pixels are covered by a cloud mask, though not enough to reject the window
    public boolean isObscured()
    {
        return obscuredFraction > 0.0;
    }
}

package com.thetalimited.coreg.raster;

/**
 * Boolean per-pixel mask laid out on the grid of the raster it belongs to.
 * {@code true} marks a pixel as bad, cloudy or otherwise unusable.
 */
public final class BinaryMask
{
    private final boolean[][] mask;
    private final int rows, cols;

    public BinaryMask(boolean[][] mask)
    {
        if (mask == null || mask.length == 0 || mask[0].length == 0) {
            throw new IllegalArgumentException("mask must not be empty");
        }
        this.rows = mask.length;
        this.cols = mask[0].length;
        this.mask = new boolean[rows][];
        for (int r = 0; r < rows; r++) {
            if (mask[r].length != cols) throw new IllegalArgumentException("mask rows must have equal length");
            this.mask[r] = mask[r].clone();
        }
    }

    public static BinaryMask empty(int rows, int cols)
    {
        return new BinaryMask(new boolean[rows][cols]);
    }

    // pixels equal to 'value' (or above zero when value is null) become true
    public static BinaryMask fromRaster(Raster raster, Double value)
    {
        double[][] band = raster.getBand(0);
        boolean[][] m = new boolean[raster.getRows()][raster.getCols()];
        for (int r = 0; r < m.length; r++) {
            for (int c = 0; c < m[r].length; c++) {
                double v = band[r][c];
                m[r][c] = value == null ? v > 0 : Double.compare(v, value) == 0;
            }
        }
        return new BinaryMask(m);
    }

    public int getRows() { return rows; }
    public int getCols() { return cols; }

    public boolean isSet(int row, int col)
    {
        return mask[row][col];
    }

    public boolean matches(Raster raster)
    {
        return rows == raster.getRows() && cols == raster.getCols();
    }

    public long countSet()
    {
        long n = 0;
        for (boolean[] row : mask) for (boolean b : row) if (b) n++;
        return n;
    }
}

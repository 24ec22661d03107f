package com.thetalimited.coreg;

/**
 * Requested centre of the matching window, either in map units of the
 * reference projection or in reference pixel coordinates (column, row; pixel
 * centres at +0.5).
 */
public final class WindowPosition
{
    private final double x, y;
    private final boolean pixelCoordinates;

    private WindowPosition(double x, double y, boolean pixelCoordinates)
    {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("window position must be finite, got " + x + "," + y);
        }
        this.x = x;
        this.y = y;
        this.pixelCoordinates = pixelCoordinates;
    }

    public static WindowPosition ofMap(double x, double y)
    {
        return new WindowPosition(x, y, false);
    }

    public static WindowPosition ofPixel(double col, double row)
    {
        return new WindowPosition(col, row, true);
    }

    public double getX() { return x; }
    public double getY() { return y; }

    public boolean isPixelCoordinates()
    {
        return pixelCoordinates;
    }

    @Override
    public String toString()
    {
        return (pixelCoordinates ? "pixel(" : "map(") + x + ", " + y + ")";
    }
}

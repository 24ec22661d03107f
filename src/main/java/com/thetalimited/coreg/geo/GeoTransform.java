package com.thetalimited.coreg.geo;

import java.util.Arrays;

/**
 * GDAL-ordered affine geotransform.
 *
 * <pre>
 *   x = originX + col * pixelWidth + row * rotationX
 *   y = originY + col * rotationY  + row * pixelHeight
 * </pre>
 *
 * Instances are immutable; the inverse is computed once at construction.
 */
public final class GeoTransform
{
    // tolerance used when deciding whether two grids line up
    public static final double GRID_TOLERANCE = 1e-6;

    // Affine: x = a0 + a1*col + a2*row; y = b0 + b1*col + b2*row
    private final double a0, a1, a2, b0, b1, b2;
    private final double inv00, inv01, inv10, inv11;

    public GeoTransform(double originX, double pixelWidth, double rotationX,
                        double originY, double rotationY, double pixelHeight)
    {
        if (pixelWidth == 0.0 || pixelHeight == 0.0) {
            throw new IllegalArgumentException("pixel width and height must be non-zero, got "
                                               + pixelWidth + "," + pixelHeight);
        }
        this.a0 = originX; this.a1 = pixelWidth; this.a2 = rotationX;
        this.b0 = originY; this.b1 = rotationY; this.b2 = pixelHeight;

        double det = a1*b2 - a2*b1;
        if (Math.abs(det) < 1e-24) throw new IllegalStateException("Non-invertible geotransform (det≈0)");
        this.inv00 =  b2/det; this.inv01 = -a2/det;
        this.inv10 = -b1/det; this.inv11 =  a1/det;
    }

    public static GeoTransform of(double[] gt)
    {
        if (gt == null || gt.length != 6) {
            throw new IllegalArgumentException("geotransform needs 6 coefficients, got "
                                               + (gt == null ? "null" : gt.length));
        }
        return new GeoTransform(gt[0], gt[1], gt[2], gt[3], gt[4], gt[5]);
    }

    // pixel space identity with north-up orientation, used for rasters without georeferencing
    public static GeoTransform pixelSpace()
    {
        return new GeoTransform(0, 1, 0, 0, 0, -1);
    }

    public double getOriginX()    { return a0; }
    public double getPixelWidth() { return a1; }
    public double getRotationX()  { return a2; }
    public double getOriginY()    { return b0; }
    public double getRotationY()  { return b1; }
    public double getPixelHeight(){ return b2; }

    // absolute pixel sizes along the two image axes
    public double getXRes() { return Math.hypot(a1, b1); }
    public double getYRes() { return Math.hypot(a2, b2); }

    public boolean isRotated()
    {
        return a2 != 0.0 || b1 != 0.0;
    }

    public double[] toArray()
    {
        return new double[] { a0, a1, a2, b0, b1, b2 };
    }

    public double[] worldFromPixel(double col, double row)
    {
        return new double[] { a0 + a1*col + a2*row, b0 + b1*col + b2*row };
    }

    public double[] pixelFromWorld(double x, double y)
    {
        double dx = x - a0, dy = y - b0;
        double col = inv00*dx + inv01*dy;
        double row = inv10*dx + inv11*dy;
        return new double[] { col, row };
    }

    public GeoTransform translate(double dx, double dy)
    {
        return new GeoTransform(a0 + dx, a1, a2, b0 + dy, b1, b2);
    }

    // same transform with the origin moved to pixel (col,row) of this grid
    public GeoTransform withOriginAtPixel(double col, double row)
    {
        double[] o = worldFromPixel(col, row);
        return new GeoTransform(o[0], a1, a2, o[1], b1, b2);
    }

    /**
     * Map-space footprint of a cols x rows raster on this transform.
     * Pixel corners are used (PixelIsArea convention).
     */
    public Bounds footprint(int cols, int rows)
    {
        double[] p00 = worldFromPixel(0, 0);     // UL
        double[] p10 = worldFromPixel(cols, 0);  // UR
        double[] p01 = worldFromPixel(0, rows);  // LL
        double[] p11 = worldFromPixel(cols, rows); // LR

        double minX = Math.min(Math.min(p00[0], p10[0]), Math.min(p01[0], p11[0]));
        double maxX = Math.max(Math.max(p00[0], p10[0]), Math.max(p01[0], p11[0]));
        double minY = Math.min(Math.min(p00[1], p10[1]), Math.min(p01[1], p11[1]));
        double maxY = Math.max(Math.max(p00[1], p10[1]), Math.max(p01[1], p11[1]));

        return new Bounds(minX, minY, maxX, maxY);
    }

    public boolean hasSameResolution(GeoTransform other)
    {
        return near(a1, other.a1) && near(b2, other.b2) && near(a2, other.a2) && near(b1, other.b1);
    }

    /**
     * True if both grids share resolution, carry no rotation and their origins
     * differ by a whole number of pixels.
     */
    public boolean isGridAlignedWith(GeoTransform other)
    {
        if (isRotated() || other.isRotated() || !hasSameResolution(other)) {
            return false;
        }
        double[] px = pixelFromWorld(other.a0, other.b0);
        return nearInteger(px[0]) && nearInteger(px[1]);
    }

    private static boolean near(double a, double b)
    {
        double scale = Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
        return Math.abs(a - b) <= GRID_TOLERANCE * scale;
    }

    private static boolean nearInteger(double v)
    {
        return Math.abs(v - Math.rint(v)) < 1e-4;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof GeoTransform)) return false;
        return Arrays.equals(toArray(), ((GeoTransform) o).toArray());
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(toArray());
    }

    @Override
    public String toString()
    {
        return String.format("(%.6f, %.6f, %.6f, %.6f, %.6f, %.6f)", a0, a1, a2, b0, b1, b2);
    }
}

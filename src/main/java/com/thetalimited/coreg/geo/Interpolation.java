package com.thetalimited.coreg.geo;

/**
 * Point sampling of a single band at fractional array positions.
 *
 * <p>Positions are given in array index space, i.e. {@code (x, y) = (2.0, 3.0)}
 * is the centre of {@code band[3][2]}. A geotransform pixel coordinate converts
 * with {@code x = col - 0.5}. Every method returns {@code NaN} when the position
 * lies outside the band or when a contributing pixel is nodata.</p>
 */
public final class Interpolation
{
    private static final double CUBIC_A = -0.5;

    private Interpolation() {}

    public static double sample(double[][] band, double x, double y, ResamplingMethod method, Double noData)
    {
        switch (method) {
        case NEAREST:
            return nearest(band, x, y, noData);
        case BILINEAR:
            return bilinear(band, x, y, noData);
        case CUBIC:
            return cubic(band, x, y, noData);
        default:
            throw new IllegalArgumentException("unsupported resampling method " + method);
        }
    }

    public static double nearest(double[][] band, double x, double y, Double noData)
    {
        int rows = band.length, cols = band[0].length;
        int c = (int) Math.round(x), r = (int) Math.round(y);
        if (c < 0 || r < 0 || c >= cols || r >= rows) return Double.NaN;
        return valueOrNaN(band[r][c], noData);
    }

    // bilinear over the 2x2 neighbourhood; edges are clamped within half a pixel
    public static double bilinear(double[][] band, double x, double y, Double noData)
    {
        int rows = band.length, cols = band[0].length;
        if (!inside(x, y, cols, rows)) return Double.NaN;

        int c0 = (int) Math.floor(x), r0 = (int) Math.floor(y);
        double dc = x - c0, dr = y - r0;
        int c1 = clamp(c0 + 1, cols), r1 = clamp(r0 + 1, rows);
        c0 = clamp(c0, cols); r0 = clamp(r0, rows);

        double z00 = valueOrNaN(band[r0][c0], noData), z10 = valueOrNaN(band[r0][c1], noData);
        double z01 = valueOrNaN(band[r1][c0], noData), z11 = valueOrNaN(band[r1][c1], noData);
        if (Double.isNaN(z00) || Double.isNaN(z10) || Double.isNaN(z01) || Double.isNaN(z11)) return Double.NaN;

        double z0 = z00*(1-dc) + z10*dc;
        double z1 = z01*(1-dc) + z11*dc;
        return z0*(1-dr) + z1*dr;
    }

    // cubic convolution over the 4x4 neighbourhood
    public static double cubic(double[][] band, double x, double y, Double noData)
    {
        int rows = band.length, cols = band[0].length;
        if (!inside(x, y, cols, rows)) return Double.NaN;

        int cBase = (int) Math.floor(x), rBase = (int) Math.floor(y);
        double dc = x - cBase, dr = y - rBase;

        double[] wx = cubicWeights(dc);
        double[] wy = cubicWeights(dr);

        double sum = 0.0;
        for (int j = 0; j < 4; j++) {
            int r = clamp(rBase - 1 + j, rows);
            double rowSum = 0.0;
            for (int i = 0; i < 4; i++) {
                int c = clamp(cBase - 1 + i, cols);
                double v = valueOrNaN(band[r][c], noData);
                if (Double.isNaN(v)) {
                    // only pixels with a non-zero weight matter
                    if (wx[i] != 0.0 && wy[j] != 0.0) return Double.NaN;
                    continue;
                }
                rowSum += wx[i] * v;
            }
            sum += wy[j] * rowSum;
        }
        return sum;
    }

    static double[] cubicWeights(double t)
    {
        return new double[] {
            kernel(1.0 + t), kernel(t), kernel(1.0 - t), kernel(2.0 - t)
        };
    }

    private static double kernel(double s)
    {
        s = Math.abs(s);
        if (s <= 1.0) {
            return (CUBIC_A + 2.0)*s*s*s - (CUBIC_A + 3.0)*s*s + 1.0;
        }
        if (s < 2.0) {
            return CUBIC_A*s*s*s - 5.0*CUBIC_A*s*s + 8.0*CUBIC_A*s - 4.0*CUBIC_A;
        }
        return 0.0;
    }

    private static boolean inside(double x, double y, int cols, int rows)
    {
        return x >= -0.5 && y >= -0.5 && x <= cols - 0.5 && y <= rows - 0.5;
    }

    private static int clamp(int i, int n)
    {
        return i < 0 ? 0 : (i >= n ? n - 1 : i);
    }

    private static double valueOrNaN(double v, Double noData)
    {
        if (Double.isNaN(v)) return Double.NaN;
        if (noData != null && Double.compare(v, noData) == 0) return Double.NaN;
        return v;
    }
}

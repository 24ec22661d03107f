package com.thetalimited.coreg;

import java.util.Random;

import org.jtransforms.fft.DoubleFFT_2D;

import com.thetalimited.coreg.geo.GeoTransform;
import com.thetalimited.coreg.raster.Raster;

/**
 * Deterministic test imagery: smoothed noise textures, crops of them at known
 * offsets and exact sub-pixel translations via Fourier phase ramps.
 */
public final class SyntheticImages
{
    public static final String UTM33 = "+proj=utm +zone=33 +datum=WGS84 +units=m +no_defs";

    private SyntheticImages() {}

    // white noise smoothed with a 3x3 box filter, values roughly in [0, 1000]
    public static double[][] texture(int rows, int cols, long seed)
    {
        Random rnd = new Random(seed);
        double[][] noise = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) noise[r][c] = rnd.nextDouble() * 1000.0;
        }
        double[][] out = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                double sum = 0;
                int n = 0;
                for (int dr = -1; dr <= 1; dr++) {
                    for (int dc = -1; dc <= 1; dc++) {
                        int rr = r + dr, cc = c + dc;
                        if (rr < 0 || cc < 0 || rr >= rows || cc >= cols) continue;
                        sum += noise[rr][cc];
                        n++;
                    }
                }
                out[r][c] = sum / n;
            }
        }
        return out;
    }

    public static double[][] crop(double[][] src, int row0, int col0, int rows, int cols)
    {
        double[][] out = new double[rows][cols];
        for (int r = 0; r < rows; r++) System.arraycopy(src[row0 + r], col0, out[r], 0, cols);
        return out;
    }

    /**
     * Circular translation by a fractional amount: {@code out(x) = in(x - d)},
     * so image content moves by {@code (dx, dy)} pixels. Nyquist terms are dropped.
     */
    public static double[][] fourierShift(double[][] in, double dx, double dy)
    {
        int rows = in.length, cols = in[0].length;
        double[][] a = new double[rows][2 * cols];
        for (int r = 0; r < rows; r++) System.arraycopy(in[r], 0, a[r], 0, cols);
        DoubleFFT_2D fft = new DoubleFFT_2D(rows, cols);
        fft.realForwardFull(a);

        for (int r = 0; r < rows; r++) {
            int ky = r < (rows + 1) / 2 ? r : r - rows;
            for (int c = 0; c < cols; c++) {
                int kx = c < (cols + 1) / 2 ? c : c - cols;
                if ((rows % 2 == 0 && r == rows / 2) || (cols % 2 == 0 && c == cols / 2)) {
                    a[r][2 * c] = 0;
                    a[r][2 * c + 1] = 0;
                    continue;
                }
                double phi = -2.0 * Math.PI * ((double) kx * dx / cols + (double) ky * dy / rows);
                double re = a[r][2 * c], im = a[r][2 * c + 1];
                double cos = Math.cos(phi), sin = Math.sin(phi);
                a[r][2 * c] = re * cos - im * sin;
                a[r][2 * c + 1] = re * sin + im * cos;
            }
        }
        fft.complexInverse(a, true);

        double[][] out = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) out[r][c] = a[r][2 * c];
        }
        return out;
    }

    // north-up grid with square pixels
    public static GeoTransform grid(double originX, double originY, double res)
    {
        return new GeoTransform(originX, res, 0, originY, 0, -res);
    }

    public static Raster raster(double[][] band, GeoTransform gt, String projection)
    {
        return Raster.builder(band).geoTransform(gt).projection(projection).build();
    }

    /**
     * Reference and target cut from one texture so that the target content is
     * displaced by {@code (dx, dy)} whole pixels: {@code tgt[r][c] = ref[r - dy][c - dx]}.
     * Both share the same grid.
     */
    public static Raster[] shiftedPair(int size, int dx, int dy, GeoTransform gt, String projection, long seed)
    {
        int pad = 16;
        double[][] base = texture(size + 2 * pad, size + 2 * pad, seed);
        double[][] ref = crop(base, pad, pad, size, size);
        double[][] tgt = crop(base, pad - dy, pad - dx, size, size);
        return new Raster[] { raster(ref, gt, projection), raster(tgt, gt, projection) };
    }
}

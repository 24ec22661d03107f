package com.thetalimited.coreg.engine;

import java.util.HashSet;
import java.util.Set;

import org.jtransforms.fft.DoubleFFT_2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Frequency domain estimator of the translation between two equally sized
 * windows.
 *
 * <p>Both windows are mean-free and tapered, transformed with JTransforms and
 * combined into the normalized cross-power spectrum
 * {@code Ft * conj(Fr) / (|Ft * conj(Fr)| + eps)}. Its inverse transform is a
 * correlation surface with a single sharp peak at the displacement. The peak
 * is refined to sub-pixel precision with Foroosh's side peak estimator, which
 * is exact for the sinc shaped peak of a pure translation.</p>
 */
public class PhaseCorrelator
{
    private static final Logger log = LoggerFactory.getLogger(PhaseCorrelator.class);

    static final double EPS = 1e-12;

    // half sizes of the neighbourhoods used for peak statistics
    private static final int PEAK_HALF = 1;        // 3x3
    private static final int AMBIGUITY_HALF = 2;   // 5x5
    private static final int NOISE_HALF = 3;       // 7x7

    /**
     * Supplies the sample window with the target sampled at an integer offset
     * (analysis grid pixels) from its nominal position.
     */
    @FunctionalInterface
    public interface WindowExtractor
    {
        SampleWindow extract(int shiftCol, int shiftRow);
    }

    @FunctionalInterface
    public interface IterationListener
    {
        IterationListener NONE = (i, w, pc) -> { };

        void onIteration(int iteration, SampleWindow window, PhaseCorrelation correlation);
    }

    private final WindowFunction windowFunction;
    private final double ambiguityRatio;
    private final int maxIterations;

    public PhaseCorrelator(WindowFunction windowFunction, double ambiguityRatio, int maxIterations)
    {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
        this.windowFunction = windowFunction;
        this.ambiguityRatio = ambiguityRatio;
        this.maxIterations = maxIterations;
    }

    /**
     * Estimate iteratively: while the integer peak is not at zero, move the
     * target window by it and correlate again. The returned displacement is the
     * accumulated integer offset plus the estimate of the last pass.
     */
    public PhaseCorrelation estimate(WindowExtractor extractor, IterationListener listener)
    {
        int offCol = 0, offRow = 0;
        Set<Long> visited = new HashSet<>();
        PhaseCorrelation last = null;

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            SampleWindow window = extractor.extract(offCol, offRow);
            last = correlate(window.getReference(), window.getTarget());
            listener.onIteration(iteration, window, last);
            log.debug("iteration {}: offset ({},{}) -> {}", iteration, offCol, offRow, last);

            if (last.getPeakCol() == 0 && last.getPeakRow() == 0) {
                return last.withOffset(offCol, offRow, iteration, true);
            }
            visited.add(key(offCol, offRow));
            int nextCol = offCol + last.getPeakCol(), nextRow = offRow + last.getPeakRow();
            if (iteration == maxIterations || visited.contains(key(nextCol, nextRow))) {
                // oscillating between offsets or out of iterations
                return last.withOffset(offCol, offRow, iteration, false);
            }
            offCol = nextCol;
            offRow = nextRow;
        }
        throw new IllegalStateException("unreachable");
    }

    // single pass on two windows of identical shape
    public PhaseCorrelation correlate(double[][] reference, double[][] target)
    {
        int rows = reference.length, cols = reference[0].length;
        if (target.length != rows || target[0].length != cols) {
            throw new IllegalArgumentException("windows differ in shape: " + rows + "x" + cols
                                               + " vs " + target.length + "x" + target[0].length);
        }

        double[][] fr = spectrum(reference);
        double[][] ft = spectrum(target);

        double[][] cross = new double[rows][2 * cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                double rr = fr[r][2*c], ri = fr[r][2*c + 1];
                double tr = ft[r][2*c], ti = ft[r][2*c + 1];
                double re = tr*rr + ti*ri;
                double im = ti*rr - tr*ri;
                double mag = Math.hypot(re, im) + EPS;
                cross[r][2*c] = re / mag;
                cross[r][2*c + 1] = im / mag;
            }
        }
        new DoubleFFT_2D(rows, cols).complexInverse(cross, true);

        double[][] s = new double[rows][cols];
        int pr = 0, pc = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                s[r][c] = cross[r][2*c];
                if (s[r][c] > s[pr][pc]) {
                    pr = r;
                    pc = c;
                }
            }
        }
        double peak = s[pr][pc];

        int peakRow = signed(pr, rows), peakCol = signed(pc, cols);
        double subCol = subPixel(peak, at(s, pr, pc - 1), at(s, pr, pc + 1));
        double subRow = subPixel(peak, at(s, pr - 1, pc), at(s, pr + 1, pc));

        double reliability = reliability(s, pr, pc);
        double peakRatio = peakRatio(s, pr, pc);
        boolean ambiguous = peak <= 0 || peakRatio >= ambiguityRatio;

        return new PhaseCorrelation(peakCol + subCol, peakRow + subRow, peakCol, peakRow,
                                    reliability, peakRatio, ambiguous, 1, true, fftShift(s));
    }

    private double[][] spectrum(double[][] window)
    {
        int rows = window.length, cols = window[0].length;
        double mean = 0.0;
        for (double[] row : window) for (double v : row) mean += v;
        mean /= (double) rows * cols;

        double[][] centered = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) centered[r][c] = window[r][c] - mean;
        }
        double[][] tapered = windowFunction.apply(centered);

        // realForwardFull wants rows x 2*cols with the input in the first half of each row
        double[][] a = new double[rows][2 * cols];
        for (int r = 0; r < rows; r++) System.arraycopy(tapered[r], 0, a[r], 0, cols);
        new DoubleFFT_2D(rows, cols).realForwardFull(a);
        return a;
    }

    /**
     * Foroosh et al. (2002): with c0 the peak and c1 the larger positive side
     * value the fractional offset is c1 / (c1 + c0), towards c1.
     */
    static double subPixel(double c0, double left, double right)
    {
        if (c0 <= 0) return 0.0;
        if (right >= left && right > 0) return right / (right + c0);
        if (left > 0) return -left / (left + c0);
        return 0.0;
    }

    /**
     * 100 - 100 * (mean + 2 std of the surface outside the 7x7 peak area)
     * / (mean of the 3x3 peak area), clamped to [0, 100].
     */
    static double reliability(double[][] s, int pr, int pc)
    {
        int rows = s.length, cols = s[0].length;
        double peakSum = 0.0;
        int peakN = 0;
        for (int dr = -PEAK_HALF; dr <= PEAK_HALF; dr++) {
            for (int dc = -PEAK_HALF; dc <= PEAK_HALF; dc++) {
                peakSum += at(s, pr + dr, pc + dc);
                peakN++;
            }
        }
        double peakMean = peakSum / peakN;
        if (!(peakMean > 0)) return 0.0;

        double sum = 0.0, sumSq = 0.0;
        long n = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (circularDistance(r, pr, rows) <= NOISE_HALF && circularDistance(c, pc, cols) <= NOISE_HALF) continue;
                sum += s[r][c];
                sumSq += s[r][c] * s[r][c];
                n++;
            }
        }
        if (n == 0) return 0.0;
        double mean = sum / n;
        double std = Math.sqrt(Math.max(0.0, sumSq / n - mean * mean));
        double rel = 100.0 - 100.0 * (mean + 2.0 * std) / peakMean;
        return Math.max(0.0, Math.min(100.0, rel));
    }

    // highest local maximum outside the 5x5 peak area relative to the peak
    static double peakRatio(double[][] s, int pr, int pc)
    {
        int rows = s.length, cols = s[0].length;
        double peak = s[pr][pc];
        if (!(peak > 0)) return 1.0;

        double second = 0.0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (circularDistance(r, pr, rows) <= AMBIGUITY_HALF && circularDistance(c, pc, cols) <= AMBIGUITY_HALF) continue;
                double v = s[r][c];
                if (v > second && isLocalMax(s, r, c)) second = v;
            }
        }
        return second / peak;
    }

    private static boolean isLocalMax(double[][] s, int r, int c)
    {
        double v = s[r][c];
        for (int dr = -1; dr <= 1; dr++) {
            for (int dc = -1; dc <= 1; dc++) {
                if ((dr != 0 || dc != 0) && at(s, r + dr, c + dc) >= v) return false;
            }
        }
        return true;
    }

    static double[][] fftShift(double[][] s)
    {
        int rows = s.length, cols = s[0].length;
        double[][] out = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                out[(r + rows / 2) % rows][(c + cols / 2) % cols] = s[r][c];
            }
        }
        return out;
    }

    // index on the periodic surface -> signed displacement
    private static int signed(int i, int n)
    {
        return i >= (n + 1) / 2 ? i - n : i;
    }

    private static double at(double[][] s, int r, int c)
    {
        return s[Math.floorMod(r, s.length)][Math.floorMod(c, s[0].length)];
    }

    private static int circularDistance(int a, int b, int n)
    {
        int d = Math.abs(a - b) % n;
        return Math.min(d, n - d);
    }

    private static long key(int col, int row)
    {
        return ((long) col << 32) ^ (row & 0xFFFFFFFFL);
    }
}

package com.thetalimited.coreg.engine;

/**
 * Output of the phase correlation estimator.
 *
 * <p>The displacement is how far the target content sits from the reference
 * content, in analysis grid pixels: a feature at reference column {@code c}
 * shows up at target column {@code c + dx}. It includes the integer offsets
 * accumulated over all iterations.</p>
 */
public final class PhaseCorrelation
{
    private final double dx, dy;
    private final int peakCol, peakRow;
    private final double reliability;
    private final double peakRatio;
    private final boolean ambiguous;
    private final int iterations;
    private final boolean converged;
    private final double[][] surface;

    PhaseCorrelation(double dx, double dy, int peakCol, int peakRow, double reliability, double peakRatio,
                     boolean ambiguous, int iterations, boolean converged, double[][] surface)
    {
        this.dx = dx;
        this.dy = dy;
        this.peakCol = peakCol;
        this.peakRow = peakRow;
        this.reliability = reliability;
        this.peakRatio = peakRatio;
        this.ambiguous = ambiguous;
        this.iterations = iterations;
        this.converged = converged;
        this.surface = surface;
    }

    // same estimate with an integer offset added and iteration bookkeeping replaced
    PhaseCorrelation withOffset(int offsetCol, int offsetRow, int iterations, boolean converged)
    {
        return new PhaseCorrelation(dx + offsetCol, dy + offsetRow, peakCol, peakRow, reliability, peakRatio,
                                    ambiguous, iterations, converged, surface);
    }

    public double getDx() { return dx; }
    public double getDy() { return dy; }

    // integer peak position of the last pass as a signed displacement
    public int getPeakCol() { return peakCol; }
    public int getPeakRow() { return peakRow; }

    // 0 (noise) .. 100 (single clean peak)
    public double getReliability() { return reliability; }

    // second highest local maximum divided by the main peak
    public double getPeakRatio() { return peakRatio; }
    public boolean isAmbiguous() { return ambiguous; }
    public int getIterations() { return iterations; }
    public boolean isConverged() { return converged; }

    /**
     * Correlation surface of the last pass, fftshifted so that zero
     * displacement sits at {@code [rows/2][cols/2]}.
     */
    public double[][] getSurface() { return surface; }

    @Override
    public String toString()
    {
        return String.format("PhaseCorrelation[dx=%.4f, dy=%.4f, reliability=%.1f%%, peakRatio=%.3f%s, iter=%d%s]",
                             dx, dy, reliability, peakRatio, ambiguous ? " AMBIGUOUS" : "", iterations,
                             converged ? "" : " NOT CONVERGED");
    }
}

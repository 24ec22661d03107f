package com.thetalimited.coreg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable outcome of a shift detection run.
 *
 * <p>A successful result carries the correction to apply to the target, in
 * analysis grid pixels and in map units of the reference projection. A failed
 * result carries the {@link FailureKind} and message only; asking it for a
 * shift throws {@link IllegalStateException}.</p>
 */
public final class ShiftResult
{
    private final boolean success;
    private final FailureKind failureKind;
    private final String message;
    private final double dxPx, dyPx;
    private final double dxMap, dyMap;
    private final double reliability;
    private final double peakRatio;
    private final boolean ambiguous;
    private final boolean reliable;
    private final double ssimBefore, ssimAfter;
    private final int iterations;
    private final boolean converged;
    private final double windowCenterX, windowCenterY;
    private final int windowWidth, windowHeight;
    private final List<String> advisories;

    private ShiftResult(Builder b)
    {
        this.success = b.success;
        this.failureKind = b.failureKind;
        this.message = b.message;
        this.dxPx = b.dxPx;
        this.dyPx = b.dyPx;
        this.dxMap = b.dxMap;
        this.dyMap = b.dyMap;
        this.reliability = b.reliability;
        this.peakRatio = b.peakRatio;
        this.ambiguous = b.ambiguous;
        this.reliable = b.reliable;
        this.ssimBefore = b.ssimBefore;
        this.ssimAfter = b.ssimAfter;
        this.iterations = b.iterations;
        this.converged = b.converged;
        this.windowCenterX = b.windowCenterX;
        this.windowCenterY = b.windowCenterY;
        this.windowWidth = b.windowWidth;
        this.windowHeight = b.windowHeight;
        this.advisories = Collections.unmodifiableList(new ArrayList<>(b.advisories));
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static ShiftResult failure(FailureKind kind, String message, List<String> advisories)
    {
        Builder b = new Builder();
        b.success = false;
        b.failureKind = kind;
        b.message = message;
        b.advisories.addAll(advisories);
        return new ShiftResult(b);
    }

    public static ShiftResult failure(CoregException e, List<String> advisories)
    {
        return failure(e.getKind(), e.getReason(), advisories);
    }

    public boolean isSuccess() { return success; }

    // null on success
    public FailureKind getFailureKind() { return failureKind; }
    public String getMessage() { return message; }

    // x correction in analysis grid pixels
    public double getDxPx() { requireSuccess(); return dxPx; }
    public double getDyPx() { requireSuccess(); return dyPx; }

    // correction in map units of the reference projection
    public double getDxMap() { requireSuccess(); return dxMap; }
    public double getDyMap() { requireSuccess(); return dyMap; }

    public double getVectorLength()
    {
        requireSuccess();
        return Math.hypot(dxMap, dyMap);
    }

    // direction of the correction in degrees clockwise from north
    public double getVectorAngle()
    {
        requireSuccess();
        double deg = Math.toDegrees(Math.atan2(dxMap, dyMap));
        return deg < 0 ? deg + 360.0 : deg;
    }

    public double getReliability() { requireSuccess(); return reliability; }
    public double getPeakRatio() { requireSuccess(); return peakRatio; }
    public boolean isAmbiguous() { requireSuccess(); return ambiguous; }

    // reliability above the threshold, unambiguous peak, converged
    public boolean isReliable() { return success && reliable; }

    public double getSsimBefore() { requireSuccess(); return ssimBefore; }
    public double getSsimAfter() { requireSuccess(); return ssimAfter; }
    public int getIterations() { return iterations; }
    public boolean isConverged() { return converged; }

    public double getWindowCenterX() { return windowCenterX; }
    public double getWindowCenterY() { return windowCenterY; }
    public int getWindowWidth() { return windowWidth; }
    public int getWindowHeight() { return windowHeight; }

    public List<String> getAdvisories() { return advisories; }

    private void requireSuccess()
    {
        if (!success) {
            throw new IllegalStateException("no shift available, run failed with " + failureKind + ": " + message);
        }
    }

    @Override
    public String toString()
    {
        if (!success) {
            return "ShiftResult[FAILED " + failureKind + ": " + message + "]";
        }
        return String.format("ShiftResult[dx=%.4f px, dy=%.4f px, dxMap=%.4f, dyMap=%.4f, reliability=%.1f%%%s]",
                             dxPx, dyPx, dxMap, dyMap, reliability, reliable ? "" : ", UNRELIABLE");
    }

    public static final class Builder
    {
        private boolean success = true;
        private FailureKind failureKind;
        private String message = "";
        private double dxPx, dyPx, dxMap, dyMap;
        private double reliability, peakRatio;
        private boolean ambiguous, reliable;
        private double ssimBefore = Double.NaN, ssimAfter = Double.NaN;
        private int iterations;
        private boolean converged = true;
        private double windowCenterX = Double.NaN, windowCenterY = Double.NaN;
        private int windowWidth, windowHeight;
        private final List<String> advisories = new ArrayList<>();

        private Builder() {}

        public Builder shiftPx(double dx, double dy) { dxPx = dx; dyPx = dy; return this; }
        public Builder shiftMap(double dx, double dy) { dxMap = dx; dyMap = dy; return this; }
        public Builder reliability(double r) { reliability = r; return this; }
        public Builder peakRatio(double r) { peakRatio = r; return this; }
        public Builder ambiguous(boolean a) { ambiguous = a; return this; }
        public Builder reliable(boolean r) { reliable = r; return this; }
        public Builder ssim(double before, double after) { ssimBefore = before; ssimAfter = after; return this; }
        public Builder iterations(int n, boolean hasConverged) { iterations = n; converged = hasConverged; return this; }

        public Builder window(double centerX, double centerY, int width, int height)
        {
            windowCenterX = centerX;
            windowCenterY = centerY;
            windowWidth = width;
            windowHeight = height;
            return this;
        }

        public Builder advisories(List<String> list) { advisories.addAll(list); return this; }

        public ShiftResult build()
        {
            return new ShiftResult(this);
        }
    }
}

package com.thetalimited.coreg.engine;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.coreg.CoregConfig;
import com.thetalimited.coreg.CoregException;
import com.thetalimited.coreg.FailureKind;
import com.thetalimited.coreg.ShiftResult;
import com.thetalimited.coreg.geo.GeoTransform;

/**
 * Turns a phase correlation estimate into a {@link ShiftResult}: converts the
 * displacement into a map space correction, rejects implausible shifts and
 * scores the match before and after correction with SSIM.
 */
public class ShiftValidator
{
    private static final Logger log = LoggerFactory.getLogger(ShiftValidator.class);

    private final double minReliability;

    public ShiftValidator(double minReliability)
    {
        this.minReliability = minReliability;
    }

    public static double defaultMaxShift(GeoTransform grid)
    {
        return CoregConfig.DEFAULT_MAX_SHIFT_PX * Math.max(grid.getXRes(), grid.getYRes());
    }

    /**
     * @param grid       analysis grid the displacement refers to
     * @param maxShift   largest accepted |dx| or |dy| in map units
     * @param before     window sampled without any offset
     * @param after      window with the target sampled at the estimated displacement, may be null
     * @param advisories advisories collected so far; new ones are appended
     * @throws CoregException IMPLAUSIBLE_SHIFT if the shift exceeds {@code maxShift}
     */
    public ShiftResult validate(PhaseCorrelation pc, WindowSpec spec, GeoTransform grid, double maxShift,
                                SampleWindow before, SampleWindow after, List<String> advisories)
    {
        double dxPx = -pc.getDx(), dyPx = -pc.getDy();
        double[] map = toMap(grid, dxPx, dyPx);

        if (Math.max(Math.abs(map[0]), Math.abs(map[1])) > maxShift) {
            throw new CoregException(FailureKind.IMPLAUSIBLE_SHIFT, String.format(
                "calculated shift (%.4f, %.4f) map units exceeds the maximum shift of %.4f; "
                + "the estimate is discarded", map[0], map[1], maxShift));
        }

        double ssimBefore = ssim(before.getReference(), before.getTarget());
        double ssimAfter = after == null ? Double.NaN : ssim(after.getReference(), after.getTarget());
        if (after != null && ssimAfter < ssimBefore) {
            advise(advisories, String.format("image similarity decreased after correction (SSIM %.4f -> %.4f)",
                                             ssimBefore, ssimAfter));
        }

        boolean reliable = true;
        if (pc.getReliability() < minReliability) {
            advise(advisories, String.format("shift reliability %.1f%% is below %.1f%%", pc.getReliability(),
                                             minReliability));
            reliable = false;
        }
        if (pc.isAmbiguous()) {
            advise(advisories, String.format("correlation peak is ambiguous (second peak at %.0f%% of the main peak)",
                                             100.0 * pc.getPeakRatio()));
            reliable = false;
        }
        if (!pc.isConverged()) {
            advise(advisories, "shift estimation did not converge within " + pc.getIterations() + " iterations");
            reliable = false;
        }

        ShiftResult result = ShiftResult.builder()
            .shiftPx(dxPx, dyPx)
            .shiftMap(map[0], map[1])
            .reliability(pc.getReliability())
            .peakRatio(pc.getPeakRatio())
            .ambiguous(pc.isAmbiguous())
            .reliable(reliable)
            .ssim(ssimBefore, ssimAfter)
            .iterations(pc.getIterations(), pc.isConverged())
            .window(spec.getCenterX(), spec.getCenterY(), spec.getWidth(), spec.getHeight())
            .advisories(advisories)
            .build();
        log.info("detected shift: {}", result);
        return result;
    }

    // pixel displacement to map displacement on a (possibly rotated) grid
    public static double[] toMap(GeoTransform grid, double dxPx, double dyPx)
    {
        return new double[] {
            dxPx * grid.getPixelWidth() + dyPx * grid.getRotationX(),
            dxPx * grid.getRotationY() + dyPx * grid.getPixelHeight()
        };
    }

    /**
     * Structural similarity of two equally sized arrays computed over the
     * whole window, with the usual constants C1 = (0.01 L)^2, C2 = (0.03 L)^2
     * and L the joint value range.
     */
    public static double ssim(double[][] a, double[][] b)
    {
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        double sa = 0, sb = 0;
        long n = 0;
        for (int r = 0; r < a.length; r++) {
            for (int c = 0; c < a[r].length; c++) {
                double x = a[r][c], y = b[r][c];
                min = Math.min(min, Math.min(x, y));
                max = Math.max(max, Math.max(x, y));
                sa += x;
                sb += y;
                n++;
            }
        }
        double range = max - min;
        if (n == 0 || range == 0) return 1.0;
        double ma = sa / n, mb = sb / n;
        double va = 0, vb = 0, cov = 0;
        for (int r = 0; r < a.length; r++) {
            for (int c = 0; c < a[r].length; c++) {
                double da = a[r][c] - ma, db = b[r][c] - mb;
                va += da * da;
                vb += db * db;
                cov += da * db;
            }
        }
        va /= n;
        vb /= n;
        cov /= n;
        double c1 = Math.pow(0.01 * range, 2), c2 = Math.pow(0.03 * range, 2);
        return ((2 * ma * mb + c1) * (2 * cov + c2)) / ((ma * ma + mb * mb + c1) * (va + vb + c2));
    }

    private static void advise(List<String> advisories, String msg)
    {
        advisories.add(msg);
        log.warn(msg);
    }
}

package com.thetalimited.coreg.engine;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.thetalimited.coreg.CoregException;
import com.thetalimited.coreg.FailureKind;
import com.thetalimited.coreg.ShiftResult;
import com.thetalimited.coreg.SyntheticImages;
import com.thetalimited.coreg.geo.GeoTransform;

public class ShiftValidatorTest
{
    private static final GeoTransform GRID = SyntheticImages.grid(0, 1000, 10);
    private static final WindowSpec SPEC = new WindowSpec(500, 500, 32, 32, 34, 34, GRID);

    private final ShiftValidator validator = new ShiftValidator(30.0);

    private static PhaseCorrelation estimate(double dx, double dy, double reliability, boolean ambiguous,
                                             boolean converged)
    {
        return new PhaseCorrelation(dx, dy, (int) Math.rint(dx), (int) Math.rint(dy), reliability,
                                    ambiguous ? 0.95 : 0.1, ambiguous, 2, converged, new double[4][4]);
    }

    private static SampleWindow window(double[][] ref, double[][] tgt)
    {
        return new SampleWindow(ref, tgt, GRID, 0, 0, 0, 0, 0);
    }

    @Test
    public void correctionIsOppositeOfDisplacement()
    {
        double[][] img = SyntheticImages.texture(32, 32, 1);
        List<String> advisories = new ArrayList<>();
        ShiftResult r = validator.validate(estimate(3, -2, 80, false, true), SPEC, GRID, 50,
                                           window(img, img), null, advisories);
        assertTrue(r.isSuccess());
        assertTrue(r.isReliable());
        assertEquals(-3, r.getDxPx(), 0);
        assertEquals(2, r.getDyPx(), 0);
        assertEquals(-30, r.getDxMap(), 1e-12);
        assertEquals(-20, r.getDyMap(), 1e-12);
        assertEquals(Math.hypot(30, 20), r.getVectorLength(), 1e-9);
        assertTrue(Double.isNaN(r.getSsimAfter()));
        assertEquals(500, r.getWindowCenterX(), 0);
        assertTrue(advisories.isEmpty());
    }

    @Test
    public void shiftAboveMaximumIsImplausible()
    {
        double[][] img = SyntheticImages.texture(32, 32, 1);
        try {
            validator.validate(estimate(10, 0, 80, false, true), SPEC, GRID, 50, window(img, img), null,
                               new ArrayList<>());
            fail("expected IMPLAUSIBLE_SHIFT");
        } catch (CoregException e) {
            assertEquals(FailureKind.IMPLAUSIBLE_SHIFT, e.getKind());
        }
    }

    @Test
    public void weakEstimatesAreFlaggedButKept()
    {
        double[][] img = SyntheticImages.texture(32, 32, 1);
        List<String> advisories = new ArrayList<>();
        ShiftResult r = validator.validate(estimate(1, 1, 10, true, false), SPEC, GRID, 50,
                                           window(img, img), null, advisories);
        assertTrue(r.isSuccess());
        assertFalse(r.isReliable());
        assertTrue(r.isAmbiguous());
        assertFalse(r.isConverged());
        assertEquals(3, advisories.size());
        assertEquals(advisories, r.getAdvisories());
    }

    @Test
    public void similarityDropIsReported()
    {
        double[][] a = SyntheticImages.texture(32, 32, 1);
        double[][] b = SyntheticImages.texture(32, 32, 2);
        List<String> advisories = new ArrayList<>();
        ShiftResult r = validator.validate(estimate(0.2, 0, 80, false, true), SPEC, GRID, 50,
                                           window(a, a), window(a, b), advisories);
        assertTrue(r.getSsimAfter() < r.getSsimBefore());
        assertEquals(1, advisories.size());
        assertTrue(advisories.get(0).startsWith("image similarity decreased"));
    }

    @Test
    public void ssimOfIdenticalAndUnrelatedWindows()
    {
        double[][] a = SyntheticImages.texture(32, 32, 1);
        double[][] b = SyntheticImages.texture(32, 32, 2);
        assertEquals(1.0, ShiftValidator.ssim(a, a), 1e-12);
        assertTrue(ShiftValidator.ssim(a, b) < 0.5);
    }

    @Test
    public void pixelToMapOnNorthUpAndRotatedGrids()
    {
        assertArrayEquals(new double[] { -30, -20 }, ShiftValidator.toMap(GRID, -3, 2), 1e-12);
        GeoTransform rotated = new GeoTransform(0, 10, 5, 0, 5, -10);
        assertArrayEquals(new double[] { 20, -15 }, ShiftValidator.toMap(rotated, 1, 2), 1e-12);
        assertEquals(50, ShiftValidator.defaultMaxShift(GRID), 0);
    }
}

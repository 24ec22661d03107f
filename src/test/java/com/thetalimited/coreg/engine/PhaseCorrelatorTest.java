package com.thetalimited.coreg.engine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.thetalimited.coreg.SyntheticImages;

public class PhaseCorrelatorTest
{
    private final PhaseCorrelator plain = new PhaseCorrelator(WindowFunction.NONE, 0.9, 5);

    @Test
    public void selfCorrelationPeaksAtZero()
    {
        double[][] img = SyntheticImages.texture(64, 64, 1);
        PhaseCorrelation pc = new PhaseCorrelator(WindowFunction.HANN, 0.9, 5).correlate(img, img);
        assertEquals(0.0, pc.getDx(), 1e-6);
        assertEquals(0.0, pc.getDy(), 1e-6);
        assertEquals(0, pc.getPeakCol());
        assertEquals(0, pc.getPeakRow());
        assertTrue(pc.getReliability() > 90);
        assertFalse(pc.isAmbiguous());
    }

    @Test
    public void integerShiftIsFound()
    {
        double[][] ref = SyntheticImages.texture(64, 64, 2);
        double[][] tgt = SyntheticImages.fourierShift(ref, 5, -3);
        PhaseCorrelation pc = plain.correlate(ref, tgt);
        assertEquals(5, pc.getPeakCol());
        assertEquals(-3, pc.getPeakRow());
        assertEquals(5.0, pc.getDx(), 0.05);
        assertEquals(-3.0, pc.getDy(), 0.05);
    }

    @Test
    public void subPixelShiftIsRecovered()
    {
        double[][] ref = SyntheticImages.texture(64, 64, 3);
        double[][] tgt = SyntheticImages.fourierShift(ref, 1.3, -0.6);
        PhaseCorrelation pc = plain.correlate(ref, tgt);
        assertEquals(1.3, pc.getDx(), 0.1);
        assertEquals(-0.6, pc.getDy(), 0.1);
    }

    @Test
    public void surfaceIsCentred()
    {
        double[][] img = SyntheticImages.texture(32, 32, 4);
        double[][] s = plain.correlate(img, img).getSurface();
        double max = Double.NEGATIVE_INFINITY;
        int mr = -1, mc = -1;
        for (int r = 0; r < s.length; r++) {
            for (int c = 0; c < s[r].length; c++) {
                if (s[r][c] > max) {
                    max = s[r][c];
                    mr = r;
                    mc = c;
                }
            }
        }
        assertEquals(16, mr);
        assertEquals(16, mc);
    }

    @Test
    public void periodicPatternIsAmbiguous()
    {
        double[][] stripes = new double[64][64];
        for (int r = 0; r < 64; r++) {
            for (int c = 0; c < 64; c++) {
                stripes[r][c] = Math.sin(2 * Math.PI * c / 8.0) + Math.sin(2 * Math.PI * r / 8.0);
            }
        }
        PhaseCorrelation pc = plain.correlate(stripes, stripes);
        assertTrue(pc.isAmbiguous());
        assertTrue(pc.getPeakRatio() > 0.9);
    }

    @Test
    public void iterationMovesTheTargetWindowUntilThePeakIsAtZero()
    {
        int dx = 4, dy = -2;
        double[][] base = SyntheticImages.texture(96, 96, 5);
        double[][] ref = SyntheticImages.crop(base, 16, 16, 64, 64);
        List<int[]> offsets = new ArrayList<>();

        PhaseCorrelation pc = new PhaseCorrelator(WindowFunction.HANN, 0.9, 5).estimate(
            (shiftCol, shiftRow) -> {
                offsets.add(new int[] { shiftCol, shiftRow });
                // target content displaced by (dx, dy); sampled with the current offset
                double[][] tgt = SyntheticImages.crop(base, 16 - dy + shiftRow, 16 - dx + shiftCol, 64, 64);
                return new SampleWindow(ref, tgt, SyntheticImages.grid(0, 0, 1), 0, 0, 0,
                                        shiftCol, shiftRow);
            },
            PhaseCorrelator.IterationListener.NONE);

        assertTrue(pc.isConverged());
        assertEquals(2, pc.getIterations());
        assertEquals(dx, pc.getDx(), 1e-6);
        assertEquals(dy, pc.getDy(), 1e-6);
        assertEquals(2, offsets.size());
        assertEquals(dx, offsets.get(1)[0]);
        assertEquals(dy, offsets.get(1)[1]);
    }

    @Test
    public void forooshEstimatorOnSincSamples()
    {
        double d = 0.3;
        double c0 = Math.sin(Math.PI * d) / (Math.PI * d);
        double c1 = Math.sin(Math.PI * (1 - d)) / (Math.PI * (1 - d));
        assertEquals(d, PhaseCorrelator.subPixel(c0, -0.1, c1), 1e-9);
        assertEquals(-d, PhaseCorrelator.subPixel(c0, c1, -0.1), 1e-9);
        assertEquals(0.0, PhaseCorrelator.subPixel(1.0, 0.0, 0.0), 0);
    }
}

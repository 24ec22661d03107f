package com.thetalimited.coreg.geo;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class InterpolationTest
{
    private static final double[][] RAMP = {
        { 0, 1, 2, 3, 4 },
        { 10, 11, 12, 13, 14 },
        { 20, 21, 22, 23, 24 },
        { 30, 31, 32, 33, 34 },
        { 40, 41, 42, 43, 44 },
    };

    @Test
    public void allMethodsHitPixelCentresExactly()
    {
        for (ResamplingMethod m : ResamplingMethod.values()) {
            assertEquals(m.name(), 22.0, Interpolation.sample(RAMP, 2, 2, m, null), 1e-12);
        }
    }

    @Test
    public void linearRampIsReproduced()
    {
        assertEquals(16.5, Interpolation.bilinear(RAMP, 1.5, 1.5, null), 1e-12);
        assertEquals(16.5, Interpolation.cubic(RAMP, 1.5, 1.5, null), 1e-9);
        assertEquals(22.0, Interpolation.nearest(RAMP, 2.4, 1.6, null), 0);
    }

    @Test
    public void outsideAndNodataGiveNaN()
    {
        assertTrue(Double.isNaN(Interpolation.bilinear(RAMP, -0.6, 0, null)));
        assertTrue(Double.isNaN(Interpolation.nearest(RAMP, 5, 0, null)));
        assertTrue(Double.isNaN(Interpolation.bilinear(RAMP, 1.5, 1.5, 12.0)));
    }

    @Test
    public void resamplingMethodNames()
    {
        assertEquals(ResamplingMethod.CUBIC, ResamplingMethod.fromName("cubic"));
        assertEquals(ResamplingMethod.NEAREST, ResamplingMethod.fromName("NEAREST"));
    }
}

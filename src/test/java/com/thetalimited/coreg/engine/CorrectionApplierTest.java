package com.thetalimited.coreg.engine;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.thetalimited.coreg.DeshiftResult;
import com.thetalimited.coreg.FailureKind;
import com.thetalimited.coreg.ProgressListener;
import com.thetalimited.coreg.ShiftResult;
import com.thetalimited.coreg.SyntheticImages;
import com.thetalimited.coreg.geo.GeoTransform;
import com.thetalimited.coreg.geo.ResamplingMethod;
import com.thetalimited.coreg.raster.Raster;

public class CorrectionApplierTest
{
    private static final GeoTransform GRID = SyntheticImages.grid(0, 200, 10);

    private final Raster target = SyntheticImages.raster(SyntheticImages.texture(20, 20, 9), GRID,
                                                         SyntheticImages.UTM33);
    private final Reconciliation rec = new GridReconciler().reconcile(target, target);

    private static ShiftResult shift(double dxMap, double dyMap)
    {
        return ShiftResult.builder()
            .shiftPx(dxMap / 10, -dyMap / 10)
            .shiftMap(dxMap, dyMap)
            .reliability(90)
            .reliable(true)
            .window(100, 100, 16, 16)
            .build();
    }

    @Test
    public void translateKeepsPixelsAndMovesGeotransform()
    {
        DeshiftResult out = new CorrectionApplier(ProgressListener.NONE)
            .apply(target, rec, shift(7.5, -2.5), false, ResamplingMethod.CUBIC);
        assertTrue(out.isShifted());
        assertFalse(out.isResampled());
        assertFalse(out.isGridMatchingReference());
        for (int r = 0; r < 20; r++) {
            assertArrayEquals(target.getBand(0)[r], out.getArray()[0][r], 0);
        }
        assertArrayEquals(new double[] { 7.5, 10, 0, 197.5, 0, -10 }, out.getGeoTransform().toArray(), 1e-12);
        assertEquals(target.getProjection(), out.getProjection());
    }

    @Test
    public void wholePixelTranslationStaysOnReferenceGrid()
    {
        DeshiftResult out = new CorrectionApplier(ProgressListener.NONE)
            .apply(target, rec, shift(10, 0), false, ResamplingMethod.CUBIC);
        assertTrue(out.isGridMatchingReference());
    }

    @Test
    public void resamplingKeepsTargetExtentAndMovesContent()
    {
        DeshiftResult out = new CorrectionApplier(ProgressListener.NONE)
            .apply(target, rec, shift(10, 0), true, ResamplingMethod.CUBIC);
        assertTrue(out.isResampled());
        assertTrue(out.isGridMatchingReference());
        assertEquals(20, out.getRaster().getCols());
        assertEquals(20, out.getRaster().getRows());
        assertEquals(GRID, out.getGeoTransform());

        double[][] band = out.getArray()[0];
        boolean differs = false;
        for (int r = 0; r < 20; r++) {
            // one pixel east: column c now holds what column c - 1 held
            assertTrue(Double.isNaN(band[r][0]));
            for (int c = 1; c < 20; c++) {
                assertEquals(target.getBand(0)[r][c - 1], band[r][c], 1e-6);
                if (Math.abs(band[r][c] - target.getBand(0)[r][c]) > 1e-6) differs = true;
            }
        }
        assertTrue(differs);
    }

    @Test
    public void subPixelResamplingSnapsToReferenceGrid()
    {
        List<Double> progress = new ArrayList<>();
        DeshiftResult out = new CorrectionApplier((stage, fraction) -> progress.add(fraction))
            .apply(target, rec, shift(5, 0), true, ResamplingMethod.BILINEAR);
        Raster r = out.getRaster();
        assertEquals(GRID, r.getGeoTransform());
        assertEquals(20, r.getCols());
        assertEquals(20, r.getRows());
        // halfway between two source columns
        double expected = 0.5 * (target.getBand(0)[5][4] + target.getBand(0)[5][5]);
        assertEquals(expected, r.getBand(0)[5][5], 1e-9);
        assertNotEquals(target.getBand(0)[5][5], r.getBand(0)[5][5], 1e-9);
        assertEquals(1.0, progress.get(progress.size() - 1), 1e-12);
    }

    @Test(expected = IllegalStateException.class)
    public void failedShiftCannotBeApplied()
    {
        ShiftResult failed = ShiftResult.failure(FailureKind.OUT_OF_BOUNDS, "outside", new ArrayList<>());
        new CorrectionApplier(ProgressListener.NONE).apply(target, rec, failed, false, ResamplingMethod.CUBIC);
    }
}

package com.thetalimited.coreg.engine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import com.thetalimited.coreg.CoregConfig;
import com.thetalimited.coreg.CoregException;
import com.thetalimited.coreg.FailureKind;
import com.thetalimited.coreg.SyntheticImages;
import com.thetalimited.coreg.WindowPosition;
import com.thetalimited.coreg.geo.Bounds;
import com.thetalimited.coreg.geo.GeoTransform;
import com.thetalimited.coreg.raster.BinaryMask;
import com.thetalimited.coreg.raster.Raster;

public class WindowSelectorTest
{
    private static final String PRJ = SyntheticImages.UTM33;
    private static final GeoTransform GRID = SyntheticImages.grid(0, 1000, 10);

    private static WindowSelector selector(Raster ref, Raster tgt, CoregConfig config)
    {
        return new WindowSelector(ref, tgt, new GridReconciler().reconcile(ref, tgt), config);
    }

    private static Raster texture(int size, long seed)
    {
        return SyntheticImages.raster(SyntheticImages.texture(size, size, seed), GRID, PRJ);
    }

    @Test
    public void overlapIsIntersectionOfValidData()
    {
        Raster ref = texture(100, 1);
        Raster tgt = SyntheticImages.raster(SyntheticImages.texture(100, 100, 2), GRID.translate(200, -100), PRJ);
        Bounds ov = selector(ref, tgt, CoregConfig.defaults()).getOverlap();
        assertEquals(200, ov.minX, 1e-9);
        assertEquals(1000, ov.maxX, 1e-9);
        assertEquals(0, ov.minY, 1e-9);
        assertEquals(900, ov.maxY, 1e-9);
    }

    @Test
    public void positionOutsideOverlapIsOutOfBounds()
    {
        Raster ref = texture(100, 1);
        Raster tgt = SyntheticImages.raster(SyntheticImages.texture(100, 100, 2), GRID.translate(200, -100), PRJ);
        WindowSelector ws = selector(ref, tgt, CoregConfig.builder().windowSize(32).build());
        try {
            ws.select(WindowPosition.ofMap(1100, 500), new ArrayList<>());
            fail("expected OUT_OF_BOUNDS");
        } catch (CoregException e) {
            assertEquals(FailureKind.OUT_OF_BOUNDS, e.getKind());
        }
    }

    @Test
    public void windowLargerThanOverlapIsOutOfBounds()
    {
        Raster img = texture(100, 1);
        WindowSelector ws = selector(img, img, CoregConfig.builder().windowSize(256).build());
        try {
            ws.select(null, new ArrayList<>());
            fail("expected OUT_OF_BOUNDS");
        } catch (CoregException e) {
            assertEquals(FailureKind.OUT_OF_BOUNDS, e.getKind());
        }
    }

    @Test
    public void automaticWindowSizeIsOddFractionOfImage()
    {
        Raster img = texture(400, 3);
        WindowSpec spec = selector(img, img, CoregConfig.defaults()).select(null, new ArrayList<>());
        assertEquals(51, spec.getWidth());
        assertEquals(51, spec.getHeight());
    }

    @Test
    public void smallWindowGivesAdvisory()
    {
        Raster img = texture(100, 1);
        List<String> advisories = new ArrayList<>();
        WindowSpec spec = selector(img, img, CoregConfig.builder().windowSize(64).build()).select(null, advisories);
        assertEquals(64, spec.getWidth());
        assertEquals(1, advisories.size());
        assertTrue(advisories.get(0).startsWith("window size 64x64 is a rather small value"));
    }

    @Test
    public void extractSamplesTargetAtIntegerOffset()
    {
        Raster img = texture(100, 4);
        WindowSelector ws = selector(img, img, CoregConfig.builder().windowSize(32).build());
        WindowSpec spec = ws.select(WindowPosition.ofMap(500, 500), new ArrayList<>());
        assertEquals(34, spec.getCol0());
        assertEquals(34, spec.getRow0());

        SampleWindow w = ws.extract(spec, 2, 1);
        double[][] band = img.getBand(0);
        assertEquals(band[34][34], w.getReference()[0][0], 0);
        assertEquals(band[35][36], w.getTarget()[0][0], 0);
        assertEquals(band[34 + 31 + 1][34 + 31 + 2], w.getTarget()[31][31], 0);
    }

    @Test
    public void pixelPositionIsResolvedOnReferenceGrid()
    {
        Raster img = texture(100, 4);
        WindowSelector ws = selector(img, img, CoregConfig.builder().windowSize(32).build());
        WindowSpec spec = ws.select(WindowPosition.ofPixel(40.5, 60.5), new ArrayList<>());
        assertEquals(405, spec.getCenterX(), 1e-9);
        assertEquals(395, spec.getCenterY(), 1e-9);
        assertEquals(40 - 16, spec.getCol0());
    }

    @Test
    public void nodataIsFilledWithWindowMean()
    {
        double[][] band = SyntheticImages.texture(100, 100, 5);
        for (double[] row : band) {
            for (int c = 0; c < row.length; c += 2) row[c] = Double.NaN;
        }
        Raster ref = texture(100, 6);
        Raster tgt = SyntheticImages.raster(band, GRID, PRJ);
        WindowSelector ws = selector(ref, tgt, CoregConfig.builder().windowSize(32).build());
        SampleWindow w = ws.extract(ws.select(null, new ArrayList<>()), 0, 0);
        assertEquals(0.5, w.getTgtNodataFraction(), 1e-9);
        for (double[] row : w.getTarget()) {
            for (double v : row) assertFalse(Double.isNaN(v));
        }
    }

    @Test
    public void tooMuchNodataIsRejected()
    {
        double[][] band = SyntheticImages.texture(100, 100, 5);
        for (double[] row : band) {
            for (int c = 0; c < row.length; c += 2) row[c] = Double.NaN;
        }
        Raster ref = texture(100, 6);
        Raster tgt = SyntheticImages.raster(band, GRID, PRJ);
        WindowSelector ws = selector(ref, tgt, CoregConfig.builder().windowSize(32).maxNodataFraction(0.3).build());
        try {
            ws.extract(ws.select(null, new ArrayList<>()), 0, 0);
            fail("expected NO_VALID_DATA");
        } catch (CoregException e) {
            assertEquals(FailureKind.NO_VALID_DATA, e.getKind());
        }
    }

    @Test
    public void cloudAtWindowCentreIsObscured()
    {
        Raster img = texture(100, 7);
        boolean[][] clouds = new boolean[100][100];
        for (int r = 40; r < 60; r++) {
            for (int c = 40; c < 60; c++) clouds[r][c] = true;
        }
        CoregConfig config = CoregConfig.builder().windowSize(32).cloudMaskTgt(new BinaryMask(clouds)).build();
        WindowSelector ws = selector(img, img, config);
        try {
            ws.extract(ws.select(null, new ArrayList<>()), 0, 0);
            fail("expected OBSCURED_WINDOW");
        } catch (CoregException e) {
            assertEquals(FailureKind.OBSCURED_WINDOW, e.getKind());
        }
    }

    @Test
    public void largelyCloudedWindowIsObscured()
    {
        Raster img = texture(100, 7);
        boolean[][] clouds = new boolean[100][100];
        for (int r = 0; r < 100; r++) {
            for (int c = 34; c < 46; c++) clouds[r][c] = true;
        }
        CoregConfig config = CoregConfig.builder().windowSize(32).cloudMaskRef(new BinaryMask(clouds)).build();
        WindowSelector ws = selector(img, img, config);
        try {
            ws.extract(ws.select(null, new ArrayList<>()), 0, 0);
            fail("expected OBSCURED_WINDOW");
        } catch (CoregException e) {
            assertEquals(FailureKind.OBSCURED_WINDOW, e.getKind());
            assertTrue(e.getReason().contains("37"));
        }
    }

    @Test
    public void lightCloudCoverIsFlaggedButAccepted()
    {
        Raster img = texture(100, 7);
        boolean[][] clouds = new boolean[100][100];
        for (int r = 0; r < 100; r++) {
            for (int c = 34; c < 38; c++) clouds[r][c] = true;
        }
        CoregConfig config = CoregConfig.builder().windowSize(32).cloudMaskRef(new BinaryMask(clouds)).build();
        WindowSelector ws = selector(img, img, config);
        SampleWindow window = ws.extract(ws.select(null, new ArrayList<>()), 0, 0);
        assertEquals(0.125, window.getObscuredFraction(), 1e-12);
        assertTrue(window.isObscured());
        assertTrue(window.hasValidData());

        WindowSelector clear = selector(img, img, CoregConfig.builder().windowSize(32).build());
        SampleWindow clean = clear.extract(clear.select(null, new ArrayList<>()), 0, 0);
        assertFalse(clean.isObscured());
        assertTrue(clean.hasValidData());
    }
}

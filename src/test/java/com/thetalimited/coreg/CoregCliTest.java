package com.thetalimited.coreg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.thetalimited.coreg.geo.GeoTransform;
import com.thetalimited.coreg.io.GeoTiffRasterReader;
import com.thetalimited.coreg.io.GeoTiffRasterWriter;
import com.thetalimited.coreg.raster.Raster;

public class CoregCliTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void helpAndBadUsage()
    {
        assertEquals(CoregCli.EXIT_OK, CoregCli.run(new String[] { "-h" }));
        assertEquals(CoregCli.EXIT_USAGE, CoregCli.run(new String[] { "only-one.tif" }));
        assertEquals(CoregCli.EXIT_USAGE, CoregCli.run(new String[] { "-frobnicate", "a.tif", "b.tif" }));
        assertEquals(CoregCli.EXIT_USAGE, CoregCli.run(new String[] { "a.tif", "b.tif", "-ws" }));
        assertEquals(CoregCli.EXIT_USAGE, CoregCli.run(new String[] { "-nodata", "0", "a.tif", "b.tif" }));
    }

    @Test
    public void detectsAndWritesCorrectedImage() throws IOException
    {
        GeoTransform grid = SyntheticImages.grid(500000, 5000000, 10);
        Raster[] pair = SyntheticImages.shiftedPair(256, 3, -2, grid, SyntheticImages.UTM33, 7);
        Path ref = folder.getRoot().toPath().resolve("ref.tif");
        Path tgt = folder.getRoot().toPath().resolve("tgt.tif");
        GeoTiffRasterWriter writer = new GeoTiffRasterWriter();
        writer.write(pair[0], ref, Collections.emptyMap());
        writer.write(pair[1], tgt, Collections.emptyMap());

        int rc = CoregCli.run(new String[] { "-ws", "128", "-o", "auto", "-co", "COMPRESS=DEFLATE",
                                             ref.toString(), tgt.toString() });

        assertEquals(CoregCli.EXIT_OK, rc);
        Path out = folder.getRoot().toPath().resolve("tgt__shifted_to__ref.tif");
        assertTrue(Files.exists(out));
        Raster corrected = new GeoTiffRasterReader().read(out);
        assertEquals(grid.getOriginX() - 30, corrected.getGeoTransform().getOriginX(), 1e-6);
        assertEquals(grid.getOriginY() - 20, corrected.getGeoTransform().getOriginY(), 1e-6);
    }

    @Test
    public void implausibleShiftExitsWithFailure() throws IOException
    {
        GeoTransform grid = SyntheticImages.grid(500000, 5000000, 10);
        Raster[] pair = SyntheticImages.shiftedPair(256, 3, -2, grid, SyntheticImages.UTM33, 7);
        Path ref = folder.getRoot().toPath().resolve("ref.tif");
        Path tgt = folder.getRoot().toPath().resolve("tgt.tif");
        GeoTiffRasterWriter writer = new GeoTiffRasterWriter();
        writer.write(pair[0], ref, Collections.emptyMap());
        writer.write(pair[1], tgt, Collections.emptyMap());

        assertEquals(CoregCli.EXIT_FAILED,
                     CoregCli.run(new String[] { "-max_shift", "5", ref.toString(), tgt.toString() }));
        assertEquals(CoregCli.EXIT_FAILED,
                     CoregCli.run(new String[] { "-max_shift", "5", "-ignore_errors", ref.toString(), tgt.toString() }));
    }

    @Test
    public void unsupportedCreationOptionFailsCleanly() throws IOException
    {
        GeoTransform grid = SyntheticImages.grid(500000, 5000000, 10);
        Raster[] pair = SyntheticImages.shiftedPair(256, 3, -2, grid, SyntheticImages.UTM33, 7);
        Path ref = folder.getRoot().toPath().resolve("ref.tif");
        Path tgt = folder.getRoot().toPath().resolve("tgt.tif");
        GeoTiffRasterWriter writer = new GeoTiffRasterWriter();
        writer.write(pair[0], ref, Collections.emptyMap());
        writer.write(pair[1], tgt, Collections.emptyMap());
        Path out = folder.getRoot().toPath().resolve("out.tif");

        int rc = CoregCli.run(new String[] { "-ws", "128", "-o", out.toString(), "-co", "COMPRESS=FOO",
                                             ref.toString(), tgt.toString() });

        assertEquals(CoregCli.EXIT_FAILED, rc);
        assertFalse(Files.exists(out));
    }
}

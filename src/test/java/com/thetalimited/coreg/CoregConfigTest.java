package com.thetalimited.coreg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Properties;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.thetalimited.coreg.engine.WindowFunction;
import com.thetalimited.coreg.geo.ResamplingMethod;

public class CoregConfigTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void defaultsMatchDocumentedConstants()
    {
        CoregConfig c = CoregConfig.defaults();
        assertTrue(c.isAutoWindowSize());
        assertNull(c.getMaxShift());
        assertFalse(c.isAlignGrids());
        assertNull(c.getPathOut());
        assertEquals("GTiff", c.getFormatOut());
        assertEquals(1, c.getRefBand());
        assertEquals(ResamplingMethod.CUBIC, c.getResamplingCalc());
        assertEquals(WindowFunction.HANN, c.getWindowFunction());
        assertEquals(CoregConfig.DEFAULT_MAX_ITERATIONS, c.getMaxIterations());
        assertEquals(CoregConfig.DEFAULT_MIN_RELIABILITY, c.getMinReliability(), 0);
        assertEquals(128, c.getSmallWindowThreshold());
        assertEquals(0.25, c.getMaxObscuredFraction(), 0);
    }

    @Test
    public void loadsPropertiesFile() throws IOException
    {
        Path file = folder.newFile("coreg.properties").toPath();
        Files.write(file, Arrays.asList(
            "# test settings",
            "coreg.windowSize=64,48",
            "coreg.windowPosition=500100.5, 4999900",
            "coreg.maxShift=25",
            "coreg.alignGrids=yes",
            "coreg.pathOut=auto",
            "coreg.formatOut=envi",
            "coreg.creationOptions=COMPRESS=DEFLATE;BLOCKYSIZE=16",
            "coreg.resamplingCalc=bilinear",
            "coreg.windowFunction=none",
            "coreg.nodataTgt=-9999",
            "coreg.ignoreErrors=true",
            "unrelated.key=whatever"), StandardCharsets.UTF_8);

        CoregConfig c = CoregConfig.fromProperties(file);
        assertEquals(Integer.valueOf(64), c.getWindowWidth());
        assertEquals(Integer.valueOf(48), c.getWindowHeight());
        assertEquals(500100.5, c.getWindowPosition().getX(), 0);
        assertFalse(c.getWindowPosition().isPixelCoordinates());
        assertEquals(25.0, c.getMaxShift(), 0);
        assertTrue(c.isAlignGrids());
        assertTrue(c.isAutoPathOut());
        assertEquals("envi", c.getFormatOut());
        assertEquals("DEFLATE", c.getCreationOptions().get("COMPRESS"));
        assertEquals("16", c.getCreationOptions().get("BLOCKYSIZE"));
        assertEquals(ResamplingMethod.BILINEAR, c.getResamplingCalc());
        assertEquals(WindowFunction.NONE, c.getWindowFunction());
        assertEquals(-9999.0, c.getNodataTgt(), 0);
        assertTrue(c.isIgnoreErrors());
    }

    @Test
    public void unknownKeyIsRejected() throws IOException
    {
        Properties p = new Properties();
        p.setProperty("coreg.windwoSize", "64");
        try {
            CoregConfig.builder().fromProperties(p, null);
            fail("expected CONFIGURATION");
        } catch (CoregException e) {
            assertEquals(FailureKind.CONFIGURATION, e.getKind());
            assertTrue(e.getReason().contains("coreg.windwoSize"));
        }
    }

    @Test
    public void badValueIsRejected() throws IOException
    {
        Properties p = new Properties();
        p.setProperty("coreg.maxIterations", "many");
        try {
            CoregConfig.builder().fromProperties(p, null);
            fail("expected CONFIGURATION");
        } catch (CoregException e) {
            assertEquals(FailureKind.CONFIGURATION, e.getKind());
        }
    }

    @Test
    public void invalidSettingsFailOnBuild()
    {
        assertBuildFails(CoregConfig.builder().windowSize(2));
        assertBuildFails(CoregConfig.builder().maxShift(-1.0));
        assertBuildFails(CoregConfig.builder().refBand(0));
        assertBuildFails(CoregConfig.builder().formatOut("PNG"));
        assertBuildFails(CoregConfig.builder().maxObscuredFraction(1.5));
    }

    @Test
    public void toBuilderKeepsSettings()
    {
        CoregConfig c = CoregConfig.builder().windowSize(96).maxShift(12.0).build().toBuilder().alignGrids(true).build();
        assertEquals(Integer.valueOf(96), c.getWindowWidth());
        assertEquals(12.0, c.getMaxShift(), 0);
        assertTrue(c.isAlignGrids());
    }

    private static void assertBuildFails(CoregConfig.Builder b)
    {
        try {
            b.build();
            fail("expected CONFIGURATION");
        } catch (CoregException e) {
            assertEquals(FailureKind.CONFIGURATION, e.getKind());
        }
    }
}

package com.thetalimited.coreg.io;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.thetalimited.coreg.geo.GeoTransform;
import com.thetalimited.coreg.raster.DataType;
import com.thetalimited.coreg.raster.Raster;

public class EnviRasterWriterTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void writesLittleEndianBsqWithHeader() throws IOException
    {
        double[][][] bands = {
            { { 1, 2, 3 }, { 4, 5, 6 } },
            { { -1, -2, -3 }, { -4, -5, 40000 } },
        };
        Raster raster = Raster.builder(bands)
            .geoTransform(new GeoTransform(500000, 10, 0, 5000000, 0, -10))
            .projection("EPSG:32633")
            .noData(0.0)
            .dataType(DataType.INT16)
            .build();
        Path data = folder.getRoot().toPath().resolve("scene.bsq");

        new EnviRasterWriter().write(raster, data, Collections.singletonMap("DESCRIPTION", "unit test"));

        byte[] bytes = Files.readAllBytes(data);
        assertEquals(2 * 2 * 3 * 2, bytes.length);
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(1, buf.getShort(0));
        assertEquals(6, buf.getShort(5 * 2));
        assertEquals(-1, buf.getShort(6 * 2));
        // clamped to the INT16 range
        assertEquals(Short.MAX_VALUE, buf.getShort(11 * 2));

        List<String> header = Files.readAllLines(EnviRasterWriter.headerPathFor(data), StandardCharsets.US_ASCII);
        assertEquals("ENVI", header.get(0));
        assertTrue(header.contains("description = {unit test}"));
        assertTrue(header.contains("samples = 3"));
        assertTrue(header.contains("lines = 2"));
        assertTrue(header.contains("bands = 2"));
        assertTrue(header.contains("data type = 2"));
        assertTrue(header.contains("byte order = 0"));
        assertTrue(header.contains("data ignore value = 0"));
        assertTrue(header.contains("band names = {Band 1, Band 2}"));
        assertTrue(header.stream().anyMatch(l -> l.startsWith("map info = {Arbitrary, 1, 1, 500000.0000000000, "
                                                              + "5000000.0000000000, 10.0000000000, 10.0000000000")));
    }

    @Test
    public void headerSitsNextToData()
    {
        assertEquals(Paths.get("out", "a.hdr"), EnviRasterWriter.headerPathFor(Paths.get("out", "a.bsq")));
        assertEquals(Paths.get("b.hdr"), EnviRasterWriter.headerPathFor(Paths.get("b")));
    }

    @Test
    public void formatsAreLookedUpByDriverName()
    {
        assertTrue(RasterFormats.writerFor("envi") instanceof EnviRasterWriter);
        assertTrue(RasterFormats.writerFor(" GTiff ") instanceof GeoTiffRasterWriter);
        assertEquals(List.of("GTiff", "ENVI"), RasterFormats.supportedFormats());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownFormatIsRejected()
    {
        RasterFormats.writerFor("JPEG");
    }
}

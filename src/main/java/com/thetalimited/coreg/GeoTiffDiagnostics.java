package com.thetalimited.coreg;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import com.thetalimited.coreg.engine.SampleWindow;
import com.thetalimited.coreg.geo.GeoTransform;
import com.thetalimited.coreg.io.GeoTiffRasterWriter;
import com.thetalimited.coreg.raster.DataType;
import com.thetalimited.coreg.raster.Raster;

/**
 * Dumps the matching windows and correlation surfaces of every estimation
 * pass as float GeoTIFFs into a directory, plus a text summary of the result.
 * Window files carry the window geotransform so they overlay the inputs in a GIS.
 */
public class GeoTiffDiagnostics implements CoregDiagnostics
{
    private final Path dir;
    private final String projection;
    private final GeoTiffRasterWriter writer = new GeoTiffRasterWriter();

    public GeoTiffDiagnostics(Path dir, String projection) throws IOException
    {
        this.dir = Files.createDirectories(dir);
        this.projection = projection == null ? "" : projection;
    }

    @Override
    public void onSampleWindow(SampleWindow window, int iteration)
    {
        write(window.getReference(), window.getGrid(), projection, "window_ref_" + iteration + ".tif");
        write(window.getTarget(), window.getGrid(), projection, "window_tgt_" + iteration + ".tif");
    }

    @Override
    public void onCrossPowerSpectrum(double[][] surface, int iteration)
    {
        write(surface, GeoTransform.pixelSpace(), "", "cps_" + iteration + ".tif");
    }

    @Override
    public void onShiftResult(ShiftResult result)
    {
        StringBuilder sb = new StringBuilder();
        sb.append(result).append('\n');
        for (String a : result.getAdvisories()) sb.append("advisory: ").append(a).append('\n');
        try {
            Files.write(dir.resolve("shift_result.txt"), sb.toString().getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void write(double[][] values, GeoTransform gt, String prj, String name)
    {
        Raster r = Raster.builder(values).geoTransform(gt).projection(prj).dataType(DataType.FLOAT32).build();
        try {
            writer.write(r, dir.resolve(name), Collections.emptyMap());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

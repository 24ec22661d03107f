package com.thetalimited.coreg.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import com.thetalimited.coreg.raster.Raster;

/**
 * Writes a raster to disk in one output format.
 *
 * <p>Creation options are format specific {@code KEY=VALUE} pairs handed over
 * verbatim from the caller. Implementations must not leave a partially written
 * file at {@code path} when they fail.</p>
 */
public interface RasterWriter
{
    String getFormatName();

    // default file extension without the dot
    String getExtension();

    void write(Raster raster, Path path, Map<String, String> creationOptions) throws IOException;
}

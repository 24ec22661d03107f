package com.thetalimited.coreg.io;

import java.io.IOException;
import java.nio.file.Path;

import com.thetalimited.coreg.raster.Raster;

public interface RasterReader
{
    String getFormatName();

    // true if this reader recognises the file, usually by extension or magic bytes
    boolean canRead(Path path);

    Raster read(Path path) throws IOException;
}

package com.thetalimited.coreg.io;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.coreg.raster.Raster;

/**
 * Input to a co-registration run: either a raster file on disk that is read on
 * first use, or a raster that is already in memory.
 */
public final class RasterSource
{
    private static final Logger log = LoggerFactory.getLogger(RasterSource.class);

    private final Path path;
    private final String name;
    private Raster raster;

    private RasterSource(Path path, Raster raster, String name)
    {
        this.path = path;
        this.raster = raster;
        this.name = name;
    }

    public static RasterSource fromPath(Path path)
    {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        return new RasterSource(path, null, baseName(path));
    }

    // name may be null; an unnamed in-memory raster cannot derive an output file name
    public static RasterSource fromMemory(Raster raster, String name)
    {
        if (raster == null) throw new IllegalArgumentException("raster must not be null");
        return new RasterSource(null, raster, name);
    }

    public static RasterSource fromMemory(Raster raster)
    {
        return fromMemory(raster, null);
    }

    public boolean isFileBacked()
    {
        return path != null;
    }

    public Path getPath()
    {
        return path;
    }

    // base name without extension, or null for unnamed in-memory rasters
    public String getName()
    {
        return name;
    }

    /**
     * The raster behind this source, reading it from disk the first time.
     */
    public synchronized Raster toMemory() throws IOException
    {
        if (raster == null) {
            log.info("reading {}", path);
            raster = RasterFormats.readerFor(path).read(path);
        }
        return raster;
    }

    private static String baseName(Path path)
    {
        String fn = path.getFileName().toString();
        int dot = fn.lastIndexOf('.');
        return dot > 0 ? fn.substring(0, dot) : fn;
    }

    @Override
    public String toString()
    {
        return path != null ? path.toString() : "<memory:" + (name != null ? name : "unnamed") + ">";
    }
}

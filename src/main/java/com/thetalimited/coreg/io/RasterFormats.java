package com.thetalimited.coreg.io;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Registry of output formats by GDAL driver name plus the shared
 * write-to-temp-then-move helper used by the writers.
 */
public final class RasterFormats
{
    public static final String GTIFF = "GTiff";
    public static final String ENVI = "ENVI";

    private static final Map<String, RasterWriter> writers = new LinkedHashMap<>();
    private static final List<RasterReader> readers = List.of(new GeoTiffRasterReader());

    static {
        register(new GeoTiffRasterWriter());
        register(new EnviRasterWriter());
    }

    private RasterFormats() {}

    private static void register(RasterWriter writer)
    {
        writers.put(writer.getFormatName().toUpperCase(Locale.ROOT), writer);
    }

    public static boolean isSupported(String formatName)
    {
        return formatName != null && writers.containsKey(formatName.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * @throws IllegalArgumentException for an unknown format name
     */
    public static RasterWriter writerFor(String formatName)
    {
        RasterWriter w = formatName == null ? null : writers.get(formatName.trim().toUpperCase(Locale.ROOT));
        if (w == null) {
            throw new IllegalArgumentException("unknown output format '" + formatName + "', supported: "
                                               + String.join(", ", supportedFormats()));
        }
        return w;
    }

    public static List<String> supportedFormats()
    {
        return writers.values().stream().map(RasterWriter::getFormatName).collect(Collectors.toList());
    }

    public static RasterReader readerFor(Path path) throws IOException
    {
        for (RasterReader r : readers) {
            if (r.canRead(path)) return r;
        }
        throw new IOException("no reader recognises " + path);
    }

    @FunctionalInterface
    interface PathWriter
    {
        void writeTo(Path tmp) throws IOException;
    }

    /**
     * Runs {@code body} against a temporary file next to {@code target} and moves
     * it into place afterwards. On failure the temporary file is removed and
     * {@code target} is left untouched.
     */
    static void writeAtomically(Path target, PathWriter body) throws IOException
    {
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".part");
        boolean moved = false;
        try {
            body.writeTo(tmp);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            moved = true;
        } finally {
            if (!moved) Files.deleteIfExists(tmp);
        }
    }
}

package com.thetalimited.coreg.io;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.util.TiffException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.coreg.geo.GeoTransform;
import com.thetalimited.coreg.geo.Projections;
import com.thetalimited.coreg.raster.DataType;
import com.thetalimited.coreg.raster.Raster;

/**
 * Reads a GeoTIFF into a {@link Raster}.
 *
 * <p>Georeferencing is taken, in order of preference, from the GDAL
 * {@code <GeoTransform>} metadata item, from ModelPixelScale + ModelTiepoint,
 * or from a ModelTransformation matrix. The result is always a corner based
 * (PixelIsArea, GDAL style) geotransform. Files without any georeferencing are
 * read in pixel space.</p>
 */
public class GeoTiffRasterReader implements RasterReader
{
    private static final Logger log = LoggerFactory.getLogger(GeoTiffRasterReader.class);

    private static final Pattern EPSG_PATTERN = Pattern.compile("EPSG\\s*:\\s*(\\d{3,6})");

    @Override
    public String getFormatName()
    {
        return RasterFormats.GTIFF;
    }

    @Override
    public boolean canRead(Path path)
    {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".tif") || name.endsWith(".tiff")) return true;
        if (!Files.isRegularFile(path)) return false;

        // II*\0 or MM\0*
        try (RandomAccessFile in = new RandomAccessFile(path.toFile(), "r")) {
            byte[] hdr = new byte[4];
            in.readFully(hdr);
            return (hdr[0] == 'I' && hdr[1] == 'I' && hdr[2] == 42 && hdr[3] == 0)
                || (hdr[0] == 'M' && hdr[1] == 'M' && hdr[2] == 0 && hdr[3] == 42);
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public Raster read(Path path) throws IOException
    {
        TIFFImage tiff;
        try {
            tiff = TiffReader.readTiff(path.toFile());
        } catch (TiffException e) {
            throw new IOException("cannot read GeoTIFF " + path + ": " + e.getMessage(), e);
        }
        FileDirectory dir = tiff.getFileDirectory();

        GeoTransform gt = buildGeoTransform(dir);
        if (gt == null) {
            log.warn("{}: no georeferencing found; operating in pixel space", path);
            gt = GeoTransform.pixelSpace();
        }
        String projection = determineProjection(dir);
        Double noData = readNoData(dir);

        Rasters rasters;
        try {
            rasters = dir.readRasters();
        } catch (TiffException e) {
            throw new IOException("cannot decode raster data of " + path + ": " + e.getMessage(), e);
        }
        int width = rasters.getWidth(), height = rasters.getHeight();
        int bandCount = rasters.getSamplesPerPixel();

        double[][][] bands = new double[bandCount][height][width];
        for (int b = 0; b < bandCount; b++) {
            for (int y = 0; y < height; y++) {
                double[] row = bands[b][y];
                for (int x = 0; x < width; x++) {
                    row[x] = rasters.getPixelSample(b, x, y).doubleValue();
                }
            }
        }

        FieldType[] fieldTypes = rasters.getFieldTypes();
        DataType dataType = DataType.fromFieldType(fieldTypes.length > 0 ? fieldTypes[0] : FieldType.FLOAT);

        log.debug("read {}: {}x{}x{} {} gt={} prj={} nodata={}", path, width, height, bandCount,
                  dataType, gt, projection, noData);

        return Raster.builder(bands)
            .geoTransform(gt)
            .projection(projection)
            .noData(noData)
            .dataType(dataType)
            .filePath(path.toString())
            .build();
    }

    /**
     * Build a corner-based (GDAL-style) affine:
     *   1) GDAL_METADATA <GeoTransform>          (already corner-based)
     *   2) ModelPixelScale + ModelTiepoint       (center to corner if (0.5,0.5) or PixelIsPoint)
     *   3) ModelTransformation (4x4)             (center to corner if PixelIsPoint)
     */
    static GeoTransform buildGeoTransform(FileDirectory d)
    {
        double[] gt = extractGeoTransformFromGdalMetadata(d);
        if (gt != null) {
            return GeoTransform.of(gt);
        }

        boolean pixelIsPoint = isPixelIsPoint(d);

        double[] scale = GeoTiffTags.getDoubles(d, GeoTiffTags.MODEL_PIXEL_SCALE);
        double[] tie = GeoTiffTags.getDoubles(d, GeoTiffTags.MODEL_TIEPOINT);
        if (scale != null && scale.length >= 2 && tie != null && tie.length >= 6) {
            double sx = scale[0], sy = scale[1];
            double i = tie[0], j = tie[1], x = tie[3], y = tie[4];

            double originX = x - i * sx;
            double originY = y + j * sy;
            if (pixelIsPoint) {
                originX -= 0.5 * sx;
                originY += 0.5 * sy;
            }
            // north-up for Scale+Tiepoint
            return new GeoTransform(originX, sx, 0.0, originY, 0.0, -sy);
        }

        double[] mt = GeoTiffTags.getDoubles(d, GeoTiffTags.MODEL_TRANSFORMATION);
        if (mt != null && mt.length == 16) {
            double a1 = mt[0], a2 = mt[1], a0 = mt[3];
            double b1 = mt[4], b2 = mt[5], b0 = mt[7];
            if (pixelIsPoint) {
                a0 -= 0.5 * a1 + 0.5 * a2;
                b0 -= 0.5 * b1 + 0.5 * b2;
            }
            return new GeoTransform(a0, a1, a2, b0, b1, b2);
        }
        return null;
    }

    // Detect PixelIsPoint (true) vs PixelIsArea (false). Defaults to false if unknown.
    static boolean isPixelIsPoint(FileDirectory d)
    {
        String v = GeoTiffTags.findMetadataItem(GeoTiffTags.getAscii(d, GeoTiffTags.GDAL_METADATA), "AREA_OR_POINT");
        if (v != null) return v.equalsIgnoreCase("Point");
        int rasterType = GeoTiffTags.geoKeyValue(GeoTiffTags.readGeoKeyDirectory(d), GeoTiffTags.KEY_GT_RASTER_TYPE);
        return rasterType == GeoTiffTags.RASTER_PIXEL_IS_POINT;
    }

    /**
     * Returns something like "EPSG:32616", a proj4 string for user defined
     * projections written by this library, or "" if unknown.
     */
    static String determineProjection(FileDirectory d)
    {
        int[] gk = GeoTiffTags.readGeoKeyDirectory(d);
        int projected = GeoTiffTags.geoKeyValue(gk, GeoTiffTags.KEY_PROJECTED_CS_TYPE);
        if (projected > 0 && projected != GeoTiffTags.USER_DEFINED) return Projections.fromEpsg(projected);
        int geographic = GeoTiffTags.geoKeyValue(gk, GeoTiffTags.KEY_GEOGRAPHIC_TYPE);
        if (geographic > 0 && geographic != GeoTiffTags.USER_DEFINED) return Projections.fromEpsg(geographic);

        String ascii = GeoTiffTags.getAscii(d, GeoTiffTags.GEO_ASCII_PARAMS);
        if (ascii != null && ascii.contains("+proj=")) {
            return ascii.substring(ascii.indexOf("+proj=")).trim();
        }

        // some files stash EPSG in <GDALMetadata>
        String gdal = GeoTiffTags.getAscii(d, GeoTiffTags.GDAL_METADATA);
        if (gdal != null) {
            Matcher m = EPSG_PATTERN.matcher(gdal);
            if (m.find()) return "EPSG:" + m.group(1);
        }
        return "";
    }

    static Double readNoData(FileDirectory d)
    {
        String s = GeoTiffTags.getAscii(d, GeoTiffTags.GDAL_NODATA);
        if (s == null || s.isEmpty()) return null;
        if (s.equalsIgnoreCase("nan")) return Double.NaN;
        try {
            return Double.valueOf(s);
        } catch (NumberFormatException e) {
            log.warn("ignoring unparsable GDAL_NODATA value '{}'", s);
            return null;
        }
    }

    private static double[] extractGeoTransformFromGdalMetadata(FileDirectory d)
    {
        String xml = GeoTiffTags.getAscii(d, GeoTiffTags.GDAL_METADATA);
        if (xml == null) return null;
        int i0 = xml.indexOf("<GeoTransform>");
        int i1 = xml.indexOf("</GeoTransform>");
        if (i0 < 0 || i1 <= i0) return null;
        String body = xml.substring(i0 + "<GeoTransform>".length(), i1).trim();
        String[] toks = body.split("[,\\s]+");
        if (toks.length < 6) return null;
        double[] gt = new double[6];
        try {
            for (int i = 0; i < 6; i++) gt[i] = Double.parseDouble(toks[i]);
        } catch (NumberFormatException e) {
            return null;
        }
        return gt;
    }
}

package com.thetalimited.coreg.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;
import mil.nga.tiff.util.TiffException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.coreg.geo.GeoTransform;
import com.thetalimited.coreg.geo.Projections;
import com.thetalimited.coreg.raster.DataType;
import com.thetalimited.coreg.raster.Raster;

/**
 * Writes single or multi band GeoTIFFs with mil.nga.tiff.
 *
 * <p>Supported creation options:</p>
 * <ul>
 *   <li>{@code COMPRESS=NONE|DEFLATE|LZW|PACKBITS}. The TIFF library only
 *       encodes DEFLATE, so LZW and PACKBITS are written as DEFLATE.</li>
 *   <li>{@code BLOCKYSIZE=n}, rows per strip.</li>
 * </ul>
 * Other options are logged and ignored.
 */
public class GeoTiffRasterWriter implements RasterWriter
{
    private static final Logger log = LoggerFactory.getLogger(GeoTiffRasterWriter.class);

    @Override
    public String getFormatName()
    {
        return RasterFormats.GTIFF;
    }

    @Override
    public String getExtension()
    {
        return "tif";
    }

    @Override
    public void write(Raster raster, Path path, Map<String, String> creationOptions) throws IOException
    {
        TIFFImage tiff = new TIFFImage();
        tiff.add(buildDirectory(raster, creationOptions));

        RasterFormats.writeAtomically(path, tmp -> {
            try {
                TiffWriter.writeTiff(tmp.toFile(), tiff);
            } catch (TiffException e) {
                throw new IOException("cannot encode GeoTIFF " + path + ": " + e.getMessage(), e);
            }
        });
        log.info("wrote GeoTIFF {} ({}x{}x{} {})", path, raster.getCols(), raster.getRows(),
                 raster.getBandCount(), raster.getDataType());
    }

    FileDirectory buildDirectory(Raster raster, Map<String, String> creationOptions)
    {
        int width = raster.getCols(), height = raster.getRows(), bandCount = raster.getBandCount();
        DataType dataType = raster.getDataType();

        Rasters rasters = new Rasters(width, height, bandCount, dataType.getFieldType());
        for (int b = 0; b < bandCount; b++) {
            double[][] band = raster.getBand(b);
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    rasters.setPixelSample(b, x, y, toSample(dataType, band[y][x]));
                }
            }
        }

        int compression = TiffConstants.COMPRESSION_NO;
        int rowsPerStrip = rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);

        for (Map.Entry<String, String> opt : creationOptions.entrySet()) {
            String key = opt.getKey().trim().toUpperCase(Locale.ROOT);
            String value = opt.getValue() == null ? "" : opt.getValue().trim().toUpperCase(Locale.ROOT);
            switch (key) {
            case "COMPRESS":
                compression = compressionFor(value);
                break;
            case "BLOCKYSIZE":
                try {
                    rowsPerStrip = Math.max(1, Math.min(height, Integer.parseInt(value)));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("BLOCKYSIZE must be an integer, got '" + value + "'", e);
                }
                break;
            default:
                log.warn("GTiff creation option {}={} is not supported and ignored", key, value);
            }
        }

        FileDirectory directory = new FileDirectory();
        directory.setImageWidth(width);
        directory.setImageHeight(height);
        directory.setBitsPerSample(Collections.nCopies(bandCount, dataType.getBits()));
        directory.setCompression(compression);
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(bandCount);
        directory.setRowsPerStrip(rowsPerStrip);
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(Collections.nCopies(bandCount, dataType.getSampleFormat()));
        directory.setWriteRasters(rasters);

        addGeoreferencing(directory, raster.getGeoTransform(), raster.getProjection());
        if (raster.getNoData() != null) {
            String nd = formatNoData(raster.getNoData());
            directory.addEntry(new FileDirectoryEntry(GeoTiffTags.tag(GeoTiffTags.GDAL_NODATA),
                                                      FieldType.ASCII, nd.length() + 1, List.of(nd)));
        }
        return directory;
    }

    static int compressionFor(String value)
    {
        switch (value) {
        case "NONE":
            return TiffConstants.COMPRESSION_NO;
        case "DEFLATE":
        case "ZIP":
            return TiffConstants.COMPRESSION_DEFLATE;
        case "LZW":
        case "PACKBITS":
            log.warn("COMPRESS={} cannot be encoded by the TIFF library; writing DEFLATE instead", value);
            return TiffConstants.COMPRESSION_DEFLATE;
        default:
            throw new IllegalArgumentException("unsupported GTiff compression '" + value + "'");
        }
    }

    private static void addGeoreferencing(FileDirectory directory, GeoTransform gt, String projection)
    {
        if (gt.isRotated()) {
            List<Double> m = Arrays.asList(
                gt.getPixelWidth(), gt.getRotationX(), 0.0, gt.getOriginX(),
                gt.getRotationY(), gt.getPixelHeight(), 0.0, gt.getOriginY(),
                0.0, 0.0, 0.0, 0.0,
                0.0, 0.0, 0.0, 1.0);
            directory.addEntry(new FileDirectoryEntry(GeoTiffTags.tag(GeoTiffTags.MODEL_TRANSFORMATION),
                                                      FieldType.DOUBLE, m.size(), m));
        } else {
            List<Double> scale = Arrays.asList(gt.getPixelWidth(), -gt.getPixelHeight(), 0.0);
            List<Double> tie = Arrays.asList(0.0, 0.0, 0.0, gt.getOriginX(), gt.getOriginY(), 0.0);
            directory.addEntry(new FileDirectoryEntry(GeoTiffTags.tag(GeoTiffTags.MODEL_PIXEL_SCALE),
                                                      FieldType.DOUBLE, scale.size(), scale));
            directory.addEntry(new FileDirectoryEntry(GeoTiffTags.tag(GeoTiffTags.MODEL_TIEPOINT),
                                                      FieldType.DOUBLE, tie.size(), tie));
        }

        List<int[]> keys = new ArrayList<>();
        keys.add(new int[] { GeoTiffTags.KEY_GT_RASTER_TYPE, 0, 1, GeoTiffTags.RASTER_PIXEL_IS_AREA });

        String citation = null;
        if (!Projections.isUndefined(projection)) {
            boolean geographic = Projections.isGeographic(projection);
            keys.add(new int[] { GeoTiffTags.KEY_GT_MODEL_TYPE, 0, 1,
                                 geographic ? GeoTiffTags.MODEL_TYPE_GEOGRAPHIC : GeoTiffTags.MODEL_TYPE_PROJECTED });
            int epsg = Projections.toEpsg(projection);
            int csKey = geographic ? GeoTiffTags.KEY_GEOGRAPHIC_TYPE : GeoTiffTags.KEY_PROJECTED_CS_TYPE;
            if (epsg > 0) {
                keys.add(new int[] { csKey, 0, 1, epsg });
            } else {
                // user defined; keep the proj4 definition in the citation
                citation = projection.trim() + "|";
                keys.add(new int[] { GeoTiffTags.KEY_GT_CITATION, GeoTiffTags.GEO_ASCII_PARAMS, citation.length(), 0 });
                keys.add(new int[] { csKey, 0, 1, GeoTiffTags.USER_DEFINED });
            }
        }
        // GeoKeys must be sorted by key id
        keys.sort((a, b) -> Integer.compare(a[0], b[0]));

        List<Integer> gk = new ArrayList<>();
        gk.addAll(Arrays.asList(1, 1, 0, keys.size()));
        for (int[] k : keys) {
            for (int v : k) gk.add(v);
        }
        directory.addEntry(new FileDirectoryEntry(GeoTiffTags.tag(GeoTiffTags.GEO_KEY_DIRECTORY),
                                                  FieldType.SHORT, gk.size(), gk));
        if (citation != null) {
            directory.addEntry(new FileDirectoryEntry(GeoTiffTags.tag(GeoTiffTags.GEO_ASCII_PARAMS),
                                                      FieldType.ASCII, citation.length() + 1, List.of(citation)));
        }
    }

    private static Number toSample(DataType type, double v)
    {
        double fitted = type.fit(v);
        switch (type) {
        case FLOAT32:
            return (float) fitted;
        case FLOAT64:
            return fitted;
        default:
            return (long) fitted;
        }
    }

    static String formatNoData(double noData)
    {
        if (Double.isNaN(noData)) return "nan";
        if (noData == Math.rint(noData) && Math.abs(noData) < 1e15) return Long.toString((long) noData);
        return Double.toString(noData);
    }
}

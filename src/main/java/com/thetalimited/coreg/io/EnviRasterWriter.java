package com.thetalimited.coreg.io;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.coreg.geo.GeoTransform;
import com.thetalimited.coreg.geo.Projections;
import com.thetalimited.coreg.raster.DataType;
import com.thetalimited.coreg.raster.Raster;

/**
 * Writes ENVI raw rasters: a little endian BSQ data file plus a {@code .hdr}
 * text header next to it. The only creation option understood is
 * {@code DESCRIPTION}.
 */
public class EnviRasterWriter implements RasterWriter
{
    private static final Logger log = LoggerFactory.getLogger(EnviRasterWriter.class);

    @Override
    public String getFormatName()
    {
        return RasterFormats.ENVI;
    }

    @Override
    public String getExtension()
    {
        return "bsq";
    }

    // foo.bsq -> foo.hdr
    public static Path headerPathFor(Path dataPath)
    {
        String name = dataPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return dataPath.resolveSibling(base + ".hdr");
    }

    @Override
    public void write(Raster raster, Path path, Map<String, String> creationOptions) throws IOException
    {
        String description = "theta-coreg output";
        for (Map.Entry<String, String> opt : creationOptions.entrySet()) {
            if (opt.getKey().trim().equalsIgnoreCase("DESCRIPTION")) {
                description = opt.getValue();
            } else {
                log.warn("ENVI creation option {}={} is not supported and ignored", opt.getKey(), opt.getValue());
            }
        }

        String header = buildHeader(raster, description);
        RasterFormats.writeAtomically(path, tmp -> writeData(raster, tmp));
        RasterFormats.writeAtomically(headerPathFor(path),
                                      tmp -> Files.write(tmp, header.getBytes(StandardCharsets.US_ASCII)));
        log.info("wrote ENVI {} ({}x{}x{} {})", path, raster.getCols(), raster.getRows(),
                 raster.getBandCount(), raster.getDataType());
    }

    static String buildHeader(Raster raster, String description)
    {
        GeoTransform gt = raster.getGeoTransform();
        StringBuilder sb = new StringBuilder();
        sb.append("ENVI\n");
        sb.append("description = {").append(description).append("}\n");
        sb.append("samples = ").append(raster.getCols()).append('\n');
        sb.append("lines = ").append(raster.getRows()).append('\n');
        sb.append("bands = ").append(raster.getBandCount()).append('\n');
        sb.append("header offset = 0\n");
        sb.append("file type = ENVI Standard\n");
        sb.append("data type = ").append(raster.getDataType().getEnviCode()).append('\n');
        sb.append("interleave = bsq\n");
        sb.append("byte order = 0\n");

        // reference pixel (1,1) is the upper left corner of the first pixel
        String units = Projections.isGeographic(raster.getProjection()) ? "Degrees" : "Meters";
        sb.append(String.format(Locale.ROOT, "map info = {Arbitrary, 1, 1, %.10f, %.10f, %.10f, %.10f, units=%s",
                                gt.getOriginX(), gt.getOriginY(), gt.getXRes(), gt.getYRes(), units));
        if (gt.isRotated()) {
            double angle = Math.toDegrees(Math.atan2(gt.getRotationY(), gt.getPixelWidth()));
            sb.append(String.format(Locale.ROOT, ", rotation=%.10f", -angle));
        }
        sb.append("}\n");
        if (raster.hasProjection()) {
            sb.append("coordinate system string = {").append(raster.getProjection()).append("}\n");
        }
        if (raster.getNoData() != null) {
            sb.append("data ignore value = ").append(GeoTiffRasterWriter.formatNoData(raster.getNoData())).append('\n');
        }
        sb.append("band names = {");
        for (int b = 0; b < raster.getBandCount(); b++) {
            if (b > 0) sb.append(", ");
            sb.append("Band ").append(b + 1);
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static void writeData(Raster raster, Path path) throws IOException
    {
        DataType type = raster.getDataType();
        ByteBuffer row = ByteBuffer.allocate(raster.getCols() * type.getBytes()).order(ByteOrder.LITTLE_ENDIAN);
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(path))) {
            for (int b = 0; b < raster.getBandCount(); b++) {
                for (double[] values : raster.getBand(b)) {
                    row.clear();
                    for (double v : values) put(row, type, type.fit(v));
                    out.write(row.array(), 0, row.position());
                }
            }
        }
    }

    private static void put(ByteBuffer buf, DataType type, double v)
    {
        switch (type) {
        case UINT8:
            buf.put((byte) (long) v);
            break;
        case INT16:
        case UINT16:
            buf.putShort((short) (long) v);
            break;
        case INT32:
        case UINT32:
            buf.putInt((int) (long) v);
            break;
        case FLOAT32:
            buf.putFloat((float) v);
            break;
        case FLOAT64:
            buf.putDouble(v);
            break;
        default:
            throw new IllegalStateException("unhandled data type " + type);
        }
    }
}

package com.thetalimited.coreg.raster;

import com.thetalimited.coreg.geo.Bounds;
import com.thetalimited.coreg.geo.GeoTransform;

/**
 * In-memory, band-stacked raster with its georeferencing.
 *
 * <p>Sample data is held as {@code double[band][row][col]}. The engine treats a
 * Raster as read-only; {@link #getBand(int)} hands out the backing array for
 * speed, so callers must not write into it.</p>
 */
public final class Raster
{
    private final double[][][] bands;
    private final int rows, cols;
    private final GeoTransform geoTransform;
    private final String projection;
    private final Double noData;
    private final BinaryMask badDataMask;
    private final DataType dataType;
    private final String filePath;

    private Raster(Builder b)
    {
        if (b.bands == null || b.bands.length == 0 || b.bands[0].length == 0 || b.bands[0][0].length == 0) {
            throw new IllegalArgumentException("raster needs at least one non-empty band");
        }
        this.bands = b.bands;
        this.rows = bands[0].length;
        this.cols = bands[0][0].length;
        for (double[][] band : bands) {
            if (band.length != rows) throw new IllegalArgumentException("all bands must have " + rows + " rows");
            for (double[] row : band) {
                if (row.length != cols) throw new IllegalArgumentException("all rows must have " + cols + " columns");
            }
        }
        if (b.badDataMask != null && !b.badDataMask.matches(this)) {
            throw new IllegalArgumentException("bad data mask is " + b.badDataMask.getRows() + "x"
                                               + b.badDataMask.getCols() + " but raster is " + rows + "x" + cols);
        }
        this.geoTransform = b.geoTransform != null ? b.geoTransform : GeoTransform.pixelSpace();
        this.projection = b.projection == null ? "" : b.projection.trim();
        this.noData = b.noData;
        this.badDataMask = b.badDataMask;
        this.dataType = b.dataType != null ? b.dataType : DataType.FLOAT64;
        this.filePath = b.filePath;
    }

    public static Builder builder(double[][][] bands)
    {
        return new Builder(bands);
    }

    public static Builder builder(double[][] band)
    {
        return new Builder(new double[][][] { band });
    }

    public int getRows() { return rows; }
    public int getCols() { return cols; }
    public int getBandCount() { return bands.length; }
    public GeoTransform getGeoTransform() { return geoTransform; }
    public String getProjection() { return projection; }
    public Double getNoData() { return noData; }
    public BinaryMask getBadDataMask() { return badDataMask; }
    public DataType getDataType() { return dataType; }
    public String getFilePath() { return filePath; }

    public boolean hasProjection()
    {
        return !projection.isEmpty();
    }

    // zero based band index
    public double[][] getBand(int index)
    {
        if (index < 0 || index >= bands.length) {
            throw new IndexOutOfBoundsException("band " + index + " out of range, raster has " + bands.length);
        }
        return bands[index];
    }

    public double[][][] copyBands()
    {
        double[][][] out = new double[bands.length][rows][];
        for (int b = 0; b < bands.length; b++) {
            for (int r = 0; r < rows; r++) {
                out[b][r] = bands[b][r].clone();
            }
        }
        return out;
    }

    public boolean isNoData(int band, int row, int col)
    {
        if (badDataMask != null && badDataMask.isSet(row, col)) return true;
        double v = bands[band][row][col];
        if (Double.isNaN(v)) return true;
        return noData != null && Double.compare(v, noData) == 0;
    }

    // true if no band holds a single valid pixel
    public boolean isEntirelyNoData()
    {
        for (int b = 0; b < bands.length; b++) {
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    if (!isNoData(b, r, c)) return false;
                }
            }
        }
        return true;
    }

    public Bounds getFootprint()
    {
        return geoTransform.footprint(cols, rows);
    }

    /**
     * Map bounds of the bounding box of all valid pixels of a band, or null if
     * the band holds no valid pixel at all.
     */
    public Bounds getValidDataBounds(int band)
    {
        int minR = rows, maxR = -1, minC = cols, maxC = -1;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                if (isNoData(band, r, c)) continue;
                if (r < minR) minR = r;
                if (r > maxR) maxR = r;
                if (c < minC) minC = c;
                if (c > maxC) maxC = c;
            }
        }
        if (maxR < 0) return null;
        return Bounds.enclosing(new double[][] {
            geoTransform.worldFromPixel(minC, minR), geoTransform.worldFromPixel(maxC + 1, minR),
            geoTransform.worldFromPixel(minC, maxR + 1), geoTransform.worldFromPixel(maxC + 1, maxR + 1)
        });
    }

    // copy of this raster's metadata around new data and georeferencing
    public Builder derive(double[][][] newBands, GeoTransform newTransform)
    {
        return new Builder(newBands)
            .geoTransform(newTransform)
            .projection(projection)
            .noData(noData)
            .dataType(dataType);
    }

    // same samples (shared, not copied) with another nodata value and bad data mask
    public Raster withNoDataAndMask(Double newNoData, BinaryMask newMask)
    {
        return new Builder(bands)
            .geoTransform(geoTransform)
            .projection(projection)
            .noData(newNoData)
            .badDataMask(newMask)
            .dataType(dataType)
            .filePath(filePath)
            .build();
    }

    @Override
    public String toString()
    {
        return "Raster[" + cols + "x" + rows + "x" + bands.length + ", gt=" + geoTransform
            + ", prj=" + (projection.isEmpty() ? "<none>" : projection)
            + (filePath != null ? ", file=" + filePath : "") + "]";
    }

    public static final class Builder
    {
        private final double[][][] bands;
        private GeoTransform geoTransform;
        private String projection;
        private Double noData;
        private BinaryMask badDataMask;
        private DataType dataType;
        private String filePath;

        private Builder(double[][][] bands)
        {
            this.bands = bands;
        }

        public Builder geoTransform(GeoTransform gt) { this.geoTransform = gt; return this; }
        public Builder geoTransform(double[] gt) { this.geoTransform = GeoTransform.of(gt); return this; }
        public Builder projection(String projection) { this.projection = projection; return this; }
        public Builder noData(Double noData) { this.noData = noData; return this; }
        public Builder badDataMask(BinaryMask mask) { this.badDataMask = mask; return this; }
        public Builder dataType(DataType dataType) { this.dataType = dataType; return this; }
        public Builder filePath(String filePath) { this.filePath = filePath; return this; }

        public Raster build()
        {
            return new Raster(this);
        }
    }
}

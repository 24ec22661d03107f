package com.thetalimited.coreg.raster;

import mil.nga.tiff.FieldType;
import mil.nga.tiff.util.TiffConstants;

/**
 * Storage type of raster samples, with its TIFF and ENVI encodings.
 */
public enum DataType
{
    // tiff field type, tiff sample format, envi code, integer range
    UINT8(FieldType.BYTE, TiffConstants.SAMPLE_FORMAT_UNSIGNED_INT, 1, 0, 255),
    INT16(FieldType.SSHORT, TiffConstants.SAMPLE_FORMAT_SIGNED_INT, 2, Short.MIN_VALUE, Short.MAX_VALUE),
    UINT16(FieldType.SHORT, TiffConstants.SAMPLE_FORMAT_UNSIGNED_INT, 12, 0, 65535),
    INT32(FieldType.SLONG, TiffConstants.SAMPLE_FORMAT_SIGNED_INT, 3, Integer.MIN_VALUE, Integer.MAX_VALUE),
    UINT32(FieldType.LONG, TiffConstants.SAMPLE_FORMAT_UNSIGNED_INT, 13, 0, 4294967295.0),
    FLOAT32(FieldType.FLOAT, TiffConstants.SAMPLE_FORMAT_FLOAT, 4, -Float.MAX_VALUE, Float.MAX_VALUE),
    FLOAT64(FieldType.DOUBLE, TiffConstants.SAMPLE_FORMAT_FLOAT, 5, -Double.MAX_VALUE, Double.MAX_VALUE);

    private final FieldType fieldType;
    private final int sampleFormat;
    private final int enviCode;
    private final double min;
    private final double max;

    DataType(FieldType fieldType, int sampleFormat, int enviCode, double min, double max)
    {
        this.fieldType = fieldType;
        this.sampleFormat = sampleFormat;
        this.enviCode = enviCode;
        this.min = min;
        this.max = max;
    }

    public FieldType getFieldType() { return fieldType; }
    public int getSampleFormat() { return sampleFormat; }
    public int getEnviCode() { return enviCode; }
    public int getBytes() { return fieldType.getBytes(); }
    public int getBits() { return fieldType.getBits(); }

    public boolean isFloatingPoint()
    {
        return this == FLOAT32 || this == FLOAT64;
    }

    // round and clip a computed value into this type's range; NaN passes through for float types
    public double fit(double v)
    {
        if (isFloatingPoint()) return v;
        if (Double.isNaN(v)) return 0;
        double r = Math.rint(v);
        return r < min ? min : (r > max ? max : r);
    }

    public static DataType fromFieldType(FieldType fieldType)
    {
        for (DataType t : values()) {
            if (t.fieldType == fieldType) return t;
        }
        // SBYTE and friends are widened to a float type
        return FLOAT32;
    }
}

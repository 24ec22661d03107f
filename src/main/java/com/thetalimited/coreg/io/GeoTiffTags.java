package com.thetalimited.coreg.io;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;

/**
 * GeoTIFF tag and GeoKey ids plus helpers to pull typed values out of a
 * {@link FileDirectory}. Values are located by tag id so that files written by
 * GDAL and by this library read the same way.
 */
final class GeoTiffTags
{
    static final int MODEL_PIXEL_SCALE   = 33550;
    static final int MODEL_TIEPOINT      = 33922;
    static final int MODEL_TRANSFORMATION = 34264;
    static final int GEO_KEY_DIRECTORY   = 34735;
    static final int GEO_DOUBLE_PARAMS   = 34736;
    static final int GEO_ASCII_PARAMS    = 34737;
    static final int GDAL_METADATA       = 42112;
    static final int GDAL_NODATA         = 42113;

    // GeoKey IDs
    static final int KEY_GT_MODEL_TYPE      = 1024;
    static final int KEY_GT_RASTER_TYPE     = 1025;
    static final int KEY_GT_CITATION        = 1026;
    static final int KEY_GEOGRAPHIC_TYPE    = 2048;
    static final int KEY_PROJECTED_CS_TYPE  = 3072;

    static final int MODEL_TYPE_PROJECTED  = 1;
    static final int MODEL_TYPE_GEOGRAPHIC = 2;
    static final int RASTER_PIXEL_IS_AREA  = 1;
    static final int RASTER_PIXEL_IS_POINT = 2;
    static final int USER_DEFINED          = 32767;

    private GeoTiffTags() {}

    static FieldTagType tag(int id)
    {
        FieldTagType t = FieldTagType.getById(id);
        if (t == null) {
            throw new IllegalStateException("TIFF library does not know tag " + id);
        }
        return t;
    }

    static FileDirectoryEntry findEntry(FileDirectory directory, int tag)
    {
        for (FileDirectoryEntry entry : safeEntries(directory)) {
            FieldTagType t = entry.getFieldTag();
            if (t != null && t.getId() == tag) return entry;
        }
        return null;
    }

    /**
     * Extracts tag values from the FileDirectory as a List. Pass in the expected
     * type so that stray elements of other types are dropped instead of causing
     * a ClassCastException later on. Returns null if the tag is absent.
     */
    static <T> List<T> getTagValues(FileDirectory directory, int tag, Class<T> type)
    {
        FileDirectoryEntry entry = findEntry(directory, tag);
        if (entry == null) return null;

        Object values = entry.getValues();
        List<T> out = new ArrayList<>();
        if (values instanceof List<?>) {
            for (Object item : (List<?>) values) {
                if (type.isInstance(item)) out.add(type.cast(item));
            }
        } else if (type.isInstance(values)) {
            out.add(type.cast(values));
        }
        return out;
    }

    static double[] getDoubles(FileDirectory directory, int tag)
    {
        FileDirectoryEntry entry = findEntry(directory, tag);
        return entry == null ? null : toDoubleArray(entry.getValues());
    }

    static String getAscii(FileDirectory directory, int tag)
    {
        FileDirectoryEntry entry = findEntry(directory, tag);
        if (entry == null) return null;
        String s = toAscii(entry.getValues()).trim();
        // strip the NUL terminator(s) and GeoTIFF's '|' separator
        while (!s.isEmpty() && (s.charAt(s.length() - 1) == '\0' || s.charAt(s.length() - 1) == '|')) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }

    // GeoKeyDirectory as unsigned shorts, or null if absent or malformed
    static int[] readGeoKeyDirectory(FileDirectory directory)
    {
        List<Number> raw = getTagValues(directory, GEO_KEY_DIRECTORY, Number.class);
        if (raw == null) return null;
        int[] s = new int[raw.size()];
        for (int i = 0; i < s.length; i++) s[i] = raw.get(i).intValue() & 0xFFFF;
        return looksLikeGeoKeyDirectory(s) ? s : null;
    }

    // inline value of a GeoKey, or -1 if it is not present or stored elsewhere
    static int geoKeyValue(int[] gk, int keyId)
    {
        if (gk == null) return -1;
        int numKeys = gk[3], idx = 4;
        for (int k = 0; k < numKeys && (idx + 3) < gk.length; k++, idx += 4) {
            if (gk[idx] == keyId && gk[idx + 1] == 0 && gk[idx + 2] == 1) {
                return gk[idx + 3];
            }
        }
        return -1;
    }

    // Pull the value of an <Item name="...">...</Item> in GDAL metadata (simple string search).
    static String findMetadataItem(String gdalXml, String name)
    {
        if (gdalXml == null) return null;
        Matcher m = Pattern
            .compile("<Item\\s+name=\"" + Pattern.quote(name) + "\"[^>]*>(.*?)</Item>",
                     Pattern.CASE_INSENSITIVE | Pattern.DOTALL)
            .matcher(gdalXml);
        return m.find() ? m.group(1).trim() : null;
    }

    static double[] toDoubleArray(Object o)
    {
        if (o == null) return null;
        if (o instanceof double[]) return (double[]) o;
        if (o instanceof Number) return new double[] { ((Number) o).doubleValue() };
        if (o instanceof List<?>) {
            List<?> lst = (List<?>) o;
            double[] d = new double[lst.size()];
            for (int i = 0; i < lst.size(); i++) {
                Object v = lst.get(i);
                if (v instanceof Number) {
                    d[i] = ((Number) v).doubleValue();
                } else {
                    try {
                        d[i] = Double.parseDouble(String.valueOf(v).trim());
                    } catch (NumberFormatException ex) {
                        return null;
                    }
                }
            }
            return d;
        }
        return null;
    }

    static String toAscii(Object v)
    {
        if (v == null) return "";
        if (v instanceof String) return (String) v;
        if (v instanceof byte[]) return new String((byte[]) v, StandardCharsets.UTF_8);
        if (v instanceof List<?>) {
            // ascii tags come back as a list of strings, one per NUL terminated chunk
            StringBuilder sb = new StringBuilder();
            for (Object o : (List<?>) v) sb.append(o);
            return sb.toString();
        }
        return String.valueOf(v);
    }

    private static Set<FileDirectoryEntry> safeEntries(FileDirectory d)
    {
        Set<FileDirectoryEntry> s = d.getEntries();
        return (s == null) ? Collections.emptySet() : s;
    }

    private static boolean looksLikeGeoKeyDirectory(int[] s)
    {
        return s != null && s.length >= 4 && s[0] == 1 && s[1] == 1 && s[2] == 0;
    }
}

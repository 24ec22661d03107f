package com.thetalimited.coreg.geo;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;

/**
 * Projection utilities on top of proj4j.
 *
 * <p>A projection descriptor is either {@code "EPSG:nnnn"}, a proj4 parameter
 * string such as {@code "+proj=utm +zone=33 +datum=WGS84"}, or empty when the
 * raster lives in plain pixel coordinates.</p>
 */
public final class Projections
{
    // EPSG: 4269 is NAD83
    // EPSG: 4326 is WGS84
    // EPSG: 3035 is ETRS89 / LAEA Europe
    public static final String WGS84 = "EPSG:4326";

    // proj4 keys that do not change the meaning of a projection
    private static final Set<String> COSMETIC_KEYS = Set.of("no_defs", "type", "wktext", "title");

    private static final CRSFactory crsFactory = new CRSFactory();
    private static final CoordinateTransformFactory ctf = new CoordinateTransformFactory();
    // proj4j CRS objects are immutable, so they can be shared between runs
    private static final Map<String, CoordinateReferenceSystem> crsCache = new ConcurrentHashMap<>();

    private Projections() {}

    public static String fromEpsg(int epsgCode)
    {
        if (epsgCode <= 0) throw new IllegalArgumentException("invalid EPSG code " + epsgCode);
        return "EPSG:" + epsgCode;
    }

    // returns the EPSG code of a descriptor or 0 when it is not an EPSG reference
    public static int toEpsg(String descriptor)
    {
        if (isUndefined(descriptor)) return 0;
        String d = descriptor.trim();
        if (d.regionMatches(true, 0, "EPSG:", 0, 5)) {
            try {
                return Integer.parseInt(d.substring(5).trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    public static boolean isUndefined(String descriptor)
    {
        return descriptor == null || descriptor.trim().isEmpty();
    }

    /**
     * Build (or fetch) the proj4j CRS for a descriptor.
     *
     * @throws IllegalArgumentException if the descriptor is empty or cannot be parsed
     */
    public static CoordinateReferenceSystem createCrs(String descriptor)
    {
        if (isUndefined(descriptor)) {
            throw new IllegalArgumentException("no projection defined");
        }
        String key = descriptor.trim();
        CoordinateReferenceSystem crs = crsCache.get(key);
        if (crs != null) return crs;

        try {
            if (key.startsWith("+") || key.contains("+proj=")) {
                crs = crsFactory.createFromParameters("custom", key);
            } else {
                crs = crsFactory.createFromName(key);
            }
        } catch (Proj4jException e) {
            throw new IllegalArgumentException("cannot interpret projection '" + key + "': " + e.getMessage(), e);
        }
        crsCache.put(key, crs);
        return crs;
    }

    /**
     * Name of the geographic datum underlying a projection, e.g. "WGS84" or "NAD83".
     * When the CRS carries no named datum the ellipsoid (plus non-zero towgs84
     * parameters) stands in for it. Returns null for an undefined projection.
     */
    public static String getDatum(String descriptor)
    {
        if (isUndefined(descriptor)) return null;

        Map<String, String> params = parameters(createCrs(descriptor));
        String datum = params.get("datum");
        if (datum != null) {
            return datum.toUpperCase();
        }
        String ellps = params.getOrDefault("ellps", "unknown").toUpperCase();
        String towgs84 = params.get("towgs84");
        if (towgs84 != null && !isZeroVector(towgs84)) {
            return ellps + "[" + towgs84 + "]";
        }
        return ellps;
    }

    public static boolean isSameDatum(String a, String b)
    {
        String da = getDatum(a), db = getDatum(b);
        return da != null && da.equals(db);
    }

    // true if both descriptors describe the same projection, independent of spelling
    public static boolean isSameProjection(String a, String b)
    {
        if (isUndefined(a) || isUndefined(b)) {
            return isUndefined(a) && isUndefined(b);
        }
        if (a.trim().equalsIgnoreCase(b.trim())) return true;
        return parameters(createCrs(a)).equals(parameters(createCrs(b)));
    }

    public static boolean isGeographic(String descriptor)
    {
        if (isUndefined(descriptor)) return false;
        String proj = parameters(createCrs(descriptor)).get("proj");
        return "longlat".equals(proj) || "latlong".equals(proj);
    }

    public static CoordinateTransform createTransform(String from, String to)
    {
        return ctf.createTransform(createCrs(from), createCrs(to));
    }

    // proj4j expects (lon, lat) order when one side is geographic
    public static double[] transform(CoordinateTransform ct, double x, double y)
    {
        ProjCoordinate src = new ProjCoordinate(x, y), dst = new ProjCoordinate();
        ct.transform(src, dst);
        return new double[] { dst.x, dst.y };
    }

    public static Bounds transformBounds(Bounds b, String from, String to)
    {
        if (isSameProjection(from, to)) return b;
        CoordinateTransform ct = createTransform(from, to);
        double[][] corners = {
            transform(ct, b.minX, b.minY), transform(ct, b.minX, b.maxY),
            transform(ct, b.maxX, b.minY), transform(ct, b.maxX, b.maxY)
        };
        return Bounds.enclosing(corners);
    }

    private static Map<String, String> parameters(CoordinateReferenceSystem crs)
    {
        Map<String, String> out = new TreeMap<>();
        String[] params = crs.getParameters();
        if (params == null) return out;
        for (String p : params) {
            if (p == null) continue;
            String s = p.trim();
            if (s.startsWith("+")) s = s.substring(1);
            if (s.isEmpty()) continue;
            int eq = s.indexOf('=');
            String k = eq < 0 ? s : s.substring(0, eq);
            String v = eq < 0 ? "" : s.substring(eq + 1);
            if (COSMETIC_KEYS.contains(k)) continue;
            out.put(k, v);
        }
        return out;
    }

    private static boolean isZeroVector(String csv)
    {
        for (String part : csv.split(",")) {
            try {
                if (Double.parseDouble(part.trim()) != 0.0) return false;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return true;
    }
}

package com.thetalimited.coreg.geo;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ProjectionsTest
{
    private static final String UTM33 = "+proj=utm +zone=33 +datum=WGS84 +units=m +no_defs";
    private static final String UTM32 = "+proj=utm +zone=32 +datum=WGS84 +units=m +no_defs";
    private static final String UTM33_INTL = "+proj=utm +zone=33 +ellps=intl +towgs84=-87,-98,-121,0,0,0,0 +units=m";

    @Test
    public void epsgCodes()
    {
        assertEquals("EPSG:32633", Projections.fromEpsg(32633));
        assertEquals(32633, Projections.toEpsg("epsg:32633"));
        assertEquals(0, Projections.toEpsg(UTM33));
        assertEquals(0, Projections.toEpsg(""));
    }

    @Test
    public void datumOfProj4Strings()
    {
        assertEquals("WGS84", Projections.getDatum(UTM33));
        assertTrue(Projections.isSameDatum(UTM33, UTM32));
        assertFalse(Projections.isSameDatum(UTM33, UTM33_INTL));
        assertNull(Projections.getDatum(""));
    }

    @Test
    public void sameProjectionIgnoresCosmeticKeys()
    {
        assertTrue(Projections.isSameProjection(UTM33, "+proj=utm +zone=33 +datum=WGS84 +units=m"));
        assertFalse(Projections.isSameProjection(UTM33, UTM32));
        assertTrue(Projections.isSameProjection("", null));
        assertFalse(Projections.isSameProjection(UTM33, ""));
    }

    @Test
    public void geographicDetection()
    {
        assertTrue(Projections.isGeographic("+proj=longlat +datum=WGS84 +no_defs"));
        assertFalse(Projections.isGeographic(UTM33));
    }

    @Test
    public void transformBetweenZonesRoundTrips()
    {
        double[] there = Projections.transform(Projections.createTransform(UTM33, UTM32), 500000, 5000000);
        double[] back = Projections.transform(Projections.createTransform(UTM32, UTM33), there[0], there[1]);
        assertEquals(500000, back[0], 0.05);
        assertEquals(5000000, back[1], 0.05);
        // zone 32 lies west, so the same point has a larger easting there
        assertTrue(there[0] > 500000);
    }
}

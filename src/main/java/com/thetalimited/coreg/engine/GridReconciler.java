package com.thetalimited.coreg.engine;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.coreg.CoregException;
import com.thetalimited.coreg.FailureKind;
import com.thetalimited.coreg.geo.Bounds;
import com.thetalimited.coreg.geo.GeoTransform;
import com.thetalimited.coreg.geo.Projections;
import com.thetalimited.coreg.raster.Raster;

/**
 * Decides how a reference and a target raster can be compared: checks that
 * their datums agree and whether the target (and possibly the reference) has
 * to be resampled onto a common north-up analysis grid.
 */
public class GridReconciler
{
    private static final Logger log = LoggerFactory.getLogger(GridReconciler.class);

    public static final String RESAMPLING_ADVISORY = "target image needs to be resampled";

    /**
     * @throws CoregException DATUM_MISMATCH if the datums differ,
     *         PROJECTION_MISMATCH if only one raster has a projection,
     *         CONFIGURATION if a projection cannot be interpreted
     */
    public Reconciliation reconcile(Raster reference, Raster target)
    {
        List<String> advisories = new ArrayList<>();
        String refPrj = reference.getProjection(), tgtPrj = target.getProjection();
        boolean refUndefined = Projections.isUndefined(refPrj), tgtUndefined = Projections.isUndefined(tgtPrj);

        boolean localMode = refUndefined && tgtUndefined;
        boolean needsReprojection = false;

        if (!localMode) {
            if (refUndefined || tgtUndefined) {
                throw new CoregException(FailureKind.PROJECTION_MISMATCH,
                    (refUndefined ? "reference" : "target") + " image has no projection while the "
                    + (refUndefined ? "target" : "reference") + " has '" + (refUndefined ? tgtPrj : refPrj) + "'");
            }
            String refDatum, tgtDatum;
            try {
                refDatum = Projections.getDatum(refPrj);
                tgtDatum = Projections.getDatum(tgtPrj);
            } catch (IllegalArgumentException e) {
                throw new CoregException(FailureKind.CONFIGURATION, e.getMessage(), e);
            }
            if (!refDatum.equals(tgtDatum)) {
                throw new CoregException(FailureKind.DATUM_MISMATCH,
                    "input projections have different datums: reference " + refDatum + " (" + refPrj
                    + "), target " + tgtDatum + " (" + tgtPrj + ")");
            }
            if (!Projections.isSameProjection(refPrj, tgtPrj)) {
                needsReprojection = true;
                advisories.add("target projection " + tgtPrj + " differs from reference projection " + refPrj
                               + "; target is reprojected point by point");
            }
        }

        GeoTransform refGt = reference.getGeoTransform(), tgtGt = target.getGeoTransform();
        boolean referenceResampled = refGt.isRotated();
        GeoTransform analysisGrid = referenceResampled ? northUpGrid(reference) : refGt;

        boolean needsResampling = needsReprojection || !tgtGt.isGridAlignedWith(analysisGrid);
        if (needsResampling) {
            advisories.add(RESAMPLING_ADVISORY);
        }
        if (referenceResampled) {
            advisories.add("reference image is rotated and is resampled onto a north-up grid");
        }

        Reconciliation rec = new Reconciliation(analysisGrid, localMode ? "" : refPrj, localMode,
                                                needsResampling, needsReprojection, referenceResampled, advisories);
        log.info("grid reconciliation: {}", rec);
        return rec;
    }

    // north-up grid covering a rotated raster, with its pixel sizes
    static GeoTransform northUpGrid(Raster raster)
    {
        GeoTransform gt = raster.getGeoTransform();
        Bounds fp = raster.getFootprint();
        return new GeoTransform(fp.minX, gt.getXRes(), 0.0, fp.maxY, 0.0, -gt.getYRes());
    }
}

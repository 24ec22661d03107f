package com.thetalimited.coreg.engine;

import java.util.Collections;
import java.util.List;

import com.thetalimited.coreg.geo.GeoTransform;

/**
 * Common analysis frame of a reference/target pair as decided by the
 * {@link GridReconciler}.
 */
public final class Reconciliation
{
    private final GeoTransform analysisGrid;
    private final String projection;
    private final boolean localMode;
    private final boolean needsResampling;
    private final boolean needsReprojection;
    private final boolean referenceResampled;
    private final List<String> advisories;

    Reconciliation(GeoTransform analysisGrid, String projection, boolean localMode, boolean needsResampling,
                   boolean needsReprojection, boolean referenceResampled, List<String> advisories)
    {
        this.analysisGrid = analysisGrid;
        this.projection = projection;
        this.localMode = localMode;
        this.needsResampling = needsResampling;
        this.needsReprojection = needsReprojection;
        this.referenceResampled = referenceResampled;
        this.advisories = Collections.unmodifiableList(advisories);
    }

    /**
     * North-up grid on which both windows are compared. Identical to the
     * reference geotransform unless the reference is rotated.
     */
    public GeoTransform getAnalysisGrid() { return analysisGrid; }

    // projection of the analysis grid, i.e. the reference projection
    public String getProjection() { return projection; }

    // both rasters lack a projection; coordinates are compared as is
    public boolean isLocalMode() { return localMode; }

    public boolean needsResampling() { return needsResampling; }
    public boolean needsReprojection() { return needsReprojection; }

    // reference is rotated, so its window is resampled onto the analysis grid as well
    public boolean isReferenceResampled() { return referenceResampled; }

    public boolean isProjectionCompatible() { return !needsReprojection; }

    public double getResolutionX() { return analysisGrid.getXRes(); }
    public double getResolutionY() { return analysisGrid.getYRes(); }

    public List<String> getAdvisories() { return advisories; }

    @Override
    public String toString()
    {
        return "Reconciliation[grid=" + analysisGrid + (localMode ? ", local" : ", prj=" + projection)
            + (needsResampling ? ", resample" : "") + (needsReprojection ? ", reproject" : "")
            + (referenceResampled ? ", rotated reference" : "") + "]";
    }
}

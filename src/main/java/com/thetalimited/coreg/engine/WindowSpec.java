package com.thetalimited.coreg.engine;

import com.thetalimited.coreg.geo.Bounds;
import com.thetalimited.coreg.geo.GeoTransform;

/**
 * Resolved matching window: a centre in map units of the analysis grid plus
 * the window size in analysis grid pixels. Reference and target each resolve
 * it to their own pixel sub-window.
 */
public final class WindowSpec
{
    private final double centerX, centerY;
    private final int width, height;
    private final int col0, row0;
    private final GeoTransform analysisGrid;

    WindowSpec(double centerX, double centerY, int width, int height, int col0, int row0, GeoTransform analysisGrid)
    {
        this.centerX = centerX;
        this.centerY = centerY;
        this.width = width;
        this.height = height;
        this.col0 = col0;
        this.row0 = row0;
        this.analysisGrid = analysisGrid;
    }

    public double getCenterX() { return centerX; }
    public double getCenterY() { return centerY; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }

    // upper left pixel of the window on the analysis grid
    public int getCol0() { return col0; }
    public int getRow0() { return row0; }

    public GeoTransform getWindowGrid()
    {
        return analysisGrid.withOriginAtPixel(col0, row0);
    }

    public Bounds getBounds()
    {
        return getWindowGrid().footprint(width, height);
    }

    @Override
    public String toString()
    {
        return String.format("WindowSpec[center=(%.4f, %.4f), size=%dx%d, ul=(%d,%d)]",
                             centerX, centerY, width, height, col0, row0);
    }
}

package com.thetalimited.coreg.geo;

// axis-aligned rectangle in map units

public final class Bounds
{
    public final double minX, minY, maxX, maxY;

    public Bounds(double minX, double minY, double maxX, double maxY)
    {
        this.minX = minX; this.minY = minY; this.maxX = maxX; this.maxY = maxY;
    }

    public double getWidth()  { return maxX - minX; }
    public double getHeight() { return maxY - minY; }

    public boolean isEmpty()
    {
        return !(maxX > minX && maxY > minY);
    }

    public double[] getCenter()
    {
        return new double[] { (minX + maxX) / 2.0, (minY + maxY) / 2.0 };
    }

    public boolean contains(double x, double y)
    {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    // containment with a small slack, in map units
    public boolean contains(Bounds other, double tolerance)
    {
        return other.minX >= minX - tolerance && other.maxX <= maxX + tolerance
            && other.minY >= minY - tolerance && other.maxY <= maxY + tolerance;
    }

    public Bounds intersection(Bounds other)
    {
        return new Bounds(Math.max(minX, other.minX), Math.max(minY, other.minY),
                          Math.min(maxX, other.maxX), Math.min(maxY, other.maxY));
    }

    public static Bounds enclosing(double[][] points)
    {
        double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        for (double[] p : points) {
            minX = Math.min(minX, p[0]);
            maxX = Math.max(maxX, p[0]);
            minY = Math.min(minY, p[1]);
            maxY = Math.max(maxY, p[1]);
        }
        return new Bounds(minX, minY, maxX, maxY);
    }

    @Override
    public String toString()
    {
        return String.format("minX=%.6f, minY=%.6f, maxX=%.6f, maxY=%.6f", minX, minY, maxX, maxY);
    }
}

package com.thetalimited.coreg.geo;

public enum ResamplingMethod
{
    // name, kernel radius in pixels, description
    NEAREST("nearest", 0, "Nearest neighbour"),
    BILINEAR("bilinear", 1, "Bilinear interpolation over 2x2 pixels"),
    CUBIC("cubic", 2, "Cubic convolution (Keys, a=-0.5) over 4x4 pixels");

    private final String gdalName;
    private final int radius;
    private final String description;

    ResamplingMethod(String gdalName, int radius, String description)
    {
        this.gdalName = gdalName;
        this.radius = radius;
        this.description = description;
    }

    public String getGdalName() { return gdalName; }
    public int getRadius() { return radius; }
    public String getDescription() { return description; }

    public static ResamplingMethod fromName(String name)
    {
        for (ResamplingMethod m : values()) {
            if (m.gdalName.equalsIgnoreCase(name) || m.name().equalsIgnoreCase(name)) {
                return m;
            }
        }
        throw new IllegalArgumentException("unsupported resampling method '" + name + "'");
    }
}

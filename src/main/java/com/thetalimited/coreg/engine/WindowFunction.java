package com.thetalimited.coreg.engine;

import java.util.Locale;

/**
 * Taper applied to a sample window before it is transformed, to suppress the
 * cross shaped artefacts caused by the implicit periodic continuation.
 */
public enum WindowFunction
{
    NONE,
    HANN;

    // returns a new array; the input is left alone
    public double[][] apply(double[][] window)
    {
        int rows = window.length, cols = window[0].length;
        double[][] out = new double[rows][cols];
        if (this == NONE) {
            for (int r = 0; r < rows; r++) out[r] = window[r].clone();
            return out;
        }
        double[] wr = hann(rows), wc = hann(cols);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                out[r][c] = window[r][c] * wr[r] * wc[c];
            }
        }
        return out;
    }

    static double[] hann(int n)
    {
        double[] w = new double[n];
        if (n == 1) {
            w[0] = 1.0;
            return w;
        }
        for (int i = 0; i < n; i++) {
            w[i] = 0.5 - 0.5 * Math.cos(2.0 * Math.PI * i / (n - 1));
        }
        return w;
    }

    public static WindowFunction fromName(String name)
    {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown window function '" + name + "'", e);
        }
    }
}

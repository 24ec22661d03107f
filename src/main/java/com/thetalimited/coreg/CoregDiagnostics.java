package com.thetalimited.coreg;

import com.thetalimited.coreg.engine.SampleWindow;

/**
 * Optional observer of intermediate products, e.g. for plotting. All methods
 * default to no-ops. Exceptions thrown here are logged and otherwise ignored;
 * a diagnostics hook never changes the computed shift.
 */
public interface CoregDiagnostics
{
    CoregDiagnostics NONE = new CoregDiagnostics() { };

    // sample window of one estimation pass (1-based)
    default void onSampleWindow(SampleWindow window, int iteration) { }

    // fftshifted correlation surface of one estimation pass
    default void onCrossPowerSpectrum(double[][] surface, int iteration) { }

    default void onShiftResult(ShiftResult result) { }
}

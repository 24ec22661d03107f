package com.thetalimited.coreg;

/**
 * Observer for long running stages such as resampling. Implementations must
 * be cheap; they are called from the computing thread.
 */
@FunctionalInterface
public interface ProgressListener
{
    ProgressListener NONE = (stage, fraction) -> { };

    // fraction runs from 0.0 to 1.0
    void onProgress(String stage, double fraction);
}

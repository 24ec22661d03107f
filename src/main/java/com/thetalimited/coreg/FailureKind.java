package com.thetalimited.coreg;

// reasons a co-registration run can end without a usable shift
public enum FailureKind
{
    CONFIGURATION,
    DATUM_MISMATCH,
    PROJECTION_MISMATCH,
    NO_VALID_DATA,
    OUT_OF_BOUNDS,
    OBSCURED_WINDOW,
    IMPLAUSIBLE_SHIFT
}

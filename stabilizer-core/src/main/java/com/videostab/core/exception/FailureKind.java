package com.videostab.core.exception;

/**
 * Structural failures that abort the current stage.
 *
 * <p>Numeric degeneracies (zero sigma, empty cutoff range, extreme correction, tracking loss)
 * are not listed here: they resolve locally to a defined value and never surface as failures.
 */
public enum FailureKind {

    /** A required persisted array or run is missing. */
    INPUT_NOT_FOUND,

    /** Two series that must be aligned frame-by-frame differ in length. */
    LENGTH_MISMATCH,

    /** The resolved analysis window is empty even with trimming disabled. */
    TOO_SHORT,

    /** A smoothing parameter, frame size or trim bound lies outside its domain. */
    INVALID_PARAMETER,

    /** The requested algorithm is reserved but not implemented. */
    UNSUPPORTED_ALGORITHM,

    /** A persisted array exists but cannot be decoded. */
    CORRUPT_ARRAY
}

package com.sysmuse.structure.cas;

/**
 * Transcendental family a named function or power form belongs to.
 */
public enum FunctionFamily {
    TRIGONOMETRIC,
    EXPONENTIAL,
    LOGARITHMIC,
    OTHER
}

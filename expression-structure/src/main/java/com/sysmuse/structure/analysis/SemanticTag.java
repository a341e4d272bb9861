package com.sysmuse.structure.analysis;

/**
 * Transcendental content of an expression with respect to the target variable.
 */
public enum SemanticTag {
    POLYNOMIAL,
    TRIGONOMETRIC,
    EXPONENTIAL,
    LOGARITHMIC,
    MIXED_OR_UNKNOWN
}

package com.sysmuse.structure.analysis;

/**
 * Syntactic category of an expression's outermost operator.
 */
public enum ShapeTag {
    SUM,
    PRODUCT,
    QUOTIENT,
    POWER_OR_COMPOSITION,
    ATOMIC
}

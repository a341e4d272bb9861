package com.sysmuse.structure.analysis;

/**
 * Order of Sum and Product children in a decomposition.
 */
public enum ChildOrdering {
    /**
     * Operand order as reported by the expression tree.
     */
    AS_GIVEN,

    /**
     * Polynomial degree ascending, non-polynomial operands last, ties broken by printed form.
     */
    DEGREE_LEXICOGRAPHIC
}

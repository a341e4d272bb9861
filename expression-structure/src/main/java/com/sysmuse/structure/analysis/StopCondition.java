package com.sysmuse.structure.analysis;

import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.Polynomials;
import com.sysmuse.structure.cas.Symbol;

/**
 * Decides whether a subtree stays a leaf of the decomposition.
 * <p>
 * Low-degree polynomials and variable-free subtrees always stop. Sums, products and
 * quotients continue into their natural children. Powers and compositions continue
 * only when composition expansion is enabled.
 */
public class StopCondition {

    public static final int DEFAULT_MAX_LEAF_DEGREE = 2;

    private final int maxLeafPolynomialDegree;
    private final boolean expandCompositions;

    public StopCondition() {
        this(DEFAULT_MAX_LEAF_DEGREE, false);
    }

    public StopCondition(int maxLeafPolynomialDegree, boolean expandCompositions) {
        if (maxLeafPolynomialDegree < 0) {
            throw new IllegalArgumentException("maxLeafPolynomialDegree must be >= 0: " + maxLeafPolynomialDegree);
        }
        this.maxLeafPolynomialDegree = maxLeafPolynomialDegree;
        this.expandCompositions = expandCompositions;
    }

    public boolean shouldStop(Expression expr, Symbol variable, Classification classification) {
        if (classification.getSemanticTag() == SemanticTag.POLYNOMIAL
                && Polynomials.isPolynomial(expr, variable)
                && Polynomials.degree(expr, variable) <= maxLeafPolynomialDegree) {
            return true;
        }
        if (!expr.contains(variable)) return true;

        switch (classification.getShapeTag()) {
            case SUM:
            case PRODUCT:
            case QUOTIENT:
                return false;
            case POWER_OR_COMPOSITION:
                return !expandCompositions;
            default:
                return true;
        }
    }

    public int getMaxLeafPolynomialDegree() {
        return maxLeafPolynomialDegree;
    }

    public boolean isExpandCompositions() {
        return expandCompositions;
    }
}

package com.sysmuse.structure.analysis;

import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.Expressions;
import com.sysmuse.structure.cas.Power;
import com.sysmuse.structure.cas.Product;
import com.sysmuse.structure.cas.Symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * A term split as {@code prefactor * base^exponent}, where the base does not depend on
 * the variable and the exponent does.
 */
public final class ExponentialTerm {

    private final Expression prefactor;
    private final Expression base;
    private final Expression exponent;

    private ExponentialTerm(Expression prefactor, Expression base, Expression exponent) {
        this.prefactor = prefactor;
        this.base = base;
        this.exponent = exponent;
    }

    /**
     * Splits {@code term} around its single exponential factor.
     *
     * @return the split, or {@code null} when the term has no exponential factor or more than one
     */
    public static ExponentialTerm extract(Expression term, Symbol variable) {
        if (isExponential(term, variable)) {
            Power power = (Power) term;
            return new ExponentialTerm(Expressions.ONE, power.base(), power.exponent());
        }
        if (!(term instanceof Product product)) return null;

        Power found = null;
        List<Expression> rest = new ArrayList<>();
        for (Expression factor : product.factors()) {
            if (isExponential(factor, variable)) {
                if (found != null) return null;
                found = (Power) factor;
            } else {
                rest.add(factor);
            }
        }
        if (found == null) return null;
        return new ExponentialTerm(Expressions.multiply(rest), found.base(), found.exponent());
    }

    static boolean isExponential(Expression expr, Symbol variable) {
        return expr instanceof Power p && !p.base().contains(variable) && p.exponent().contains(variable);
    }

    public Expression getPrefactor() {
        return prefactor;
    }

    public Expression getBase() {
        return base;
    }

    public Expression getExponent() {
        return exponent;
    }

    @Override
    public String toString() {
        return prefactor + " * " + base + "^(" + exponent + ")";
    }
}

package com.sysmuse.structure.analysis;

import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.Expressions;
import com.sysmuse.structure.cas.Polynomials;
import com.sysmuse.structure.cas.Rational;
import com.sysmuse.structure.cas.Sum;
import com.sysmuse.structure.cas.Symbol;
import com.sysmuse.structure.cas.SymbolicEquality;
import com.sysmuse.structure.util.LoggingUtil;

import java.util.Objects;

/**
 * Rewrites {@code c1*b^(k1*x) + c2*b^(k2*x)} as
 * {@code b^(kmin*x) * (cmin + cmax*b^((kmax-kmin)*x))}, where {@code kmin} is the rate
 * of smaller absolute value.
 * <p>
 * With exponent offsets allowed, {@code b^(k*x+m)} addends are handled too and the
 * offset of the {@code kmin} addend moves into the common factor. Every rewrite is
 * checked with {@link SymbolicEquality} before it is returned. Failure is a normal
 * result, never an exception.
 */
public class ExponentialSumFactorizer {

    private final SymbolicEquality equality;
    private final boolean allowExponentOffsets;

    public ExponentialSumFactorizer(SymbolicEquality equality) {
        this(equality, false);
    }

    public ExponentialSumFactorizer(SymbolicEquality equality, boolean allowExponentOffsets) {
        this.equality = Objects.requireNonNull(equality, "equality");
        this.allowExponentOffsets = allowExponentOffsets;
    }

    public FactorizationResult factorize(Expression expr, Symbol variable) {
        Objects.requireNonNull(expr, "expr");
        Objects.requireNonNull(variable, "variable");
        try {
            return attempt(expr, variable);
        } catch (ArithmeticException e) {
            return reject(expr, "rational overflow (" + e.getMessage() + ")");
        }
    }

    private FactorizationResult attempt(Expression expr, Symbol variable) {
        if (!(expr instanceof Sum sum) || sum.terms().size() != 2) {
            return reject(expr, "not a two-term sum");
        }

        ExponentialTerm first = ExponentialTerm.extract(sum.terms().get(0), variable);
        ExponentialTerm second = ExponentialTerm.extract(sum.terms().get(1), variable);
        if (first == null || second == null) {
            return reject(expr, "each addend needs exactly one exponential factor");
        }
        if (!first.getBase().equals(second.getBase())) {
            return reject(expr, "addends have different bases");
        }

        Polynomials.Affine rate1 = Polynomials.affine(first.getExponent(), variable).orElse(null);
        Polynomials.Affine rate2 = Polynomials.affine(second.getExponent(), variable).orElse(null);
        if (rate1 == null || rate2 == null) {
            return reject(expr, "exponent is not affine in " + variable);
        }
        if (!allowExponentOffsets && (!rate1.getOffset().isZero() || !rate2.getOffset().isZero())) {
            return reject(expr, "exponent has a constant term");
        }
        if (rate1.getSlope().equals(rate2.getSlope())) {
            return reject(expr, "addends share the rate " + rate1.getSlope());
        }

        boolean firstIsMin = isSmallerRate(rate1.getSlope(), rate2.getSlope());
        ExponentialTerm min = firstIsMin ? first : second;
        ExponentialTerm max = firstIsMin ? second : first;
        Polynomials.Affine minRate = firstIsMin ? rate1 : rate2;
        Polynomials.Affine maxRate = firstIsMin ? rate2 : rate1;

        Rational diff = maxRate.getSlope().subtract(minRate.getSlope());
        Rational shift = maxRate.getOffset().subtract(minRate.getOffset());
        Expression base = min.getBase();

        Expression commonFactor = Expressions.power(base,
                Expressions.affine(minRate.getSlope(), minRate.getOffset(), variable));
        Expression residualFactor = Expressions.add(
                min.getPrefactor(),
                Expressions.multiply(max.getPrefactor(),
                        Expressions.power(base, Expressions.affine(diff, shift, variable))));

        if (!equality.areEqual(Expressions.multiply(commonFactor, residualFactor), expr)) {
            return reject(expr, "verification failed for " + commonFactor + " * (" + residualFactor + ")");
        }
        LoggingUtil.debug("Factorized " + expr + " as " + commonFactor + " * (" + residualFactor + ")");
        return FactorizationResult.success(commonFactor, residualFactor);
    }

    /**
     * Smaller absolute value wins; for {@code k} and {@code -k} the negative rate wins.
     */
    private static boolean isSmallerRate(Rational a, Rational b) {
        int byMagnitude = a.abs().compareTo(b.abs());
        if (byMagnitude != 0) return byMagnitude < 0;
        return a.compareTo(b) < 0;
    }

    private static FactorizationResult reject(Expression expr, String reason) {
        LoggingUtil.debug("No exponential factorization for " + expr + ": " + reason);
        return FactorizationResult.failure(expr);
    }

    public boolean isAllowExponentOffsets() {
        return allowExponentOffsets;
    }
}

package com.sysmuse.structure.cas;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Factory and structural queries for {@link Expression} trees.
 * <p>
 * Construction flattens nested sums and products, folds numeric constants and
 * merges integer powers of exponentials ({@code (e^u)^n} becomes {@code e^(n*u)}).
 * It does not collect like terms, expand or reorder non-numeric operands.
 */
public final class Expressions {

    public static final Num ZERO = new Num(Rational.ZERO);
    public static final Num ONE = new Num(Rational.ONE);
    public static final Num MINUS_ONE = new Num(Rational.MINUS_ONE);
    public static final Constant E = Constant.E;
    public static final Constant PI = Constant.PI;

    private Expressions() {
    }

    public static Num num(long value) {
        return num(Rational.valueOf(value));
    }

    public static Num num(long numerator, long denominator) {
        return num(Rational.of(numerator, denominator));
    }

    public static Num num(Rational value) {
        if (value.isZero()) return ZERO;
        if (value.isOne()) return ONE;
        return new Num(value);
    }

    public static Symbol symbol(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Symbol name must not be empty");
        }
        return new Symbol(name);
    }

    public static Expression add(Expression... terms) {
        return add(Arrays.asList(terms));
    }

    public static Expression add(List<Expression> terms) {
        List<Expression> flat = new ArrayList<>();
        Rational constant = Rational.ZERO;
        int constantSlot = -1;
        for (Expression term : terms) {
            Objects.requireNonNull(term, "term");
            List<Expression> pieces = term instanceof Sum s ? s.terms() : List.of(term);
            for (Expression piece : pieces) {
                if (piece instanceof Num n) {
                    if (constantSlot < 0) constantSlot = flat.size();
                    constant = constant.add(n.value());
                } else {
                    flat.add(piece);
                }
            }
        }
        if (constantSlot >= 0 && !constant.isZero()) {
            flat.add(constantSlot, num(constant));
        }
        if (flat.isEmpty()) return ZERO;
        if (flat.size() == 1) return flat.get(0);
        return new Sum(flat);
    }

    public static Expression multiply(Expression... factors) {
        return multiply(Arrays.asList(factors));
    }

    public static Expression multiply(List<Expression> factors) {
        List<Expression> flat = new ArrayList<>();
        Rational coefficient = Rational.ONE;
        for (Expression factor : factors) {
            Objects.requireNonNull(factor, "factor");
            List<Expression> pieces = factor instanceof Product p ? p.factors() : List.of(factor);
            for (Expression piece : pieces) {
                if (piece instanceof Num n) {
                    coefficient = coefficient.multiply(n.value());
                } else {
                    flat.add(piece);
                }
            }
        }
        if (coefficient.isZero()) return ZERO;
        if (!coefficient.isOne() || flat.isEmpty()) flat.add(0, num(coefficient));
        if (flat.size() == 1) return flat.get(0);
        return new Product(flat);
    }

    public static Expression power(Expression base, Expression exponent) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(exponent, "exponent");
        if (exponent instanceof Num e) {
            if (e.value().isZero()) return ONE;
            if (e.value().isOne()) return base;
            if (base instanceof Num b && e.value().isInteger() && Math.abs(e.value().getNumerator()) <= 64
                    && !(b.value().isZero() && e.isNegative())) {
                return num(b.value().pow((int) e.value().getNumerator()));
            }
            // (b^u)^n = b^(n*u) for integer n and a numeric base b, so 1/e^x reads e^(-x)
            if (base instanceof Power inner && e.value().isInteger() && isPositiveConstant(inner.base())) {
                return power(inner.base(), multiply(exponent, inner.exponent()));
            }
        }
        if (base.equals(ONE)) return ONE;
        return new Power(base, exponent);
    }

    private static boolean isPositiveConstant(Expression expr) {
        return expr instanceof Constant || expr instanceof Num n && n.value().signum() > 0;
    }

    public static Expression power(Expression base, long exponent) {
        return power(base, num(exponent));
    }

    public static Expression negate(Expression expr) {
        return multiply(MINUS_ONE, expr);
    }

    public static Expression subtract(Expression left, Expression right) {
        return add(left, negate(right));
    }

    public static Expression divide(Expression numerator, Expression denominator) {
        if (denominator instanceof Num d) {
            return multiply(numerator, num(d.value().reciprocal()));
        }
        return multiply(numerator, power(denominator, MINUS_ONE));
    }

    public static Expression exp(Expression exponent) {
        return power(E, exponent);
    }

    public static Expression call(String name, Expression... arguments) {
        return call(name, Arrays.asList(arguments));
    }

    public static Expression call(String name, List<Expression> arguments) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Function name must not be empty");
        }
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("Function " + name + " needs at least one argument");
        }
        return new FunctionCall(name, arguments);
    }

    /**
     * {@code slope*variable + offset} built with the usual folding.
     */
    public static Expression affine(Rational slope, Rational offset, Symbol variable) {
        return add(multiply(num(slope), variable), num(offset));
    }

    /**
     * Numerator of a quotient-shaped expression: the product of all factors that are
     * not reciprocals. Returns the expression itself when it has no denominator.
     */
    public static Expression numerator(Expression expr) {
        if (expr instanceof Power p && p.isReciprocal()) return ONE;
        if (expr instanceof Product p) {
            List<Expression> top = new ArrayList<>();
            for (Expression factor : p.factors()) {
                if (!(factor instanceof Power pw && pw.isReciprocal())) top.add(factor);
            }
            return multiply(top);
        }
        return expr;
    }

    /**
     * Denominator of a quotient-shaped expression, {@code 1} when there is none.
     */
    public static Expression denominator(Expression expr) {
        if (expr instanceof Power p && p.isReciprocal()) return invert(p);
        if (expr instanceof Product p) {
            List<Expression> bottom = new ArrayList<>();
            for (Expression factor : p.factors()) {
                if (factor instanceof Power pw && pw.isReciprocal()) bottom.add(invert(pw));
            }
            return multiply(bottom);
        }
        return ONE;
    }

    private static Expression invert(Power reciprocal) {
        Rational exponent = ((Num) reciprocal.exponent()).value().negate();
        return power(reciprocal.base(), num(exponent));
    }
}

package com.sysmuse.structure.cas;

import java.util.List;

/**
 * {@code base^exponent}. Division is represented as a power with exponent {@code -1}.
 */
public final class Power extends Expression {

    private final Expression base;
    private final Expression exponent;

    Power(Expression base, Expression exponent) {
        this.base = base;
        this.exponent = exponent;
    }

    public Expression base() {
        return base;
    }

    public Expression exponent() {
        return exponent;
    }

    /**
     * True for {@code b^-n} with a negative numeric exponent.
     */
    public boolean isReciprocal() {
        return exponent instanceof Num n && n.isNegative();
    }

    @Override
    public List<Expression> operands() {
        return List.of(base, exponent);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Power p && base.equals(p.base) && exponent.equals(p.exponent));
    }

    @Override
    public int hashCode() {
        return 31 * (31 * base.hashCode() + exponent.hashCode()) + 3;
    }
}

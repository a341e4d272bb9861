package com.sysmuse.structure.cas;

import java.util.List;

/**
 * Exact rational constant.
 */
public final class Num extends Expression {

    private final Rational value;

    Num(Rational value) {
        this.value = value;
    }

    public Rational value() {
        return value;
    }

    public boolean isNegative() {
        return value.signum() < 0;
    }

    @Override
    public List<Expression> operands() {
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Num n && value.equals(n.value));
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}

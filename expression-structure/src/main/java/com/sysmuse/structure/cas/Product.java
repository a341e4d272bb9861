package com.sysmuse.structure.cas;

import java.util.List;

/**
 * n-ary multiplication, at least two factors. A numeric coefficient, if any,
 * is always the first factor.
 */
public final class Product extends Expression {

    private final List<Expression> factors;

    Product(List<Expression> factors) {
        this.factors = List.copyOf(factors);
    }

    public List<Expression> factors() {
        return factors;
    }

    /**
     * Leading numeric coefficient, {@code 1} when there is none.
     */
    public Rational coefficient() {
        return factors.get(0) instanceof Num n ? n.value() : Rational.ONE;
    }

    @Override
    public List<Expression> operands() {
        return factors;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Product p && factors.equals(p.factors));
    }

    @Override
    public int hashCode() {
        return 31 * factors.hashCode() + 2;
    }
}

package com.sysmuse.structure.cas;

import java.util.List;

/**
 * n-ary addition, at least two terms, operand order as constructed.
 */
public final class Sum extends Expression {

    private final List<Expression> terms;

    Sum(List<Expression> terms) {
        this.terms = List.copyOf(terms);
    }

    public List<Expression> terms() {
        return terms;
    }

    @Override
    public List<Expression> operands() {
        return terms;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Sum s && terms.equals(s.terms));
    }

    @Override
    public int hashCode() {
        return 31 * terms.hashCode() + 1;
    }
}

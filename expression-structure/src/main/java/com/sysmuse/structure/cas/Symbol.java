package com.sysmuse.structure.cas;

import java.util.List;
import java.util.Objects;

/**
 * Named free symbol: the target variable or a parameter.
 */
public final class Symbol extends Expression {

    private final String name;

    Symbol(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    @Override
    public List<Expression> operands() {
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Symbol s && name.equals(s.name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}

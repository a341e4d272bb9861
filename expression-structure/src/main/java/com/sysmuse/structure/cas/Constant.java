package com.sysmuse.structure.cas;

import java.util.List;

/**
 * Named mathematical constant with a fixed numeric value.
 */
public final class Constant extends Expression {

    static final Constant E = new Constant("e", Math.E);
    static final Constant PI = new Constant("pi", Math.PI);

    private final String name;
    private final double value;

    private Constant(String name, double value) {
        this.name = name;
        this.value = value;
    }

    public String name() {
        return name;
    }

    public double value() {
        return value;
    }

    @Override
    public List<Expression> operands() {
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Constant c && name.equals(c.name));
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}

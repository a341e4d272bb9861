package com.sysmuse.structure.cas;

import java.util.List;

/**
 * Named function applied to one or more arguments, e.g. {@code sin(2*x)}.
 */
public final class FunctionCall extends Expression {

    private final String name;
    private final List<Expression> arguments;

    FunctionCall(String name, List<Expression> arguments) {
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    public String name() {
        return name;
    }

    public List<Expression> arguments() {
        return arguments;
    }

    @Override
    public List<Expression> operands() {
        return arguments;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FunctionCall f && name.equals(f.name) && arguments.equals(f.arguments));
    }

    @Override
    public int hashCode() {
        return 31 * (31 * name.hashCode() + arguments.hashCode()) + 4;
    }
}

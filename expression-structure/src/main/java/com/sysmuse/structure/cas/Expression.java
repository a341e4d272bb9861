package com.sysmuse.structure.cas;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable symbolic expression tree.
 * <p>
 * Node kinds are {@link Num}, {@link Symbol}, {@link Constant}, {@link Sum},
 * {@link Product}, {@link Power} and {@link FunctionCall}. Instances are built through
 * {@link Expressions}, which flattens nested sums and products and folds numeric
 * constants but never combines like terms. Equality is structural.
 */
public abstract class Expression {

    Expression() {
    }

    /**
     * Ordered operands of the outermost operator; empty for atoms.
     */
    public abstract List<Expression> operands();

    public boolean isAtom() {
        return operands().isEmpty();
    }

    public boolean contains(Symbol symbol) {
        if (this.equals(symbol)) return true;
        for (Expression operand : operands()) {
            if (operand.contains(symbol)) return true;
        }
        return false;
    }

    public Set<Symbol> freeSymbols() {
        Set<Symbol> symbols = new LinkedHashSet<>();
        collectSymbols(this, symbols);
        return symbols;
    }

    /**
     * Every named function occurring anywhere in this expression, sorted by name.
     */
    public Set<String> functionNames() {
        Set<String> names = new TreeSet<>();
        collectFunctionNames(this, names);
        return names;
    }

    @JsonValue
    public final String text() {
        return ExpressionPrinter.print(this);
    }

    @Override
    public final String toString() {
        return text();
    }

    private static void collectSymbols(Expression expr, Set<Symbol> out) {
        if (expr instanceof Symbol s) {
            out.add(s);
            return;
        }
        for (Expression operand : expr.operands()) collectSymbols(operand, out);
    }

    private static void collectFunctionNames(Expression expr, Set<String> out) {
        if (expr instanceof FunctionCall call) out.add(call.name());
        for (Expression operand : expr.operands()) collectFunctionNames(operand, out);
    }
}

package com.sysmuse.structure.cas;

import java.util.Map;

/**
 * Double-precision evaluation of an expression under a symbol binding.
 */
public class Evaluator {

    private final FunctionRegistry registry;

    public Evaluator(FunctionRegistry registry) {
        this.registry = registry;
    }

    /**
     * @throws IllegalArgumentException for unbound symbols or functions without a numeric implementation
     */
    public double evaluate(Expression expr, Map<Symbol, Double> bindings) {
        if (expr instanceof Num n) return n.value().doubleValue();
        if (expr instanceof Constant c) return c.value();
        if (expr instanceof Symbol s) {
            Double value = bindings.get(s);
            if (value == null) throw new IllegalArgumentException("Unbound symbol: " + s.name());
            return value;
        }
        if (expr instanceof Sum s) {
            double total = 0.0;
            for (Expression term : s.terms()) total += evaluate(term, bindings);
            return total;
        }
        if (expr instanceof Product p) {
            double total = 1.0;
            for (Expression factor : p.factors()) total *= evaluate(factor, bindings);
            return total;
        }
        if (expr instanceof Power p) {
            return Math.pow(evaluate(p.base(), bindings), evaluate(p.exponent(), bindings));
        }
        if (expr instanceof FunctionCall f) {
            FunctionRegistry.Definition definition = registry.get(f.name());
            if (definition == null) {
                throw new IllegalArgumentException("No numeric implementation for function: " + f.name());
            }
            double[] args = new double[f.arguments().size()];
            for (int i = 0; i < args.length; i++) args[i] = evaluate(f.arguments().get(i), bindings);
            return definition.apply(args);
        }
        throw new IllegalArgumentException("Cannot evaluate: " + expr);
    }

    public double evaluate(Expression expr, Symbol variable, double value) {
        return evaluate(expr, Map.of(variable, value));
    }
}

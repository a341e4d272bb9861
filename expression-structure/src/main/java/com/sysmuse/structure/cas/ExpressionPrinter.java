package com.sysmuse.structure.cas;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text rendering that {@link ExpressionParser} reads back.
 */
final class ExpressionPrinter {

    private ExpressionPrinter() {
    }

    static String print(Expression expr) {
        if (expr instanceof Num n) return n.value().toString();
        if (expr instanceof Symbol s) return s.name();
        if (expr instanceof Constant c) return c.name();
        if (expr instanceof Sum s) return printSum(s);
        if (expr instanceof Product p) return printProduct(p);
        if (expr instanceof Power p) return printPower(p);
        if (expr instanceof FunctionCall f) return printCall(f);
        throw new IllegalStateException("Unknown expression node: " + expr.getClass());
    }

    private static String printSum(Sum sum) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < sum.terms().size(); i++) {
            Expression term = sum.terms().get(i);
            if (i == 0) {
                sb.append(print(term));
            } else if (isNegative(term)) {
                sb.append(" - ").append(wrapIfSum(Expressions.negate(term)));
            } else {
                sb.append(" + ").append(print(term));
            }
        }
        return sb.toString();
    }

    private static String printProduct(Product product) {
        List<String> top = new ArrayList<>();
        List<Expression> bottom = new ArrayList<>();
        boolean negative = false;
        for (Expression factor : product.factors()) {
            if (factor instanceof Num n && n.value().equals(Rational.MINUS_ONE)) {
                negative = true;
            } else if (factor instanceof Power p && p.isReciprocal()) {
                bottom.add(Expressions.denominator(p));
            } else if (factor instanceof Sum) {
                top.add("(" + print(factor) + ")");
            } else {
                top.add(print(factor));
            }
        }
        String numerator = top.isEmpty() ? "1" : String.join("*", top);
        StringBuilder sb = new StringBuilder();
        if (negative) sb.append('-');
        sb.append(numerator);
        if (!bottom.isEmpty()) {
            Expression denominator = Expressions.multiply(bottom);
            sb.append('/');
            sb.append(isTight(denominator) ? print(denominator) : "(" + print(denominator) + ")");
        }
        return sb.toString();
    }

    private static String printPower(Power power) {
        if (power.isReciprocal()) {
            Expression denominator = Expressions.denominator(power);
            return "1/" + (isTight(denominator) ? print(denominator) : "(" + print(denominator) + ")");
        }
        String base = isTight(power.base()) ? print(power.base()) : "(" + print(power.base()) + ")";
        String exponent = isTight(power.exponent()) ? print(power.exponent()) : "(" + print(power.exponent()) + ")";
        return base + "^" + exponent;
    }

    private static String printCall(FunctionCall call) {
        List<String> args = new ArrayList<>();
        for (Expression arg : call.arguments()) args.add(print(arg));
        return call.name() + "(" + String.join(", ", args) + ")";
    }

    private static String wrapIfSum(Expression expr) {
        return expr instanceof Sum ? "(" + print(expr) + ")" : print(expr);
    }

    /**
     * Atoms that bind tighter than any operator and need no parentheses.
     */
    private static boolean isTight(Expression expr) {
        if (expr instanceof Num n) return n.value().isInteger() && !n.isNegative();
        return expr instanceof Symbol || expr instanceof Constant || expr instanceof FunctionCall;
    }

    private static boolean isNegative(Expression term) {
        if (term instanceof Num n) return n.isNegative();
        return term instanceof Product p && p.coefficient().signum() < 0;
    }
}

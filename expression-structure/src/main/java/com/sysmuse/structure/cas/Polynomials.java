package com.sysmuse.structure.cas;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Polynomial introspection with respect to one variable.
 * <p>
 * Coefficient lists are in ascending order of degree ({@code [a0, a1, ...]}) and are
 * only available when every coefficient is an exact rational; expressions with
 * symbolic parameters are still recognized as polynomials but only get a
 * structural degree bound.
 */
public final class Polynomials {

    static final int MAX_EXPANDED_DEGREE = 512;

    private Polynomials() {
    }

    public static boolean isPolynomial(Expression expr, Symbol variable) {
        if (!expr.contains(variable)) return true;
        if (expr instanceof Symbol) return true;
        if (expr instanceof Sum || expr instanceof Product) {
            for (Expression operand : expr.operands()) {
                if (!isPolynomial(operand, variable)) return false;
            }
            return true;
        }
        if (expr instanceof Power p) {
            return isNonNegativeInteger(p.exponent()) && isPolynomial(p.base(), variable);
        }
        return false;
    }

    /**
     * Degree in {@code variable}. Exact when coefficients are rational, otherwise an
     * upper bound read from the structure. Degrees beyond the int range saturate to
     * {@link Integer#MAX_VALUE}.
     *
     * @throws IllegalArgumentException if the expression is not a polynomial in {@code variable}
     */
    public static int degree(Expression expr, Symbol variable) {
        if (!isPolynomial(expr, variable)) {
            throw new IllegalArgumentException("Not a polynomial in " + variable + ": " + expr);
        }
        Optional<List<Rational>> coefficients = coefficients(expr, variable);
        if (coefficients.isPresent()) return coefficients.get().size() - 1;
        return (int) Math.min(structuralDegree(expr, variable), Integer.MAX_VALUE);
    }

    /**
     * Exact rational coefficients by expansion, ascending and trimmed; the zero
     * polynomial yields {@code [0]}.
     */
    public static Optional<List<Rational>> coefficients(Expression expr, Symbol variable) {
        try {
            List<Rational> expanded = expand(expr, variable);
            return expanded == null ? Optional.empty() : Optional.of(Collections.unmodifiableList(trim(expanded)));
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
    }

    /**
     * {@code slope*variable + offset} view of an expression of degree at most one with
     * rational coefficients.
     */
    public static Optional<Affine> affine(Expression expr, Symbol variable) {
        if (!isPolynomial(expr, variable)) return Optional.empty();
        return coefficients(expr, variable)
                .filter(c -> c.size() <= 2)
                .map(c -> new Affine(c.size() > 1 ? c.get(1) : Rational.ZERO, c.get(0)));
    }

    /**
     * Builds {@code an*x^n + ... + a1*x + a0} from ascending coefficients.
     */
    public static Expression fromCoefficients(List<Rational> ascending, Symbol variable) {
        List<Expression> terms = new ArrayList<>();
        for (int d = ascending.size() - 1; d >= 0; d--) {
            Rational c = ascending.get(d);
            if (c.isZero()) continue;
            terms.add(Expressions.multiply(Expressions.num(c), Expressions.power(variable, d)));
        }
        return Expressions.add(terms);
    }

    private static long structuralDegree(Expression expr, Symbol variable) {
        if (!expr.contains(variable)) return 0;
        if (expr instanceof Symbol) return 1;
        if (expr instanceof Sum s) {
            long max = 0;
            for (Expression term : s.terms()) max = Math.max(max, structuralDegree(term, variable));
            return max;
        }
        if (expr instanceof Product p) {
            long total = 0;
            for (Expression factor : p.factors()) total = saturatedAdd(total, structuralDegree(factor, variable));
            return total;
        }
        if (expr instanceof Power p) {
            long n = ((Num) p.exponent()).value().getNumerator();
            return saturatedMultiply(structuralDegree(p.base(), variable), n);
        }
        throw new IllegalArgumentException("Not a polynomial in " + variable + ": " + expr);
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }

    private static long saturatedMultiply(long a, long b) {
        if (a == 0 || b == 0) return 0;
        return a > Long.MAX_VALUE / b ? Long.MAX_VALUE : a * b;
    }

    private static List<Rational> expand(Expression expr, Symbol variable) {
        if (expr instanceof Num n) return List.of(n.value());
        if (expr.equals(variable)) return List.of(Rational.ZERO, Rational.ONE);
        if (expr instanceof Sum s) {
            List<Rational> total = List.of(Rational.ZERO);
            for (Expression term : s.terms()) {
                List<Rational> part = expand(term, variable);
                if (part == null) return null;
                total = addCoefficients(total, part);
            }
            return total;
        }
        if (expr instanceof Product p) {
            List<Rational> total = List.of(Rational.ONE);
            for (Expression factor : p.factors()) {
                List<Rational> part = expand(factor, variable);
                if (part == null) return null;
                total = multiplyCoefficients(total, part);
                if (total == null) return null;
            }
            return total;
        }
        if (expr instanceof Power p && isNonNegativeInteger(p.exponent())) {
            List<Rational> base = expand(p.base(), variable);
            if (base == null) return null;
            long n = ((Num) p.exponent()).value().getNumerator();
            if (n > MAX_EXPANDED_DEGREE) return null;
            List<Rational> result = List.of(Rational.ONE);
            for (long i = 0; i < n; i++) {
                result = multiplyCoefficients(result, base);
                if (result == null) return null;
            }
            return result;
        }
        // symbols other than the variable, named constants, function calls, roots
        return null;
    }

    private static List<Rational> addCoefficients(List<Rational> a, List<Rational> b) {
        List<Rational> out = new ArrayList<>();
        for (int i = 0; i < Math.max(a.size(), b.size()); i++) {
            Rational x = i < a.size() ? a.get(i) : Rational.ZERO;
            Rational y = i < b.size() ? b.get(i) : Rational.ZERO;
            out.add(x.add(y));
        }
        return out;
    }

    private static List<Rational> multiplyCoefficients(List<Rational> a, List<Rational> b) {
        List<Rational> ta = trim(a);
        List<Rational> tb = trim(b);
        int degree = (ta.size() - 1) + (tb.size() - 1);
        if (degree > MAX_EXPANDED_DEGREE) return null;
        List<Rational> out = new ArrayList<>(Collections.nCopies(degree + 1, Rational.ZERO));
        for (int i = 0; i < ta.size(); i++) {
            for (int j = 0; j < tb.size(); j++) {
                out.set(i + j, out.get(i + j).add(ta.get(i).multiply(tb.get(j))));
            }
        }
        return out;
    }

    private static List<Rational> trim(List<Rational> coefficients) {
        int last = coefficients.size() - 1;
        while (last > 0 && coefficients.get(last).isZero()) last--;
        return new ArrayList<>(coefficients.subList(0, last + 1));
    }

    private static boolean isNonNegativeInteger(Expression expr) {
        return expr instanceof Num n && n.value().isInteger() && n.value().signum() >= 0;
    }

    /**
     * {@code slope*x + offset} with exact coefficients.
     */
    public static final class Affine {
        private final Rational slope;
        private final Rational offset;

        public Affine(Rational slope, Rational offset) {
            this.slope = slope;
            this.offset = offset;
        }

        public Rational getSlope() {
            return slope;
        }

        public Rational getOffset() {
            return offset;
        }

        @Override
        public String toString() {
            return slope + "*x + " + offset;
        }
    }
}

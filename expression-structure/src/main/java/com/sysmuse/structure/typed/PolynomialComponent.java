package com.sysmuse.structure.typed;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.sysmuse.structure.analysis.SemanticTag;
import com.sysmuse.structure.cas.Evaluator;
import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.Expressions;
import com.sysmuse.structure.cas.Polynomials;
import com.sysmuse.structure.cas.Rational;
import com.sysmuse.structure.cas.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Polynomial leaf with exact coefficients and exact factoring over the rationals.
 * <p>
 * Coefficients are {@code null} when the polynomial has symbolic parameters; the
 * degree is then a structural bound and factoring returns the term unchanged.
 */
public final class PolynomialComponent extends TypedComponent {

    private static final long MAX_DIVISOR_SEARCH = 1_000_000_000_000L;

    public enum Kind {
        CONSTANT,
        LINEAR,
        QUADRATIC,
        HIGHER
    }

    private final List<Rational> coefficients;
    private final int degree;

    PolynomialComponent(Expression term, Symbol variable, Evaluator evaluator) {
        super(term, variable, evaluator);
        this.coefficients = Polynomials.coefficients(term, variable).orElse(null);
        this.degree = Polynomials.degree(term, variable);
    }

    @Override
    public SemanticTag getSemanticTag() {
        return SemanticTag.POLYNOMIAL;
    }

    /**
     * Ascending exact coefficients, or {@code null} for symbolic coefficients.
     */
    public List<Rational> getCoefficients() {
        return coefficients;
    }

    /**
     * Degree, saturated at {@link Integer#MAX_VALUE} for huge exponents.
     */
    public int getDegree() {
        return degree;
    }

    public Kind getKind() {
        switch (degree) {
            case 0: return Kind.CONSTANT;
            case 1: return Kind.LINEAR;
            case 2: return Kind.QUADRATIC;
            default: return Kind.HIGHER;
        }
    }

    @JsonIgnore
    public boolean hasExactCoefficients() {
        return coefficients != null;
    }

    /**
     * Exact value at a rational point.
     *
     * @throws IllegalStateException when the coefficients are symbolic
     */
    public Rational evaluateExact(Rational at) {
        if (coefficients == null) {
            throw new IllegalStateException("Polynomial has symbolic coefficients: " + term);
        }
        return horner(coefficients, at);
    }

    /**
     * Rational roots with multiplicity, ascending.
     */
    public List<Rational> getRationalRoots() {
        List<Rational> roots = new ArrayList<>();
        deflate(roots);
        Collections.sort(roots);
        return roots;
    }

    /**
     * Factors whose product is the term: a remaining factor without rational roots
     * (omitted when it is {@code 1}) followed by one linear factor per rational root.
     */
    public List<Expression> getFactors() {
        List<Rational> roots = new ArrayList<>();
        List<Rational> remaining = deflate(roots);
        if (roots.isEmpty()) return List.of(term);

        Collections.sort(roots);
        List<Expression> factors = new ArrayList<>();
        Expression rest = Polynomials.fromCoefficients(remaining, variable);
        if (!rest.equals(Expressions.ONE)) factors.add(rest);
        for (Rational root : roots) {
            factors.add(Expressions.add(variable, Expressions.num(root.negate())));
        }
        return factors;
    }

    @JsonIgnore
    public Expression getFactoredForm() {
        List<Expression> factors = getFactors();
        return factors.size() == 1 ? factors.get(0) : Expressions.multiply(factors);
    }

    @Override
    public String getDescription() {
        String kind = getKind().name().toLowerCase();
        return kind + " polynomial of degree " + degree;
    }

    /**
     * Divides out every rational root found, collecting the roots; returns the quotient.
     */
    private List<Rational> deflate(List<Rational> roots) {
        if (coefficients == null) return null;
        List<Rational> remaining = new ArrayList<>(coefficients);
        try {
            while (remaining.size() > 1 && remaining.get(0).isZero()) {
                roots.add(Rational.ZERO);
                remaining = new ArrayList<>(remaining.subList(1, remaining.size()));
            }
            boolean found = true;
            while (found && remaining.size() > 1) {
                found = false;
                for (Rational candidate : candidates(remaining)) {
                    if (horner(remaining, candidate).isZero()) {
                        roots.add(candidate);
                        remaining = divideByRoot(remaining, candidate);
                        found = true;
                        break;
                    }
                }
            }
        } catch (ArithmeticException e) {
            // coefficients too large for exact search; keep what was found
        }
        return remaining;
    }

    /**
     * Rational root theorem candidates {@code ±p/q}, {@code p | a0}, {@code q | an},
     * after scaling to integer coefficients.
     */
    private static List<Rational> candidates(List<Rational> ascending) {
        long lcm = 1;
        for (Rational c : ascending) {
            lcm = Math.multiplyExact(lcm / gcd(lcm, c.getDenominator()), c.getDenominator());
        }
        long a0 = Math.abs(ascending.get(0).multiply(Rational.valueOf(lcm)).getNumerator());
        long an = Math.abs(ascending.get(ascending.size() - 1).multiply(Rational.valueOf(lcm)).getNumerator());
        if (a0 == 0 || a0 > MAX_DIVISOR_SEARCH || an > MAX_DIVISOR_SEARCH) return List.of();

        TreeSet<Rational> result = new TreeSet<>();
        for (long p : divisors(a0)) {
            for (long q : divisors(an)) {
                Rational r = Rational.of(p, q);
                result.add(r);
                result.add(r.negate());
            }
        }
        return new ArrayList<>(result);
    }

    private static List<Long> divisors(long n) {
        List<Long> small = new ArrayList<>();
        List<Long> large = new ArrayList<>();
        for (long d = 1; d * d <= n; d++) {
            if (n % d == 0) {
                small.add(d);
                if (d != n / d) large.add(0, n / d);
            }
        }
        small.addAll(large);
        return small;
    }

    private static List<Rational> divideByRoot(List<Rational> ascending, Rational root) {
        int n = ascending.size() - 1;
        Rational[] quotient = new Rational[n];
        quotient[n - 1] = ascending.get(n);
        for (int i = n - 1; i >= 1; i--) {
            quotient[i - 1] = ascending.get(i).add(root.multiply(quotient[i]));
        }
        List<Rational> result = new ArrayList<>();
        Collections.addAll(result, quotient);
        return result;
    }

    private static Rational horner(List<Rational> ascending, Rational at) {
        Rational value = Rational.ZERO;
        for (int i = ascending.size() - 1; i >= 0; i--) {
            value = value.multiply(at).add(ascending.get(i));
        }
        return value;
    }

    private static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a == 0 ? 1 : a;
    }
}

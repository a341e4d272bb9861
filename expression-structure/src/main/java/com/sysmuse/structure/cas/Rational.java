package com.sysmuse.structure.cas;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Exact fraction over {@code long}. Always normalized: the denominator is positive
 * and shares no factor with the numerator. Arithmetic that leaves the {@code long}
 * range throws {@link ArithmeticException}.
 */
public final class Rational implements Comparable<Rational> {

    public static final Rational ZERO = new Rational(0, 1);
    public static final Rational ONE = new Rational(1, 1);
    public static final Rational MINUS_ONE = new Rational(-1, 1);

    private final long numerator;
    private final long denominator;

    private Rational(long numerator, long denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static Rational of(long numerator, long denominator) {
        if (denominator == 0) {
            throw new ArithmeticException("Zero denominator: " + numerator + "/0");
        }
        if (numerator == 0) return ZERO;
        if (denominator < 0) {
            numerator = Math.negateExact(numerator);
            denominator = Math.negateExact(denominator);
        }
        long g = gcd(Math.abs(numerator), denominator);
        return new Rational(numerator / g, denominator / g);
    }

    public static Rational valueOf(long value) {
        if (value == 0) return ZERO;
        if (value == 1) return ONE;
        return new Rational(value, 1);
    }

    /**
     * Parses integer or decimal literals such as {@code 3}, {@code -0.25} or {@code 1.5}.
     */
    public static Rational parse(String literal) {
        BigDecimal decimal;
        try {
            decimal = new BigDecimal(literal);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a numeric literal: " + literal, e);
        }
        BigInteger unscaled = decimal.unscaledValue();
        int scale = decimal.scale();
        BigInteger num = scale >= 0 ? unscaled : unscaled.multiply(BigInteger.TEN.pow(-scale));
        BigInteger den = scale >= 0 ? BigInteger.TEN.pow(scale) : BigInteger.ONE;
        BigInteger g = num.gcd(den);
        if (g.signum() != 0) {
            num = num.divide(g);
            den = den.divide(g);
        }
        try {
            return of(num.longValueExact(), den.longValueExact());
        } catch (ArithmeticException e) {
            throw new ArithmeticException("Literal out of range: " + literal);
        }
    }

    public long getNumerator() {
        return numerator;
    }

    public long getDenominator() {
        return denominator;
    }

    public boolean isZero() {
        return numerator == 0;
    }

    public boolean isOne() {
        return numerator == 1 && denominator == 1;
    }

    public boolean isInteger() {
        return denominator == 1;
    }

    public int signum() {
        return Long.signum(numerator);
    }

    public Rational add(Rational other) {
        long g = gcd(denominator, other.denominator);
        long lcm = Math.multiplyExact(denominator / g, other.denominator);
        long a = Math.multiplyExact(numerator, lcm / denominator);
        long b = Math.multiplyExact(other.numerator, lcm / other.denominator);
        return of(Math.addExact(a, b), lcm);
    }

    public Rational subtract(Rational other) {
        return add(other.negate());
    }

    public Rational multiply(Rational other) {
        if (isZero() || other.isZero()) return ZERO;
        long g1 = gcd(Math.abs(numerator), other.denominator);
        long g2 = gcd(Math.abs(other.numerator), denominator);
        long num = Math.multiplyExact(numerator / g1, other.numerator / g2);
        long den = Math.multiplyExact(denominator / g2, other.denominator / g1);
        return of(num, den);
    }

    public Rational divide(Rational other) {
        if (other.isZero()) {
            throw new ArithmeticException("Division by zero: " + this + " / 0");
        }
        return multiply(other.reciprocal());
    }

    public Rational reciprocal() {
        return of(denominator, numerator);
    }

    public Rational negate() {
        return numerator == 0 ? this : new Rational(Math.negateExact(numerator), denominator);
    }

    public Rational abs() {
        return numerator < 0 ? negate() : this;
    }

    public Rational pow(int exponent) {
        if (exponent < 0) return reciprocal().pow(-exponent);
        Rational result = ONE;
        Rational base = this;
        int e = exponent;
        while (e > 0) {
            if ((e & 1) == 1) result = result.multiply(base);
            e >>= 1;
            if (e > 0) base = base.multiply(base);
        }
        return result;
    }

    public double doubleValue() {
        return (double) numerator / (double) denominator;
    }

    @Override
    public int compareTo(Rational other) {
        return subtract(other).signum();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rational r)) return false;
        return numerator == r.numerator && denominator == r.denominator;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(numerator) * 31 + Long.hashCode(denominator);
    }

    @JsonValue
    @Override
    public String toString() {
        return denominator == 1 ? Long.toString(numerator) : numerator + "/" + denominator;
    }

    static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a == 0 ? 1 : a;
    }
}

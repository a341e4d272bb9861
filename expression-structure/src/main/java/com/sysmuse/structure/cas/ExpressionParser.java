package com.sysmuse.structure.cas;

import com.sysmuse.structure.util.LoggingUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for school-style formula text.
 * <p>
 * Grammar, loosest first: sums ({@code + -}), products ({@code * /} and implicit
 * multiplication after a number or closing parenthesis), unary minus, powers
 * ({@code ^} or {@code **}, right-associative), and primaries (numbers, symbols,
 * {@code e}, {@code pi}, function calls, parentheses).
 */
public class ExpressionParser {

    private final String expr;
    private final FunctionRegistry registry;
    private int pos = 0;

    public ExpressionParser(String expr, FunctionRegistry registry) {
        if (expr == null) throw new NullPointerException("expr");
        this.expr = expr.replaceAll("\\s+", "");
        this.registry = registry;
    }

    public Expression parse() {
        if (expr.isEmpty()) throw new IllegalArgumentException("Empty expression");
        Expression result = parseSum();
        if (pos < expr.length()) {
            throw error("Unexpected '" + current() + "'");
        }
        LoggingUtil.debug("Parsed '" + expr + "' as " + result);
        return result;
    }

    private Expression parseSum() {
        List<Expression> terms = new ArrayList<>();
        terms.add(parseProduct());
        while (peek("+") || peek("-")) {
            if (match("+")) {
                terms.add(parseProduct());
            } else {
                match("-");
                terms.add(Expressions.negate(parseProduct()));
            }
        }
        return Expressions.add(terms);
    }

    private Expression parseProduct() {
        Expression left = parseUnary();
        while (true) {
            if (match("*")) {
                left = Expressions.multiply(left, parseUnary());
            } else if (match("/")) {
                left = Expressions.divide(left, parseUnary());
            } else if (startsImplicitFactor()) {
                left = Expressions.multiply(left, parsePower());
            } else {
                break;
            }
        }
        return left;
    }

    private Expression parseUnary() {
        if (match("-")) return Expressions.negate(parseUnary());
        if (match("+")) return parseUnary();
        return parsePower();
    }

    private Expression parsePower() {
        Expression base = parsePrimary();
        if (match("^") || match("**")) {
            return Expressions.power(base, parseUnary());
        }
        return base;
    }

    private Expression parsePrimary() {
        if (match("(")) {
            Expression inner = parseSum();
            expect(")");
            return inner;
        }
        if (Character.isDigit(current()) || peek(".")) return parseNumberLiteral();
        if (Character.isLetter(current())) return parseIdentifierOrCall();
        throw error(pos < expr.length() ? "Unexpected '" + current() + "'" : "Unexpected end of input");
    }

    private Expression parseNumberLiteral() {
        int start = pos;
        while (pos < expr.length() && (Character.isDigit(expr.charAt(pos)) || expr.charAt(pos) == '.')) {
            pos++;
        }
        String literal = expr.substring(start, pos);
        try {
            return Expressions.num(Rational.parse(literal));
        } catch (IllegalArgumentException e) {
            throw error("Malformed number '" + literal + "'");
        }
    }

    private Expression parseIdentifierOrCall() {
        String name = parseIdentifier();
        if (!match("(")) {
            switch (name) {
                case "e":
                    return Expressions.E;
                case "pi":
                    return Expressions.PI;
                default:
                    return Expressions.symbol(name);
            }
        }

        List<Expression> args = new ArrayList<>();
        if (!peek(")")) {
            args.add(parseSum());
            while (match(",")) args.add(parseSum());
        }
        expect(")");

        String resolved = registry.resolve(name);
        if ("exp".equals(resolved)) {
            requireArity(resolved, args, 1);
            return Expressions.exp(args.get(0));
        }
        if ("sqrt".equals(resolved)) {
            requireArity(resolved, args, 1);
            return Expressions.power(args.get(0), Expressions.num(1, 2));
        }
        FunctionRegistry.Definition definition = registry.get(resolved);
        if (definition != null && !definition.acceptsArity(args.size())) {
            throw error("Wrong number of arguments for " + resolved + ": " + args.size());
        }
        if (args.isEmpty()) throw error("Function " + resolved + " needs an argument");
        return Expressions.call(resolved, args);
    }

    private String parseIdentifier() {
        int start = pos;
        while (pos < expr.length() &&
                (Character.isLetterOrDigit(expr.charAt(pos)) || expr.charAt(pos) == '_')) {
            pos++;
        }
        return expr.substring(start, pos);
    }

    /**
     * {@code 3x}, {@code 2(x+1)}, {@code (x+1)(x-1)}: a factor follows a number
     * or closing parenthesis without an operator.
     */
    private boolean startsImplicitFactor() {
        if (pos == 0 || pos >= expr.length()) return false;
        char previous = expr.charAt(pos - 1);
        char next = current();
        boolean afterFactor = Character.isDigit(previous) || previous == ')' || previous == '.';
        return afterFactor && (Character.isLetter(next) || next == '(');
    }

    private void requireArity(String name, List<Expression> args, int count) {
        if (args.size() != count) {
            throw error("Function " + name + " expects " + count + " argument(s) but got " + args.size());
        }
    }

    private boolean match(String s) {
        if (peek(s)) {
            pos += s.length();
            return true;
        }
        return false;
    }

    private void expect(String s) {
        if (!match(s)) throw error("Expected '" + s + "'");
    }

    private boolean peek(String s) {
        return expr.startsWith(s, pos);
    }

    private char current() {
        return pos < expr.length() ? expr.charAt(pos) : '\0';
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " at pos " + pos + " in: " + expr);
    }
}

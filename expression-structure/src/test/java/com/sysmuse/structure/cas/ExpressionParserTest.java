package com.sysmuse.structure.cas;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.sysmuse.structure.cas.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionParserTest {

    private FunctionRegistry registry;
    private Symbol x;

    @BeforeEach
    public void setup() {
        registry = FunctionRegistry.standard();
        x = symbol("x");
    }

    private Expression parse(String text) {
        return new ExpressionParser(text, registry).parse();
    }

    @Test
    public void testPolynomialWithImplicitMultiplication() {
        Expression expr = parse("x^2 + 3x - 2");
        assertEquals(add(power(x, 2), multiply(num(3), x), num(-2)), expr);
        assertEquals("x^2 + 3*x - 2", expr.text());
    }

    @Test
    public void testPrecedenceAndAssociativity() {
        // unary minus binds looser than power
        assertEquals(negate(power(x, 2)), parse("-x^2"));
        // power is right-associative
        assertEquals(power(x, power(num(2), x)), parse("x^2^x"));
        assertEquals(power(x, 3), parse("x**3"));
        assertEquals(multiply(num(2), add(x, ONE)), parse("2(x+1)"));
    }

    @Test
    public void testDivisionBecomesReciprocal() {
        Expression expr = parse("x / (x + 1)");
        assertEquals(multiply(x, power(add(x, ONE), MINUS_ONE)), expr);
        assertEquals(multiply(num(1, 2), x), parse("x/2"));
    }

    @Test
    public void testIntegerPowersOfExponentialsMerge() {
        assertEquals(power(E, negate(x)), parse("1/e^x"));
        assertEquals(multiply(num(3), power(E, multiply(num(-2), x))), parse("3/e^(2x)"));
        assertEquals(power(E, multiply(num(2), x)), parse("(e^x)^2"));
        assertEquals(power(num(2), negate(x)), parse("1/2^x"));
        // variable bases stay nested
        assertEquals(power(power(x, num(2)), num(3)), parse("(x^2)^3"));
    }

    @Test
    public void testConstantsAndExpRewrites() {
        assertEquals(power(E, x), parse("exp(x)"));
        assertEquals(power(E, x), parse("e^x"));
        assertEquals(power(x, num(1, 2)), parse("sqrt(x)"));
        assertEquals(multiply(num(2), PI), parse("2pi"));
    }

    @Test
    public void testFunctionCallsAndAliases() {
        Expression expr = parse("ln(x) + sin(2x)");
        Sum sum = assertInstanceOf(Sum.class, expr);
        FunctionCall log = assertInstanceOf(FunctionCall.class, sum.terms().get(0));
        assertEquals("log", log.name());
        assertEquals(List.of(x), log.arguments());
        assertEquals(List.of("log", "sin"), List.copyOf(expr.functionNames()));
    }

    @Test
    public void testUnknownFunctionIsAllowed() {
        Expression expr = parse("f(x, y)");
        FunctionCall call = assertInstanceOf(FunctionCall.class, expr);
        assertEquals("f", call.name());
        assertEquals(2, call.arguments().size());
    }

    @Test
    public void testDecimalsAreExact() {
        assertEquals(multiply(num(3, 2), x), parse("1.5x"));
        assertEquals(num(1, 4), parse("0.25"));
    }

    @Test
    public void testPrintedFormParsesBack() {
        String[] inputs = {"x^2 - 4x + 5", "(x^2 - 4*x + 5)*e^(-x)", "2*e^x + 3*e^(2*x)",
                "sin(x)/(x + 1)", "-x/2 + x^(1/2)", "log(x, 2) - cos(3*x)"};
        for (String input : inputs) {
            Expression expr = parse(input);
            assertEquals(expr, parse(expr.text()), "reparse of " + expr.text());
        }
    }

    @Test
    public void testSyntaxErrorsReportPosition() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> parse("x + * 2"));
        assertTrue(e.getMessage().contains("pos"));
        assertThrows(IllegalArgumentException.class, () -> parse("(x + 1"));
        assertThrows(IllegalArgumentException.class, () -> parse(""));
        assertThrows(IllegalArgumentException.class, () -> parse("sin(x, 2)"));
        assertThrows(IllegalArgumentException.class, () -> parse("x $ 2"));
    }
}

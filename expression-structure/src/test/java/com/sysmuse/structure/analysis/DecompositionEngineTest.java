package com.sysmuse.structure.analysis;

import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.ExpressionParser;
import com.sysmuse.structure.cas.Expressions;
import com.sysmuse.structure.cas.FunctionRegistry;
import com.sysmuse.structure.cas.Polynomials;
import com.sysmuse.structure.cas.Symbol;
import com.sysmuse.structure.cas.SymbolicEquality;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.sysmuse.structure.cas.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

public class DecompositionEngineTest {

    private FunctionRegistry registry;
    private SymbolicEquality equality;
    private DecompositionEngine engine;
    private Symbol x;

    @BeforeEach
    public void setup() {
        registry = FunctionRegistry.standard();
        equality = new SymbolicEquality(registry);
        engine = newEngine(new StopCondition(), ChildOrdering.AS_GIVEN);
        x = symbol("x");
    }

    private DecompositionEngine newEngine(StopCondition stopCondition, ChildOrdering ordering) {
        return new DecompositionEngine(new StructureClassifier(registry), stopCondition,
                new ExponentialSumFactorizer(equality), ordering);
    }

    private Expression parse(String text) {
        return new ExpressionParser(text, registry).parse();
    }

    private Component decompose(String text) {
        return engine.decompose(parse(text), x);
    }

    @Test
    public void testLowDegreePolynomialIsSingleLeaf() {
        Component root = decompose("x^2 + 3x - 2");
        assertTrue(root.isLeaf());
        assertEquals(ShapeTag.SUM, root.getShapeTag());
        assertEquals(SemanticTag.POLYNOMIAL, root.getSemanticTag());
    }

    @Test
    public void testTrigonometricSumWithoutFactorization() {
        Component root = decompose("sin(x) + cos(x)");
        assertEquals(ShapeTag.SUM, root.getShapeTag());
        assertEquals(SemanticTag.TRIGONOMETRIC, root.getSemanticTag());
        assertFalse(root.isFactorized());
        assertEquals(2, root.getChildren().size());
        assertEquals(parse("sin(x)"), root.getChildren().get(0).getTerm());
        assertEquals(parse("cos(x)"), root.getChildren().get(1).getTerm());
    }

    @Test
    public void testExponentialSumIsFactorized() {
        Component root = decompose("e^x + e^(2x)");
        assertTrue(root.isFactorized());
        assertEquals(ShapeTag.PRODUCT, root.getShapeTag());
        assertEquals(SemanticTag.EXPONENTIAL, root.getSemanticTag());
        assertEquals(exp(x), root.getChildren().get(0).getTerm());
        assertTrue(root.getChildren().get(0).isLeaf());
        assertEquals("1 + e^x", root.getChildren().get(1).getTerm().text());
    }

    @Test
    public void testExponentialSumWithPrefactors() {
        Component root = decompose("2*e^x + 3*e^(2x)");
        assertTrue(root.isFactorized());
        assertEquals(exp(x), root.getChildren().get(0).getTerm());
        assertEquals("2 + 3*e^x", root.getChildren().get(1).getTerm().text());
    }

    @Test
    public void testMixedTwoTermSumIsFactorized() {
        Component root = decompose("sin(x)*e^x + e^(2x)");
        assertTrue(root.isFactorized());
        assertEquals(ShapeTag.PRODUCT, root.getShapeTag());
        assertEquals(SemanticTag.MIXED_OR_UNKNOWN, root.getSemanticTag());
        assertEquals(exp(x), root.getChildren().get(0).getTerm());

        Component residual = root.getChildren().get(1);
        assertEquals("sin(x) + e^x", residual.getTerm().text());
        assertFalse(residual.isFactorized());
        assertEquals(List.of(parse("sin(x)"), exp(x)), terms(residual.getChildren()));
    }

    @Test
    public void testFailedFactorizationFallsBackToSum() {
        Component root = decompose("e^x + e^x");
        assertFalse(root.isFactorized());
        assertEquals(ShapeTag.SUM, root.getShapeTag());
        assertEquals(2, root.getChildren().size());
        Component first = root.getChildren().get(0);
        Component second = root.getChildren().get(1);
        assertEquals(first, second);
        assertTrue(first.isLeaf());
        assertEquals(SemanticTag.EXPONENTIAL, first.getSemanticTag());
    }

    @Test
    public void testPolynomialTimesExponential() {
        Component root = decompose("(x^2 - 4x + 5)*e^(-x)");
        assertEquals(ShapeTag.PRODUCT, root.getShapeTag());
        assertFalse(root.isFactorized());
        assertEquals(2, root.getChildren().size());

        Component polynomial = root.getChildren().get(0);
        assertTrue(polynomial.isLeaf());
        assertEquals(SemanticTag.POLYNOMIAL, polynomial.getSemanticTag());
        assertEquals(2, Polynomials.degree(polynomial.getTerm(), x));

        Component exponential = root.getChildren().get(1);
        assertTrue(exponential.isLeaf());
        assertEquals(SemanticTag.EXPONENTIAL, exponential.getSemanticTag());
    }

    @Test
    public void testQuotientChildrenAreNumeratorThenDenominator() {
        Component root = decompose("sin(x)/(x^3 + 1)");
        assertEquals(ShapeTag.QUOTIENT, root.getShapeTag());
        assertEquals(parse("sin(x)"), root.getChildren().get(0).getTerm());
        assertEquals(parse("x^3 + 1"), root.getChildren().get(1).getTerm());
    }

    @Test
    public void testDegreeBoundStopRule() {
        for (String text : List.of("x^2 + 3x - 2", "(x + 1)*(x - 1)", "5", "x", "x^2")) {
            Component root = decompose(text);
            assertTrue(root.isLeaf(), text + " should be a single leaf");
        }
        for (String text : List.of("x^3 + x", "x*(x + 1)*(x - 1)", "(x + 1)^2*(x - 2)", "x^4 - 1")) {
            Component root = decompose(text);
            assertFalse(root.getChildren().isEmpty(), text + " should have children");
        }
    }

    @Test
    public void testCompositionExpansion() {
        DecompositionEngine expanding = newEngine(new StopCondition(2, true), ChildOrdering.AS_GIVEN);
        Component root = expanding.decompose(parse("sin(x^3 + x)"), x);
        assertEquals(ShapeTag.POWER_OR_COMPOSITION, root.getShapeTag());
        assertEquals(1, root.getChildren().size());
        assertEquals(parse("x^3 + x"), root.getChildren().get(0).getTerm());
        assertTrue(decompose("sin(x^3 + x)").isLeaf());
    }

    @Test
    public void testChildOrdering() {
        Component asGiven = decompose("sin(x) + x^3 + x");
        assertEquals(List.of(parse("sin(x)"), parse("x^3"), x), terms(asGiven.getChildren()));

        DecompositionEngine sorted = newEngine(new StopCondition(), ChildOrdering.DEGREE_LEXICOGRAPHIC);
        Component ordered = sorted.decompose(parse("sin(x) + x^3 + x"), x);
        assertEquals(List.of(x, parse("x^3"), parse("sin(x)")), terms(ordered.getChildren()));
    }

    @Test
    public void testTargetVariableIsExplicit() {
        Expression expr = parse("e^t + e^(2t)");
        assertTrue(engine.decompose(expr, symbol("t")).isFactorized());
        // constant with respect to x
        assertTrue(engine.decompose(expr, x).isLeaf());
    }

    @Test
    public void testRoundTripOnRandomExpressions() {
        Random random = new Random(42L);
        DecompositionEngine expanding = newEngine(new StopCondition(1, true), ChildOrdering.DEGREE_LEXICOGRAPHIC);
        for (int i = 0; i < 80; i++) {
            Expression expr = randomExpression(random, 2);
            assertRecombines(engine.decompose(expr, x));
            assertRecombines(expanding.decompose(expr, x));
        }
    }

    @Test
    public void testLeavesAreIdempotent() {
        Random random = new Random(7L);
        for (int i = 0; i < 40; i++) {
            Component root = engine.decompose(randomExpression(random, 2), x);
            for (Component leaf : root.getLeaves()) {
                assertEquals(leaf, engine.decompose(leaf.getTerm(), x), "re-decomposing " + leaf.getTerm());
            }
        }
    }

    @Test
    public void testFreshTreePerCall() {
        Expression expr = parse("(x^2 - 4x + 5)*e^(-x) + sin(x)");
        Component first = engine.decompose(expr, x);
        Component second = engine.decompose(expr, x);
        assertEquals(first, second);
        assertNotSame(first, second);
    }

    @Test
    public void testNullArgumentsFailFast() {
        assertThrows(NullPointerException.class, () -> engine.decompose(null, x));
        assertThrows(NullPointerException.class, () -> engine.decompose(ONE, null));
    }

    private void assertRecombines(Component component) {
        if (component.isLeaf()) return;
        Expression rebuilt = Components.recombine(component);
        assertTrue(equality.areEqual(rebuilt, component.getTerm()),
                "children of " + component.getTerm() + " recombine to " + rebuilt);
        for (Component child : component.getChildren()) assertRecombines(child);
    }

    private static List<Expression> terms(List<Component> components) {
        List<Expression> out = new ArrayList<>();
        for (Component c : components) out.add(c.getTerm());
        return out;
    }

    private Expression randomExpression(Random random, int depth) {
        if (depth == 0 || random.nextInt(4) == 0) return randomAtom(random);
        Expression left = randomExpression(random, depth - 1);
        Expression right = randomExpression(random, depth - 1);
        switch (random.nextInt(3)) {
            case 0:
                return add(left, right);
            case 1:
                return multiply(left, right);
            default:
                return divide(left, right);
        }
    }

    private Expression randomAtom(Random random) {
        String[] atoms = {
                "x", "x^2 + 1", "3x - 2", "x^3 - x", "sin(x)", "cos(2x)", "e^x", "2*e^(-x)",
                "e^x + e^(3x)", "log(x^2 + 1)", "4"
        };
        return parse(atoms[random.nextInt(atoms.length)]);
    }
}

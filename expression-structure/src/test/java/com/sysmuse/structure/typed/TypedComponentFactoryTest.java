package com.sysmuse.structure.typed;

import com.sysmuse.structure.analysis.ChildOrdering;
import com.sysmuse.structure.analysis.Classification;
import com.sysmuse.structure.analysis.Component;
import com.sysmuse.structure.analysis.DecompositionEngine;
import com.sysmuse.structure.analysis.ExponentialSumFactorizer;
import com.sysmuse.structure.analysis.SemanticTag;
import com.sysmuse.structure.analysis.ShapeTag;
import com.sysmuse.structure.analysis.StopCondition;
import com.sysmuse.structure.analysis.StructureClassifier;
import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.ExpressionParser;
import com.sysmuse.structure.cas.Expressions;
import com.sysmuse.structure.cas.FunctionRegistry;
import com.sysmuse.structure.cas.Rational;
import com.sysmuse.structure.cas.Symbol;
import com.sysmuse.structure.cas.SymbolicEquality;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypedComponentFactoryTest {

    private FunctionRegistry registry;
    private StructureClassifier classifier;
    private TypedComponentFactory factory;
    private Symbol x;

    @BeforeEach
    public void setup() {
        registry = FunctionRegistry.standard();
        classifier = new StructureClassifier(registry);
        factory = new TypedComponentFactory(registry);
        x = Expressions.symbol("x");
    }

    private Expression parse(String text) {
        return new ExpressionParser(text, registry).parse();
    }

    private TypedComponent typed(String text) {
        Expression expr = parse(text);
        return factory.create(Component.leaf(expr, classifier.classify(expr, x)), x);
    }

    @Test
    public void testDispatchBySemanticTag() {
        assertInstanceOf(PolynomialComponent.class, typed("x^2 + 1"));
        assertInstanceOf(TrigonometricComponent.class, typed("sin(2x)"));
        assertInstanceOf(ExponentialComponent.class, typed("3*e^(-x)"));
        assertInstanceOf(LogarithmicComponent.class, typed("log(x)"));
        assertInstanceOf(GenericComponent.class, typed("sin(x) + e^x"));
        assertInstanceOf(GenericComponent.class, typed("f(x)"));
    }

    @Test
    public void testEverySemanticTagHasATypedComponent() {
        for (SemanticTag tag : SemanticTag.values()) {
            Component leaf = Component.leaf(x, new Classification(ShapeTag.ATOMIC, tag));
            TypedComponent typed = factory.create(leaf, x);
            assertEquals(tag, typed.getSemanticTag(), "dispatch for " + tag);
            assertEquals(x, typed.getTerm());
        }
    }

    @Test
    public void testPolynomialKindsAndCoefficients() {
        PolynomialComponent quadratic = (PolynomialComponent) typed("x^2 - 4x + 5");
        assertEquals(2, quadratic.getDegree());
        assertEquals(PolynomialComponent.Kind.QUADRATIC, quadratic.getKind());
        assertEquals(List.of(Rational.valueOf(5), Rational.valueOf(-4), Rational.ONE), quadratic.getCoefficients());
        assertEquals(Rational.valueOf(2), quadratic.evaluateExact(Rational.valueOf(1)));
        assertEquals(Rational.of(5, 4), quadratic.evaluateExact(Rational.of(3, 2)));
        assertEquals("quadratic polynomial of degree 2", quadratic.getDescription());

        assertEquals(PolynomialComponent.Kind.CONSTANT, ((PolynomialComponent) typed("7")).getKind());
        assertEquals(PolynomialComponent.Kind.LINEAR, ((PolynomialComponent) typed("3x - 2")).getKind());
        assertEquals(PolynomialComponent.Kind.HIGHER, ((PolynomialComponent) typed("x^5")).getKind());
    }

    @Test
    public void testPolynomialRationalRoots() {
        PolynomialComponent cubic = (PolynomialComponent) typed("2x^3 - 3x^2 - 3x + 2");
        assertEquals(List.of(Rational.valueOf(-1), Rational.of(1, 2), Rational.valueOf(2)), cubic.getRationalRoots());

        List<Expression> factors = cubic.getFactors();
        assertEquals(4, factors.size());
        assertEquals(Expressions.num(2), factors.get(0));
        assertEquals(parse("x + 1"), factors.get(1));
        assertEquals(parse("x - 1/2"), factors.get(2));
        assertEquals(parse("x - 2"), factors.get(3));
        assertTrue(new SymbolicEquality(registry).areEqual(cubic.getFactoredForm(), cubic.getTerm()));
    }

    @Test
    public void testPolynomialWithRepeatedAndIrrationalRoots() {
        PolynomialComponent poly = (PolynomialComponent) typed("x^4 - 2x^3 - x^2 + 2x");
        // x*(x - 1)*(x + 1)*(x - 2)
        assertEquals(4, poly.getRationalRoots().size());

        PolynomialComponent square = (PolynomialComponent) typed("(x - 3)^2");
        assertEquals(List.of(Rational.valueOf(3), Rational.valueOf(3)), square.getRationalRoots());

        PolynomialComponent irreducible = (PolynomialComponent) typed("x^2 - 2");
        assertTrue(irreducible.getRationalRoots().isEmpty());
        assertEquals(List.of(irreducible.getTerm()), irreducible.getFactors());

        PolynomialComponent partial = (PolynomialComponent) typed("(x^2 + 1)*(x - 1)");
        assertEquals(List.of(Rational.ONE), partial.getRationalRoots());
        assertEquals(List.of(parse("x^2 + 1"), parse("x - 1")), partial.getFactors());
    }

    @Test
    public void testPolynomialWithSymbolicCoefficients() {
        PolynomialComponent poly = (PolynomialComponent) typed("a*x^2 + b");
        assertFalse(poly.hasExactCoefficients());
        assertNull(poly.getCoefficients());
        assertEquals(2, poly.getDegree());
        assertTrue(poly.getRationalRoots().isEmpty());
        assertThrows(IllegalStateException.class, () -> poly.evaluateExact(Rational.ONE));
    }

    @Test
    public void testExponentialParts() {
        ExponentialComponent decay = (ExponentialComponent) typed("3*e^(-2x + 1)");
        assertEquals(Expressions.E, decay.getBase());
        assertEquals(Expressions.num(3), decay.getPrefactor());
        assertEquals(Rational.valueOf(-2), decay.getRate());
        assertEquals(Rational.ONE, decay.getOffset());
        assertTrue(decay.isDecaying());
        assertFalse(decay.isGrowing());
        assertEquals(3 * Math.exp(1.0), decay.evaluate(0.0), 1e-12);

        ExponentialComponent growth = (ExponentialComponent) typed("2^x");
        assertTrue(growth.isGrowing());
        assertEquals(8.0, growth.evaluate(3.0), 1e-12);
    }

    @Test
    public void testExponentialWithoutSimpleForm() {
        ExponentialComponent exponential = (ExponentialComponent) typed("x*e^x + 1");
        assertNull(exponential.getRate());
        assertNull(exponential.getBase());
        assertEquals(1.0, exponential.evaluate(0.0), 1e-12);
    }

    @Test
    public void testTrigonometricAndLogarithmic() {
        TrigonometricComponent trig = (TrigonometricComponent) typed("sin(x)*cos(x)");
        assertEquals(List.of("cos", "sin"), trig.getFunctionNames());
        assertEquals(Math.sin(1.0) * Math.cos(1.0), trig.evaluate(1.0), 1e-12);

        LogarithmicComponent log = (LogarithmicComponent) typed("ln(x) + 1");
        assertEquals(List.of("log"), log.getFunctionNames());
        assertEquals(1.0, log.evaluate(1.0), 1e-12);
    }

    @Test
    public void testGenericKeepsTermAsGiven() {
        TypedComponent generic = typed("f(x) + sin(x)");
        assertEquals(parse("f(x) + sin(x)"), generic.getTerm());
        assertThrows(IllegalArgumentException.class, () -> generic.evaluate(1.0));
    }

    @Test
    public void testCreateAllFollowsLeafOrder() {
        DecompositionEngine engine = new DecompositionEngine(classifier, new StopCondition(),
                new ExponentialSumFactorizer(new SymbolicEquality(registry)), ChildOrdering.AS_GIVEN);
        Component root = engine.decompose(parse("(x^2 - 4x + 5)*e^(-x)"), x);
        List<TypedComponent> leaves = factory.createAll(root, x);
        assertEquals(2, leaves.size());
        assertInstanceOf(PolynomialComponent.class, leaves.get(0));
        assertInstanceOf(ExponentialComponent.class, leaves.get(1));
    }
}

package com.sysmuse.structure.analysis;

import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.Expressions;
import com.sysmuse.structure.cas.FunctionCall;
import com.sysmuse.structure.cas.Polynomials;
import com.sysmuse.structure.cas.Power;
import com.sysmuse.structure.cas.Symbol;
import com.sysmuse.structure.util.LoggingUtil;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Recursively decomposes an expression into a tree of {@link Component}s.
 * <p>
 * Each call classifies the expression, tries the exponential-sum rewrite on every
 * two-term sum, consults the {@link StopCondition}, and otherwise recurses into
 * the natural children of the shape: addends, factors, numerator then denominator,
 * base then exponent, or function arguments. Every call returns a fresh immutable tree.
 */
public class DecompositionEngine {

    private static final Comparator<Expression> BY_PRINTED_FORM = Comparator.comparing(Expression::text);

    private final StructureClassifier classifier;
    private final StopCondition stopCondition;
    private final ExponentialSumFactorizer factorizer;
    private final ChildOrdering childOrdering;

    public DecompositionEngine(StructureClassifier classifier, StopCondition stopCondition,
                               ExponentialSumFactorizer factorizer, ChildOrdering childOrdering) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.stopCondition = Objects.requireNonNull(stopCondition, "stopCondition");
        this.factorizer = Objects.requireNonNull(factorizer, "factorizer");
        this.childOrdering = Objects.requireNonNull(childOrdering, "childOrdering");
    }

    public Component decompose(Expression expr, Symbol variable) {
        Objects.requireNonNull(expr, "expr");
        Objects.requireNonNull(variable, "variable");

        Classification classification = classifier.classify(expr, variable);
        LoggingUtil.trace("Decomposing " + expr + " " + classification);

        if (isTwoTermSum(expr, classification)) {
            FactorizationResult result = factorizer.factorize(expr, variable);
            if (result.isSuccess()) {
                return Component.factorized(expr, classification.getSemanticTag(),
                        decompose(result.getCommonFactor(), variable),
                        decompose(result.getResidualFactor(), variable));
            }
        }

        if (stopCondition.shouldStop(expr, variable, classification)) {
            return Component.leaf(expr, classification);
        }

        List<Expression> natural = naturalChildren(expr, classification.getShapeTag(), variable);
        if (natural.isEmpty()) {
            return Component.leaf(expr, classification);
        }
        List<Component> children = new ArrayList<>(natural.size());
        for (Expression child : natural) {
            children.add(decompose(child, variable));
        }
        return Component.composite(expr, classification, children);
    }

    private static boolean isTwoTermSum(Expression expr, Classification classification) {
        return classification.getShapeTag() == ShapeTag.SUM && expr.operands().size() == 2;
    }

    private List<Expression> naturalChildren(Expression expr, ShapeTag shapeTag, Symbol variable) {
        switch (shapeTag) {
            case SUM:
            case PRODUCT:
                return ordered(expr.operands(), variable);
            case QUOTIENT:
                return List.of(Expressions.numerator(expr), Expressions.denominator(expr));
            case POWER_OR_COMPOSITION:
                if (expr instanceof Power p) return List.of(p.base(), p.exponent());
                if (expr instanceof FunctionCall call) return call.arguments();
                return List.of();
            default:
                return List.of();
        }
    }

    private List<Expression> ordered(List<Expression> operands, Symbol variable) {
        if (childOrdering == ChildOrdering.AS_GIVEN) return operands;
        List<Expression> sorted = new ArrayList<>(operands);
        sorted.sort(Comparator.<Expression>comparingInt(e -> orderingDegree(e, variable)).thenComparing(BY_PRINTED_FORM));
        return sorted;
    }

    /**
     * Polynomial degree, or {@link Integer#MAX_VALUE} so non-polynomials sort last.
     * Degrees beyond the int range saturate to the same value.
     */
    private static int orderingDegree(Expression expr, Symbol variable) {
        return Polynomials.isPolynomial(expr, variable) ? Polynomials.degree(expr, variable) : Integer.MAX_VALUE;
    }

    public StructureClassifier getClassifier() {
        return classifier;
    }

    public StopCondition getStopCondition() {
        return stopCondition;
    }

    public ExponentialSumFactorizer getFactorizer() {
        return factorizer;
    }

    public ChildOrdering getChildOrdering() {
        return childOrdering;
    }
}

package com.sysmuse.structure.analysis;

import com.sysmuse.structure.cas.Constant;
import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.FunctionCall;
import com.sysmuse.structure.cas.FunctionFamily;
import com.sysmuse.structure.cas.FunctionRegistry;
import com.sysmuse.structure.cas.Num;
import com.sysmuse.structure.cas.Polynomials;
import com.sysmuse.structure.cas.Power;
import com.sysmuse.structure.cas.Product;
import com.sysmuse.structure.cas.Sum;
import com.sysmuse.structure.cas.Symbol;
import com.sysmuse.structure.util.LoggingUtil;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Maps an expression to its {@link ShapeTag} and {@link SemanticTag}.
 * <p>
 * The shape comes from the outermost operator. The semantic tag comes from the
 * families of all named functions and exponential powers that depend on the target
 * variable anywhere in the tree. Classification never throws for non-null input;
 * anything unexpected degrades to {@link Classification#UNKNOWN}.
 */
public class StructureClassifier {

    private final FunctionRegistry registry;

    public StructureClassifier(FunctionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Classification classify(Expression expr, Symbol variable) {
        Objects.requireNonNull(expr, "expr");
        Objects.requireNonNull(variable, "variable");
        try {
            return new Classification(shapeOf(expr), semanticOf(expr, variable));
        } catch (RuntimeException e) {
            LoggingUtil.debug("Classification of " + expr + " degraded to " + Classification.UNKNOWN
                    + ": " + e.getMessage());
            return Classification.UNKNOWN;
        }
    }

    public static ShapeTag shapeOf(Expression expr) {
        if (expr instanceof Sum) return ShapeTag.SUM;
        if (expr instanceof Product p) {
            for (Expression factor : p.factors()) {
                if (factor instanceof Power pw && pw.isReciprocal()) return ShapeTag.QUOTIENT;
            }
            return ShapeTag.PRODUCT;
        }
        if (expr instanceof Power p) {
            return p.isReciprocal() ? ShapeTag.QUOTIENT : ShapeTag.POWER_OR_COMPOSITION;
        }
        if (expr instanceof FunctionCall call) {
            for (Expression argument : call.arguments()) {
                if (!isTrivialArgument(argument)) return ShapeTag.POWER_OR_COMPOSITION;
            }
        }
        return ShapeTag.ATOMIC;
    }

    private SemanticTag semanticOf(Expression expr, Symbol variable) {
        Set<FunctionFamily> families = EnumSet.noneOf(FunctionFamily.class);
        collectFamilies(expr, variable, families);

        if (families.isEmpty()) {
            return Polynomials.isPolynomial(expr, variable) ? SemanticTag.POLYNOMIAL : SemanticTag.MIXED_OR_UNKNOWN;
        }
        if (families.size() > 1) return SemanticTag.MIXED_OR_UNKNOWN;

        switch (families.iterator().next()) {
            case TRIGONOMETRIC:
                return SemanticTag.TRIGONOMETRIC;
            case EXPONENTIAL:
                return SemanticTag.EXPONENTIAL;
            case LOGARITHMIC:
                return SemanticTag.LOGARITHMIC;
            default:
                return SemanticTag.MIXED_OR_UNKNOWN;
        }
    }

    private void collectFamilies(Expression expr, Symbol variable, Set<FunctionFamily> out) {
        // variable-free subtrees are constants, whatever functions they mention
        if (!expr.contains(variable)) return;

        if (expr instanceof FunctionCall call) {
            out.add(registry.familyOf(call.name()));
        } else if (expr instanceof Power p) {
            boolean baseDepends = p.base().contains(variable);
            boolean exponentDepends = p.exponent().contains(variable);
            if (exponentDepends) {
                out.add(!baseDepends && isLinear(p.exponent(), variable)
                        ? FunctionFamily.EXPONENTIAL : FunctionFamily.OTHER);
            }
        }
        for (Expression operand : expr.operands()) {
            collectFamilies(operand, variable, out);
        }
    }

    /**
     * Degree at most one in {@code variable}; coefficients may be symbolic ({@code a*x + b}).
     */
    private static boolean isLinear(Expression exponent, Symbol variable) {
        return Polynomials.isPolynomial(exponent, variable) && Polynomials.degree(exponent, variable) <= 1;
    }

    private static boolean isTrivialArgument(Expression argument) {
        return argument instanceof Symbol || argument instanceof Constant || argument instanceof Num;
    }
}

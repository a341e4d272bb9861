package com.sysmuse.structure.analysis;

import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.Expressions;
import com.sysmuse.structure.cas.FunctionCall;
import com.sysmuse.structure.cas.Power;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers over decomposition trees.
 */
public final class Components {

    private Components() {
    }

    /**
     * Rebuilds an expression from a component's children according to its shape tag.
     * A leaf yields its own term.
     */
    public static Expression recombine(Component component) {
        if (component.isLeaf()) return component.getTerm();
        List<Expression> parts = new ArrayList<>();
        for (Component child : component.getChildren()) parts.add(child.getTerm());

        switch (component.getShapeTag()) {
            case SUM:
                return Expressions.add(parts);
            case PRODUCT:
                return Expressions.multiply(parts);
            case QUOTIENT:
                return Expressions.divide(parts.get(0), parts.get(1));
            case POWER_OR_COMPOSITION:
                if (component.getTerm() instanceof FunctionCall call) {
                    return Expressions.call(call.name(), parts);
                }
                if (component.getTerm() instanceof Power) {
                    return Expressions.power(parts.get(0), parts.get(1));
                }
                throw new IllegalStateException("Composition without function or power: " + component.getTerm());
            default:
                return component.getTerm();
        }
    }

    /**
     * Multi-line indented rendering for logs and display.
     */
    public static String render(Component root) {
        StringBuilder sb = new StringBuilder();
        render(root, 0, sb);
        return sb.toString();
    }

    private static void render(Component node, int indent, StringBuilder sb) {
        sb.append("  ".repeat(indent))
                .append(node.getTerm())
                .append("  [").append(node.getShapeTag()).append(", ").append(node.getSemanticTag());
        if (node.isFactorized()) sb.append(", factorized");
        sb.append("]\n");
        for (Component child : node.getChildren()) render(child, indent + 1, sb);
    }
}

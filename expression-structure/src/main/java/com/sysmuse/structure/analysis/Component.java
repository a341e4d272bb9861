package com.sysmuse.structure.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.sysmuse.structure.cas.Expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Node of a typed decomposition tree.
 * <p>
 * A component with children recombines to its term according to its shape tag
 * (see {@link Components#recombine}). A childless component is a leaf whose term met
 * the stop condition. The one place the shape tag may differ from the term's own top
 * operator is a factorized exponential sum, reported as a {@link ShapeTag#PRODUCT}
 * of common and residual factor.
 */
@JsonPropertyOrder({"term", "shapeTag", "semanticTag", "factorized", "children"})
public final class Component {

    @JsonProperty("term")
    private final Expression term;

    @JsonProperty("shapeTag")
    private final ShapeTag shapeTag;

    @JsonProperty("semanticTag")
    private final SemanticTag semanticTag;

    @JsonProperty("factorized")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    private final boolean factorized;

    @JsonProperty("children")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final List<Component> children;

    Component(Expression term, ShapeTag shapeTag, SemanticTag semanticTag,
              List<Component> children, boolean factorized) {
        this.term = Objects.requireNonNull(term, "term");
        this.shapeTag = Objects.requireNonNull(shapeTag, "shapeTag");
        this.semanticTag = Objects.requireNonNull(semanticTag, "semanticTag");
        this.children = List.copyOf(children);
        this.factorized = factorized;
    }

    public static Component leaf(Expression term, Classification classification) {
        return new Component(term, classification.getShapeTag(), classification.getSemanticTag(), List.of(), false);
    }

    public static Component composite(Expression term, Classification classification, List<Component> children) {
        if (children.isEmpty()) throw new IllegalArgumentException("Composite component needs children: " + term);
        return new Component(term, classification.getShapeTag(), classification.getSemanticTag(), children, false);
    }

    /**
     * Product-shaped node for a factorized exponential sum: children are common factor
     * and residual factor.
     */
    public static Component factorized(Expression term, SemanticTag semanticTag,
                                       Component commonFactor, Component residualFactor) {
        return new Component(term, ShapeTag.PRODUCT, semanticTag, List.of(commonFactor, residualFactor), true);
    }

    public Expression getTerm() {
        return term;
    }

    public ShapeTag getShapeTag() {
        return shapeTag;
    }

    public SemanticTag getSemanticTag() {
        return semanticTag;
    }

    public List<Component> getChildren() {
        return children;
    }

    public boolean isFactorized() {
        return factorized;
    }

    @JsonIgnore
    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Leaves in depth-first, left-to-right order.
     */
    @JsonIgnore
    public List<Component> getLeaves() {
        List<Component> leaves = new ArrayList<>();
        collectLeaves(this, leaves);
        return leaves;
    }

    @JsonIgnore
    public int getDepth() {
        int depth = 0;
        for (Component child : children) depth = Math.max(depth, child.getDepth());
        return depth + 1;
    }

    private static void collectLeaves(Component node, List<Component> out) {
        if (node.isLeaf()) {
            out.add(node);
            return;
        }
        for (Component child : node.children) collectLeaves(child, out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Component c)) return false;
        return factorized == c.factorized && term.equals(c.term) && shapeTag == c.shapeTag
                && semanticTag == c.semanticTag && children.equals(c.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(term, shapeTag, semanticTag, children, factorized);
    }

    @Override
    public String toString() {
        return term + " " + shapeTag + "/" + semanticTag + (isLeaf() ? "" : " " + children.size() + " children");
    }
}

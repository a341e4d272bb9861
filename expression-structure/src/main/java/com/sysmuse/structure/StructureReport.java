package com.sysmuse.structure;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.sysmuse.structure.analysis.Component;
import com.sysmuse.structure.analysis.SemanticTag;
import com.sysmuse.structure.analysis.ShapeTag;
import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.Symbol;
import com.sysmuse.structure.typed.TypedComponent;

import java.util.List;
import java.util.Objects;

/**
 * Result of analyzing one expression: its classification, the decomposition tree and
 * the typed leaves.
 */
@JsonPropertyOrder({"term", "variable", "shapeTag", "semanticTag", "components", "typedLeaves", "root"})
public class StructureReport {

    @JsonProperty("term")
    private final Expression term;

    @JsonProperty("variable")
    private final Symbol variable;

    @JsonProperty("root")
    private final Component root;

    @JsonProperty("typedLeaves")
    private final List<TypedComponent> typedLeaves;

    public StructureReport(Expression term, Symbol variable, Component root, List<TypedComponent> typedLeaves) {
        this.term = Objects.requireNonNull(term, "term");
        this.variable = Objects.requireNonNull(variable, "variable");
        this.root = Objects.requireNonNull(root, "root");
        this.typedLeaves = List.copyOf(typedLeaves);
    }

    public Expression getTerm() {
        return term;
    }

    public Symbol getVariable() {
        return variable;
    }

    @JsonProperty("shapeTag")
    public ShapeTag getShapeTag() {
        return root.getShapeTag();
    }

    @JsonProperty("semanticTag")
    public SemanticTag getSemanticTag() {
        return root.getSemanticTag();
    }

    public Component getRoot() {
        return root;
    }

    /**
     * Top-level components: the root's children, or the root itself when it is a leaf.
     */
    @JsonProperty("components")
    public List<Component> getComponents() {
        return root.isLeaf() ? List.of(root) : root.getChildren();
    }

    public List<TypedComponent> getTypedLeaves() {
        return typedLeaves;
    }

    public boolean isFactorized() {
        return root.isFactorized();
    }

    @Override
    public String toString() {
        return "StructureReport{term=" + term + ", variable=" + variable
                + ", shape=" + getShapeTag() + ", semantic=" + getSemanticTag()
                + ", components=" + getComponents().size() + ", leaves=" + typedLeaves.size() + "}";
    }
}

package com.sysmuse.structure.typed;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.sysmuse.structure.analysis.SemanticTag;
import com.sysmuse.structure.cas.Evaluator;
import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.Symbol;

import java.util.Objects;

/**
 * Specialized representation of a decomposition leaf, one variant per {@link SemanticTag}.
 * Instances are created by {@link TypedComponentFactory} only and never change variant.
 */
@JsonPropertyOrder({"semanticTag", "term", "description"})
public abstract class TypedComponent {

    protected final Expression term;
    protected final Symbol variable;
    private final Evaluator evaluator;

    TypedComponent(Expression term, Symbol variable, Evaluator evaluator) {
        this.term = Objects.requireNonNull(term, "term");
        this.variable = Objects.requireNonNull(variable, "variable");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    @JsonProperty("term")
    public Expression getTerm() {
        return term;
    }

    @JsonProperty("semanticTag")
    public abstract SemanticTag getSemanticTag();

    /**
     * Short human-readable summary of the leaf.
     */
    @JsonProperty("description")
    public abstract String getDescription();

    /**
     * Numeric value at {@code variable = at}; other free symbols must not occur.
     *
     * @throws IllegalArgumentException when the term has other free symbols or unknown functions
     */
    public double evaluate(double at) {
        return evaluator.evaluate(term, variable, at);
    }

    public Symbol getVariable() {
        return variable;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + term + "]";
    }
}

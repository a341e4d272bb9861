package com.sysmuse.structure.analysis;

import java.util.Objects;

/**
 * Result of {@link StructureClassifier#classify}: shape and semantic tag of one expression.
 */
public final class Classification {

    /**
     * What unclassifiable input degrades to.
     */
    public static final Classification UNKNOWN = new Classification(ShapeTag.ATOMIC, SemanticTag.MIXED_OR_UNKNOWN);

    private final ShapeTag shapeTag;
    private final SemanticTag semanticTag;

    public Classification(ShapeTag shapeTag, SemanticTag semanticTag) {
        this.shapeTag = Objects.requireNonNull(shapeTag, "shapeTag");
        this.semanticTag = Objects.requireNonNull(semanticTag, "semanticTag");
    }

    public ShapeTag getShapeTag() {
        return shapeTag;
    }

    public SemanticTag getSemanticTag() {
        return semanticTag;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Classification c)) return false;
        return shapeTag == c.shapeTag && semanticTag == c.semanticTag;
    }

    @Override
    public int hashCode() {
        return Objects.hash(shapeTag, semanticTag);
    }

    @Override
    public String toString() {
        return "(" + shapeTag + ", " + semanticTag + ")";
    }
}

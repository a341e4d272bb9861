package com.sysmuse.structure.typed;

import com.sysmuse.structure.analysis.SemanticTag;
import com.sysmuse.structure.cas.Evaluator;
import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.Symbol;

/**
 * Fallback for mixed or unrecognized leaves: displayed as given, numeric evaluation only.
 */
public final class GenericComponent extends TypedComponent {

    GenericComponent(Expression term, Symbol variable, Evaluator evaluator) {
        super(term, variable, evaluator);
    }

    @Override
    public SemanticTag getSemanticTag() {
        return SemanticTag.MIXED_OR_UNKNOWN;
    }

    @Override
    public String getDescription() {
        return "expression " + term;
    }
}

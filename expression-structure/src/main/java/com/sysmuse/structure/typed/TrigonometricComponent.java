package com.sysmuse.structure.typed;

import com.sysmuse.structure.analysis.SemanticTag;
import com.sysmuse.structure.cas.Evaluator;
import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.Symbol;

import java.util.List;

public final class TrigonometricComponent extends TypedComponent {

    private final List<String> functionNames;

    TrigonometricComponent(Expression term, Symbol variable, Evaluator evaluator) {
        super(term, variable, evaluator);
        this.functionNames = List.copyOf(term.functionNames());
    }

    @Override
    public SemanticTag getSemanticTag() {
        return SemanticTag.TRIGONOMETRIC;
    }

    public List<String> getFunctionNames() {
        return functionNames;
    }

    @Override
    public String getDescription() {
        return "trigonometric term using " + String.join(", ", functionNames);
    }
}

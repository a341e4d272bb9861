package com.sysmuse.structure.typed;

import com.sysmuse.structure.analysis.Component;
import com.sysmuse.structure.cas.Evaluator;
import com.sysmuse.structure.cas.FunctionRegistry;
import com.sysmuse.structure.cas.Symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns decomposition leaves into typed components according to their semantic tag.
 */
public class TypedComponentFactory {

    private final FunctionRegistry registry;
    private final Evaluator evaluator;

    public TypedComponentFactory(FunctionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.evaluator = new Evaluator(registry);
    }

    /**
     * Typed view of one component. Intended for leaves, but any component is accepted;
     * its own term and semantic tag are used.
     */
    public TypedComponent create(Component component, Symbol variable) {
        Objects.requireNonNull(component, "component");
        Objects.requireNonNull(variable, "variable");
        switch (component.getSemanticTag()) {
            case POLYNOMIAL:
                return new PolynomialComponent(component.getTerm(), variable, evaluator);
            case TRIGONOMETRIC:
                return new TrigonometricComponent(component.getTerm(), variable, evaluator);
            case EXPONENTIAL:
                return new ExponentialComponent(component.getTerm(), variable, evaluator);
            case LOGARITHMIC:
                return new LogarithmicComponent(component.getTerm(), variable, evaluator);
            case MIXED_OR_UNKNOWN:
                return new GenericComponent(component.getTerm(), variable, evaluator);
        }
        throw new IllegalStateException("No typed component for semantic tag " + component.getSemanticTag());
    }

    /**
     * Typed views of all leaves of a tree, in depth-first order.
     */
    public List<TypedComponent> createAll(Component root, Symbol variable) {
        List<TypedComponent> typed = new ArrayList<>();
        for (Component leaf : root.getLeaves()) {
            typed.add(create(leaf, variable));
        }
        return typed;
    }

    public FunctionRegistry getRegistry() {
        return registry;
    }
}

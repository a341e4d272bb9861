package com.sysmuse.structure.typed;

import com.sysmuse.structure.analysis.ExponentialTerm;
import com.sysmuse.structure.analysis.SemanticTag;
import com.sysmuse.structure.cas.Evaluator;
import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.Polynomials;
import com.sysmuse.structure.cas.Rational;
import com.sysmuse.structure.cas.Symbol;

/**
 * Exponential leaf. When the term has the form {@code c*b^(k*x+m)} the parts are
 * exposed; otherwise they are {@code null}.
 */
public final class ExponentialComponent extends TypedComponent {

    private final Expression base;
    private final Expression prefactor;
    private final Rational rate;
    private final Rational offset;

    ExponentialComponent(Expression term, Symbol variable, Evaluator evaluator) {
        super(term, variable, evaluator);
        ExponentialTerm split = ExponentialTerm.extract(term, variable);
        Polynomials.Affine affine = split == null ? null
                : Polynomials.affine(split.getExponent(), variable).orElse(null);
        this.base = split == null ? null : split.getBase();
        this.prefactor = split == null ? null : split.getPrefactor();
        this.rate = affine == null ? null : affine.getSlope();
        this.offset = affine == null ? null : affine.getOffset();
    }

    @Override
    public SemanticTag getSemanticTag() {
        return SemanticTag.EXPONENTIAL;
    }

    public Expression getBase() {
        return base;
    }

    public Expression getPrefactor() {
        return prefactor;
    }

    /**
     * Linear coefficient {@code k} of the exponent.
     */
    public Rational getRate() {
        return rate;
    }

    public Rational getOffset() {
        return offset;
    }

    public boolean isGrowing() {
        return rate != null && rate.signum() > 0;
    }

    public boolean isDecaying() {
        return rate != null && rate.signum() < 0;
    }

    @Override
    public String getDescription() {
        if (rate == null) return "exponential term " + term;
        return "exponential term with base " + base + " and rate " + rate
                + (isDecaying() ? " (decay)" : isGrowing() ? " (growth)" : "");
    }
}

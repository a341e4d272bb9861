package com.sysmuse.structure.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.Expressions;

import java.util.Objects;

/**
 * Outcome of an exponential-sum rewrite. On success {@code commonFactor * residualFactor}
 * equals the original sum; on failure the common factor is {@code 1} and the residual
 * is the original expression, so both cases read the same way.
 */
public final class FactorizationResult {

    @JsonProperty("success")
    private final boolean success;

    @JsonProperty("commonFactor")
    private final Expression commonFactor;

    @JsonProperty("residualFactor")
    private final Expression residualFactor;

    private FactorizationResult(boolean success, Expression commonFactor, Expression residualFactor) {
        this.success = success;
        this.commonFactor = commonFactor;
        this.residualFactor = residualFactor;
    }

    public static FactorizationResult success(Expression commonFactor, Expression residualFactor) {
        return new FactorizationResult(true,
                Objects.requireNonNull(commonFactor, "commonFactor"),
                Objects.requireNonNull(residualFactor, "residualFactor"));
    }

    public static FactorizationResult failure(Expression original) {
        return new FactorizationResult(false, Expressions.ONE, Objects.requireNonNull(original, "original"));
    }

    public boolean isSuccess() {
        return success;
    }

    public Expression getCommonFactor() {
        return commonFactor;
    }

    public Expression getResidualFactor() {
        return residualFactor;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FactorizationResult r)) return false;
        return success == r.success && commonFactor.equals(r.commonFactor) && residualFactor.equals(r.residualFactor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, commonFactor, residualFactor);
    }

    @Override
    public String toString() {
        return success ? commonFactor + " * (" + residualFactor + ")" : "no factorization of " + residualFactor;
    }
}

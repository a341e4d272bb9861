package com.sysmuse.structure.cas;

import com.sysmuse.structure.util.LoggingUtil;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Symbolic equality predicate.
 * <p>
 * Structurally equal expressions are equal. Otherwise both sides are evaluated at a
 * fixed set of sample bindings for all free symbols and must agree within a relative
 * tolerance at every point. Points where both sides are undefined are skipped; a point
 * where only one side is defined is a mismatch. The sample set is fixed, so the
 * predicate is deterministic.
 */
public class SymbolicEquality {

    public static final double DEFAULT_TOLERANCE = 1e-9;
    public static final int DEFAULT_SAMPLES = 12;

    private static final double[] SAMPLE_POINTS = {
            0.37, 1.23, -0.43, 0.81, 2.11, -1.19, 1.67, 0.59, -0.77, 2.63, 0.13, 1.41,
            -2.07, 0.97, 1.89, -0.29
    };
    private static final int MIN_DEFINED_POINTS = 3;

    private final Evaluator evaluator;
    private final double tolerance;
    private final int samples;

    public SymbolicEquality(FunctionRegistry registry) {
        this(registry, DEFAULT_TOLERANCE, DEFAULT_SAMPLES);
    }

    public SymbolicEquality(FunctionRegistry registry, double tolerance, int samples) {
        if (tolerance <= 0) throw new IllegalArgumentException("tolerance must be positive: " + tolerance);
        if (samples < MIN_DEFINED_POINTS || samples > SAMPLE_POINTS.length) {
            throw new IllegalArgumentException("samples must be between " + MIN_DEFINED_POINTS
                    + " and " + SAMPLE_POINTS.length + ": " + samples);
        }
        this.evaluator = new Evaluator(registry);
        this.tolerance = tolerance;
        this.samples = samples;
    }

    public boolean areEqual(Expression a, Expression b) {
        if (a.equals(b)) return true;

        Set<Symbol> symbols = new LinkedHashSet<>(a.freeSymbols());
        symbols.addAll(b.freeSymbols());
        List<Symbol> ordered = new ArrayList<>(symbols);
        ordered.sort(Comparator.comparing(Symbol::name));

        int defined = 0;
        for (int i = 0; i < samples; i++) {
            Map<Symbol, Double> binding = sampleBinding(ordered, i);
            double va;
            double vb;
            try {
                va = evaluator.evaluate(a, binding);
                vb = evaluator.evaluate(b, binding);
            } catch (IllegalArgumentException e) {
                LoggingUtil.debug("Equality check not decidable numerically: " + e.getMessage());
                return false;
            }
            boolean finiteA = Double.isFinite(va);
            boolean finiteB = Double.isFinite(vb);
            if (!finiteA && !finiteB) continue;
            if (finiteA != finiteB) return false;
            double scale = Math.max(1.0, Math.max(Math.abs(va), Math.abs(vb)));
            if (Math.abs(va - vb) > tolerance * scale) return false;
            defined++;
        }
        return defined >= MIN_DEFINED_POINTS;
    }

    private static Map<Symbol, Double> sampleBinding(List<Symbol> symbols, int sample) {
        Map<Symbol, Double> binding = new HashMap<>();
        for (int j = 0; j < symbols.size(); j++) {
            double point = SAMPLE_POINTS[(sample + 5 * j) % SAMPLE_POINTS.length];
            binding.put(symbols.get(j), point * (1.0 + 0.13 * j));
        }
        return binding;
    }
}

package com.sysmuse.structure.cas;

@FunctionalInterface
public interface NumericFunction {
    double apply(double[] args);
}

package com.sysmuse.structure.cas;

/**
 * School-level elementary functions. {@code exp} and {@code sqrt} are not listed:
 * the parser rewrites them to powers.
 */
public class ElementaryFunctions {

    public static void register(FunctionRegistry registry) {
        // Trigonometric
        registry.register("sin", FunctionFamily.TRIGONOMETRIC, args -> Math.sin(args[0]));
        registry.register("cos", FunctionFamily.TRIGONOMETRIC, args -> Math.cos(args[0]));
        registry.register("tan", FunctionFamily.TRIGONOMETRIC, args -> Math.tan(args[0]));
        registry.register("cot", FunctionFamily.TRIGONOMETRIC, args -> 1.0 / Math.tan(args[0]));
        registry.register("sec", FunctionFamily.TRIGONOMETRIC, args -> 1.0 / Math.cos(args[0]));
        registry.register("csc", FunctionFamily.TRIGONOMETRIC, args -> 1.0 / Math.sin(args[0]));
        registry.register("asin", FunctionFamily.TRIGONOMETRIC, args -> Math.asin(args[0]), "arcsin");
        registry.register("acos", FunctionFamily.TRIGONOMETRIC, args -> Math.acos(args[0]), "arccos");
        registry.register("atan", FunctionFamily.TRIGONOMETRIC, args -> Math.atan(args[0]), "arctan");

        // Logarithmic; log(u, b) is the logarithm of u to base b
        registry.register("log", FunctionFamily.LOGARITHMIC, 1, 2,
                args -> args.length == 1 ? Math.log(args[0]) : Math.log(args[0]) / Math.log(args[1]), "ln");
        registry.register("log10", FunctionFamily.LOGARITHMIC, args -> Math.log10(args[0]), "lg");
        registry.register("log2", FunctionFamily.LOGARITHMIC, args -> Math.log(args[0]) / Math.log(2.0), "ld");

        // Everything else counts as its own family
        registry.register("sinh", FunctionFamily.OTHER, args -> Math.sinh(args[0]));
        registry.register("cosh", FunctionFamily.OTHER, args -> Math.cosh(args[0]));
        registry.register("tanh", FunctionFamily.OTHER, args -> Math.tanh(args[0]));
        registry.register("abs", FunctionFamily.OTHER, args -> Math.abs(args[0]));
    }
}

package com.sysmuse.structure.cas;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Named functions known to the parser, classifier and evaluator.
 * <p>
 * Registration happens once, before the registry is handed to any analysis
 * component; afterwards it is only read.
 */
public class FunctionRegistry {

    private final Map<String, Definition> functions = new HashMap<>();
    private final Map<String, String> aliases = new HashMap<>();

    /**
     * A fresh registry populated with {@link ElementaryFunctions}.
     */
    public static FunctionRegistry standard() {
        FunctionRegistry registry = new FunctionRegistry();
        ElementaryFunctions.register(registry);
        return registry;
    }

    public void register(String name, FunctionFamily family, int minArgs, int maxArgs,
                         NumericFunction implementation, String... alternativeNames) {
        String key = name.toLowerCase(Locale.ROOT);
        functions.put(key, new Definition(key, family, minArgs, maxArgs, implementation));
        for (String alias : alternativeNames) aliases.put(alias.toLowerCase(Locale.ROOT), key);
    }

    public void register(String name, FunctionFamily family, NumericFunction implementation,
                         String... alternativeNames) {
        register(name, family, 1, 1, implementation, alternativeNames);
    }

    /**
     * Canonical name for {@code name}; unknown names are returned lower-cased.
     */
    public String resolve(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        return aliases.getOrDefault(key, key);
    }

    public boolean contains(String name) {
        return functions.containsKey(resolve(name));
    }

    public Definition get(String name) {
        return functions.get(resolve(name));
    }

    /**
     * Family of a named function; {@link FunctionFamily#OTHER} when unregistered.
     */
    public FunctionFamily familyOf(String name) {
        Definition definition = get(name);
        return definition == null ? FunctionFamily.OTHER : definition.getFamily();
    }

    public static final class Definition {
        private final String name;
        private final FunctionFamily family;
        private final int minArgs;
        private final int maxArgs;
        private final NumericFunction implementation;

        Definition(String name, FunctionFamily family, int minArgs, int maxArgs, NumericFunction implementation) {
            this.name = name;
            this.family = family;
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
            this.implementation = implementation;
        }

        public String getName() {
            return name;
        }

        public FunctionFamily getFamily() {
            return family;
        }

        public boolean acceptsArity(int count) {
            return count >= minArgs && count <= maxArgs;
        }

        public double apply(double[] args) {
            if (!acceptsArity(args.length)) {
                throw new IllegalArgumentException("Function " + name + " expects " + minArgs
                        + (maxArgs != minArgs ? ".." + maxArgs : "") + " arguments but got " + args.length);
            }
            return implementation.apply(args);
        }
    }
}

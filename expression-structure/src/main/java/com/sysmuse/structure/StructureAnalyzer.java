package com.sysmuse.structure;

import com.sysmuse.structure.analysis.Classification;
import com.sysmuse.structure.analysis.Component;
import com.sysmuse.structure.analysis.Components;
import com.sysmuse.structure.analysis.DecompositionEngine;
import com.sysmuse.structure.analysis.ExponentialSumFactorizer;
import com.sysmuse.structure.analysis.FactorizationResult;
import com.sysmuse.structure.analysis.StopCondition;
import com.sysmuse.structure.analysis.StructureClassifier;
import com.sysmuse.structure.cas.Expression;
import com.sysmuse.structure.cas.ExpressionParser;
import com.sysmuse.structure.cas.Expressions;
import com.sysmuse.structure.cas.FunctionRegistry;
import com.sysmuse.structure.cas.Symbol;
import com.sysmuse.structure.cas.SymbolicEquality;
import com.sysmuse.structure.configuration.AnalyzerConfig;
import com.sysmuse.structure.configuration.AnalyzerConfigLoader;
import com.sysmuse.structure.output.ReportExporter;
import com.sysmuse.structure.typed.TypedComponent;
import com.sysmuse.structure.typed.TypedComponentFactory;
import com.sysmuse.structure.util.LoggingUtil;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Entry point: parses formulas, decomposes them into typed components and builds
 * {@link StructureReport}s. Immutable after construction.
 */
public class StructureAnalyzer {

    private final AnalyzerConfig config;
    private final FunctionRegistry registry;
    private final StructureClassifier classifier;
    private final ExponentialSumFactorizer factorizer;
    private final DecompositionEngine engine;
    private final TypedComponentFactory typedFactory;

    public StructureAnalyzer() {
        this(new AnalyzerConfig());
    }

    public StructureAnalyzer(AnalyzerConfig config) {
        this(config, FunctionRegistry.standard());
    }

    public StructureAnalyzer(AnalyzerConfig config, FunctionRegistry registry) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        config.validate();

        SymbolicEquality equality = new SymbolicEquality(registry,
                config.getEqualityTolerance(), config.getEqualitySamples());
        this.classifier = new StructureClassifier(registry);
        this.factorizer = new ExponentialSumFactorizer(equality, config.isAllowExponentOffsets());
        StopCondition stopCondition = new StopCondition(config.getMaxLeafPolynomialDegree(),
                config.isExpandCompositions());
        this.engine = new DecompositionEngine(classifier, stopCondition, factorizer, config.getChildOrdering());
        this.typedFactory = new TypedComponentFactory(registry);
    }

    /**
     * Analyzer configured from a JSON file, or from the classpath default when the
     * path is {@code null}. Also initializes logging from that configuration.
     */
    public static StructureAnalyzer create(String configPath) throws IOException {
        AnalyzerConfigLoader loader = new AnalyzerConfigLoader();
        AnalyzerConfig config = configPath == null ? loader.loadDefault() : loader.loadFromJSON(configPath);
        LoggingUtil.initialize(config);
        return new StructureAnalyzer(config);
    }

    public Expression parse(String formula) {
        return new ExpressionParser(formula, registry).parse();
    }

    public StructureReport analyze(Expression expr, Symbol variable) {
        Objects.requireNonNull(expr, "expr");
        Objects.requireNonNull(variable, "variable");

        Component root = engine.decompose(expr, variable);
        List<TypedComponent> leaves = typedFactory.createAll(root, variable);
        StructureReport report = new StructureReport(expr, variable, root, leaves);

        LoggingUtil.info("Analyzed " + expr + " in " + variable + ": " + root.getShapeTag() + "/"
                + root.getSemanticTag() + ", " + report.getComponents().size() + " components, "
                + leaves.size() + " leaves" + (root.isFactorized() ? ", factorized" : ""));
        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("Decomposition tree:\n" + Components.render(root));
        }
        return report;
    }

    public StructureReport analyze(String formula, String variable) {
        Objects.requireNonNull(formula, "formula");
        Objects.requireNonNull(variable, "variable");
        return analyze(parse(formula), Expressions.symbol(variable));
    }

    /**
     * Analyze with the configured default variable.
     */
    public StructureReport analyze(String formula) {
        return analyze(formula, config.getDefaultVariable());
    }

    public FactorizationResult factorize(Expression expr, Symbol variable) {
        return factorizer.factorize(expr, variable);
    }

    public Classification classify(Expression expr, Symbol variable) {
        return classifier.classify(expr, variable);
    }

    public AnalyzerConfig getConfig() {
        return config;
    }

    public FunctionRegistry getRegistry() {
        return registry;
    }

    public DecompositionEngine getEngine() {
        return engine;
    }

    public TypedComponentFactory getTypedFactory() {
        return typedFactory;
    }

    /**
     * Usage: {@code StructureAnalyzer <formula> [variable] [config.json] [output.json]}.
     * Prints the report as JSON, or writes it to the output file.
     */
    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: java StructureAnalyzer <formula> [variable] [config.json] [output.json]");
            System.exit(1);
        }

        StructureAnalyzer analyzer = create(args.length > 2 ? args[2] : null);
        String variable = args.length > 1 ? args[1] : analyzer.getConfig().getDefaultVariable();
        StructureReport report = analyzer.analyze(args[0], variable);

        ReportExporter exporter = new ReportExporter();
        if (args.length > 3) {
            exporter.exportToFile(report, args[3]);
            LoggingUtil.info("Report written to " + args[3]);
        } else {
            System.out.println(exporter.exportToString(report));
        }
    }
}

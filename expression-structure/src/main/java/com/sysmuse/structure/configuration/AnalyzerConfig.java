package com.sysmuse.structure.configuration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sysmuse.structure.analysis.ChildOrdering;
import com.sysmuse.structure.cas.SymbolicEquality;

/**
 * Settings for the structure analyzer, loaded from JSON by {@link AnalyzerConfigLoader}.
 * Every field has a default, so an empty JSON object is a valid configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyzerConfig {

    @JsonProperty("defaultVariable")
    private String defaultVariable = "x";

    @JsonProperty("maxLeafPolynomialDegree")
    private int maxLeafPolynomialDegree = 2;

    @JsonProperty("allowExponentOffsets")
    private boolean allowExponentOffsets = false;

    @JsonProperty("expandCompositions")
    private boolean expandCompositions = false;

    @JsonProperty("childOrdering")
    private ChildOrdering childOrdering = ChildOrdering.AS_GIVEN;

    @JsonProperty("equalityTolerance")
    private double equalityTolerance = SymbolicEquality.DEFAULT_TOLERANCE;

    @JsonProperty("equalitySamples")
    private int equalitySamples = SymbolicEquality.DEFAULT_SAMPLES;

    // Logging configuration
    @JsonProperty("loggingLevel")
    private String loggingLevel = "INFO";

    @JsonProperty("consoleLoggingEnabled")
    private boolean consoleLoggingEnabled = true;

    @JsonProperty("fileLoggingEnabled")
    private boolean fileLoggingEnabled = false;

    @JsonProperty("logFileName")
    private String logFileName = "structure-analyzer.log";

    /**
     * Default constructor for Jackson.
     */
    public AnalyzerConfig() {
    }

    /**
     * Check value ranges.
     *
     * @throws IllegalArgumentException naming the first invalid setting
     */
    public void validate() {
        if (defaultVariable == null || !defaultVariable.matches("[A-Za-z][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("defaultVariable must be an identifier: " + defaultVariable);
        }
        if ("e".equals(defaultVariable) || "pi".equals(defaultVariable)) {
            throw new IllegalArgumentException("defaultVariable must not be a named constant: " + defaultVariable);
        }
        if (maxLeafPolynomialDegree < 0) {
            throw new IllegalArgumentException("maxLeafPolynomialDegree must be >= 0: " + maxLeafPolynomialDegree);
        }
        if (childOrdering == null) {
            throw new IllegalArgumentException("childOrdering must be set");
        }
        if (!(equalityTolerance > 0)) {
            throw new IllegalArgumentException("equalityTolerance must be positive: " + equalityTolerance);
        }
        if (equalitySamples < 3 || equalitySamples > 16) {
            throw new IllegalArgumentException("equalitySamples must be between 3 and 16: " + equalitySamples);
        }
    }

    public String getDefaultVariable() {
        return defaultVariable;
    }

    public void setDefaultVariable(String defaultVariable) {
        this.defaultVariable = defaultVariable;
    }

    public int getMaxLeafPolynomialDegree() {
        return maxLeafPolynomialDegree;
    }

    public void setMaxLeafPolynomialDegree(int maxLeafPolynomialDegree) {
        this.maxLeafPolynomialDegree = maxLeafPolynomialDegree;
    }

    public boolean isAllowExponentOffsets() {
        return allowExponentOffsets;
    }

    public void setAllowExponentOffsets(boolean allowExponentOffsets) {
        this.allowExponentOffsets = allowExponentOffsets;
    }

    public boolean isExpandCompositions() {
        return expandCompositions;
    }

    public void setExpandCompositions(boolean expandCompositions) {
        this.expandCompositions = expandCompositions;
    }

    public ChildOrdering getChildOrdering() {
        return childOrdering;
    }

    public void setChildOrdering(ChildOrdering childOrdering) {
        this.childOrdering = childOrdering;
    }

    public double getEqualityTolerance() {
        return equalityTolerance;
    }

    public void setEqualityTolerance(double equalityTolerance) {
        this.equalityTolerance = equalityTolerance;
    }

    public int getEqualitySamples() {
        return equalitySamples;
    }

    public void setEqualitySamples(int equalitySamples) {
        this.equalitySamples = equalitySamples;
    }

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public void setLoggingLevel(String loggingLevel) {
        this.loggingLevel = loggingLevel;
    }

    public boolean isConsoleLoggingEnabled() {
        return consoleLoggingEnabled;
    }

    public void setConsoleLoggingEnabled(boolean consoleLoggingEnabled) {
        this.consoleLoggingEnabled = consoleLoggingEnabled;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public void setFileLoggingEnabled(boolean fileLoggingEnabled) {
        this.fileLoggingEnabled = fileLoggingEnabled;
    }

    public String getLogFileName() {
        return logFileName;
    }

    public void setLogFileName(String logFileName) {
        this.logFileName = logFileName;
    }

    @Override
    public String toString() {
        return String.format("AnalyzerConfig[variable=%s, maxLeafDegree=%d, offsets=%s, compositions=%s, ordering=%s]",
                defaultVariable, maxLeafPolynomialDegree, allowExponentOffsets, expandCompositions, childOrdering);
    }
}

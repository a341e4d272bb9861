package com.sysmuse.structure.configuration;

import com.sysmuse.structure.analysis.ChildOrdering;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class AnalyzerConfigLoaderTest {

    private AnalyzerConfigLoader loader;

    @TempDir
    Path tempDir;

    @BeforeEach
    public void setup() {
        loader = new AnalyzerConfigLoader();
    }

    @Test
    public void testDefaults() throws IOException {
        AnalyzerConfig config = loader.loadDefault();
        assertEquals("x", config.getDefaultVariable());
        assertEquals(2, config.getMaxLeafPolynomialDegree());
        assertFalse(config.isAllowExponentOffsets());
        assertFalse(config.isExpandCompositions());
        assertEquals(ChildOrdering.AS_GIVEN, config.getChildOrdering());
        assertEquals(12, config.getEqualitySamples());
        assertEquals("INFO", config.getLoggingLevel());
    }

    @Test
    public void testLoadFromClasspath() throws IOException {
        AnalyzerConfig config = loader.loadFromClasspath("test-analyzer-config.json");
        assertEquals("t", config.getDefaultVariable());
        assertEquals(3, config.getMaxLeafPolynomialDegree());
        assertTrue(config.isAllowExponentOffsets());
        assertEquals(ChildOrdering.DEGREE_LEXICOGRAPHIC, config.getChildOrdering());
        assertEquals(8, config.getEqualitySamples());
        assertEquals("DEBUG", config.getLoggingLevel());
        // not in the file
        assertFalse(config.isExpandCompositions());
        assertEquals(1e-9, config.getEqualityTolerance());
    }

    @Test
    public void testMissingClasspathResourceGivesDefaults() throws IOException {
        AnalyzerConfig config = loader.loadFromClasspath("no-such-config.json");
        assertEquals("x", config.getDefaultVariable());
    }

    @Test
    public void testMissingFileIsAnError() {
        assertThrows(IOException.class, () -> loader.loadFromJSON(tempDir.resolve("missing.json").toString()));
    }

    @Test
    public void testSaveAndReload() throws IOException {
        AnalyzerConfig config = new AnalyzerConfig();
        config.setDefaultVariable("s");
        config.setExpandCompositions(true);
        config.setChildOrdering(ChildOrdering.DEGREE_LEXICOGRAPHIC);

        String file = tempDir.resolve("nested/config.json").toString();
        loader.saveToJSON(config, file);
        AnalyzerConfig reloaded = loader.loadFromJSON(file);

        assertEquals("s", reloaded.getDefaultVariable());
        assertTrue(reloaded.isExpandCompositions());
        assertEquals(ChildOrdering.DEGREE_LEXICOGRAPHIC, reloaded.getChildOrdering());
    }

    @Test
    public void testInvalidValuesAreRejected() throws IOException {
        Path file = tempDir.resolve("invalid.json");
        Files.write(file, "{\"equalitySamples\": 40}".getBytes(StandardCharsets.UTF_8));
        assertThrows(IllegalArgumentException.class, () -> loader.loadFromJSON(file.toString()));

        AnalyzerConfig config = new AnalyzerConfig();
        config.setDefaultVariable("pi");
        assertThrows(IllegalArgumentException.class, config::validate);
        config.setDefaultVariable("2x");
        assertThrows(IllegalArgumentException.class, config::validate);
    }
}

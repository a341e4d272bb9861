package com.sysmuse.structure.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sysmuse.structure.StructureReport;

import java.io.File;
import java.io.IOException;

/**
 * Handles JSON export of structure reports.
 * <p>
 * Expressions serialize as their printed form, rationals as {@code "p/q"} strings.
 */
public class ReportExporter {

    private final ObjectMapper objectMapper;

    /**
     * Create a new ReportExporter with pretty-printing enabled.
     */
    public ReportExporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Export a report to a JSON file, creating parent directories if needed.
     *
     * @throws IOException If the file cannot be written
     */
    public void exportToFile(StructureReport report, String filename) throws IOException {
        File file = new File(filename);
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) parent.mkdirs();
        objectMapper.writeValue(file, report);
    }

    /**
     * Export a report to a JSON string.
     *
     * @throws IOException If serialization fails
     */
    public String exportToString(StructureReport report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}

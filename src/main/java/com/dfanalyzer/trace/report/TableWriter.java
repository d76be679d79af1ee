package com.dfanalyzer.trace.report;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

import com.dfanalyzer.trace.model.IOCategory;
import com.dfanalyzer.trace.table.NormalizedTable;
import com.dfanalyzer.trace.table.TraceRow;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Exports the normalized events table as JSON lines (one object per row) or
 * CSV, columns in table order. I/O categories are written as their numeric
 * code.
 */
public class TableWriter {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static void writeJsonLines(NormalizedTable table, Path file) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeJsonLines(table, writer);
        }
    }

    public static void writeJsonLines(NormalizedTable table, Writer writer) throws IOException {
        List<String> columns = table.getColumns();
        Iterator<TraceRow> rows = table.rows().iterator();
        while (rows.hasNext()) {
            writer.write(mapper.writeValueAsString(toJson(rows.next(), columns)));
            writer.write('\n');
        }
        writer.flush();
    }

    static ObjectNode toJson(TraceRow row, List<String> columns) {
        ObjectNode node = mapper.createObjectNode();
        for (String column : columns) {
            Object value = exportValue(row.get(column));
            if (value == null) {
                node.putNull(column);
            } else {
                node.set(column, mapper.valueToTree(value));
            }
        }
        return node;
    }

    public static void writeCsv(NormalizedTable table, Path file) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeCsv(table, writer);
        }
    }

    public static void writeCsv(NormalizedTable table, Writer writer) throws IOException {
        List<String> columns = table.getColumns();
        writer.write(String.join(",", columns));
        writer.write('\n');
        Iterator<TraceRow> rows = table.rows().iterator();
        while (rows.hasNext()) {
            TraceRow row = rows.next();
            StringBuilder line = new StringBuilder();
            for (int i = 0; i < columns.size(); i++) {
                if (i > 0) {
                    line.append(',');
                }
                Object value = exportValue(row.get(columns.get(i)));
                if (value != null) {
                    line.append(escapeCsv(value.toString()));
                }
            }
            writer.write(line.toString());
            writer.write('\n');
        }
        writer.flush();
    }

    static Object exportValue(Object value) {
        if (value instanceof IOCategory) {
            return ((IOCategory) value).code;
        }
        return value;
    }

    static String escapeCsv(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0) {
            return value;
        }
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}

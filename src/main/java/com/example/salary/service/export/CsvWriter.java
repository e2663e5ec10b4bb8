package com.example.salary.service.export;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Minimal CSV row writer: comma delimited, {@code \n} line endings, fields quoted only when
 * they contain a comma, a quote or a line break.
 */
final class CsvWriter {

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';

    private final Writer out;

    CsvWriter(Writer out) {
        this.out = out;
    }

    void writeRow(List<String> fields) throws IOException {
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                out.write(DELIMITER);
            }
            out.write(escape(fields.get(i)));
        }
        out.write('\n');
    }

    static String escape(String field) {
        if (field == null) {
            return "";
        }
        boolean needsQuotes = field.indexOf(DELIMITER) >= 0
                || field.indexOf(QUOTE) >= 0
                || field.indexOf('\n') >= 0
                || field.indexOf('\r') >= 0;
        if (!needsQuotes) {
            return field;
        }
        return QUOTE + field.replace("\"", "\"\"") + QUOTE;
    }
}

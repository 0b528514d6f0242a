package org.dxworks.logframe.reader;

import org.dxworks.logframe.model.TabularData;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tab-separated files with one header row. Subclasses decide how many lines
 * precede the header.
 */
public abstract class DelimitedTableReader implements TableReader {

    static final String DELIMITER = "\t";
    static final int MIN_COLUMNS = 3;

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    /**
     * Lines to skip before the header row.
     */
    protected abstract int linesBeforeHeader();

    @Override
    public TabularData read(Reader input) throws IOException {
        BufferedReader reader = input instanceof BufferedReader ? (BufferedReader) input : new BufferedReader(input);
        for (int i = 0; i < linesBeforeHeader(); i++) {
            if (reader.readLine() == null) {
                return new TabularData();
            }
        }
        String headerLine = reader.readLine();
        if (headerLine == null) {
            return new TabularData();
        }
        List<String> header = new ArrayList<>();
        for (String name : split(headerLine)) {
            header.add(name.trim());
        }

        TabularData data = new TabularData(header);
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            List<String> fields = split(line);
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                row.put(header.get(i), i < fields.size() ? fields.get(i) : "");
            }
            data.addRow(row);
        }
        return data;
    }

    static List<String> split(String line) {
        String text = line.startsWith(BYTE_ORDER_MARK) ? line.substring(1) : line;
        if (text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }
        return Arrays.asList(text.split(DELIMITER, -1));
    }

    static int fieldCount(String line) {
        return line == null ? 0 : split(line).size();
    }
}

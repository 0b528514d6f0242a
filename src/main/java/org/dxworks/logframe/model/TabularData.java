package org.dxworks.logframe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rows of named string values plus the ordered union of their column names.
 * Columns are kept in first-seen order unless reordered explicitly.
 */
public class TabularData {

    private final List<String> columns = new ArrayList<>();
    private final Set<String> knownColumns = new HashSet<>();
    private final List<Map<String, String>> rows = new ArrayList<>();

    public TabularData() {
    }

    public TabularData(List<String> columns) {
        columns.forEach(this::addColumn);
    }

    public void addColumn(String column) {
        if (knownColumns.add(column)) {
            columns.add(column);
        }
    }

    /**
     * Appends a copy of {@code row}; columns not seen before are added in the
     * row's iteration order.
     */
    public void addRow(Map<String, String> row) {
        Map<String, String> copy = new LinkedHashMap<>(row);
        copy.keySet().forEach(this::addColumn);
        rows.add(copy);
    }

    public List<String> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public List<Map<String, String>> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public Map<String, String> getRow(int index) {
        return Collections.unmodifiableMap(rows.get(index));
    }

    /**
     * The value at {@code column} in row {@code index}, or {@code null} when
     * the row has no such column.
     */
    public String get(int index, String column) {
        return rows.get(index).get(column);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int findColumnIndex(String column) {
        return columns.indexOf(column);
    }

    /**
     * Moves the named columns to the front in the given order. Names that
     * are not columns of this table are ignored; remaining columns keep
     * their relative order after the named ones.
     */
    public void orderColumns(List<String> order) {
        Set<String> ordered = new LinkedHashSet<>();
        for (String column : order) {
            if (knownColumns.contains(column)) {
                ordered.add(column);
            }
        }
        ordered.addAll(columns);
        columns.clear();
        columns.addAll(ordered);
    }
}

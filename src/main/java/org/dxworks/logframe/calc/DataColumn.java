package org.dxworks.logframe.calc;

import java.util.List;

/**
 * A column backed directly by the underlying data.
 */
public class DataColumn implements Column {

    private final String name;

    public DataColumn(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String compute(CalculatedRow row, List<String> path) {
        String value = row.dataValue(name);
        return value == null ? "" : value;
    }
}

package org.dxworks.logframe.calc;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds the last non-blank value seen in another column. Rows must be
 * computed in order.
 */
public class CopydownColumn implements Column {

    private final String name;
    private final String copiedName;
    private String lastValue = "";

    public CopydownColumn(String name, String copiedName) {
        this.name = name;
        this.copiedName = copiedName;
    }

    @Override
    public String name() {
        return name;
    }

    public String copiedName() {
        return copiedName;
    }

    @Override
    public String compute(CalculatedRow row, List<String> path) {
        List<String> nextPath = new ArrayList<>(path);
        nextPath.add(name);
        String value = row.compute(copiedName, nextPath);
        if (value != null && !value.isBlank()) {
            lastValue = value;
        }
        return lastValue;
    }

    @Override
    public void reset() {
        lastValue = "";
    }
}

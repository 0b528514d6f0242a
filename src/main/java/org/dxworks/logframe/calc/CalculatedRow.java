package org.dxworks.logframe.calc;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * One row of a {@link ColumnCalculator}. Cell values are computed on first
 * access and remembered, failures included, so every cell is evaluated at
 * most once per pass.
 */
public class CalculatedRow implements Comparable<CalculatedRow> {

    private final ColumnCalculator owner;
    private final Map<String, String> data;
    private final Cell[] cells;
    // Counter predicates read cells through get(), which starts a fresh path,
    // so a loop through a predicate only shows up here.
    private final boolean[] inProgress;
    private BigDecimal sortValue = BigDecimal.ONE;

    CalculatedRow(ColumnCalculator owner, Map<String, String> data, int columnCount) {
        this.owner = owner;
        this.data = data;
        this.cells = new Cell[columnCount];
        this.inProgress = new boolean[columnCount];
    }

    public String get(String columnName) {
        int index = owner.columnIndex(columnName)
                .orElseThrow(() -> new UnknownColumnException(columnName));
        return cell(index, List.of());
    }

    public String get(int columnIndex) {
        int index = owner.columnIndex(columnIndex)
                .orElseThrow(() -> new UnknownColumnException(columnIndex));
        return cell(index, List.of());
    }

    /**
     * Computes (or returns the remembered value of) the named column.
     */
    public String compute(String columnName) {
        return compute(columnName, List.of());
    }

    String compute(String columnName, List<String> path) {
        int index = owner.columnIndex(columnName)
                .orElseThrow(() -> new UnknownColumnException(columnName));
        return cell(index, path);
    }

    /**
     * The value stored in the underlying data under {@code columnName}, or
     * {@code null}.
     */
    String dataValue(String columnName) {
        return data.get(columnName);
    }

    String cell(int index, List<String> path) {
        Cell cell = cells[index];
        if (cell != null) {
            return cell.value();
        }
        Column column = owner.column(index);
        if (inProgress[index] || path.contains(column.name())) {
            ComputationException loop = new ComputationException(
                    column.name() + " contains a loop: " + String.join(" -> ", path) + " -> " + column.name());
            cells[index] = Cell.failed(loop);
            throw loop;
        }
        inProgress[index] = true;
        try {
            String value = column.compute(this, path);
            cells[index] = Cell.of(value);
            return value;
        } catch (ComputationException | ExpressionException | IndexOutOfBoundsException e) {
            cells[index] = Cell.failed(e);
            throw e;
        } finally {
            inProgress[index] = false;
        }
    }

    public BigDecimal getSortValue() {
        return sortValue;
    }

    void setSortValue(BigDecimal sortValue) {
        this.sortValue = sortValue;
    }

    @Override
    public int compareTo(CalculatedRow other) {
        return sortValue.compareTo(other.sortValue);
    }

    private static final class Cell {
        private final String value;
        private final RuntimeException failure;

        private Cell(String value, RuntimeException failure) {
            this.value = value;
            this.failure = failure;
        }

        static Cell of(String value) {
            return new Cell(value, null);
        }

        static Cell failed(RuntimeException failure) {
            return new Cell(null, failure);
        }

        String value() {
            if (failure != null) {
                throw failure;
            }
            return value;
        }
    }
}

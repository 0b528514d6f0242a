package org.dxworks.logframe.calc;

import org.dxworks.logframe.model.TabularData;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Adds derived columns to tabular data.
 *
 * <p>Four kinds of columns are supported:
 * <ol>
 *   <li>data columns, backed directly by the data;</li>
 *   <li>computed columns, evaluated from an expression over other columns of the same row;</li>
 *   <li>copydown columns, holding the last non-blank value of another column;</li>
 *   <li>counter columns, advanced and reset by per-row predicates.</li>
 * </ol>
 * Columns are exposed in that order, each kind in declaration order. Columns may
 * depend on each other as long as the dependencies do not loop.
 *
 * <p>Rows are realized in a single ordered pass on first access, because copydown
 * and counter columns carry state from one row to the next. Registering a column
 * or changing the data discards realized rows.
 */
public class ColumnCalculator implements Iterable<CalculatedRow> {

    private static final String SORTER_NAME = "sorter";
    private static final String DEFAULT_SORT_EXPRESSION = "1";

    private final Calculator calculator;

    private TabularData data = new TabularData();
    private List<Column> dataColumns = new ArrayList<>();
    private final List<Column> computedColumns = new ArrayList<>();
    private final List<Column> copydownColumns = new ArrayList<>();
    private final List<Column> counterColumns = new ArrayList<>();

    private List<Column> columns = List.of();
    private List<String> columnNames = List.of();
    private Map<String, Integer> columnIndexes = Map.of();

    private ComputedColumn sorter;
    private List<CalculatedRow> rows;
    private int failedCells;

    public ColumnCalculator() {
        this(new Calculator());
    }

    public ColumnCalculator(Calculator calculator) {
        this.calculator = calculator;
        this.sorter = new ComputedColumn(SORTER_NAME, new Expression(DEFAULT_SORT_EXPRESSION), calculator);
    }

    public ColumnCalculator(TabularData data) {
        this();
        setData(data);
    }

    public void setData(TabularData data) {
        List<Column> newDataColumns = new ArrayList<>();
        for (String name : data.getColumns()) {
            newDataColumns.add(new DataColumn(name));
        }
        rebuildColumns(newDataColumns);
        this.data = data;
        this.dataColumns = newDataColumns;
    }

    public TabularData getData() {
        return data;
    }

    public void computedColumn(String name, String expression) {
        addColumn(computedColumns, new ComputedColumn(name, new Expression(expression), calculator));
    }

    public void copydownColumn(String name, String copiedName) {
        addColumn(copydownColumns, new CopydownColumn(name, copiedName));
    }

    public void counterColumn(String name) {
        counterColumn(name, CounterOptions.defaults());
    }

    public void counterColumn(String name, CounterOptions options) {
        addColumn(counterColumns, new CounterColumn(name, options));
    }

    public void sortExpression(String expression) {
        sorter = new ComputedColumn(SORTER_NAME, new Expression(expression), calculator);
        rows = null;
    }

    public String sortExpression() {
        return sorter.expression().toString();
    }

    /**
     * Column names in evaluation order.
     */
    public List<String> columns() {
        return columnNames;
    }

    /**
     * Resolves a position: present iff {@code 0 <= id < columns().size()}.
     */
    public OptionalInt columnIndex(int id) {
        return id >= 0 && id < columns.size() ? OptionalInt.of(id) : OptionalInt.empty();
    }

    public OptionalInt columnIndex(String name) {
        Integer index = columnIndexes.get(name);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public Column column(String name) {
        return columns.get(columnIndex(name).orElseThrow(() -> new UnknownColumnException(name)));
    }

    public Column column(int id) {
        return columns.get(columnIndex(id).orElseThrow(() -> new UnknownColumnException(id)));
    }

    public int size() {
        return data.size();
    }

    public CalculatedRow get(int index) {
        return realizedRows().get(index);
    }

    @Override
    public Iterator<CalculatedRow> iterator() {
        return realizedRows().iterator();
    }

    /**
     * Number of cells whose computation failed in the last pass. Reading one
     * of those cells rethrows its failure.
     */
    public int failedCellCount() {
        realizedRows();
        return failedCells;
    }

    /**
     * All rows, stably ordered by their sort value, with every cell computed.
     *
     * @throws ComputationException if a cell contains a loop
     * @throws ExpressionException if a cell's expression is malformed
     * @throws UnknownColumnException if a cell references a missing column
     */
    public TabularData toTabularData() {
        List<CalculatedRow> sorted = new ArrayList<>(realizedRows());
        Collections.sort(sorted);
        TabularData result = new TabularData(columnNames);
        for (CalculatedRow row : sorted) {
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                values.put(columnNames.get(i), row.get(i));
            }
            result.addRow(values);
        }
        return result;
    }

    private void addColumn(List<Column> group, Column column) {
        if (columnIndexes.containsKey(column.name())) {
            throw new ComputationException(column.name() + " already exists!");
        }
        group.add(column);
        try {
            rebuildColumns(dataColumns);
        } catch (ComputationException e) {
            group.remove(group.size() - 1);
            throw e;
        }
    }

    private void rebuildColumns(List<Column> newDataColumns) {
        List<Column> all = new ArrayList<>();
        Map<String, Integer> indexes = new HashMap<>();
        for (List<Column> group : List.of(newDataColumns, computedColumns, copydownColumns, counterColumns)) {
            for (Column column : group) {
                if (indexes.putIfAbsent(column.name(), all.size()) != null) {
                    throw new ComputationException(column.name() + " already exists!");
                }
                all.add(column);
            }
        }
        List<String> names = new ArrayList<>(all.size());
        all.forEach(column -> names.add(column.name()));

        this.columns = Collections.unmodifiableList(all);
        this.columnNames = Collections.unmodifiableList(names);
        this.columnIndexes = indexes;
        this.rows = null;
    }

    private List<CalculatedRow> realizedRows() {
        if (rows == null) {
            rows = Collections.unmodifiableList(computeRows());
        }
        return rows;
    }

    // Copydown and counter columns depend on the rows before them, so the
    // pass walks rows in their original order.
    private List<CalculatedRow> computeRows() {
        columns.forEach(Column::reset);
        failedCells = 0;
        List<CalculatedRow> computed = new ArrayList<>(data.size());
        for (Map<String, String> record : data.getRows()) {
            CalculatedRow row = new CalculatedRow(this, record, columns.size());
            for (int i = 0; i < columns.size(); i++) {
                try {
                    row.cell(i, List.of());
                } catch (ComputationException | ExpressionException | IndexOutOfBoundsException e) {
                    failedCells++;
                }
            }
            row.setSortValue(sortValue(row));
            computed.add(row);
        }
        return computed;
    }

    private BigDecimal sortValue(CalculatedRow row) {
        String value = sorter.computeWithoutCheck(row, List.of());
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new ComputationException("Sort expression " + sorter.expression() + " gave a non-numeric value: '" + value + "'");
        }
    }
}

package org.dxworks.logframe.calc;

import org.dxworks.logframe.model.TabularData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static org.dxworks.logframe.TestUtils.table;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ColumnCalculatorTest {

    private static final String NEW_COLUMN = "NEW_COLUMN";

    private TabularData data;
    private ColumnCalculator calc;

    @BeforeEach
    void setUp() {
        data = table(List.of("stim_time", "run_start"), List.of(
                List.of("5000", "1000"),
                List.of("6000", "1000"),
                List.of("7500", "2000")));
        calc = new ColumnCalculator();
        calc.setData(data);
    }

    @Nested
    class Indexing {

        @Test
        void hasOnlyDataColumnsInitially() {
            assertEquals(data.getColumns(), calc.columns());
            assertEquals(3, calc.size());
        }

        @Test
        void returnsData() {
            assertEquals("5000", calc.get(0).get("stim_time"));
            assertEquals("2000", calc.get(2).get(1));
        }

        @Test
        void findsIndexesByNameAndPosition() {
            assertEquals(OptionalInt.of(0), calc.columnIndex("stim_time"));
            assertEquals(OptionalInt.of(1), calc.columnIndex("run_start"));
            assertEquals(OptionalInt.of(1), calc.columnIndex(1));
        }

        @Test
        void missingIndexesAreEmpty() {
            assertEquals(OptionalInt.empty(), calc.columnIndex("not_present"));
            assertEquals(OptionalInt.empty(), calc.columnIndex(calc.columns().size()));
            assertEquals(OptionalInt.empty(), calc.columnIndex(-1));
        }

        @Test
        void indexLookupMatchesNamedLookup() {
            calc.computedColumn(NEW_COLUMN, "{stim_time}*2");
            int index = calc.columnIndex(NEW_COLUMN).orElseThrow();
            assertSame(calc.column(NEW_COLUMN), calc.column(index));
            assertEquals(calc.get(1).get(NEW_COLUMN), calc.get(1).get(index));
        }

        @Test
        void computedColumnsAreAppended() {
            int previousSize = calc.columns().size();
            calc.computedColumn(NEW_COLUMN, "1");
            assertEquals(previousSize + 1, calc.columns().size());
            assertEquals(OptionalInt.of(previousSize), calc.columnIndex(NEW_COLUMN));
            assertEquals(OptionalInt.of(previousSize), calc.columnIndex(previousSize));
        }

        @Test
        void rowRejectsUnknownColumns() {
            CalculatedRow row = calc.get(0);
            assertThrows(UnknownColumnException.class, () -> row.get(NEW_COLUMN));
            assertThrows(IndexOutOfBoundsException.class, () -> row.get(calc.columns().size()));
            assertThrows(UnknownColumnException.class, () -> row.compute("nonexistent"));
        }

        @Test
        void rejectsDuplicateNames() {
            List<String> before = calc.columns();
            assertThrows(ComputationException.class, () -> calc.computedColumn("stim_time", "1"));
            assertEquals(before, calc.columns());

            calc.copydownColumn("copied", "stim_time");
            assertThrows(ComputationException.class, () -> calc.counterColumn("copied"));
            assertThrows(ComputationException.class, () -> calc.copydownColumn("copied", "run_start"));
            assertEquals(List.of("stim_time", "run_start", "copied"), calc.columns());
        }

        @Test
        void ordersColumnsByKind() {
            calc.counterColumn("counter");
            calc.copydownColumn("copy", "stim_time");
            calc.computedColumn("computed", "1");
            assertEquals(List.of("stim_time", "run_start", "computed", "copy", "counter"), calc.columns());
        }

        @Test
        void iteratesRowsInOrder() {
            int count = 0;
            for (CalculatedRow row : calc) {
                assertEquals(data.get(count, "stim_time"), row.get("stim_time"));
                count++;
            }
            assertEquals(3, count);
        }
    }

    @Nested
    class StaticExpressions {

        @Test
        void computesConstants() {
            calc.computedColumn("always_1", "1");
            assertEquals("1", calc.get(0).compute("always_1"));
            assertEquals("1", calc.get(0).get("always_1"));
        }

        @Test
        void computesGroupedArithmetic() {
            calc.computedColumn("test", "(3+2)*4");
            calc.computedColumn("add_mul", "5*(6+2)");
            for (CalculatedRow row : calc) {
                assertEquals("20", row.get("test"));
                assertEquals("40", row.get("add_mul"));
            }
        }

        @Test
        void returnsDataForDataColumns() {
            assertEquals("5000", calc.get(0).compute("stim_time"));
        }
    }

    @Nested
    class ColumnReferences {

        @Test
        void computesFromDataColumns() {
            calc.computedColumn("stim_time_s", "{stim_time}/1000");
            assertEquals(List.of("5", "6", "7.5"), values("stim_time_s"));
        }

        @Test
        void subtractsTwoColumns() {
            calc.computedColumn("stim_from_run", "{stim_time}-{run_start}");
            for (CalculatedRow row : calc) {
                long expected = Long.parseLong(row.get("stim_time")) - Long.parseLong(row.get("run_start"));
                assertEquals(Long.toString(expected), row.get("stim_from_run"));
            }
        }

        @Test
        void chainsComputedColumns() {
            calc.computedColumn("stim_from_run", "{stim_time}-{run_start}");
            calc.computedColumn("stim_run_s", "{stim_from_run} / 1000");
            assertEquals(List.of("4", "5", "5.5"), values("stim_run_s"));
        }

        @Test
        void referencesColumnsDeclaredLater() {
            calc.computedColumn("twice_later", "{later} * 2");
            calc.computedColumn("later", "{run_start} + 1");
            assertEquals("2002", calc.get(0).get("twice_later"));
        }

        @Test
        void treatsBlankValuesAsZero() {
            ColumnCalculator sparse = new ColumnCalculator(table(List.of("a", "b"), List.of(List.of("7", ""))));
            sparse.computedColumn("sum", "{a} + {b}");
            assertEquals("7", sparse.get(0).get("sum"));
        }

        @Test
        void concatenatesTextValues() {
            ColumnCalculator text = new ColumnCalculator(table(List.of("name", "n"), List.of(List.of("it's", "-3"))));
            text.computedColumn("label", "{name} & '_' & {n}");
            text.computedColumn("negated", "0-{n}");
            assertEquals("it's_-3", text.get(0).get("label"));
            assertEquals("3", text.get(0).get("negated"));
        }

        @Test
        void concatenationKeepsNumbersAsWritten() {
            ColumnCalculator ids = new ColumnCalculator(table(List.of("subject", "rate", "offset"),
                    List.of(List.of("007", "1.50", "-2.0"))));
            ids.computedColumn("label", "{subject} & '_' & {rate} & '_' & {offset}");
            ids.computedColumn("rate_sum", "{rate} + 0");
            assertEquals("007_1.50_-2.0", ids.get(0).get("label"));
            assertEquals("1.5", ids.get(0).get("rate_sum"));
        }

        @Test
        void failsOnMissingColumnWhenRead() {
            calc.computedColumn("borked", "{stim_time} - {not_there}");
            calc.computedColumn("fine", "{stim_time} + 1");
            CalculatedRow row = calc.get(0);
            assertThrows(IndexOutOfBoundsException.class, () -> row.get("borked"));
            assertEquals("5001", row.get("fine"));
            assertEquals(3, calc.failedCellCount());
        }

        @Test
        void detectsLoops() {
            calc.computedColumn("loop1", "{stim_time} - {run_start} - {loop3}");
            calc.computedColumn("loop2", "{loop1}");
            calc.computedColumn("loop3", "{loop2}");
            calc.computedColumn("loop4", "{loop3}");
            calc.computedColumn("independent", "{stim_time} / 1000");
            CalculatedRow row = calc.get(0);
            assertThrows(ComputationException.class, () -> row.get("loop4"));
            assertThrows(ComputationException.class, () -> row.get("loop1"));
            assertEquals("5", row.get("independent"));
        }

        @Test
        void detectsSelfReference() {
            calc.computedColumn("self", "{self} + 1");
            assertThrows(ComputationException.class, () -> calc.get(0).get("self"));
        }

        @Test
        void computesDiamondDependencies() {
            calc.computedColumn("c1", "{stim_time} - {run_start}");
            calc.computedColumn("c2", "{c1}");
            calc.computedColumn("c3", "{c1} - {c2}");
            assertDoesNotThrow(() -> calc.get(0).get("c3"));
            assertEquals("0", calc.get(0).get("c3"));
            assertEquals(0, calc.failedCellCount());
        }

        @Test
        void reportsMalformedExpressionsWhenRead() {
            calc.computedColumn("broken", "({stim_time}");
            assertThrows(ExpressionParseException.class, () -> calc.get(0).get("broken"));
        }
    }

    @Nested
    class Sorting {

        @Test
        void keepsOriginalOrderByDefault() {
            assertEquals("1", calc.sortExpression());
            TabularData sorted = calc.toTabularData();
            assertEquals("5000", sorted.get(0, "stim_time"));
            assertEquals("7500", sorted.get(2, "stim_time"));
        }

        @Test
        void sortsByExpression() {
            calc.sortExpression("0 - {stim_time}");
            calc.computedColumn("stim_s", "{stim_time} / 1000");
            TabularData sorted = calc.toTabularData();
            assertEquals(List.of("stim_time", "run_start", "stim_s"), sorted.getColumns());
            assertEquals("7.5", sorted.get(0, "stim_s"));
            assertEquals("5", sorted.get(2, "stim_s"));
            assertTrue(calc.get(0).compareTo(calc.get(2)) > 0);
        }

        @Test
        void sortIsStableForEqualKeys() {
            calc.sortExpression("{run_start}");
            TabularData sorted = calc.toTabularData();
            assertEquals("5000", sorted.get(0, "stim_time"));
            assertEquals("6000", sorted.get(1, "stim_time"));
            assertEquals("7500", sorted.get(2, "stim_time"));
        }

        @Test
        void rejectsNonNumericSortValues() {
            calc.sortExpression("'x' & {stim_time}");
            assertThrows(ComputationException.class, () -> calc.get(0));
        }
    }

    @Test
    void constructsWithCalculator() {
        ColumnCalculator withCalculator = new ColumnCalculator(new Calculator());
        withCalculator.setData(data);
        withCalculator.computedColumn("half", "{run_start} / 2");
        assertEquals("500", withCalculator.get(0).get("half"));
    }

    private List<String> values(String column) {
        List<String> values = new ArrayList<>();
        for (CalculatedRow row : calc) {
            values.add(row.get(column));
        }
        return values;
    }
}

package org.dxworks.logframe.calc;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionTest {

    private static final String TEXT = "({stim_time}-{run_start}) / 1000";

    @Test
    void findsReferencedColumns() {
        Expression expression = Expression.parse(TEXT);
        assertEquals(List.of("stim_time", "run_start"), expression.columns());
    }

    @Test
    void deduplicatesInFirstOccurrenceOrder() {
        Expression expression = new Expression("{b} + {a} * {b} - {a}");
        assertEquals(List.of("b", "a"), expression.columns());
    }

    @Test
    void columnsCannotBeChanged() {
        Expression expression = Expression.parse(TEXT);
        assertThrows(UnsupportedOperationException.class, () -> expression.columns().add("wakka"));
    }

    @Test
    void keepsOriginalText() {
        assertEquals(TEXT, Expression.parse(TEXT).toString());
    }

    @Test
    void constantHasNoColumns() {
        assertTrue(Expression.parse("(3+2)*4").columns().isEmpty());
    }
}

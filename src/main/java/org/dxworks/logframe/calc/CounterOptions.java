package org.dxworks.logframe.calc;

import java.util.Locale;
import java.util.Objects;
import java.util.function.LongUnaryOperator;
import java.util.function.Predicate;

/**
 * Settings for a {@link CounterColumn}. Defaults: start at 0, count by one on
 * every row, never reset.
 */
public class CounterOptions {

    public static final LongUnaryOperator SUCCESSOR = value -> value + 1;
    public static final LongUnaryOperator PREDECESSOR = value -> value - 1;

    private long startValue = 0;
    private LongUnaryOperator countBy = SUCCESSOR;
    private Predicate<CalculatedRow> countWhen = row -> true;
    private Predicate<CalculatedRow> resetWhen = row -> false;

    public static CounterOptions defaults() {
        return new CounterOptions();
    }

    public CounterOptions startValue(long startValue) {
        this.startValue = startValue;
        return this;
    }

    public CounterOptions countBy(LongUnaryOperator countBy) {
        this.countBy = Objects.requireNonNull(countBy, "countBy");
        return this;
    }

    public CounterOptions countBy(long delta) {
        return countBy(value -> value + delta);
    }

    /**
     * Counts with a named operation: {@code succ} or {@code pred}.
     */
    public CounterOptions countBy(String operation) {
        return countBy(namedOperation(operation));
    }

    public CounterOptions countWhen(Predicate<CalculatedRow> countWhen) {
        this.countWhen = Objects.requireNonNull(countWhen, "countWhen");
        return this;
    }

    public CounterOptions resetWhen(Predicate<CalculatedRow> resetWhen) {
        this.resetWhen = Objects.requireNonNull(resetWhen, "resetWhen");
        return this;
    }

    public long getStartValue() {
        return startValue;
    }

    public LongUnaryOperator getCountBy() {
        return countBy;
    }

    public Predicate<CalculatedRow> getCountWhen() {
        return countWhen;
    }

    public Predicate<CalculatedRow> getResetWhen() {
        return resetWhen;
    }

    public static LongUnaryOperator namedOperation(String operation) {
        switch (operation.trim().toLowerCase(Locale.ROOT)) {
            case "succ":
            case "next":
                return SUCCESSOR;
            case "pred":
                return PREDECESSOR;
            default:
                throw new IllegalArgumentException("Unknown counting operation: " + operation);
        }
    }
}

package org.dxworks.logframe.calc;

import java.util.List;

/**
 * A running value that is reset and advanced according to per-row predicates.
 * The reset check runs before the count check, so a row that triggers both
 * sees {@code countBy(startValue)}. Rows must be computed in order.
 */
public class CounterColumn implements Column {

    private final String name;
    private final CounterOptions options;
    private long currentValue;

    public CounterColumn(String name, CounterOptions options) {
        this.name = name;
        this.options = options;
        this.currentValue = options.getStartValue();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String compute(CalculatedRow row, List<String> path) {
        if (options.getResetWhen().test(row)) {
            currentValue = options.getStartValue();
        }
        if (options.getCountWhen().test(row)) {
            currentValue = options.getCountBy().applyAsLong(currentValue);
        }
        return Long.toString(currentValue);
    }

    @Override
    public void reset() {
        currentValue = options.getStartValue();
    }
}

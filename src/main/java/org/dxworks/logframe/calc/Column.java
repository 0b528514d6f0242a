package org.dxworks.logframe.calc;

import java.util.List;

/**
 * One column of a {@link ColumnCalculator}. Implementations produce the cell
 * value for a row; {@code path} lists the columns whose evaluation is in
 * progress for that row and is used to detect dependency loops.
 */
public interface Column {

    String name();

    String compute(CalculatedRow row, List<String> path);

    /**
     * Clears state carried from row to row. Called before every full pass.
     */
    default void reset() {
    }
}

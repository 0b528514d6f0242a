package org.dxworks.logframe.calc;

/**
 * Thrown when a row or calculator is indexed with a column name or position
 * that does not exist.
 */
public class UnknownColumnException extends IndexOutOfBoundsException {

    private final transient Object columnId;

    public UnknownColumnException(Object columnId) {
        super(columnId + " does not exist");
        this.columnId = columnId;
    }

    public Object getColumnId() {
        return columnId;
    }
}

package org.dxworks.logframe.calc;

/**
 * Raised when a column cannot be registered (duplicate name) or a cell cannot
 * be computed because its dependencies loop back on themselves.
 */
public class ComputationException extends RuntimeException {

    public ComputationException(String message) {
        super(message);
    }
}

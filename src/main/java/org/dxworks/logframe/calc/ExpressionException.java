package org.dxworks.logframe.calc;

/**
 * Base type for failures while parsing or evaluating a column expression.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}

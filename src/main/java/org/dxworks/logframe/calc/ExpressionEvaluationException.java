package org.dxworks.logframe.calc;

public class ExpressionEvaluationException extends ExpressionException {

    public ExpressionEvaluationException(String message) {
        super(message);
    }

    public ExpressionEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}

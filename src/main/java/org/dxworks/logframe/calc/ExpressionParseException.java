package org.dxworks.logframe.calc;

public class ExpressionParseException extends ExpressionException {

    private final int position;

    public ExpressionParseException(String message, String expression, int position) {
        super(message + " at position " + position + " in: " + expression);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}

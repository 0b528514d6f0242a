package org.dxworks.logframe.calc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A column whose value is an {@link Expression} over other columns of the same row.
 */
public class ComputedColumn implements Column {

    private static final Pattern PLAIN_NUMBER = Pattern.compile("-?(\\d+(\\.\\d*)?|\\.\\d+)");

    private final String name;
    private final Expression expression;
    private final Calculator calculator;

    public ComputedColumn(String name, Expression expression, Calculator calculator) {
        this.name = name;
        this.expression = expression;
        this.calculator = calculator;
    }

    @Override
    public String name() {
        return name;
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public String compute(CalculatedRow row, List<String> path) {
        String stored = row.dataValue(name);
        if (stored != null) {
            return stored;
        }
        return computeWithoutCheck(row, path);
    }

    /**
     * Evaluates the expression without first looking for a stored value named
     * like this column.
     */
    public String computeWithoutCheck(CalculatedRow row, List<String> path) {
        if (path.contains(name)) {
            throw new ComputationException(expression + " contains a loop with " + name + " -- can't compute");
        }
        List<String> nextPath = new ArrayList<>(path);
        nextPath.add(name);

        Map<String, String> values = new LinkedHashMap<>();
        for (String reference : expression.columns()) {
            values.put(reference, toLiteral(row.compute(reference, nextPath)));
        }
        return calculator.compute(substitute(expression.toString(), values));
    }

    private static String substitute(String text, Map<String, String> values) {
        Matcher matcher = Expression.COLUMN_REFERENCE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(values.get(matcher.group(1))));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    static String toLiteral(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            return "0";
        }
        if (PLAIN_NUMBER.matcher(trimmed).matches()) {
            return trimmed.startsWith("-") ? "(" + trimmed + ")" : trimmed;
        }
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    public String toString() {
        return name + " = " + expression;
    }
}

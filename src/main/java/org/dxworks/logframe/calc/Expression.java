package org.dxworks.logframe.calc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A column expression as written by the user, e.g. {@code ({stim_time}-{run_start}) / 1000}.
 * Holds the raw text and the names of the columns it references, in order of
 * first occurrence and without duplicates.
 */
public final class Expression {

    static final Pattern COLUMN_REFERENCE = Pattern.compile("\\{([^}]*)}");

    private final String text;
    private final List<String> columns;

    public Expression(String text) {
        this.text = Objects.requireNonNull(text, "text");
        this.columns = findColumns(text);
    }

    public static Expression parse(String text) {
        return new Expression(text);
    }

    /**
     * Referenced column names. The list cannot be modified.
     */
    public List<String> columns() {
        return columns;
    }

    public static String reference(String columnName) {
        return "{" + columnName + "}";
    }

    private static List<String> findColumns(String text) {
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = COLUMN_REFERENCE.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group(1));
        }
        return Collections.unmodifiableList(new ArrayList<>(found));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Expression)) return false;
        return text.equals(((Expression) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}

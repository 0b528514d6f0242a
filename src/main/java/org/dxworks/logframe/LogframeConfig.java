package org.dxworks.logframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.logframe.calc.CalculatedRow;
import org.dxworks.logframe.calc.ColumnCalculator;
import org.dxworks.logframe.calc.CounterOptions;
import org.dxworks.logframe.reader.log.LevelNamer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

public class LogframeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 200000;
    private static final String CONFIG_FILE_NAME = "logframe-config.yml";

    private final int maxFileLines;
    private final String levelNamingKey;
    private final boolean levelCounters;
    private final List<String> columnOrder;
    private final List<ComputedColumnDefinition> computedColumns;
    private final List<CopydownColumnDefinition> copydownColumns;
    private final List<CounterColumnDefinition> counterColumns;
    private final String sortExpression;

    private LogframeConfig(YamlConfig yaml) {
        this.maxFileLines = (yaml.maxFileLines != null && yaml.maxFileLines > 0)
                ? yaml.maxFileLines
                : DEFAULT_MAX_FILE_LINES;
        this.levelNamingKey = blankToNull(yaml.levelNamingKey);
        this.levelCounters = yaml.levelCounters == null || yaml.levelCounters;
        this.columnOrder = copyOrEmpty(yaml.columnOrder);
        this.computedColumns = copyOrEmpty(yaml.computedColumns);
        this.copydownColumns = copyOrEmpty(yaml.copydownColumns);
        this.counterColumns = copyOrEmpty(yaml.counterColumns);
        this.sortExpression = blankToNull(yaml.sortExpression);
    }

    public static LogframeConfig defaults() {
        return new LogframeConfig(new YamlConfig());
    }

    public static LogframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static LogframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return new LogframeConfig(yamlConfig);
            }
        } catch (IOException e) {
            System.err.println("Warning: ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public String getLevelNamingKey() {
        return levelNamingKey;
    }

    public LevelNamer levelNamer() {
        return levelNamingKey == null ? LevelNamer.markerName() : LevelNamer.byKey(levelNamingKey);
    }

    public boolean isLevelCounters() {
        return levelCounters;
    }

    public List<String> getColumnOrder() {
        return columnOrder;
    }

    public List<ComputedColumnDefinition> getComputedColumns() {
        return computedColumns;
    }

    public List<CopydownColumnDefinition> getCopydownColumns() {
        return copydownColumns;
    }

    public List<CounterColumnDefinition> getCounterColumns() {
        return counterColumns;
    }

    public String getSortExpression() {
        return sortExpression;
    }

    public boolean hasDerivedColumns() {
        return !computedColumns.isEmpty() || !copydownColumns.isEmpty()
                || !counterColumns.isEmpty() || sortExpression != null;
    }

    /**
     * Registers the configured derived columns and sort expression.
     */
    public void applyTo(ColumnCalculator calculator) {
        for (ComputedColumnDefinition column : computedColumns) {
            calculator.computedColumn(column.name, column.expression);
        }
        for (CopydownColumnDefinition column : copydownColumns) {
            calculator.copydownColumn(column.name, column.source);
        }
        for (CounterColumnDefinition column : counterColumns) {
            calculator.counterColumn(column.name, column.toOptions());
        }
        if (sortExpression != null) {
            calculator.sortExpression(sortExpression);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static <T> List<T> copyOrEmpty(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    public static class ComputedColumnDefinition {
        public String name;
        public String expression;
    }

    public static class CopydownColumnDefinition {
        public String name;
        public String source;
    }

    public static class CounterColumnDefinition {
        public String name;
        public Long startValue;
        // a number (step) or the name of an operation: succ, pred
        public Object countBy;
        public Condition countWhen;
        public Condition resetWhen;

        CounterOptions toOptions() {
            CounterOptions options = CounterOptions.defaults();
            if (startValue != null) {
                options.startValue(startValue);
            }
            if (countBy instanceof Number) {
                options.countBy(((Number) countBy).longValue());
            } else if (countBy != null) {
                String text = countBy.toString().trim();
                try {
                    options.countBy(Long.parseLong(text));
                } catch (NumberFormatException e) {
                    options.countBy(text);
                }
            }
            if (countWhen != null) {
                options.countWhen(countWhen.toPredicate());
            }
            if (resetWhen != null) {
                options.resetWhen(resetWhen.toPredicate());
            }
            return options;
        }
    }

    /**
     * Matches rows whose {@code column} equals {@code equals}, or, without
     * {@code equals}, rows where the column is not blank.
     */
    public static class Condition {
        public String column;
        public String equals;

        Predicate<CalculatedRow> toPredicate() {
            String columnName = column;
            String expected = equals;
            if (expected == null) {
                return row -> !row.get(columnName).isBlank();
            }
            return row -> expected.equals(row.get(columnName));
        }
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public String levelNamingKey;
        public Boolean levelCounters;
        public List<String> columnOrder = new ArrayList<>();
        public List<ComputedColumnDefinition> computedColumns = new ArrayList<>();
        public List<CopydownColumnDefinition> copydownColumns = new ArrayList<>();
        public List<CounterColumnDefinition> counterColumns = new ArrayList<>();
        public String sortExpression;
    }
}

package org.dxworks.logframe.reader.log;

import org.dxworks.logframe.model.TabularData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The frames of one log file after levels have been assigned and ambiguous
 * keys renamed. Flattens into one row per leaf frame.
 */
public class ParsedLog {

    static final String EXPERIMENT_KEY = "Experiment";
    static final String EXPERIMENT_COLUMN = "ExperimentName";

    private final FrameTree tree;
    private final Map<Integer, String> levelNames;
    private final int topLevel;
    private final Set<String> skipColumns;
    private final boolean levelCounters;

    ParsedLog(FrameTree tree, Map<Integer, String> levelNames, int topLevel,
              Set<String> skipColumns, boolean levelCounters) {
        this.tree = tree;
        this.levelNames = Collections.unmodifiableMap(levelNames);
        this.topLevel = topLevel;
        this.skipColumns = Collections.unmodifiableSet(skipColumns);
        this.levelCounters = levelCounters;
    }

    public FrameTree tree() {
        return tree;
    }

    public List<Frame> frames() {
        return tree.frames();
    }

    /**
     * Distinct level names in the order they first appear.
     */
    public Set<String> levels() {
        Set<String> names = new LinkedHashSet<>();
        tree.frames().forEach(frame -> names.add(frame.getLevelName()));
        return Collections.unmodifiableSet(names);
    }

    public Map<Integer, String> levelNames() {
        return levelNames;
    }

    public int topLevel() {
        return topLevel;
    }

    public List<Frame> topFrames() {
        return framesAtLevel(topLevel);
    }

    /**
     * The innermost frames; each becomes one row.
     */
    public List<Frame> leafFrames() {
        return framesAtLevel(1);
    }

    /**
     * Bare names of keys that occur at more than one level. They are left out
     * of the output in favour of their qualified {@code Name[Level]} forms.
     */
    public Set<String> skipColumns() {
        return skipColumns;
    }

    public List<String> columns() {
        return toTabularData().getColumns();
    }

    public TabularData toTabularData() {
        return toTabularData(List.of());
    }

    public TabularData toTabularData(List<String> columnOrder) {
        TabularData data = new TabularData();
        for (Frame leaf : leafFrames()) {
            data.addRow(flatten(leaf));
        }
        if (!columnOrder.isEmpty()) {
            data.orderColumns(columnOrder);
        }
        return data;
    }

    private Map<String, String> flatten(Frame leaf) {
        List<Frame> ancestry = tree.ancestry(leaf);
        Map<String, String> row = new LinkedHashMap<>();
        for (Frame frame : ancestry) {
            frame.values().forEach(row::putIfAbsent);
        }
        row = renameExperiment(row);
        row.keySet().removeAll(skipColumns);
        if (levelCounters) {
            List<Frame> outermostFirst = new ArrayList<>(ancestry);
            Collections.reverse(outermostFirst);
            for (Frame frame : outermostFirst) {
                if (frame.getLevel() < topLevel) {
                    row.putIfAbsent(frame.getLevelName(), Integer.toString(tree.siblingOrdinal(frame)));
                }
            }
        }
        return row;
    }

    private static Map<String, String> renameExperiment(Map<String, String> row) {
        if (!row.containsKey(EXPERIMENT_KEY) || row.containsKey(EXPERIMENT_COLUMN)) {
            return row;
        }
        Map<String, String> renamed = new LinkedHashMap<>();
        row.forEach((key, value) -> renamed.put(EXPERIMENT_KEY.equals(key) ? EXPERIMENT_COLUMN : key, value));
        return renamed;
    }

    private List<Frame> framesAtLevel(int level) {
        return tree.frames().stream()
                .filter(frame -> frame.getLevel() == level)
                .collect(Collectors.toList());
    }
}

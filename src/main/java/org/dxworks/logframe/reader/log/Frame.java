package org.dxworks.logframe.reader.log;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One {@code *** Name-Begin ***} ... {@code *** Name-End ***} block of a log
 * file. Frames are stored in a {@link FrameTree} and refer to their parent by
 * index. Level 1 is the innermost level; levels grow outward.
 */
public class Frame {

    public static final int NO_PARENT = -1;

    private final int index;
    private final int parentIndex;
    private final String levelName;
    private final int depth;
    private final int line;
    private final Map<String, String> values = new LinkedHashMap<>();
    private int level;

    Frame(int index, int parentIndex, String levelName, int depth, int line) {
        this.index = index;
        this.parentIndex = parentIndex;
        this.levelName = levelName;
        this.depth = depth;
        this.line = line;
    }

    public int getIndex() {
        return index;
    }

    public int getParentIndex() {
        return parentIndex;
    }

    public boolean hasParent() {
        return parentIndex != NO_PARENT;
    }

    /**
     * The name in the frame's begin marker, e.g. {@code Trial}.
     */
    public String getLevelName() {
        return levelName;
    }

    /**
     * Nesting depth; 0 for frames opened outside any other frame.
     */
    public int getDepth() {
        return depth;
    }

    /**
     * Line number of the begin marker.
     */
    public int getLine() {
        return line;
    }

    public int getLevel() {
        return level;
    }

    void setLevel(int level) {
        this.level = level;
    }

    public String get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<String, String> values() {
        return Collections.unmodifiableMap(values);
    }

    public int size() {
        return values.size();
    }

    void put(String key, String value) {
        values.put(key, value);
    }

    /**
     * Replaces {@code from} with {@code to}, keeping the key's position.
     */
    void renameKey(String from, String to) {
        if (!values.containsKey(from)) {
            return;
        }
        Map<String, String> renamed = new LinkedHashMap<>();
        values.forEach((key, value) -> renamed.put(key.equals(from) ? to : key, value));
        values.clear();
        values.putAll(renamed);
    }

    @Override
    public String toString() {
        return levelName + "#" + index + "(level " + level + ", " + values.size() + " keys)";
    }
}

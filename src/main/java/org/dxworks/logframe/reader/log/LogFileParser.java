package org.dxworks.logframe.reader.log;

import org.dxworks.logframe.model.TabularData;
import org.dxworks.logframe.reader.TableReader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads nested experiment logs:
 *
 * <pre>
 * *** Session-Begin ***
 * Experiment: Stroop
 * SessionTime: 11:11:11
 *     *** Trial-Begin ***
 *     Stim.RT: 512
 *     *** Trial-End ***
 * *** Session-End ***
 * </pre>
 *
 * <p>The E-Prime spellings {@code *** LogFrame Start ***} / {@code *** LogFrame End ***}
 * are accepted as well. A {@code Key: Value} line belongs to the innermost open
 * frame and is split on its first colon only. Lines that are neither markers
 * nor key lines are skipped; a frame left open at the end of input makes the
 * file damaged.
 *
 * <p>Every marker name gets one level, numbered from the inside out: the name
 * found most deeply nested is level 1, so a {@code Trial} is a leaf whether it
 * sits inside a {@code Block} or directly inside the {@code Session}. A key
 * found at more than one level is renamed to {@code Key[LevelName]} in every
 * frame that has it, and the bare key is skipped in the output.
 */
public class LogFileParser implements TableReader {

    static final Pattern MARKER = Pattern.compile("^\\*{3}\\s*(.+?)(?:\\s+|\\s*-\\s*)(Start|Begin|End)\\s*\\*{3}$");

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final LevelNamer levelNamer;
    private final boolean levelCounters;
    private final List<String> columnOrder;

    public LogFileParser() {
        this(LevelNamer.markerName(), true, List.of());
    }

    public LogFileParser(LevelNamer levelNamer, boolean levelCounters, List<String> columnOrder) {
        this.levelNamer = Objects.requireNonNull(levelNamer, "levelNamer");
        this.levelCounters = levelCounters;
        this.columnOrder = List.copyOf(columnOrder);
    }

    @Override
    public boolean canParse(List<String> firstLines) {
        for (String line : firstLines) {
            if (line == null) {
                return false;
            }
            String text = clean(line);
            if (!text.isEmpty()) {
                Matcher matcher = MARKER.matcher(text);
                return matcher.matches() && !"End".equals(matcher.group(2));
            }
        }
        return false;
    }

    @Override
    public TabularData read(Reader input) throws IOException {
        return parse(input).toTabularData(columnOrder);
    }

    public ParsedLog parse(Reader input) throws IOException {
        BufferedReader reader = input instanceof BufferedReader ? (BufferedReader) input : new BufferedReader(input);
        FrameTree tree = new FrameTree();
        Deque<Frame> open = new ArrayDeque<>();
        Map<String, Integer> deepestByName = new LinkedHashMap<>();

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String text = clean(line);
            if (text.isEmpty()) {
                continue;
            }
            Matcher marker = MARKER.matcher(text);
            if (marker.matches()) {
                if ("End".equals(marker.group(2))) {
                    open.poll();
                } else {
                    int depth = open.size();
                    Frame frame = tree.open(marker.group(1), open.peek(), depth, lineNumber);
                    deepestByName.merge(frame.getLevelName(), depth, Math::max);
                    open.push(frame);
                }
                continue;
            }
            int colon = text.indexOf(':');
            if (colon > 0 && !open.isEmpty()) {
                open.peek().put(text.substring(0, colon).trim(), text.substring(colon + 1).trim());
            }
        }

        if (!open.isEmpty()) {
            Frame unclosed = open.peek();
            throw new DamagedFileException("Frame " + unclosed.getLevelName() + " opened at line "
                    + unclosed.getLine() + " is never closed");
        }

        Map<String, Integer> levelByName = rankLevels(deepestByName);
        Map<Integer, String> levelNames = new TreeMap<>();
        for (Frame frame : tree.frames()) {
            int level = levelByName.get(frame.getLevelName());
            frame.setLevel(level);
            levelNames.putIfAbsent(level, frame.getLevelName());
        }
        int topLevel = new HashSet<>(deepestByName.values()).size();

        Set<String> skipColumns = renameAmbiguousKeys(tree, levelNames);
        return new ParsedLog(tree, levelNames, topLevel, skipColumns, levelCounters);
    }

    // Names are ranked by the deepest nesting they reach; equally deep names share a level.
    private static Map<String, Integer> rankLevels(Map<String, Integer> deepestByName) {
        List<Integer> depths = deepestByName.values().stream()
                .distinct()
                .sorted(Comparator.reverseOrder())
                .collect(Collectors.toList());
        Map<String, Integer> levels = new HashMap<>();
        deepestByName.forEach((name, depth) -> levels.put(name, depths.indexOf(depth) + 1));
        return levels;
    }

    private Set<String> renameAmbiguousKeys(FrameTree tree, Map<Integer, String> levelNames) {
        Map<String, Set<Integer>> keyLevels = new LinkedHashMap<>();
        for (Frame frame : tree.frames()) {
            for (String key : frame.keys()) {
                keyLevels.computeIfAbsent(key, k -> new TreeSet<>()).add(frame.getLevel());
            }
        }

        Set<String> ambiguous = new LinkedHashSet<>();
        keyLevels.forEach((key, levels) -> {
            if (levels.size() > 1) {
                ambiguous.add(key);
            }
        });
        if (ambiguous.isEmpty()) {
            return ambiguous;
        }

        // Names first: a naming key may itself be renamed below.
        Map<Frame, String> frameLevelNames = new HashMap<>();
        for (Frame frame : tree.frames()) {
            frameLevelNames.put(frame, levelNamer.nameFor(frame, levelNames));
        }
        for (Frame frame : tree.frames()) {
            for (String key : ambiguous) {
                frame.renameKey(key, key + "[" + frameLevelNames.get(frame) + "]");
            }
        }
        return ambiguous;
    }

    private static String clean(String line) {
        String text = line.startsWith(BYTE_ORDER_MARK) ? line.substring(1) : line;
        return text.strip();
    }
}

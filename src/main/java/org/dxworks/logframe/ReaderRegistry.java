package org.dxworks.logframe;

import org.dxworks.logframe.reader.ExcelTabParser;
import org.dxworks.logframe.reader.TabDelimitedParser;
import org.dxworks.logframe.reader.TableReader;
import org.dxworks.logframe.reader.log.LogFileParser;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class ReaderRegistry {

    public static Set<String> allFormatNames() {
        return Arrays.stream(InputFormat.values())
            .map(InputFormat::getName)
            .collect(Collectors.toSet());
    }

    /**
     * One reader per format, iterated in detection order.
     */
    public static Map<InputFormat, TableReader> buildReaders(LogframeConfig config) {
        Map<InputFormat, TableReader> readers = new EnumMap<>(InputFormat.class);
        for (InputFormat format : InputFormat.values()) {
            readers.put(format, createReader(format, config));
        }
        return Collections.unmodifiableMap(readers);
    }

    private static TableReader createReader(InputFormat format, LogframeConfig config) {
        return switch (format) {
            case LOG -> new LogFileParser(config.levelNamer(), config.isLevelCounters(), config.getColumnOrder());
            case EXCEL -> new ExcelTabParser();
            case TAB -> new TabDelimitedParser();
        };
    }
}

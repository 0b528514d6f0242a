package org.dxworks.logframe;

import org.dxworks.logframe.reader.TableReader;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tells the input formats apart from the first two lines of a file.
 */
public class FormatDetector {

    static final int SNIFFED_LINES = 2;

    private final Map<InputFormat, TableReader> readers;

    public FormatDetector(Map<InputFormat, TableReader> readers) {
        this.readers = readers;
    }

    public Optional<InputFormat> detect(List<String> firstLines) {
        for (Map.Entry<InputFormat, TableReader> entry : readers.entrySet()) {
            if (entry.getValue().canParse(firstLines)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public InputFormat detect(Path file) throws IOException {
        List<String> firstLines = new ArrayList<>();
        try (BufferedReader reader = TextFiles.open(file)) {
            for (int i = 0; i < SNIFFED_LINES; i++) {
                firstLines.add(reader.readLine());
            }
        }
        return detect(firstLines)
                .orElseThrow(() -> new UnknownTypeException("Can't determine the type of " + file));
    }
}

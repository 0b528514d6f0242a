package org.dxworks.logframe.reader;

import org.dxworks.logframe.model.TabularData;

import java.io.IOException;
import java.io.Reader;
import java.util.List;

public interface TableReader {

    /**
     * Whether this reader understands a file starting with {@code firstLines}
     * (the first two lines; missing lines are {@code null}).
     */
    boolean canParse(List<String> firstLines);

    TabularData read(Reader input) throws IOException;
}

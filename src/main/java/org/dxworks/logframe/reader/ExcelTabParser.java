package org.dxworks.logframe.reader;

import java.util.List;

/**
 * Tab-delimited exports from the experiment tool's data viewer. The first line
 * holds the source file name; the column names follow on the second.
 */
public class ExcelTabParser extends DelimitedTableReader {

    @Override
    public boolean canParse(List<String> firstLines) {
        if (firstLines.size() < 2 || firstLines.get(0) == null) {
            return false;
        }
        return !firstLines.get(0).contains(DELIMITER) && fieldCount(firstLines.get(1)) >= MIN_COLUMNS;
    }

    @Override
    protected int linesBeforeHeader() {
        return 1;
    }
}

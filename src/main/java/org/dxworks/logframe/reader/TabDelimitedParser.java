package org.dxworks.logframe.reader;

import java.util.List;

/**
 * Plain tab-delimited tables: the first line holds the column names.
 */
public class TabDelimitedParser extends DelimitedTableReader {

    @Override
    public boolean canParse(List<String> firstLines) {
        return !firstLines.isEmpty() && fieldCount(firstLines.get(0)) >= MIN_COLUMNS;
    }

    @Override
    protected int linesBeforeHeader() {
        return 0;
    }
}

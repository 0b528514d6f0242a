package org.dxworks.logframe.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One converted input file, as written to the JSONL output.
 */
public class TableResult {
    public String kind = "table";
    public String filePath;
    public String format;
    public List<String> columns = new ArrayList<>();
    public List<Map<String, String>> rows = new ArrayList<>();

    public static TableResult of(String filePath, String format, TabularData data) {
        TableResult result = new TableResult();
        result.filePath = filePath;
        result.format = format;
        result.columns = new ArrayList<>(data.getColumns());
        result.rows = new ArrayList<>(data.getRows());
        return result;
    }
}

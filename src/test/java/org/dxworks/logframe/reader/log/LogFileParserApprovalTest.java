package org.dxworks.logframe.reader.log;

import org.approvaltests.Approvals;
import org.dxworks.logframe.TestUtils;
import org.junit.jupiter.api.Test;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class LogFileParserApprovalTest {

    @Test
    void parse_SmallLog() throws Exception {
        verify(Paths.get(TestUtils.SAMPLES_BASE_PATH, "log", "small_log.txt"));
    }

    private static void verify(Path file) throws Exception {
        ParsedLog log;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            log = new LogFileParser().parse(reader);
        }
        Map<String, Object> snapshot = Map.of(
                "columns", log.columns(),
                "rows", log.toTabularData().getRows(),
                "skipColumns", log.skipColumns(),
                "topLevel", log.topLevel());
        Approvals.verify(TestUtils.APPROVAL_MAPPER.writeValueAsString(snapshot));
    }
}

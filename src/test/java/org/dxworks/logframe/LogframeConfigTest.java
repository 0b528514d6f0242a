package org.dxworks.logframe;

import org.dxworks.logframe.calc.ColumnCalculator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.dxworks.logframe.TestUtils.table;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogframeConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsAllSettings() {
        LogframeConfig config = LogframeConfig.load(Paths.get("src/test/resources/config/logframe-config.yml"));

        assertEquals(5000, config.getMaxFileLines());
        assertEquals("Procedure", config.getLevelNamingKey());
        assertTrue(config.isLevelCounters());
        assertEquals(List.of("ExperimentName", "Subject"), config.getColumnOrder());
        assertEquals(2, config.getComputedColumns().size());
        assertEquals("{stim_time}-{run_start}", config.getComputedColumns().get(0).expression);
        assertEquals("condition", config.getCopydownColumns().get(0).source);
        assertEquals(2, config.getCounterColumns().size());
        assertEquals("0 - {stim_time}", config.getSortExpression());
        assertTrue(config.hasDerivedColumns());
    }

    @Test
    void missingFileGivesDefaults() {
        LogframeConfig config = LogframeConfig.load(tempDir.resolve("absent.yml"));

        assertEquals(200000, config.getMaxFileLines());
        assertNull(config.getLevelNamingKey());
        assertTrue(config.isLevelCounters());
        assertTrue(config.getColumnOrder().isEmpty());
        assertFalse(config.hasDerivedColumns());
    }

    @Test
    void levelCountersCanBeTurnedOff() throws Exception {
        Path file = tempDir.resolve("no-counters.yml");
        Files.writeString(file, "levelCounters: false\n", StandardCharsets.UTF_8);

        assertFalse(LogframeConfig.load(file).isLevelCounters());
    }

    @Test
    void unreadableFileGivesDefaults() throws Exception {
        Path broken = tempDir.resolve("broken.yml");
        Files.writeString(broken, "maxFileLines: [not, a, number\n", StandardCharsets.UTF_8);

        LogframeConfig config = LogframeConfig.load(broken);

        assertEquals(200000, config.getMaxFileLines());
    }

    @Test
    void nonPositiveLineLimitFallsBackToDefault() throws Exception {
        Path file = tempDir.resolve("zero.yml");
        Files.writeString(file, "maxFileLines: 0\nlevelNamingKey: \"  \"\n", StandardCharsets.UTF_8);

        LogframeConfig config = LogframeConfig.load(file);

        assertEquals(200000, config.getMaxFileLines());
        assertNull(config.getLevelNamingKey());
    }

    @Test
    void appliesCounterSettings() throws Exception {
        Path file = tempDir.resolve("counters.yml");
        Files.writeString(file, "counterColumns:\n"
                + "  - name: down\n"
                + "    startValue: 3\n"
                + "    countBy: pred\n"
                + "  - name: per_block\n"
                + "    countBy: \"2\"\n"
                + "    resetWhen:\n"
                + "      column: block\n"
                + "      equals: start\n", StandardCharsets.UTF_8);
        ColumnCalculator calculator = new ColumnCalculator(table(List.of("block"), List.of(
                List.of("start"), List.of(""), List.of("start"))));

        LogframeConfig.load(file).applyTo(calculator);

        assertEquals("2", calculator.get(0).get("down"));
        assertEquals("0", calculator.get(2).get("down"));
        assertEquals("2", calculator.get(0).get("per_block"));
        assertEquals("4", calculator.get(1).get("per_block"));
        assertEquals("2", calculator.get(2).get("per_block"));
    }
}

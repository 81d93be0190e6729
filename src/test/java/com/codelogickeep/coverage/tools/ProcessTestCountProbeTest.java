package com.codelogickeep.coverage.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessTestCountProbeTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("parseCount should take the last Surefire summary")
    void parseCount_shouldUseLastSurefireSummary() {
        String output = """
                [INFO] Tests run: 3, Failures: 0, Errors: 0, Skipped: 0, Time elapsed: 0.1 s - in com.example.ATest
                [INFO] Tests run: 5, Failures: 0, Errors: 0, Skipped: 0, Time elapsed: 0.2 s - in com.example.BTest
                [INFO] Results:
                [INFO] Tests run: 8, Failures: 0, Errors: 0, Skipped: 0
                """;

        assertEquals(8, ProcessTestCountProbe.parseCount(output));
    }

    @Test
    @DisplayName("parseCount should fall back to the first 'N tests' phrase")
    void parseCount_shouldFallBackToGenericCount() {
        assertEquals(42, ProcessTestCountProbe.parseCount("Ran 42 tests in 1.2s\n3 tests skipped"));
        assertEquals(1, ProcessTestCountProbe.parseCount("1 test completed"));
    }

    @Test
    @DisplayName("parseCount should return 0 for unrecognized output")
    void parseCount_shouldReturnZero() {
        assertEquals(0, ProcessTestCountProbe.parseCount("BUILD SUCCESS"));
    }

    @Test
    @DisplayName("parseCount should return 0 when the count does not fit an int")
    void parseCount_shouldReturnZeroOnOverflow() {
        assertEquals(0, ProcessTestCountProbe.parseCount("Tests run: 99999999999, Failures: 0"));
        assertEquals(0, ProcessTestCountProbe.parseCount("Ran 12345678901234 tests"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    @DisplayName("count should return 0 for an oversized count in the command output")
    void count_shouldHandleOversizedCount() {
        ProcessTestCountProbe probe = new ProcessTestCountProbe(
                List.of("sh", "-c", "echo 'Tests run: 99999999999'"), tempDir, 10);

        assertEquals(0, probe.count());
    }

    @Test
    @DisplayName("count should return 0 for an empty command")
    void count_shouldHandleEmptyCommand() {
        assertEquals(0, new ProcessTestCountProbe(List.of(), tempDir, 5).count());
    }

    @Test
    @DisplayName("count should return 0 when the command cannot start")
    void count_shouldHandleMissingExecutable() {
        ProcessTestCountProbe probe = new ProcessTestCountProbe(
                List.of("definitely-not-a-real-command-4711"), tempDir, 5);

        assertEquals(0, probe.count());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    @DisplayName("count should parse the output of a successful command")
    void count_shouldParseCommandOutput() {
        ProcessTestCountProbe probe = new ProcessTestCountProbe(
                List.of("sh", "-c", "echo 'Tests run: 12, Failures: 0'"), tempDir, 10);

        assertEquals(12, probe.count());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    @DisplayName("count should return 0 when the command fails")
    void count_shouldIgnoreFailedCommand() {
        ProcessTestCountProbe probe = new ProcessTestCountProbe(
                List.of("sh", "-c", "echo 'Tests run: 12'; exit 3"), tempDir, 10);

        assertEquals(0, probe.count());
    }
}

package com.codelogickeep.coverage;

import com.codelogickeep.coverage.model.GateOperator;
import com.codelogickeep.coverage.model.GateSeverity;
import com.codelogickeep.coverage.model.QualityGate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Command line tests for App. Exit codes are the contract with CI scripts.
 */
class AppTest {

    @TempDir
    Path tempDir;

    private int run(String... args) {
        return App.newCommandLine().execute(args);
    }

    @Test
    @DisplayName("a missing --config file should exit with the configuration error code")
    void missingConfig_shouldExitWithConfigError() {
        int exitCode = run("analyze", "--project", tempDir.toString(),
                "--config", tempDir.resolve("nope.yml").toString());

        assertEquals(App.EXIT_CONFIG_ERROR, exitCode);
    }

    @Test
    @DisplayName("an invalid configuration should exit with the configuration error code")
    void invalidConfig_shouldExitWithConfigError() throws IOException {
        Path config = tempDir.resolve("bad.yml");
        Files.writeString(config, "tracking:\n  max-history: -3\n");

        assertEquals(App.EXIT_CONFIG_ERROR, run("trends", "--project", tempDir.toString(), "--config", config.toString()));
    }

    @Test
    @DisplayName("analyze should fail without coverage data")
    void analyze_shouldFailWithoutData() {
        assertEquals(1, run("analyze", "--project", tempDir.toString()));
    }

    @Test
    @DisplayName("analyze should write the JSON summary to the output file")
    void analyze_shouldWriteJson() throws IOException {
        CoverageFixtures.writeCalculatorProject(tempDir);
        Path output = tempDir.resolve("out/analysis.json");

        int exitCode = run("analyze", "--project", tempDir.toString(), "--format", "json", "--detailed",
                "-o", output.toString());

        assertEquals(0, exitCode);
        String json = Files.readString(output);
        assertTrue(json.contains("\"summary\""));
        assertTrue(json.contains("\"gaps_detail\""));
    }

    @Test
    @DisplayName("ci --quick should exit by the line coverage threshold")
    void ciQuick_shouldUseMinCoverage() throws IOException {
        CoverageFixtures.writeCalculatorProject(tempDir);

        assertEquals(0, run("ci", "--project", tempDir.toString(), "--quick", "--min-coverage", "75"));
        assertEquals(1, run("ci", "--project", tempDir.toString(), "--quick", "--min-coverage", "90"));
    }

    @Test
    @DisplayName("overrideThreshold should only touch gates on the given metric")
    void overrideThreshold_shouldReplaceMatchingGates() {
        List<QualityGate> gates = List.of(
                QualityGate.of("Lines", "line_coverage", 80.0, GateOperator.GTE, GateSeverity.ERROR),
                QualityGate.of("Branches", "branch_coverage", 70.0, GateOperator.GTE, GateSeverity.WARNING));

        List<QualityGate> updated = App.CiCommand.overrideThreshold(gates, "line_coverage", 92.0);

        assertEquals(92.0, updated.get(0).threshold());
        assertEquals(70.0, updated.get(1).threshold());
        assertSame(gates, App.CiCommand.overrideThreshold(gates, "line_coverage", null));
    }
}

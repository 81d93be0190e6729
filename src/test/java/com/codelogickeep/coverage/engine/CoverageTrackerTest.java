package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.model.CoverageStatistics;
import com.codelogickeep.coverage.model.CoverageTrend;
import com.codelogickeep.coverage.model.MetricStatistics;
import com.codelogickeep.coverage.model.Regression;
import com.codelogickeep.coverage.model.RegressionReport;
import com.codelogickeep.coverage.model.TrackedMetric;
import com.codelogickeep.coverage.model.TrendAnalysis;
import com.codelogickeep.coverage.model.TrendDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CoverageTracker")
class CoverageTrackerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private CoverageTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new CoverageTracker(tempDir.resolve("coverage_data"), CoverageTracker.DEFAULT_MAX_HISTORY,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void recordLine(double lineCoverage) {
        tracker.record(lineCoverage, 70.0, 90.0, 75.0, 12, "abc123", "main");
    }

    @Nested
    @DisplayName("History")
    class History {

        @Test
        @DisplayName("record should persist the measurement with the clock's timestamp")
        void record_shouldPersistMeasurement() {
            CoverageTrend recorded = tracker.record(82.5, 70.0, 90.0, 75.0, 12, "abc123", "main");

            List<CoverageTrend> history = tracker.loadHistory();
            assertEquals(1, history.size());
            assertEquals(recorded, history.get(0));
            assertEquals(NOW, history.get(0).instant());
            assertEquals("abc123", history.get(0).commitId());
            assertTrue(Files.exists(tracker.getHistoryFile()));
        }

        @Test
        @DisplayName("history should keep only the newest hundred records")
        void record_shouldEvictOldestBeyondCap() {
            for (int i = 0; i < 105; i++) {
                recordLine(i);
            }

            List<CoverageTrend> history = tracker.loadHistory();
            assertEquals(100, history.size());
            assertEquals(5.0, history.get(0).lineCoverage());
            assertEquals(104.0, history.get(99).lineCoverage());
        }

        @Test
        @DisplayName("record should refresh the trend file once two points exist")
        void record_shouldWriteTrendFile() throws IOException {
            recordLine(60.0);
            assertFalse(Files.exists(tracker.getTrendsFile()));

            recordLine(70.0);

            String trends = Files.readString(tracker.getTrendsFile());
            assertTrue(trends.contains("\"7_days\""));
            assertTrue(trends.contains("\"line_coverage\""));
        }

        @Test
        @DisplayName("corrupt history should load as empty")
        void loadHistory_shouldTolerateCorruptFile() throws IOException {
            Files.createDirectories(tracker.getHistoryFile().getParent());
            Files.writeString(tracker.getHistoryFile(), "{not json");

            assertTrue(tracker.loadHistory().isEmpty());
        }

        @Test
        @DisplayName("recentTrends should skip old and unparsable entries")
        void recentTrends_shouldFilterByPeriod() {
            tracker.saveHistory(List.of(
                    trendAt("2026-01-01T00:00:00Z", 50.0),
                    trendAt("yesterday", 55.0),
                    trendAt("2026-02-27T08:00:00Z", 60.0)));

            List<CoverageTrend> recent = tracker.recentTrends(7);

            assertEquals(1, recent.size());
            assertEquals(60.0, recent.get(0).lineCoverage());
        }

        @Test
        @DisplayName("cleanup should drop entries older than the retention period")
        void cleanup_shouldRemoveOldEntries() {
            tracker.saveHistory(List.of(
                    trendAt("2025-12-01T00:00:00Z", 50.0),
                    trendAt("2026-01-15T00:00:00Z", 55.0),
                    trendAt("2026-02-25T00:00:00Z", 60.0)));

            int removed = tracker.cleanup(30);

            assertEquals(2, removed);
            assertEquals(1, tracker.loadHistory().size());
            assertEquals(0, tracker.cleanup(30));
        }

        @Test
        @DisplayName("exportCsv should write a header and one row per record")
        void exportCsv_shouldWriteRows() throws IOException {
            recordLine(60.0);
            recordLine(70.0);
            Path csv = tempDir.resolve("export/history.csv");

            tracker.exportCsv(csv);

            List<String> lines = Files.readAllLines(csv);
            assertEquals(3, lines.size());
            assertTrue(lines.get(0).startsWith("timestamp,line_coverage,branch_coverage"));
            assertTrue(lines.get(1).contains("60.0"));
            assertTrue(lines.get(2).contains("main"));
        }
    }

    @Nested
    @DisplayName("Trend direction")
    class TrendDirectionAnalysis {

        @Test
        @DisplayName("no history should report NO_DATA")
        void analyze_shouldReportNoData() {
            TrendAnalysis analysis = tracker.analyzeTrendDirection(TrackedMetric.LINE_COVERAGE, 30);

            assertEquals(TrendDirection.NO_DATA, analysis.direction());
            assertEquals(0.0, analysis.slope());
        }

        @Test
        @DisplayName("a single point should report INSUFFICIENT_DATA")
        void analyze_shouldReportInsufficientData() {
            recordLine(60.0);

            TrendAnalysis analysis = tracker.analyzeTrendDirection(TrackedMetric.LINE_COVERAGE, 30);

            assertEquals(TrendDirection.INSUFFICIENT_DATA, analysis.direction());
            assertEquals(1, analysis.sampleCount());
            assertEquals(0.0, analysis.slope());
        }

        @Test
        @DisplayName("rising coverage should be IMPROVING with a perfect fit")
        void analyze_shouldDetectImprovement() {
            recordLine(60.0);
            recordLine(70.0);
            recordLine(80.0);

            TrendAnalysis analysis = tracker.analyzeTrendDirection(TrackedMetric.LINE_COVERAGE, 30);

            assertEquals(TrendDirection.IMPROVING, analysis.direction());
            assertEquals(10.0, analysis.slope(), 0.0001);
            assertEquals(1.0, analysis.confidence(), 0.0001);
            assertEquals(80.0, analysis.currentValue());
            assertEquals(33.333, analysis.changePercent(), 0.001);
        }

        @Test
        @DisplayName("falling coverage should be DECLINING")
        void analyze_shouldDetectDecline() {
            List<CoverageTrend> trends = List.of(trendAt(NOW.toString(), 80.0), trendAt(NOW.toString(), 75.0));

            TrendAnalysis analysis = CoverageTracker.analyze(TrackedMetric.LINE_COVERAGE, trends);

            assertEquals(TrendDirection.DECLINING, analysis.direction());
            assertEquals(-5.0, analysis.slope(), 0.0001);
        }

        @Test
        @DisplayName("constant values should be STABLE with zero confidence")
        void analyze_shouldReportStableForConstantValues() {
            recordLine(70.0);
            recordLine(70.0);

            TrendAnalysis analysis = tracker.analyzeTrendDirection(TrackedMetric.BRANCH_COVERAGE, 30);

            assertEquals(TrendDirection.STABLE, analysis.direction());
            assertEquals(0.0, analysis.confidence());
        }
    }

    @Nested
    @DisplayName("Regression detection")
    class RegressionDetection {

        @Test
        @DisplayName("fewer than two records should report insufficient data")
        void detectRegression_shouldNeedTwoRecords() {
            recordLine(85.0);

            RegressionReport report = tracker.detectRegression();

            assertFalse(report.hasRegression());
            assertEquals("Insufficient data for regression analysis", report.message());
        }

        @Test
        @DisplayName("a drop against the recent average should be a high severity regression")
        void detectRegression_shouldFlagLargeDrop() {
            for (int i = 0; i < 9; i++) {
                recordLine(85.0);
            }
            recordLine(70.0);

            RegressionReport report = tracker.detectRegression(10.0);

            assertTrue(report.hasRegression());
            assertEquals(1, report.regressions().size());
            Regression regression = report.regressions().get(0);
            assertEquals(TrackedMetric.LINE_COVERAGE, regression.metric());
            assertEquals(85.0, regression.recentAverage(), 0.0001);
            assertEquals(17.647, regression.percentageDrop(), 0.001);
            assertEquals("high", regression.severity());
            assertEquals("abc123", report.commitId());
            assertEquals("Found 1 coverage regressions", report.message());
        }

        @Test
        @DisplayName("drops within the configured threshold should pass")
        void detectRegression_shouldHonourConfiguredThreshold() {
            recordLine(85.0);
            recordLine(80.0);

            assertTrue(tracker.detectRegression().hasRegression());

            tracker.setRegressionThreshold(10.0);
            RegressionReport report = tracker.detectRegression();

            assertFalse(report.hasRegression());
            assertEquals("No regressions detected", report.message());
        }

        @Test
        @DisplayName("a drop between five and ten percent should be medium severity")
        void detectRegression_shouldGradeModerateDrop() {
            recordLine(80.0);
            recordLine(74.0);

            Regression regression = tracker.detectRegression().regressions().get(0);

            assertEquals(7.5, regression.percentageDrop(), 0.0001);
            assertEquals("medium", regression.severity());
        }

        @Test
        @DisplayName("only the nine records before the latest should form the baseline")
        void detectRegression_shouldUseRecentWindow() {
            recordLine(100.0);
            for (int i = 0; i < 9; i++) {
                recordLine(70.0);
            }
            recordLine(70.0);

            assertFalse(tracker.detectRegression(1.0).hasRegression());
        }
    }

    @Nested
    @DisplayName("Statistics")
    class Statistics {

        @Test
        @DisplayName("statistics without data should be unavailable")
        void statistics_shouldBeUnavailableWithoutData() {
            CoverageStatistics statistics = tracker.statistics(30);

            assertFalse(statistics.isAvailable());
            assertEquals(0, statistics.dataPoints());
        }

        @Test
        @DisplayName("statistics should aggregate each tracked metric")
        void statistics_shouldAggregateMetrics() {
            recordLine(60.0);
            recordLine(70.0);
            recordLine(80.0);

            CoverageStatistics statistics = tracker.statistics(30);

            assertTrue(statistics.isAvailable());
            assertEquals(3, statistics.dataPoints());
            assertEquals(4, statistics.statistics().size());

            MetricStatistics line = statistics.statistics().get("line_coverage");
            assertEquals(80.0, line.current());
            assertEquals(70.0, line.average(), 0.0001);
            assertEquals(70.0, line.median(), 0.0001);
            assertEquals(60.0, line.min());
            assertEquals(80.0, line.max());
            assertEquals(10.0, line.stdDev(), 0.0001);
            assertEquals(TrendDirection.IMPROVING, line.trend().direction());

            assertEquals(0.0, statistics.statistics().get("branch_coverage").stdDev());
        }
    }

    private static CoverageTrend trendAt(String timestamp, double lineCoverage) {
        return new CoverageTrend(timestamp, lineCoverage, 70.0, 90.0, 75.0, 0, null, null);
    }
}

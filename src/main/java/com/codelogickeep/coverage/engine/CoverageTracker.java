package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.model.CoverageStatistics;
import com.codelogickeep.coverage.model.CoverageTrend;
import com.codelogickeep.coverage.model.MetricStatistics;
import com.codelogickeep.coverage.model.Regression;
import com.codelogickeep.coverage.model.RegressionReport;
import com.codelogickeep.coverage.model.TrackedMetric;
import com.codelogickeep.coverage.model.TrendAnalysis;
import com.codelogickeep.coverage.model.TrendDirection;
import com.codelogickeep.coverage.util.JsonUtil;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists coverage measurements and derives trends and regressions from them.
 * <p>
 * History is a JSON array, oldest first, capped to the most recent entries. A
 * single writer is assumed; concurrent runs against the same directory may lose records.
 */
@Slf4j
public class CoverageTracker {

    public static final String HISTORY_FILE = "coverage_history.json";
    public static final String TRENDS_FILE = "coverage_trends.json";
    public static final int DEFAULT_MAX_HISTORY = 100;
    public static final double DEFAULT_REGRESSION_THRESHOLD = 5.0;
    public static final int[] TREND_PERIODS = {7, 30, 90};

    private static final double STABLE_SLOPE = 0.1;
    private static final int REGRESSION_WINDOW = 9;
    private static final double HIGH_SEVERITY_DROP = 10.0;

    private static final TypeReference<List<CoverageTrend>> HISTORY_TYPE = new TypeReference<>() {
    };

    private final Path dataDir;
    private final Path historyFile;
    private final Path trendsFile;
    private final int maxHistory;
    private final Clock clock;
    private double regressionThreshold = DEFAULT_REGRESSION_THRESHOLD;

    public CoverageTracker(Path dataDir) {
        this(dataDir, DEFAULT_MAX_HISTORY, Clock.systemUTC());
    }

    public CoverageTracker(Path dataDir, int maxHistory, Clock clock) {
        this.dataDir = dataDir;
        this.historyFile = dataDir.resolve(HISTORY_FILE);
        this.trendsFile = dataDir.resolve(TRENDS_FILE);
        this.maxHistory = maxHistory;
        this.clock = clock;
    }

    public Path getHistoryFile() {
        return historyFile;
    }

    public Path getTrendsFile() {
        return trendsFile;
    }

    public void setRegressionThreshold(double regressionThreshold) {
        this.regressionThreshold = regressionThreshold;
    }

    /**
     * Appends a measurement, evicts the oldest entries beyond the cap, persists the
     * history and refreshes the per-period trend file.
     */
    public CoverageTrend record(double lineCoverage, double branchCoverage, double functionCoverage,
                               double overallScore, int testCount, String commitId, String branchName) {
        CoverageTrend trend = new CoverageTrend(
                now().toString(),
                lineCoverage, branchCoverage, functionCoverage, overallScore,
                testCount, commitId, branchName);

        List<CoverageTrend> history = new ArrayList<>(loadHistory());
        history.add(trend);
        if (history.size() > maxHistory) {
            history = new ArrayList<>(history.subList(history.size() - maxHistory, history.size()));
        }

        saveHistory(history);
        updateTrendAnalysis(history);
        log.debug("Recorded coverage {}% (history size {})", lineCoverage, history.size());
        return trend;
    }

    /**
     * Stored history, oldest first. Missing or unreadable history yields an empty list.
     */
    public List<CoverageTrend> loadHistory() {
        if (!Files.exists(historyFile)) {
            return List.of();
        }
        try {
            List<CoverageTrend> history = JsonUtil.read(historyFile, HISTORY_TYPE);
            return history != null ? history : List.of();
        } catch (IOException e) {
            log.warn("Error loading coverage history from {}: {}", historyFile, e.getMessage());
            return List.of();
        }
    }

    public void saveHistory(List<CoverageTrend> history) {
        try {
            JsonUtil.writeAtomically(historyFile, history);
        } catch (IOException e) {
            log.warn("Error saving coverage history to {}: {}", historyFile, e.getMessage());
        }
    }

    /**
     * Entries recorded within the last {@code days} days. Entries with an unparsable
     * timestamp are ignored.
     */
    public List<CoverageTrend> recentTrends(int days) {
        return trendsSince(now().minus(Duration.ofDays(days)), loadHistory());
    }

    private List<CoverageTrend> trendsSince(Instant cutoff, List<CoverageTrend> history) {
        List<CoverageTrend> recent = new ArrayList<>();
        for (CoverageTrend trend : history) {
            Instant time = instantOf(trend);
            if (time != null && !time.isBefore(cutoff)) {
                recent.add(trend);
            }
        }
        return recent;
    }

    public TrendAnalysis analyzeTrendDirection(TrackedMetric metric, int periodDays) {
        return analyze(metric, recentTrends(periodDays));
    }

    /**
     * Least-squares fit of the metric against sample position.
     */
    static TrendAnalysis analyze(TrackedMetric metric, List<CoverageTrend> trends) {
        if (trends.size() < 2) {
            return TrendAnalysis.withoutData(
                    trends.isEmpty() ? TrendDirection.NO_DATA : TrendDirection.INSUFFICIENT_DATA, trends.size());
        }

        SimpleRegression regression = new SimpleRegression();
        double first = trends.get(0).valueOf(metric);
        double last = trends.get(trends.size() - 1).valueOf(metric);
        boolean constant = true;
        for (int i = 0; i < trends.size(); i++) {
            double value = trends.get(i).valueOf(metric);
            regression.addData(i, value);
            constant &= value == first;
        }

        double slope = regression.getSlope();
        double confidence = constant ? 0.0 : regression.getRSquare();

        TrendDirection direction;
        if (Math.abs(slope) < STABLE_SLOPE) {
            direction = TrendDirection.STABLE;
        } else if (slope > 0) {
            direction = TrendDirection.IMPROVING;
        } else {
            direction = TrendDirection.DECLINING;
        }

        double changePercent = first != 0 ? (last - first) / first * 100 : 0.0;
        return new TrendAnalysis(direction, slope, confidence, last, changePercent, trends.size());
    }

    public RegressionReport detectRegression() {
        return detectRegression(regressionThreshold);
    }

    /**
     * Compares the latest record with the mean of up to nine preceding records.
     *
     * @param thresholdPercent minimum relative drop, in percent, reported as a regression
     */
    public RegressionReport detectRegression(double thresholdPercent) {
        List<CoverageTrend> history = loadHistory();
        if (history.size() < 2) {
            return RegressionReport.insufficientData();
        }

        CoverageTrend current = history.get(history.size() - 1);
        List<CoverageTrend> recent = history.subList(
                Math.max(0, history.size() - 1 - REGRESSION_WINDOW), history.size() - 1);

        List<Regression> regressions = new ArrayList<>();
        for (TrackedMetric metric : TrackedMetric.values()) {
            double average = recent.stream().mapToDouble(t -> t.valueOf(metric)).average().orElse(0.0);
            if (average <= 0) {
                continue;
            }
            double currentValue = current.valueOf(metric);
            double drop = (average - currentValue) / average * 100;
            if (drop > thresholdPercent) {
                regressions.add(new Regression(metric, currentValue, average, drop,
                        drop > HIGH_SEVERITY_DROP ? "high" : "medium"));
            }
        }

        String message = regressions.isEmpty()
                ? "No regressions detected"
                : "Found " + regressions.size() + " coverage regressions";
        return new RegressionReport(!regressions.isEmpty(), regressions, current.timestamp(), current.commitId(), message);
    }

    /**
     * Per-metric aggregates over the period, flagged unavailable when it holds no data.
     */
    public CoverageStatistics statistics(int periodDays) {
        List<CoverageTrend> trends = recentTrends(periodDays);
        if (trends.isEmpty()) {
            return CoverageStatistics.unavailable(periodDays);
        }

        Map<String, MetricStatistics> stats = new LinkedHashMap<>();
        for (TrackedMetric metric : TrackedMetric.values()) {
            DescriptiveStatistics values = new DescriptiveStatistics();
            trends.forEach(t -> values.addValue(t.valueOf(metric)));
            stats.put(metric.getKey(), new MetricStatistics(
                    trends.get(trends.size() - 1).valueOf(metric),
                    values.getMean(),
                    values.getPercentile(50),
                    values.getMin(),
                    values.getMax(),
                    values.getN() > 1 ? values.getStandardDeviation() : 0.0,
                    analyze(metric, trends)));
        }

        return new CoverageStatistics(periodDays, trends.size(),
                trends.get(0).timestamp(), trends.get(trends.size() - 1).timestamp(), stats, null);
    }

    /**
     * Drops entries older than {@code keepDays} and returns how many were removed.
     */
    public int cleanup(int keepDays) {
        List<CoverageTrend> history = loadHistory();
        List<CoverageTrend> kept = trendsSince(now().minus(Duration.ofDays(keepDays)), history);
        int removed = history.size() - kept.size();
        if (removed > 0) {
            saveHistory(kept);
            log.info("Removed {} coverage records older than {} days", removed, keepDays);
        }
        return removed;
    }

    /**
     * Writes the history as CSV with a header row.
     */
    public void exportCsv(Path outputFile) throws IOException {
        List<CoverageTrend> history = loadHistory();
        CsvMapper csvMapper = new CsvMapper();
        CsvSchema schema = csvMapper.schemaFor(CoverageTrend.class).withHeader();

        Path parent = outputFile.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        try (Writer writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8);
             SequenceWriter sequence = csvMapper.writer(schema).writeValues(writer)) {
            sequence.writeAll(history);
        }
        log.info("Exported {} coverage records to {}", history.size(), outputFile);
    }

    private void updateTrendAnalysis(List<CoverageTrend> history) {
        if (history.size() < 2) {
            return;
        }

        Map<String, Map<String, TrendAnalysis>> periods = new LinkedHashMap<>();
        for (int period : TREND_PERIODS) {
            List<CoverageTrend> periodTrends = trendsSince(now().minus(Duration.ofDays(period)), history);
            if (periodTrends.size() < 2) {
                continue;
            }
            Map<String, TrendAnalysis> byMetric = new LinkedHashMap<>();
            for (TrackedMetric metric : TrackedMetric.values()) {
                byMetric.put(metric.getKey(), analyze(metric, periodTrends));
            }
            periods.put(period + "_days", byMetric);
        }

        TrendFile trendFile = new TrendFile(now().toString(), history.size(), periods);
        try {
            JsonUtil.writeAtomically(trendsFile, trendFile);
        } catch (IOException e) {
            log.warn("Error saving trend analysis to {}: {}", trendsFile, e.getMessage());
        }
    }

    private Instant now() {
        return clock.instant();
    }

    private static Instant instantOf(CoverageTrend trend) {
        try {
            return trend.instant();
        } catch (DateTimeParseException | NullPointerException e) {
            log.debug("Ignoring trend with timestamp {}", trend.timestamp());
            return null;
        }
    }

    /** Contents of {@value #TRENDS_FILE}. */
    public record TrendFile(
            @JsonProperty("last_updated") String lastUpdated,
            @JsonProperty("total_data_points") int totalDataPoints,
            @JsonProperty("periods") Map<String, Map<String, TrendAnalysis>> periods
    ) {
    }
}

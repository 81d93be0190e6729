package com.codelogickeep.coverage.report;

import com.codelogickeep.coverage.engine.CoverageAnalyzer;
import com.codelogickeep.coverage.engine.CoverageTracker;
import com.codelogickeep.coverage.engine.TestGenerator;
import com.codelogickeep.coverage.model.CoverageGap;
import com.codelogickeep.coverage.model.CoverageMetric;
import com.codelogickeep.coverage.model.CoverageQualityMetrics;
import com.codelogickeep.coverage.model.CoverageSummary;
import com.codelogickeep.coverage.model.CoverageTrend;
import com.codelogickeep.coverage.model.RegressionReport;
import com.codelogickeep.coverage.model.TestSuggestion;
import com.codelogickeep.coverage.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Writes the JSON, HTML and chart artifacts of one analysis run and builds the
 * in-memory CI payload.
 */
public class CoverageReporter {
    private static final Logger log = LoggerFactory.getLogger(CoverageReporter.class);

    public static final String DEFAULT_TITLE = "Coverage Analysis Report";
    public static final int TREND_DAYS = 30;
    public static final int DEFAULT_MAX_SUGGESTIONS = 25;

    static final int JSON_MAX_GAPS = 20;
    static final int JSON_MAX_TRENDS = 30;
    static final int JSON_MAX_SUGGESTIONS = 15;

    private static final DateTimeFormatter FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DISPLAY_STAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final Path outputDir;
    private final ReporterCapabilities capabilities;
    private final Clock clock;
    private final HtmlReportWriter htmlWriter = new HtmlReportWriter();
    private int maxSuggestions = DEFAULT_MAX_SUGGESTIONS;

    public CoverageReporter(Path outputDir) {
        this(outputDir, ReporterCapabilities.detect(), Clock.systemUTC());
    }

    public CoverageReporter(Path outputDir, ReporterCapabilities capabilities, Clock clock) {
        this.outputDir = outputDir;
        this.capabilities = capabilities;
        this.clock = clock;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public void setMaxSuggestions(int maxSuggestions) {
        this.maxSuggestions = maxSuggestions;
    }

    /**
     * Builds every report artifact. The tracker and generator are optional and may be null.
     * Each artifact is written independently; one that fails is logged and left out.
     */
    public ReportResult comprehensiveReport(CoverageAnalyzer analyzer, CoverageTracker tracker,
                                            TestGenerator generator, String title) {
        if (!analyzer.isLoaded() && !analyzer.load()) {
            return ReportResult.failed(ReportResult.LOAD_FAILED);
        }

        List<CoverageTrend> trends = tracker != null ? tracker.recentTrends(TREND_DAYS) : List.of();
        CoverageQualityMetrics metrics = tracker != null
                ? analyzer.calculateQualityMetrics(tracker.loadHistory())
                : analyzer.calculateQualityMetrics();
        List<CoverageGap> gaps = analyzer.analyzeGaps();
        Optional<CoverageSummary> summary = analyzer.coverageSummary();
        List<TestSuggestion> suggestions = generator != null
                ? generator.generateSuggestions(maxSuggestions)
                : List.of();

        String stamp = FILE_STAMP.format(clock.instant());
        String reportTitle = title != null ? title : DEFAULT_TITLE;
        Map<String, Path> artifacts = new LinkedHashMap<>();

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            log.warn("Cannot create report directory {}: {}", outputDir, e.getMessage());
        }

        Path htmlFile = outputDir.resolve("coverage_report_" + stamp + ".html");
        boolean chartsWanted = capabilities.chartsEnabled() && trends.size() >= 2;
        try {
            String html = htmlWriter.render(reportTitle, DISPLAY_STAMP.format(clock.instant()), metrics, gaps,
                    trends, suggestions, chartsWanted);
            Files.writeString(htmlFile, html, StandardCharsets.UTF_8);
            artifacts.put("html", htmlFile);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write HTML report {}: {}", htmlFile, e.getMessage());
        }

        Path jsonFile = outputDir.resolve("coverage_data_" + stamp + ".json");
        try {
            JsonUtil.writeAtomically(jsonFile, jsonDocument(metrics, gaps, trends, suggestions, summary.orElse(null)));
            artifacts.put("json", jsonFile);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write JSON report {}: {}", jsonFile, e.getMessage());
        }

        if (chartsWanted) {
            try {
                artifacts.putAll(new TrendChartWriter().write(outputDir.resolve("charts"), trends));
            } catch (IOException | RuntimeException | LinkageError e) {
                log.warn("Failed to render trend charts: {}", e.getMessage());
            }
        }

        log.info("Report written: {} artifact(s) in {}", artifacts.size(), outputDir);
        return new ReportResult(artifacts, null);
    }

    /**
     * Evaluates {@code metric >= threshold} for each entry and folds in the tracker's
     * regression check. No file is written.
     */
    public CiReport ciReport(CoverageAnalyzer analyzer, Map<String, Double> thresholds, CoverageTracker tracker) {
        if (!analyzer.isLoaded() && !analyzer.load()) {
            return CiReport.error(ReportResult.LOAD_FAILED);
        }
        CoverageQualityMetrics metrics = tracker != null
                ? analyzer.calculateQualityMetrics(tracker.loadHistory())
                : analyzer.calculateQualityMetrics();

        Map<String, CiReport.GateCheck> gates = new LinkedHashMap<>();
        boolean allPassed = true;
        for (Map.Entry<String, Double> entry : thresholds.entrySet()) {
            Optional<CoverageMetric> metric = CoverageMetric.fromKey(entry.getKey());
            if (metric.isEmpty()) {
                log.warn("Unknown metric '{}' in CI thresholds, treated as failed", entry.getKey());
            }
            double current = metric.map(m -> m.valueOf(metrics)).orElse(0.0);
            double threshold = entry.getValue();
            boolean passed = metric.isPresent() && current >= threshold;
            gates.put(entry.getKey(), new CiReport.GateCheck(current, threshold, passed, current - threshold));
            allPassed &= passed;
        }

        RegressionReport regression = tracker != null ? tracker.detectRegression() : null;

        Map<String, Object> metricBlock = new LinkedHashMap<>();
        metricBlock.put("line_coverage", metrics.getLineCoveragePercent());
        metricBlock.put("branch_coverage", metrics.getBranchCoveragePercent());
        metricBlock.put("function_coverage", metrics.getFunctionCoveragePercent());
        metricBlock.put("critical_gaps", metrics.getCriticalGaps());
        metricBlock.put("high_priority_gaps", metrics.getHighPriorityGaps());

        return new CiReport(allPassed ? "pass" : "fail", metrics.getOverallScore(), clock.instant().toString(),
                gates, regression, metricBlock, null);
    }

    Map<String, Object> jsonDocument(CoverageQualityMetrics metrics, List<CoverageGap> gaps,
                                     List<CoverageTrend> trends, List<TestSuggestion> suggestions,
                                     CoverageSummary summary) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("timestamp", clock.instant().toString());
        document.put("summary", summary);

        Map<String, Object> metricBlock = new LinkedHashMap<>();
        metricBlock.put("line_coverage", metrics.getLineCoveragePercent());
        metricBlock.put("branch_coverage", metrics.getBranchCoveragePercent());
        metricBlock.put("function_coverage", metrics.getFunctionCoveragePercent());
        metricBlock.put("overall_score", metrics.getOverallScore());
        metricBlock.put("effective_coverage", metrics.getEffectiveCoverageScore());
        metricBlock.put("test_quality", metrics.getTestQualityScore());
        metricBlock.put("coverage_density", metrics.getCoverageDensity());
        metricBlock.put("trend", metrics.getCoverageTrend().getValue());
        metricBlock.put("trend_percentage", metrics.getTrendPercentage());
        document.put("metrics", metricBlock);

        Map<String, Integer> bySeverity = new TreeMap<>();
        Map<String, Integer> byType = new TreeMap<>();
        for (CoverageGap gap : gaps) {
            bySeverity.merge(gap.getSeverity().getValue(), 1, Integer::sum);
            byType.merge(gap.getGapType().getValue(), 1, Integer::sum);
        }
        List<Map<String, Object>> details = new ArrayList<>();
        for (CoverageGap gap : gaps.subList(0, Math.min(JSON_MAX_GAPS, gaps.size()))) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("file", gap.getFilePath());
            detail.put("lines", gap.getLineStart() + "-" + gap.getLineEnd());
            detail.put("type", gap.getGapType().getValue());
            detail.put("severity", gap.getSeverity().getValue());
            detail.put("function", gap.getFunctionName());
            detail.put("class", gap.getClassName());
            detail.put("complexity", gap.getComplexityScore());
            detail.put("suggestions", gap.getSuggestedTests());
            details.add(detail);
        }
        Map<String, Object> gapBlock = new LinkedHashMap<>();
        gapBlock.put("total", gaps.size());
        gapBlock.put("critical", metrics.getCriticalGaps());
        gapBlock.put("high", metrics.getHighPriorityGaps());
        gapBlock.put("by_severity", bySeverity);
        gapBlock.put("by_type", byType);
        gapBlock.put("details", details);
        document.put("gaps", gapBlock);

        List<Map<String, Object>> trendBlock = new ArrayList<>();
        for (CoverageTrend trend : trends.subList(Math.max(0, trends.size() - JSON_MAX_TRENDS), trends.size())) {
            Map<String, Object> point = new LinkedHashMap<>();
            point.put("timestamp", trend.timestamp());
            point.put("line_coverage", trend.lineCoverage());
            point.put("branch_coverage", trend.branchCoverage());
            point.put("function_coverage", trend.functionCoverage());
            point.put("overall_score", trend.overallScore());
            point.put("test_count", trend.testCount());
            trendBlock.add(point);
        }
        document.put("trends", trendBlock);

        List<Map<String, Object>> suggestionBlock = new ArrayList<>();
        for (TestSuggestion s : suggestions.subList(0, Math.min(JSON_MAX_SUGGESTIONS, suggestions.size()))) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("file", s.getFilePath());
            entry.put("function", s.getFunctionName());
            entry.put("class", s.getClassName());
            entry.put("type", s.getTestType().getValue());
            entry.put("priority", s.getPriority().getValue());
            entry.put("description", s.getDescription());
            entry.put("test_name", s.getFullTestName());
            entry.put("complexity", s.getComplexityScore());
            suggestionBlock.add(entry);
        }
        document.put("test_suggestions", suggestionBlock);
        return document;
    }
}

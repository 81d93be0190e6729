package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.model.CiRunResult;
import com.codelogickeep.coverage.model.CiRunResult.GateTally;
import com.codelogickeep.coverage.model.CoverageGap;
import com.codelogickeep.coverage.model.CoverageMetric;
import com.codelogickeep.coverage.model.CoverageQualityMetrics;
import com.codelogickeep.coverage.model.CoverageTrend;
import com.codelogickeep.coverage.model.GateOperator;
import com.codelogickeep.coverage.model.GateSeverity;
import com.codelogickeep.coverage.model.QualityGate;
import com.codelogickeep.coverage.model.QualityGateResult;
import com.codelogickeep.coverage.model.RegressionReport;
import com.codelogickeep.coverage.model.RunStatus;
import com.codelogickeep.coverage.report.CoverageReporter;
import com.codelogickeep.coverage.report.JUnitReportExporter;
import com.codelogickeep.coverage.report.ReportResult;
import com.codelogickeep.coverage.tools.TestCountProbe;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the coverage pipeline for a CI job: analysis, quality gates, trend tracking,
 * regression detection and reports, folded into one {@link CiRunResult}.
 */
public class CiCoverageRunner {
    private static final Logger log = LoggerFactory.getLogger(CiCoverageRunner.class);

    public static final String REPORT_TITLE = "CI Coverage Analysis";

    private final CoverageAnalyzer analyzer;
    private final CoverageTracker tracker;
    private final CoverageReporter reporter;
    private final TestGenerator generator;
    private final TestCountProbe testCountProbe;
    private final Clock clock;
    private List<QualityGate> qualityGates = defaultQualityGates();

    /**
     * @param generator optional, adds test suggestions to the generated reports
     */
    public CiCoverageRunner(CoverageAnalyzer analyzer, CoverageTracker tracker, CoverageReporter reporter,
                            TestGenerator generator, TestCountProbe testCountProbe, Clock clock) {
        this.analyzer = analyzer;
        this.tracker = tracker;
        this.reporter = reporter;
        this.generator = generator;
        this.testCountProbe = testCountProbe != null ? testCountProbe : TestCountProbe.none();
        this.clock = clock;
    }

    /**
     * Per-run switches. A null gate list means the runner's configured gates.
     */
    @Value
    @Builder
    public static class RunOptions {
        List<QualityGate> gates;
        @Builder.Default
        boolean generateReports = true;
        @Builder.Default
        boolean trackTrends = true;
        @Builder.Default
        boolean failOnRegression = true;
        String commitId;
        String branchName;

        public static RunOptions defaults() {
            return RunOptions.builder().build();
        }
    }

    public record QuickCheckResult(boolean passed, String message) {
    }

    public static List<QualityGate> defaultQualityGates() {
        List<QualityGate> gates = new ArrayList<>();
        gates.add(QualityGate.of("MinimumLineCoverage", "line_coverage", 80.0, GateOperator.GTE, GateSeverity.ERROR));
        gates.add(QualityGate.of("MinimumBranchCoverage", "branch_coverage", 70.0, GateOperator.GTE, GateSeverity.WARNING));
        gates.add(QualityGate.of("MaximumCriticalGaps", "critical_gaps", 5.0, GateOperator.LTE, GateSeverity.ERROR));
        gates.add(QualityGate.of("MinimumOverallScore", "overall_score", 75.0, GateOperator.GTE, GateSeverity.WARNING));
        return gates;
    }

    public List<QualityGate> getQualityGates() {
        return List.copyOf(qualityGates);
    }

    public void setQualityGates(List<QualityGate> gates) {
        this.qualityGates = new ArrayList<>(gates);
    }

    public void addQualityGate(QualityGate gate) {
        qualityGates.add(gate);
    }

    public CiRunResult run(RunOptions options) {
        String timestamp = clock.instant().toString();
        try {
            return doRun(options, timestamp);
        } catch (RuntimeException e) {
            log.error("Coverage analysis failed", e);
            return CiRunResult.error(timestamp, "Coverage analysis failed: " + e.getMessage());
        }
    }

    private CiRunResult doRun(RunOptions options, String timestamp) {
        if (!analyzer.load()) {
            return CiRunResult.error(timestamp, ReportResult.LOAD_FAILED);
        }

        List<CoverageTrend> history = options.isTrackTrends() ? tracker.loadHistory() : List.of();
        CoverageQualityMetrics metrics = analyzer.calculateQualityMetrics(history);
        List<CoverageGap> gaps = analyzer.analyzeGaps();

        List<QualityGate> gates = options.getGates() != null ? options.getGates() : qualityGates;
        List<QualityGateResult> gateResults = evaluateGates(gates, metrics);

        RegressionReport regression = RegressionReport.skipped();
        boolean regressionFailure = false;
        if (options.isTrackTrends()) {
            int testCount = testCountProbe.count();
            tracker.record(metrics.getLineCoveragePercent(), metrics.getBranchCoveragePercent(),
                    metrics.getFunctionCoveragePercent(), metrics.getOverallScore(), testCount,
                    options.getCommitId(), options.getBranchName());
            regression = tracker.detectRegression();
            regressionFailure = options.isFailOnRegression() && regression.hasRegression();
        }

        Map<String, String> reports = new LinkedHashMap<>();
        if (options.isGenerateReports()) {
            ReportResult report = reporter.comprehensiveReport(analyzer, tracker, generator, REPORT_TITLE);
            if (report.isSuccess()) {
                report.artifacts().forEach((kind, path) -> reports.put(kind, path.toString()));
            } else {
                log.warn("Report generation failed: {}", report.error());
            }
        }

        GateTally tally = GateTally.of(gateResults);
        RunStatus status;
        if (tally.failed() > 0 || regressionFailure) {
            status = RunStatus.FAILURE;
        } else if (tally.warnings() > 0) {
            status = RunStatus.WARNING;
        } else {
            status = RunStatus.SUCCESS;
        }
        int exitCode = status == RunStatus.FAILURE ? 1 : 0;

        Map<String, Object> metricBlock = new LinkedHashMap<>();
        metricBlock.put("line_coverage", metrics.getLineCoveragePercent());
        metricBlock.put("branch_coverage", metrics.getBranchCoveragePercent());
        metricBlock.put("function_coverage", metrics.getFunctionCoveragePercent());
        metricBlock.put("overall_score", metrics.getOverallScore());
        metricBlock.put("critical_gaps", metrics.getCriticalGaps());
        metricBlock.put("high_priority_gaps", metrics.getHighPriorityGaps());
        metricBlock.put("total_gaps", gaps.size());

        String summary = summaryMessage(gateResults, regression, metrics);
        log.info("CI coverage run finished: {} ({})", status.getValue(), summary);
        return new CiRunResult(timestamp, status, exitCode, options.getCommitId(), options.getBranchName(),
                metricBlock, tally, regression, reports, summary, null);
    }

    /**
     * Evaluates each gate against the metrics. A gate naming an unknown metric fails
     * with an explicit message instead of silently comparing against 0.
     */
    public List<QualityGateResult> evaluateGates(List<QualityGate> gates, CoverageQualityMetrics metrics) {
        List<QualityGateResult> results = new ArrayList<>();
        for (QualityGate gate : gates) {
            Optional<CoverageMetric> metric = CoverageMetric.fromKey(gate.metric());
            if (metric.isEmpty()) {
                log.warn("Quality gate {} references unknown metric '{}'", gate.name(), gate.metric());
                String message = String.format(Locale.ROOT, "%s failed: unknown metric '%s'", gate.name(), gate.metric());
                results.add(new QualityGateResult(gate, 0.0, !gate.enabled(), -gate.threshold(), message));
                continue;
            }
            double current = metric.get().valueOf(metrics);
            boolean passed = gate.evaluate(current);
            double difference = current - gate.threshold();
            String message = passed
                    ? String.format(Locale.ROOT, "%s passed: %.1f %s %s",
                    gate.name(), current, gate.operator().getValue(), gate.threshold())
                    : String.format(Locale.ROOT, "%s failed: %.1f not %s %s (diff: %.1f)",
                    gate.name(), current, gate.operator().getValue(), gate.threshold(), difference);
            results.add(new QualityGateResult(gate, current, passed, difference, message));
        }
        return results;
    }

    /**
     * Compares line coverage with a single threshold; no gates, tracking or reports.
     */
    public QuickCheckResult quickCheck(double minLineCoverage) {
        try {
            if (!analyzer.load()) {
                return new QuickCheckResult(false, ReportResult.LOAD_FAILED);
            }
            double line = analyzer.calculateQualityMetrics().getLineCoveragePercent();
            if (line >= minLineCoverage) {
                return new QuickCheckResult(true,
                        String.format(Locale.ROOT, "Coverage check passed: %.1f%% >= %s%%", line, minLineCoverage));
            }
            return new QuickCheckResult(false,
                    String.format(Locale.ROOT, "Coverage check failed: %.1f%% < %s%%", line, minLineCoverage));
        } catch (RuntimeException e) {
            log.error("Quick coverage check failed", e);
            return new QuickCheckResult(false, "Coverage check error: " + e.getMessage());
        }
    }

    static String summaryMessage(List<QualityGateResult> results, RegressionReport regression,
                                 CoverageQualityMetrics metrics) {
        long failed = results.stream().filter(QualityGateResult::isFailedError).count();
        long warnings = results.stream().filter(QualityGateResult::isFailedWarning).count();
        if (failed > 0) {
            return "Coverage analysis failed: " + failed + " quality gate(s) failed";
        }
        if (regression.hasRegression()) {
            return "Coverage regression detected: " + regression.regressions().size() + " metric(s) regressed";
        }
        if (warnings > 0) {
            return "Coverage analysis passed with warnings: " + warnings + " quality gate(s) have warnings";
        }
        return String.format(Locale.ROOT, "Coverage analysis passed: %.1f overall score", metrics.getOverallScore());
    }

    /**
     * Multi-line console block for CI logs.
     */
    public String ciSummary(CiRunResult result) {
        if (result.status() == RunStatus.ERROR) {
            return "[ERROR] Coverage Analysis Error: " + (result.message() != null ? result.message() : "Unknown error");
        }
        Map<String, Object> metrics = result.metrics() != null ? result.metrics() : Map.of();
        GateTally gates = result.qualityGates();
        StringBuilder sb = new StringBuilder();
        sb.append(marker(result.status())).append(" Coverage Analysis: ")
                .append(result.status().getValue().toUpperCase(Locale.ROOT)).append('\n');
        sb.append(String.format(Locale.ROOT, "Line Coverage: %.1f%%%n", number(metrics.get("line_coverage"))));
        sb.append(String.format(Locale.ROOT, "Branch Coverage: %.1f%%%n", number(metrics.get("branch_coverage"))));
        sb.append(String.format(Locale.ROOT, "Overall Score: %.1f%n", number(metrics.get("overall_score"))));
        sb.append("Critical Gaps: ").append((long) number(metrics.get("critical_gaps"))).append('\n');
        sb.append("Quality Gates: ").append(gates != null ? gates.passed() : 0).append('/')
                .append(gates != null ? gates.total() : 0).append(" passed");
        if (result.regressionCheck() != null && result.regressionCheck().hasRegression()) {
            sb.append('\n').append("Regression detected!");
        }
        return sb.toString();
    }

    public void exportJUnit(CiRunResult result, Path outputFile) throws IOException {
        new JUnitReportExporter().export(result, outputFile);
    }

    private static String marker(RunStatus status) {
        return switch (status) {
            case SUCCESS -> "[PASS]";
            case WARNING -> "[WARN]";
            case FAILURE -> "[FAIL]";
            case ERROR -> "[ERROR]";
        };
    }

    private static double number(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }
}

package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.config.AppConfig;
import com.codelogickeep.coverage.model.QualityGate;
import com.codelogickeep.coverage.report.CoverageReporter;
import com.codelogickeep.coverage.report.ReporterCapabilities;
import com.codelogickeep.coverage.tools.JacocoCoverageDataSource;
import com.codelogickeep.coverage.tools.ProcessTestCountProbe;
import com.codelogickeep.coverage.tools.SourceScanner;
import com.codelogickeep.coverage.tools.SourceScopeParser;
import com.codelogickeep.coverage.tools.SurefireReportTestCountProbe;
import com.codelogickeep.coverage.tools.TestCountProbe;
import com.codelogickeep.coverage.tools.TestDiscovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Builds the pipeline components from configuration. Relative paths resolve against
 * the project directory.
 */
public class PipelineFactory {
    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    /**
     * Every component of one configured pipeline, sharing a single analyzer.
     */
    public record Pipeline(
            CoverageAnalyzer analyzer,
            CoverageTracker tracker,
            TestGenerator generator,
            CoverageReporter reporter,
            CiCoverageRunner runner
    ) {
    }

    private PipelineFactory() {
    }

    public static Pipeline create(AppConfig config, Path projectDir) {
        return create(config, projectDir, Clock.systemUTC());
    }

    public static Pipeline create(AppConfig config, Path projectDir, Clock clock) {
        AppConfig.AnalysisConfig analysis = config.getAnalysis();
        Path sourceRoot = projectDir.resolve(analysis.getSourceDir()).normalize();
        Path testRoot = projectDir.resolve(analysis.getTestDir()).normalize();
        Path jacocoReport = projectDir.resolve(analysis.getJacocoReport()).normalize();

        SourceScanner scanner = new SourceScanner(sourceRoot, analysis.getExcludePatterns());
        TestDiscovery testDiscovery = new TestDiscovery(sourceRoot, testRoot);
        CoverageAnalyzer analyzer = new CoverageAnalyzer(
                new JacocoCoverageDataSource(jacocoReport, sourceRoot),
                scanner,
                new SourceScopeParser(),
                new GapClassifier(),
                createScorer(analysis, testDiscovery));

        AppConfig.TrackingConfig tracking = config.getTracking();
        CoverageTracker tracker = new CoverageTracker(
                projectDir.resolve(tracking.getDataDir()).normalize(), tracking.getMaxHistory(), clock);
        tracker.setRegressionThreshold(tracking.getRegressionThreshold());

        TestGenerator generator = new TestGenerator(analyzer, scanner, testDiscovery);

        AppConfig.ReportingConfig reporting = config.getReporting();
        CoverageReporter reporter = new CoverageReporter(
                projectDir.resolve(reporting.getOutputDir()).normalize(),
                ReporterCapabilities.detect().withCharts(reporting.isCharts()),
                clock);
        reporter.setMaxSuggestions(reporting.getMaxSuggestions());

        CiCoverageRunner runner = new CiCoverageRunner(analyzer, tracker, reporter, generator,
                createProbe(config.getProbe(), projectDir), clock);
        List<QualityGate> gates = config.getCi().getGates().stream()
                .map(AppConfig.GateConfig::toQualityGate)
                .collect(Collectors.toList());
        runner.setQualityGates(gates);

        log.debug("Pipeline created: sources={}, tests={}, report={}", sourceRoot, testRoot, jacocoReport);
        return new Pipeline(analyzer, tracker, generator, reporter, runner);
    }

    static TestQualityScorer createScorer(AppConfig.AnalysisConfig analysis, TestDiscovery testDiscovery) {
        String type = analysis.getTestQualityScorer().toLowerCase(Locale.ROOT);
        if ("assertion-density".equals(type)) {
            return new AssertionDensityScorer(testDiscovery);
        }
        return new FixedTestQualityScorer(analysis.getTestQualityBaseline());
    }

    static TestCountProbe createProbe(AppConfig.ProbeConfig probe, Path projectDir) {
        switch (probe.getType().toLowerCase(Locale.ROOT)) {
            case "process":
                return new ProcessTestCountProbe(probe.getCommand(), projectDir, probe.getTimeoutSeconds());
            case "none":
                return TestCountProbe.none();
            default:
                return new SurefireReportTestCountProbe(projectDir.resolve(probe.getReportsDir()).normalize());
        }
    }
}

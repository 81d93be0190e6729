package com.codelogickeep.coverage.engine;

import com.codelogickeep.coverage.exception.CoverageGateException;
import com.codelogickeep.coverage.model.CoverageGap;
import com.codelogickeep.coverage.model.CoverageQualityMetrics;
import com.codelogickeep.coverage.model.CoverageSummary;
import com.codelogickeep.coverage.model.CoverageTrend;
import com.codelogickeep.coverage.model.FileCoverage;
import com.codelogickeep.coverage.model.Severity;
import com.codelogickeep.coverage.model.TrendDirection;
import com.codelogickeep.coverage.tools.CoverageDataSource;
import com.codelogickeep.coverage.tools.ScopeNode;
import com.codelogickeep.coverage.tools.ScopeTree;
import com.codelogickeep.coverage.tools.SourceScanner;
import com.codelogickeep.coverage.tools.SourceScopeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns per-file coverage into gaps and quality metrics.
 * <p>
 * {@link #load()} must succeed before any other query returns data; until then every
 * query returns an empty result instead of failing.
 */
public class CoverageAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(CoverageAnalyzer.class);

    private static final int TREND_WINDOW = 5;
    private static final double TREND_STABLE_SLOPE = 1.0;
    private static final double WELL_COVERED_PERCENT = 90.0;
    private static final double POORLY_COVERED_PERCENT = 50.0;

    /** Source lines and scopes of one parsed file. */
    public record ParsedSource(List<String> lines, ScopeTree scopes) {

        public String line(int lineNumber) {
            return lineNumber >= 1 && lineNumber <= lines.size() ? lines.get(lineNumber - 1) : null;
        }
    }

    private final CoverageDataSource dataSource;
    private final SourceScanner scanner;
    private final SourceScopeParser parser;
    private final GapClassifier classifier;
    private final TestQualityScorer qualityScorer;

    private List<FileCoverage> files;
    private final Map<Path, Optional<ParsedSource>> parsedSources = new HashMap<>();

    public CoverageAnalyzer(CoverageDataSource dataSource, SourceScanner scanner, SourceScopeParser parser,
                            GapClassifier classifier, TestQualityScorer qualityScorer) {
        this.dataSource = dataSource;
        this.scanner = scanner;
        this.parser = parser;
        this.classifier = classifier;
        this.qualityScorer = qualityScorer;
    }

    /**
     * Reads coverage data. Returns false, never throws, when the data is missing or corrupt.
     */
    public boolean load() {
        try {
            List<FileCoverage> all = dataSource.read();
            files = all.stream()
                    .filter(f -> scanner.isSourceFile(f.path()))
                    .sorted(Comparator.comparing(FileCoverage::path))
                    .collect(Collectors.toList());
            parsedSources.clear();
            log.info("Loaded coverage for {} source files ({} measured) from {}",
                    files.size(), all.size(), dataSource.describe());
            return true;
        } catch (CoverageGateException e) {
            log.warn("Failed to load coverage data: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to load coverage data from {}", dataSource.describe(), e);
        }
        files = null;
        return false;
    }

    public boolean isLoaded() {
        return files != null;
    }

    /** Coverage of every analyzed source file, empty before a successful load. */
    public List<FileCoverage> fileCoverage() {
        return files == null ? List.of() : Collections.unmodifiableList(files);
    }

    public Path getSourceRoot() {
        return scanner.getSourceRoot();
    }

    /**
     * Gaps for every missing line, sorted by severity then complexity, both descending.
     * Files that cannot be read or parsed are skipped.
     */
    public List<CoverageGap> analyzeGaps() {
        if (files == null) {
            return List.of();
        }

        List<CoverageGap> gaps = new ArrayList<>();
        for (FileCoverage file : files) {
            if (file.missingLines().isEmpty()) {
                continue;
            }
            try {
                gaps.addAll(analyzeFileGaps(file));
            } catch (RuntimeException e) {
                log.warn("Error analyzing {}: {}", file.path(), e.getMessage());
            }
        }

        gaps.sort(Comparator
                .comparingInt((CoverageGap g) -> g.getSeverity().getRank())
                .thenComparingInt(CoverageGap::getComplexityScore)
                .reversed());
        return gaps;
    }

    private List<CoverageGap> analyzeFileGaps(FileCoverage file) {
        Optional<ParsedSource> parsed = parsedSource(file.path());
        if (parsed.isEmpty()) {
            return List.of();
        }
        ParsedSource source = parsed.get();

        List<CoverageGap> gaps = new ArrayList<>();
        for (int lineNumber : file.missingLines()) {
            String line = source.line(lineNumber);
            if (line == null || GapClassifier.isBlankOrComment(line)) {
                continue;
            }
            gaps.add(gapFor(file.path(), lineNumber, line.trim(), source.scopes()));
        }
        return gaps;
    }

    private CoverageGap gapFor(Path path, int lineNumber, String text, ScopeTree scopes) {
        String functionName = scopes.innermost(lineNumber, ScopeNode.Kind.FUNCTION).map(ScopeNode::name).orElse(null);
        String className = scopes.innermost(lineNumber, ScopeNode.Kind.CLASS).map(ScopeNode::name).orElse(null);
        boolean declaresFunction = scopes.functionDeclaredAt(lineNumber).isPresent();

        GapClassifier.LineContext context = new GapClassifier.LineContext(text, functionName, className, declaresFunction);
        return CoverageGap.builder()
                .filePath(path.toString())
                .lineStart(lineNumber)
                .lineEnd(lineNumber)
                .gapType(classifier.classifyType(context))
                .severity(classifier.classifySeverity(context))
                .functionName(functionName)
                .className(className)
                .complexityScore(classifier.complexity(text))
                .suggestedTests(classifier.suggestTests(context))
                .build();
    }

    /**
     * Source lines and scope tree of a file, parsed once per load. Empty when the file
     * cannot be read or parsed.
     */
    public Optional<ParsedSource> parsedSource(Path path) {
        return parsedSources.computeIfAbsent(path, this::parse);
    }

    private Optional<ParsedSource> parse(Path path) {
        try {
            List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            ScopeTree scopes = parser.parse(String.join("\n", lines), path.toString());
            return Optional.of(new ParsedSource(lines, scopes));
        } catch (IOException e) {
            log.warn("Skipping unreadable source {}: {}", path, e.getMessage());
        } catch (CoverageGateException e) {
            log.warn("Skipping {}: {}", path, e.getMessage());
        }
        return Optional.empty();
    }

    public CoverageQualityMetrics calculateQualityMetrics() {
        return calculateQualityMetrics(List.of());
    }

    /**
     * Aggregate metrics of the loaded data. All zero when nothing is loaded.
     *
     * @param history earlier measurements, oldest first; used for the trend only
     */
    public CoverageQualityMetrics calculateQualityMetrics(List<CoverageTrend> history) {
        if (files == null) {
            return CoverageQualityMetrics.empty();
        }

        List<CoverageGap> gaps = analyzeGaps();
        Map<Severity, Integer> bySeverity = new HashMap<>();
        for (CoverageGap gap : gaps) {
            bySeverity.merge(gap.getSeverity(), 1, Integer::sum);
        }

        SourceTotals totals = sourceTotals();
        FileBuckets buckets = fileBuckets();
        TrendDirection trend = TrendDirection.STABLE;
        double trendPercentage = 0.0;
        if (history != null && history.size() >= 2) {
            List<CoverageTrend> recent = history.subList(Math.max(0, history.size() - TREND_WINDOW), history.size());
            trendPercentage = (recent.get(recent.size() - 1).lineCoverage() - recent.get(0).lineCoverage()) / recent.size();
            if (trendPercentage > TREND_STABLE_SLOPE) {
                trend = TrendDirection.IMPROVING;
            } else if (trendPercentage < -TREND_STABLE_SLOPE) {
                trend = TrendDirection.DECLINING;
            }
        }

        return CoverageQualityMetrics.builder()
                .lineCoveragePercent(lineCoverage())
                .branchCoveragePercent(branchCoverage())
                .functionCoveragePercent(totals.functionCoverage())
                .effectiveCoverageScore(totals.effectiveCoverage())
                .testQualityScore(clampPercent(qualityScorer.score()))
                .coverageDensity(totals.density())
                .criticalGaps(bySeverity.getOrDefault(Severity.CRITICAL, 0))
                .highPriorityGaps(bySeverity.getOrDefault(Severity.HIGH, 0))
                .mediumPriorityGaps(bySeverity.getOrDefault(Severity.MEDIUM, 0))
                .lowPriorityGaps(bySeverity.getOrDefault(Severity.LOW, 0))
                .totalGaps(gaps.size())
                .coverageTrend(trend)
                .trendPercentage(trendPercentage)
                .wellCoveredFiles(buckets.well())
                .poorlyCoveredFiles(buckets.poorly())
                .uncoveredFiles(buckets.uncovered())
                .build();
    }

    /**
     * Condensed view of the current run, empty before a successful load.
     */
    public Optional<CoverageSummary> coverageSummary() {
        if (files == null) {
            return Optional.empty();
        }
        CoverageQualityMetrics metrics = calculateQualityMetrics();
        List<CoverageGap> gaps = analyzeGaps();

        Map<String, Integer> byType = new LinkedHashMap<>();
        for (CoverageGap gap : gaps) {
            byType.merge(gap.getGapType().getValue(), 1, Integer::sum);
        }

        return Optional.of(new CoverageSummary(
                OffsetDateTime.now(ZoneOffset.UTC).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                new CoverageSummary.Metrics(
                        metrics.getLineCoveragePercent(),
                        metrics.getBranchCoveragePercent(),
                        metrics.getFunctionCoveragePercent(),
                        metrics.getOverallScore(),
                        metrics.getEffectiveCoverageScore(),
                        metrics.getTestQualityScore()),
                new CoverageSummary.Gaps(gaps.size(), metrics.getCriticalGaps(), metrics.getHighPriorityGaps(), byType),
                new CoverageSummary.Files(metrics.getWellCoveredFiles(), metrics.getPoorlyCoveredFiles(),
                        metrics.getUncoveredFiles()),
                new CoverageSummary.Trend(metrics.getCoverageTrend(), metrics.getTrendPercentage())));
    }

    private double lineCoverage() {
        long executed = 0;
        long instrumented = 0;
        for (FileCoverage file : files) {
            executed += file.executedLines().size();
            instrumented += file.instrumentedLines();
        }
        return percent(executed, instrumented);
    }

    private double branchCoverage() {
        long covered = 0;
        long total = 0;
        for (FileCoverage file : files) {
            covered += file.coveredBranches();
            total += file.totalBranches();
        }
        return percent(covered, total);
    }

    /**
     * Function, effective and density figures, which all need the parsed source.
     * A function counts as covered when any instrumented line it owns was executed;
     * functions owning no instrumented line are not counted.
     */
    private SourceTotals sourceTotals() {
        long totalFunctions = 0;
        long coveredFunctions = 0;
        long weightedTotal = 0;
        long weightedCovered = 0;
        long codeLines = 0;
        long executedLines = 0;

        for (FileCoverage file : files) {
            Optional<ParsedSource> parsed = parsedSource(file.path());
            if (parsed.isEmpty()) {
                continue;
            }
            ParsedSource source = parsed.get();

            Map<ScopeNode, Boolean> functions = new IdentityHashMap<>();
            for (int line : file.executedLines()) {
                source.scopes().innermost(line, ScopeNode.Kind.FUNCTION).ifPresent(f -> functions.put(f, true));
            }
            for (int line : file.missingLines()) {
                source.scopes().innermost(line, ScopeNode.Kind.FUNCTION).ifPresent(f -> functions.putIfAbsent(f, false));
            }
            totalFunctions += functions.size();
            coveredFunctions += functions.values().stream().filter(Boolean::booleanValue).count();

            List<String> lines = source.lines();
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (GapClassifier.isBlankOrComment(line)) {
                    continue;
                }
                int weight = classifier.complexity(line);
                codeLines++;
                weightedTotal += weight;
                if (file.executedLines().contains(i + 1)) {
                    weightedCovered += weight;
                }
            }
            executedLines += file.executedLines().size();
        }

        return new SourceTotals(
                percent(coveredFunctions, totalFunctions),
                percent(weightedCovered, weightedTotal),
                codeLines == 0 ? 0.0 : Math.min(1.0, (double) executedLines / codeLines));
    }

    private FileBuckets fileBuckets() {
        int well = 0;
        int poorly = 0;
        int uncovered = 0;
        for (FileCoverage file : files) {
            if (file.instrumentedLines() == 0) {
                continue;
            }
            double pct = file.lineCoveragePercent();
            if (pct == 0.0) {
                uncovered++;
            } else if (pct < POORLY_COVERED_PERCENT) {
                poorly++;
            } else if (pct >= WELL_COVERED_PERCENT) {
                well++;
            }
        }
        return new FileBuckets(well, poorly, uncovered);
    }

    private static double percent(long part, long total) {
        return total == 0 ? 0.0 : clampPercent(part * 100.0 / total);
    }

    private static double clampPercent(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }

    private record SourceTotals(double functionCoverage, double effectiveCoverage, double density) {
    }

    private record FileBuckets(int well, int poorly, int uncovered) {
    }
}

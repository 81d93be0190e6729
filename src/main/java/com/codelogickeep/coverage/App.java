package com.codelogickeep.coverage;

import com.codelogickeep.coverage.config.AppConfig;
import com.codelogickeep.coverage.config.ConfigLoader;
import com.codelogickeep.coverage.config.ConfigValidator;
import com.codelogickeep.coverage.engine.CiCoverageRunner;
import com.codelogickeep.coverage.engine.PipelineFactory;
import com.codelogickeep.coverage.engine.PipelineFactory.Pipeline;
import com.codelogickeep.coverage.exception.CoverageGateException;
import com.codelogickeep.coverage.model.CiRunResult;
import com.codelogickeep.coverage.model.CoverageGap;
import com.codelogickeep.coverage.model.CoverageQualityMetrics;
import com.codelogickeep.coverage.model.CoverageStatistics;
import com.codelogickeep.coverage.model.MetricStatistics;
import com.codelogickeep.coverage.model.MissingTestFile;
import com.codelogickeep.coverage.model.Priority;
import com.codelogickeep.coverage.model.QualityGate;
import com.codelogickeep.coverage.model.Regression;
import com.codelogickeep.coverage.model.RegressionReport;
import com.codelogickeep.coverage.model.TestSuggestion;
import com.codelogickeep.coverage.report.ReportResult;
import com.codelogickeep.coverage.util.JsonUtil;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.Console;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "coverage-gate", mixinStandardHelpOptions = true, version = "0.1.0",
        description = "Coverage quality analysis, trend tracking and CI quality gates for Java projects.",
        subcommands = {
                App.AnalyzeCommand.class,
                App.ReportCommand.class,
                App.SuggestCommand.class,
                App.TrendsCommand.class,
                App.CiCommand.class,
                App.CleanCommand.class
        })
public class App implements Callable<Integer> {

    static final int EXIT_CONFIG_ERROR = 2;
    private static final String RULE = "=".repeat(60);
    private static final String SUB_RULE = "-".repeat(30);

    @Option(names = {"-c", "--config"}, scope = CommandLine.ScopeType.INHERIT,
            description = "Configuration file layered over the defaults and ./coverage-gate.yml")
    private String configPath;

    @Option(names = {"-p", "--project"}, scope = CommandLine.ScopeType.INHERIT, defaultValue = ".",
            description = "Project directory that relative paths resolve against. Default: ${DEFAULT-VALUE}")
    private String projectDir;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new App());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof CoverageGateException) {
                System.err.println(((CoverageGateException) ex).toConsoleMessage());
                return EXIT_CONFIG_ERROR;
            }
            System.err.println("Error: " + ex.getMessage());
            return 1;
        });
        return cmd;
    }

    @Override
    public Integer call() {
        new CommandLine(this).usage(System.out);
        return 0;
    }

    AppConfig loadConfig() {
        AppConfig config = new ConfigLoader().load(configPath);
        ConfigValidator.validate(config);
        return config;
    }

    Path projectPath() {
        return Paths.get(projectDir).toAbsolutePath().normalize();
    }

    Pipeline pipeline(AppConfig config) {
        return PipelineFactory.create(config, projectPath());
    }

    static void emit(String text, Path output) throws IOException {
        if (output == null) {
            System.out.println(text);
            return;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, text, StandardCharsets.UTF_8);
        System.out.println(">>> Output saved to " + output.toAbsolutePath());
    }

    static String titleCase(String snake) {
        StringBuilder sb = new StringBuilder();
        for (String word : snake.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }

    private static String fileName(String path) {
        return path == null ? "" : Paths.get(path).getFileName().toString();
    }

    @Command(name = "analyze", mixinStandardHelpOptions = true,
            description = "Analyze test coverage and identify gaps.")
    static class AnalyzeCommand implements Callable<Integer> {

        @ParentCommand
        private App parent;

        @Option(names = {"-o", "--output"}, description = "Output file (default: stdout)")
        private Path output;

        @Option(names = "--format", defaultValue = "text", description = "text or json. Default: ${DEFAULT-VALUE}")
        private String format;

        @Option(names = "--detailed", description = "Include the top 20 gaps")
        private boolean detailed;

        @Override
        public Integer call() throws Exception {
            Pipeline pipeline = parent.pipeline(parent.loadConfig());
            if (!pipeline.analyzer().load()) {
                System.err.println("Error: " + ReportResult.LOAD_FAILED);
                System.err.println("Make sure the tests ran with JaCoCo first: mvn test jacoco:report");
                return 1;
            }
            CoverageQualityMetrics metrics = pipeline.analyzer()
                    .calculateQualityMetrics(pipeline.tracker().loadHistory());
            List<CoverageGap> gaps = detailed ? pipeline.analyzer().analyzeGaps() : List.of();
            List<CoverageGap> top = gaps.subList(0, Math.min(20, gaps.size()));

            String text;
            if ("json".equalsIgnoreCase(format)) {
                Map<String, Object> document = new LinkedHashMap<>();
                document.put("summary", pipeline.analyzer().coverageSummary().orElse(null));
                if (detailed) {
                    document.put("gaps_detail", top);
                }
                text = JsonUtil.toJson(document);
            } else {
                text = formatAnalysis(metrics, top);
            }
            emit(text, output);
            return 0;
        }

        private String formatAnalysis(CoverageQualityMetrics m, List<CoverageGap> gaps) {
            List<String> lines = new ArrayList<>();
            lines.add(RULE);
            lines.add("COVERAGE ANALYSIS REPORT");
            lines.add(RULE);
            lines.add("");
            lines.add("COVERAGE METRICS");
            lines.add(SUB_RULE);
            lines.add(String.format(Locale.ROOT, "Line Coverage:      %6.1f%%", m.getLineCoveragePercent()));
            lines.add(String.format(Locale.ROOT, "Branch Coverage:    %6.1f%%", m.getBranchCoveragePercent()));
            lines.add(String.format(Locale.ROOT, "Function Coverage:  %6.1f%%", m.getFunctionCoveragePercent()));
            lines.add(String.format(Locale.ROOT, "Overall Score:      %6.1f", m.getOverallScore()));
            lines.add(String.format(Locale.ROOT, "Effective Coverage: %6.1f%%", m.getEffectiveCoverageScore()));
            lines.add(String.format(Locale.ROOT, "Test Quality:       %6.1f", m.getTestQualityScore()));
            lines.add("");
            lines.add("COVERAGE GAPS");
            lines.add(SUB_RULE);
            lines.add("Total Gaps:         " + m.getTotalGaps());
            lines.add("Critical Gaps:      " + m.getCriticalGaps());
            lines.add("High Priority:      " + m.getHighPriorityGaps());
            lines.add("");
            lines.add("TREND ANALYSIS");
            lines.add(SUB_RULE);
            lines.add("Trend Direction:    " + titleCase(m.getCoverageTrend().getValue()));
            lines.add(String.format(Locale.ROOT, "Trend Change:       %+.1f%%", m.getTrendPercentage()));
            lines.add("");
            lines.add("FILE ANALYSIS");
            lines.add(SUB_RULE);
            lines.add("Well Covered:       " + m.getWellCoveredFiles() + " files (>=90%)");
            lines.add("Poorly Covered:     " + m.getPoorlyCoveredFiles() + " files (<50%)");
            lines.add("Uncovered:          " + m.getUncoveredFiles() + " files (0%)");
            if (detailed) {
                lines.add("");
                lines.add("DETAILED GAPS (Top 20)");
                lines.add(SUB_RULE);
                for (CoverageGap gap : gaps) {
                    lines.add("* " + fileName(gap.getFilePath()) + ":" + gap.getLineStart() + "-" + gap.getLineEnd()
                            + " - " + gap.getGapType().getValue() + " (" + gap.getSeverity().getValue() + ")");
                    if (gap.getFunctionName() != null) {
                        lines.add("  Function: " + gap.getFunctionName());
                    }
                    if (!gap.getSuggestedTests().isEmpty()) {
                        lines.add("  Suggestion: " + gap.getSuggestedTests().get(0));
                    }
                    lines.add("");
                }
            }
            return String.join("\n", lines);
        }
    }

    @Command(name = "report", mixinStandardHelpOptions = true,
            description = "Generate HTML, JSON and chart reports.")
    static class ReportCommand implements Callable<Integer> {

        @ParentCommand
        private App parent;

        @Option(names = "--title", description = "Report title (default from configuration)")
        private String title;

        @Option(names = "--include-trends", description = "Include coverage trends from the history")
        private boolean includeTrends;

        @Option(names = "--include-suggestions", description = "Include test suggestions")
        private boolean includeSuggestions;

        @Override
        public Integer call() {
            AppConfig config = parent.loadConfig();
            Pipeline pipeline = parent.pipeline(config);
            ReportResult result = pipeline.reporter().comprehensiveReport(
                    pipeline.analyzer(),
                    includeTrends ? pipeline.tracker() : null,
                    includeSuggestions ? pipeline.generator() : null,
                    title != null ? title : config.getReporting().getTitle());
            if (!result.isSuccess()) {
                System.err.println("Error: " + result.error());
                return 1;
            }
            System.out.println(">>> Coverage reports generated:");
            result.artifacts().forEach((kind, path) ->
                    System.out.println("    " + kind.toUpperCase(Locale.ROOT) + ": " + path));
            Path html = result.artifacts().get("html");
            if (html != null) {
                System.out.println(">>> Open HTML report: " + html.toAbsolutePath().toUri());
            }
            return 0;
        }
    }

    @Command(name = "suggest", mixinStandardHelpOptions = true,
            description = "Suggest tests for coverage gaps and list sources without tests.")
    static class SuggestCommand implements Callable<Integer> {

        @ParentCommand
        private App parent;

        @Option(names = "--max-suggestions", defaultValue = "25", description = "Default: ${DEFAULT-VALUE}")
        private int maxSuggestions;

        @Option(names = {"-o", "--output"}, description = "Output file (default: stdout)")
        private Path output;

        @Option(names = "--format", defaultValue = "text", description = "text or json. Default: ${DEFAULT-VALUE}")
        private String format;

        @Option(names = "--templates", description = "Print the rendered JUnit source of each suggestion")
        private boolean templates;

        @Option(names = "--missing", description = "List source files without a test class instead")
        private boolean missing;

        @Override
        public Integer call() throws Exception {
            Pipeline pipeline = parent.pipeline(parent.loadConfig());
            if (missing) {
                List<MissingTestFile> files = pipeline.generator().findMissingTestFiles();
                emit("json".equalsIgnoreCase(format) ? JsonUtil.toJson(files) : formatMissing(files), output);
                return 0;
            }

            List<TestSuggestion> suggestions = pipeline.generator().generateSuggestions(maxSuggestions);
            if (suggestions.isEmpty()) {
                System.out.println(">>> No test suggestions needed, coverage looks good.");
                return 0;
            }
            String text;
            if ("json".equalsIgnoreCase(format)) {
                List<Map<String, Object>> data = new ArrayList<>();
                for (TestSuggestion s : suggestions) {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("file", s.getFilePath());
                    entry.put("function", s.getFunctionName());
                    entry.put("class", s.getClassName());
                    entry.put("type", s.getTestType());
                    entry.put("priority", s.getPriority());
                    entry.put("description", s.getDescription());
                    entry.put("test_name", s.getFullTestName());
                    entry.put("template", s.getTestTemplate());
                    data.add(entry);
                }
                text = JsonUtil.toJson(data);
            } else {
                text = formatSuggestions(pipeline, suggestions);
            }
            emit(text, output);
            return 0;
        }

        private String formatSuggestions(Pipeline pipeline, List<TestSuggestion> suggestions) {
            List<String> lines = new ArrayList<>();
            lines.add(RULE);
            lines.add("TEST SUGGESTIONS");
            lines.add(RULE);
            lines.add("");
            lines.add("Generated " + suggestions.size() + " test suggestions to improve coverage:");
            lines.add("");
            for (Priority priority : Priority.values()) {
                List<TestSuggestion> group = suggestions.stream()
                        .filter(s -> s.getPriority() == priority)
                        .toList();
                if (group.isEmpty()) {
                    continue;
                }
                lines.add(priority.getValue().toUpperCase(Locale.ROOT) + " PRIORITY (" + group.size() + " suggestions)");
                lines.add("-".repeat(50));
                for (TestSuggestion s : group) {
                    String scope = s.getFunctionName() != null ? s.getFunctionName() : "file level";
                    if (s.getClassName() != null) {
                        scope = s.getClassName() + "." + scope;
                    }
                    lines.add("* " + fileName(s.getFilePath()) + " - " + scope);
                    lines.add("  Type: " + titleCase(s.getTestType().getValue()));
                    lines.add("  Description: " + s.getDescription());
                    lines.add("  Suggested test: " + s.getFullTestName());
                    if (templates) {
                        lines.add("");
                        lines.add(pipeline.generator().renderTemplate(s));
                    }
                    lines.add("");
                }
            }
            return String.join("\n", lines);
        }

        private String formatMissing(List<MissingTestFile> files) {
            if (files.isEmpty()) {
                return ">>> Every source file has a test class.";
            }
            List<String> lines = new ArrayList<>();
            lines.add("Source files without tests (" + files.size() + "):");
            for (MissingTestFile file : files) {
                lines.add("* [" + file.priority().getValue().toUpperCase(Locale.ROOT) + "] " + file.sourceFile());
                lines.add("  Expected: " + file.expectedTestFile());
                lines.add("  Functions: " + file.testStructure().functions().size()
                        + ", classes: " + file.testStructure().classes().size());
            }
            return String.join("\n", lines);
        }
    }

    @Command(name = "trends", mixinStandardHelpOptions = true,
            description = "Analyze coverage trends over time.")
    static class TrendsCommand implements Callable<Integer> {

        @ParentCommand
        private App parent;

        @Option(names = "--period", defaultValue = "30", description = "Period in days. Default: ${DEFAULT-VALUE}")
        private int period;

        @Option(names = "--format", defaultValue = "text", description = "text or json. Default: ${DEFAULT-VALUE}")
        private String format;

        @Option(names = "--export-csv", description = "Also write the full history as CSV")
        private Path exportCsv;

        @Override
        public Integer call() throws Exception {
            Pipeline pipeline = parent.pipeline(parent.loadConfig());
            if (exportCsv != null) {
                pipeline.tracker().exportCsv(exportCsv);
                System.out.println(">>> History exported to " + exportCsv.toAbsolutePath());
            }
            CoverageStatistics stats = pipeline.tracker().statistics(period);
            if (!stats.isAvailable()) {
                System.err.println("Error: " + stats.error());
                return 1;
            }
            RegressionReport regression = pipeline.tracker().detectRegression();
            if ("json".equalsIgnoreCase(format)) {
                Map<String, Object> document = new LinkedHashMap<>();
                document.put("statistics", stats);
                document.put("regression_check", regression);
                System.out.println(JsonUtil.toJson(document));
            } else {
                System.out.println(formatTrends(stats, regression));
            }
            return 0;
        }

        private String formatTrends(CoverageStatistics stats, RegressionReport regression) {
            List<String> lines = new ArrayList<>();
            lines.add(RULE);
            lines.add("COVERAGE TRENDS ANALYSIS");
            lines.add(RULE);
            lines.add("");
            lines.add("ANALYSIS PERIOD: " + stats.periodDays() + " days");
            lines.add("DATA POINTS: " + stats.dataPoints());
            lines.add("PERIOD: " + stats.firstTimestamp() + " to " + stats.lastTimestamp());
            lines.add("");
            for (Map.Entry<String, MetricStatistics> entry : stats.statistics().entrySet()) {
                MetricStatistics data = entry.getValue();
                lines.add(titleCase(entry.getKey()).toUpperCase(Locale.ROOT));
                lines.add(SUB_RULE);
                lines.add(String.format(Locale.ROOT, "Current:    %.1f", data.current()));
                lines.add(String.format(Locale.ROOT, "Average:    %.1f", data.average()));
                lines.add(String.format(Locale.ROOT, "Range:      %.1f - %.1f", data.min(), data.max()));
                lines.add("Trend:      " + titleCase(data.trend().direction().getValue()));
                lines.add(String.format(Locale.ROOT, "Change:     %+.1f%%", data.trend().changePercent()));
                lines.add("");
            }
            if (regression.hasRegression()) {
                lines.add("REGRESSION DETECTED");
                lines.add(SUB_RULE);
                for (Regression r : regression.regressions()) {
                    lines.add("* " + titleCase(r.metric().getKey()));
                    lines.add(String.format(Locale.ROOT, "  Current: %.1f", r.currentValue()));
                    lines.add(String.format(Locale.ROOT, "  Average: %.1f", r.recentAverage()));
                    lines.add(String.format(Locale.ROOT, "  Drop: %.1f%%", r.percentageDrop()));
                    lines.add("  Severity: " + r.severity().toUpperCase(Locale.ROOT));
                    lines.add("");
                }
            } else {
                lines.add("No regressions detected");
            }
            return String.join("\n", lines);
        }
    }

    @Command(name = "ci", mixinStandardHelpOptions = true,
            description = "Run coverage analysis with quality gates for CI pipelines.")
    static class CiCommand implements Callable<Integer> {

        @ParentCommand
        private App parent;

        @Option(names = "--quick", description = "Only compare line coverage with --min-coverage")
        private boolean quick;

        @Option(names = "--min-coverage", description = "Minimum line coverage (overrides the line coverage gate)")
        private Double minCoverage;

        @Option(names = "--min-branch", description = "Minimum branch coverage (overrides the branch coverage gate)")
        private Double minBranch;

        @Option(names = "--max-critical-gaps", description = "Maximum critical gaps (overrides the critical gaps gate)")
        private Double maxCriticalGaps;

        @Option(names = "--no-reports", description = "Skip report generation")
        private boolean noReports;

        @Option(names = "--no-tracking", description = "Skip trend tracking and regression detection")
        private boolean noTracking;

        @Option(names = "--junit-xml", description = "Export gate results as JUnit XML")
        private Path junitXml;

        @Option(names = {"--commit", "--commit-hash"}, description = "VCS commit of this run")
        private String commit;

        @Option(names = {"--branch", "--branch-name"}, description = "VCS branch of this run")
        private String branch;

        @Option(names = "--json", description = "Print the full result as JSON after the summary")
        private boolean json;

        @Override
        public Integer call() throws Exception {
            AppConfig config = parent.loadConfig();
            Pipeline pipeline = parent.pipeline(config);
            CiCoverageRunner runner = pipeline.runner();

            if (quick) {
                double min = minCoverage != null ? minCoverage : config.getCi().getMinLineCoverage();
                CiCoverageRunner.QuickCheckResult check = runner.quickCheck(min);
                System.out.println(check.message());
                return check.passed() ? 0 : 1;
            }

            List<QualityGate> gates = runner.getQualityGates();
            gates = overrideThreshold(gates, "line_coverage", minCoverage);
            gates = overrideThreshold(gates, "branch_coverage", minBranch);
            gates = overrideThreshold(gates, "critical_gaps", maxCriticalGaps);

            CiRunResult result = runner.run(CiCoverageRunner.RunOptions.builder()
                    .gates(gates)
                    .generateReports(!noReports && config.getCi().isGenerateReports())
                    .trackTrends(!noTracking && config.getCi().isTrackTrends())
                    .failOnRegression(config.getCi().isFailOnRegression())
                    .commitId(commit)
                    .branchName(branch)
                    .build());

            System.out.println(runner.ciSummary(result));
            if (junitXml != null) {
                runner.exportJUnit(result, junitXml);
                System.out.println(">>> JUnit XML exported to " + junitXml.toAbsolutePath());
            }
            if (json) {
                System.out.println();
                System.out.println(JsonUtil.toJson(result));
            }
            return result.exitCode();
        }

        static List<QualityGate> overrideThreshold(List<QualityGate> gates, String metric, Double threshold) {
            if (threshold == null) {
                return gates;
            }
            List<QualityGate> updated = new ArrayList<>();
            for (QualityGate gate : gates) {
                if (metric.equals(gate.metric())) {
                    updated.add(new QualityGate(gate.name(), gate.metric(), threshold, gate.operator(),
                            gate.enabled(), gate.severity()));
                } else {
                    updated.add(gate);
                }
            }
            return updated;
        }
    }

    @Command(name = "clean", mixinStandardHelpOptions = true,
            description = "Remove coverage history older than the retention period.")
    static class CleanCommand implements Callable<Integer> {

        @ParentCommand
        private App parent;

        @Option(names = "--keep-days", description = "Days of history to keep (default from configuration)")
        private Integer keepDays;

        @Option(names = {"-y", "--yes"}, description = "Do not ask for confirmation")
        private boolean yes;

        @Override
        public Integer call() {
            AppConfig config = parent.loadConfig();
            int days = keepDays != null ? keepDays : config.getTracking().getKeepDays();
            if (!yes) {
                Console console = System.console();
                if (console == null) {
                    System.err.println("Error: no console to confirm; pass --yes to clean non-interactively");
                    return 1;
                }
                String answer = console.readLine("Remove coverage history older than %d days? [y/N] ", days);
                if (answer == null || !answer.trim().toLowerCase(Locale.ROOT).startsWith("y")) {
                    System.out.println(">>> Aborted.");
                    return 0;
                }
            }
            int removed = parent.pipeline(config).tracker().cleanup(days);
            System.out.println(">>> Removed " + removed + " coverage records older than " + days + " days");
            return 0;
        }
    }
}

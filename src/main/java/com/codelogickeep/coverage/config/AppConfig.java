package com.codelogickeep.coverage.config;

import com.codelogickeep.coverage.model.GateOperator;
import com.codelogickeep.coverage.model.GateSeverity;
import com.codelogickeep.coverage.model.QualityGate;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.OptBoolean;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private AnalysisConfig analysis = new AnalysisConfig();
    private TrackingConfig tracking = new TrackingConfig();
    private ReportingConfig reporting = new ReportingConfig();
    private CiConfig ci = new CiConfig();
    private ProbeConfig probe = new ProbeConfig();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AnalysisConfig {
        @JsonProperty("source-dir")
        private String sourceDir = "src/main/java";
        @JsonProperty("test-dir")
        private String testDir = "src/test/java";
        @JsonProperty("jacoco-report")
        private String jacocoReport = "target/site/jacoco/jacoco.xml";
        /** Extra regex patterns matched against normalized source paths */
        @JsonProperty("exclude-patterns")
        @JsonMerge(OptBoolean.FALSE)
        private List<String> excludePatterns = new ArrayList<>();
        /** fixed | assertion-density */
        @JsonProperty("test-quality-scorer")
        private String testQualityScorer = "fixed";
        @JsonProperty("test-quality-baseline")
        private double testQualityBaseline = 75.0;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TrackingConfig {
        @JsonProperty("data-dir")
        private String dataDir = "coverage_reports/history";
        @JsonProperty("max-history")
        private int maxHistory = 100;
        @JsonProperty("regression-threshold")
        private double regressionThreshold = 5.0;
        @JsonProperty("keep-days")
        private int keepDays = 365;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReportingConfig {
        @JsonProperty("output-dir")
        private String outputDir = "coverage_reports";
        private String title = "Coverage Analysis Report";
        private boolean charts = true;
        @JsonProperty("max-suggestions")
        private int maxSuggestions = 25;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CiConfig {
        @JsonProperty("generate-reports")
        private boolean generateReports = true;
        @JsonProperty("track-trends")
        private boolean trackTrends = true;
        @JsonProperty("fail-on-regression")
        private boolean failOnRegression = true;
        @JsonProperty("min-line-coverage")
        private double minLineCoverage = 80.0;
        @JsonMerge(OptBoolean.FALSE)
        private List<GateConfig> gates = defaultGates();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProbeConfig {
        /** surefire | process | none */
        private String type = "surefire";
        /** Command line for the process probe, e.g. ["mvn", "-q", "test"] */
        @JsonMerge(OptBoolean.FALSE)
        private List<String> command = new ArrayList<>();
        @JsonProperty("timeout-seconds")
        private long timeoutSeconds = 30;
        @JsonProperty("reports-dir")
        private String reportsDir = "target/surefire-reports";
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GateConfig {
        private String name;
        private String metric;
        private double threshold;
        private String operator = "gte";
        private boolean enabled = true;
        private String severity = "error";

        public QualityGate toQualityGate() {
            return new QualityGate(name, metric, threshold,
                    GateOperator.fromValue(operator), enabled, GateSeverity.fromValue(severity));
        }
    }

    public static List<GateConfig> defaultGates() {
        List<GateConfig> gates = new ArrayList<>();
        gates.add(new GateConfig("MinimumLineCoverage", "line_coverage", 80.0, "gte", true, "error"));
        gates.add(new GateConfig("MinimumBranchCoverage", "branch_coverage", 70.0, "gte", true, "warning"));
        gates.add(new GateConfig("MaximumCriticalGaps", "critical_gaps", 5.0, "lte", true, "error"));
        gates.add(new GateConfig("MinimumOverallScore", "overall_score", 75.0, "gte", true, "warning"));
        return gates;
    }
}

package com.codelogickeep.coverage.report;

import com.codelogickeep.coverage.model.CoverageGap;
import com.codelogickeep.coverage.model.CoverageQualityMetrics;
import com.codelogickeep.coverage.model.CoverageTrend;
import com.codelogickeep.coverage.model.TestSuggestion;

import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Renders the self-contained HTML dashboard. Every interpolated value is escaped.
 */
class HtmlReportWriter {

    static final int MAX_GAPS = 20;
    static final int MAX_SUGGESTIONS = 15;
    private static final int TREND_WINDOW = 10;
    private static final int MAX_SUGGESTION_TEXT = 100;

    String render(String title, String generatedAt, CoverageQualityMetrics metrics, List<CoverageGap> gaps,
                  List<CoverageTrend> trends, List<TestSuggestion> suggestions, boolean chartsAvailable) {
        StringBuilder html = new StringBuilder();
        html.append("""
                <!DOCTYPE html>
                <html lang="en">
                <head>
                    <meta charset="UTF-8">
                    <meta name="viewport" content="width=device-width, initial-scale=1.0">
                """);
        html.append("    <title>").append(escapeHtml(title)).append("</title>\n");
        html.append(STYLE);
        html.append("</head>\n<body>\n<div class=\"container\">\n");
        html.append("    <div class=\"header\">\n");
        html.append("        <h1>").append(escapeHtml(title)).append("</h1>\n");
        html.append("        <p>Generated ").append(escapeHtml(generatedAt)).append("</p>\n");
        html.append("    </div>\n");

        appendSummary(html, metrics);
        appendDashboard(html, metrics);
        appendGaps(html, gaps);
        appendTrends(html, trends, chartsAvailable);
        appendSuggestions(html, suggestions);

        html.append("</div>\n</body>\n</html>\n");
        return html.toString();
    }

    private void appendSummary(StringBuilder html, CoverageQualityMetrics metrics) {
        html.append("    <div class=\"section\">\n        <h2>Coverage Summary</h2>\n");
        html.append("        <div class=\"summary-stats\">\n");
        stat(html, fmt1(metrics.getOverallScore()), "Overall Score");
        stat(html, fmt1(metrics.getLineCoveragePercent()) + "%", "Line Coverage");
        stat(html, fmt1(metrics.getBranchCoveragePercent()) + "%", "Branch Coverage");
        stat(html, fmt1(metrics.getFunctionCoveragePercent()) + "%", "Function Coverage");
        stat(html, String.valueOf(metrics.getTotalGaps()), "Coverage Gaps");
        stat(html, titleCase(metrics.getCoverageTrend().getValue()), "Trend Direction");
        html.append("        </div>\n    </div>\n");
    }

    private void appendDashboard(StringBuilder html, CoverageQualityMetrics metrics) {
        html.append("    <div class=\"section\">\n        <h2>Quality Metrics</h2>\n");
        html.append("        <div class=\"metrics-grid\">\n");
        card(html, cardClass(metrics.getLineCoveragePercent(), 90, 70), "Line Coverage",
                fmt1(metrics.getLineCoveragePercent()) + "%",
                "Effective: " + fmt1(metrics.getEffectiveCoverageScore()) + "%");
        card(html, cardClass(metrics.getBranchCoveragePercent(), 85, 65), "Branch Coverage",
                fmt1(metrics.getBranchCoveragePercent()) + "%", "Decision Points");
        card(html, "", "Function Coverage", fmt1(metrics.getFunctionCoveragePercent()) + "%", "Methods and Constructors");
        card(html, cardClass(metrics.getOverallScore(), 85, 70), "Overall Quality",
                fmt1(metrics.getOverallScore()), "Composite Score");
        card(html, "", "Test Quality", fmt1(metrics.getTestQualityScore()), "Test Effectiveness");
        card(html, "", "Coverage Density", String.format(Locale.ROOT, "%.2f", metrics.getCoverageDensity()),
                "Coverage per LOC");
        html.append("        </div>\n    </div>\n");
    }

    private void appendGaps(StringBuilder html, List<CoverageGap> gaps) {
        html.append("    <div class=\"section\">\n");
        if (gaps.isEmpty()) {
            html.append("        <h2>Coverage Gaps</h2>\n");
            html.append("        <p>No significant coverage gaps detected.</p>\n    </div>\n");
            return;
        }
        html.append("        <h2>Coverage Gaps</h2>\n");
        html.append("        <table class=\"gaps-table\">\n            <thead><tr>");
        html.append("<th>File</th><th>Class/Method</th><th>Lines</th><th>Type</th>");
        html.append("<th>Severity</th><th>Complexity</th><th>Suggestions</th></tr></thead>\n");
        html.append("            <tbody>\n");
        for (CoverageGap gap : gaps.subList(0, Math.min(MAX_GAPS, gaps.size()))) {
            String allSuggestions = gap.getSuggestedTests().isEmpty() ? "None" : String.join("; ", gap.getSuggestedTests());
            String shown = gap.getSuggestedTests().isEmpty()
                    ? "None"
                    : String.join("; ", gap.getSuggestedTests().subList(0, Math.min(2, gap.getSuggestedTests().size())));
            if (shown.length() > MAX_SUGGESTION_TEXT) {
                shown = shown.substring(0, MAX_SUGGESTION_TEXT - 3) + "...";
            }
            String severity = gap.getSeverity().getValue();
            html.append("                <tr>");
            cell(html, fileName(gap.getFilePath()));
            cell(html, gap.getScopeLabel());
            cell(html, gap.getLineStart() + "-" + gap.getLineEnd());
            cell(html, gap.getGapType().getLabel());
            html.append("<td><span class=\"severity-").append(severity).append("\">")
                    .append(severity.toUpperCase(Locale.ROOT)).append("</span></td>");
            cell(html, String.valueOf(Math.max(1, gap.getComplexityScore())));
            html.append("<td title=\"").append(escapeHtml(allSuggestions)).append("\">")
                    .append(escapeHtml(shown)).append("</td>");
            html.append("</tr>\n");
        }
        html.append("            </tbody>\n        </table>\n    </div>\n");
    }

    private void appendTrends(StringBuilder html, List<CoverageTrend> trends, boolean chartsAvailable) {
        if (trends.size() < 2) {
            return;
        }
        List<CoverageTrend> recent = trends.subList(Math.max(0, trends.size() - TREND_WINDOW), trends.size());
        double first = recent.get(0).lineCoverage();
        double last = recent.get(recent.size() - 1).lineCoverage();
        double slope = (last - first) / recent.size();
        String direction = slope > 0.5 ? "Improving" : slope < -0.5 ? "Declining" : "Stable";
        double average = recent.stream().mapToDouble(CoverageTrend::lineCoverage).average().orElse(0.0);
        double min = recent.stream().mapToDouble(CoverageTrend::lineCoverage).min().orElse(0.0);
        double max = recent.stream().mapToDouble(CoverageTrend::lineCoverage).max().orElse(0.0);

        html.append("    <div class=\"section\">\n        <h2>Coverage Trends</h2>\n");
        html.append("        <div class=\"summary-stats\">\n");
        stat(html, String.valueOf(trends.size()), "Data Points");
        stat(html, direction, "Trend Direction");
        stat(html, fmt1(average) + "%", "Average Coverage");
        stat(html, fmt1(max - min) + "%", "Coverage Range");
        html.append("        </div>\n");
        if (chartsAvailable) {
            html.append("        <div class=\"chart-container\">\n");
            html.append("            <img src=\"charts/coverage_trends.png\" alt=\"Coverage trends\">\n");
            html.append("            <img src=\"charts/quality_score.png\" alt=\"Quality score\">\n");
            html.append("        </div>\n");
        }
        html.append("    </div>\n");
    }

    private void appendSuggestions(StringBuilder html, List<TestSuggestion> suggestions) {
        if (suggestions.isEmpty()) {
            return;
        }
        html.append("    <div class=\"section\">\n        <h2>Test Suggestions</h2>\n");
        html.append("        <table class=\"suggestions-table\">\n            <thead><tr>");
        html.append("<th>File</th><th>Class/Method</th><th>Test Type</th><th>Priority</th>");
        html.append("<th>Description</th><th>Suggested Test Name</th></tr></thead>\n");
        html.append("            <tbody>\n");
        for (TestSuggestion suggestion : suggestions.subList(0, Math.min(MAX_SUGGESTIONS, suggestions.size()))) {
            String scope = suggestion.getClassName() != null
                    ? suggestion.getClassName() + (suggestion.getFunctionName() != null ? "." + suggestion.getFunctionName() : "")
                    : (suggestion.getFunctionName() != null ? suggestion.getFunctionName() : "");
            String priority = suggestion.getPriority().getValue();
            html.append("                <tr>");
            cell(html, fileName(suggestion.getFilePath()));
            cell(html, scope);
            cell(html, titleCase(suggestion.getTestType().getValue()));
            html.append("<td><span class=\"priority-").append(priority).append("\">")
                    .append(priority.toUpperCase(Locale.ROOT)).append("</span></td>");
            cell(html, suggestion.getDescription());
            html.append("<td><code>").append(escapeHtml(suggestion.getFullTestName())).append("</code></td>");
            html.append("</tr>\n");
        }
        html.append("            </tbody>\n        </table>\n    </div>\n");
    }

    private static void stat(StringBuilder html, String value, String label) {
        html.append("            <div class=\"stat-item\"><div class=\"stat-value\">").append(escapeHtml(value))
                .append("</div><div class=\"stat-label\">").append(escapeHtml(label)).append("</div></div>\n");
    }

    private static void card(StringBuilder html, String cssClass, String heading, String value, String caption) {
        html.append("            <div class=\"metric-card ").append(cssClass).append("\">");
        html.append("<h3>").append(escapeHtml(heading)).append("</h3>");
        html.append("<div class=\"metric-value\">").append(escapeHtml(value)).append("</div>");
        html.append("<div class=\"metric-trend\">").append(escapeHtml(caption)).append("</div></div>\n");
    }

    private static void cell(StringBuilder html, String value) {
        html.append("<td>").append(escapeHtml(value)).append("</td>");
    }

    static String cardClass(double value, double success, double warning) {
        if (value >= success) {
            return "success";
        }
        return value >= warning ? "warning" : "critical";
    }

    private static String fileName(String path) {
        return path == null ? "" : Paths.get(path).getFileName().toString();
    }

    private static String fmt1(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static String titleCase(String snake) {
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

    static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#39;");
    }

    private static final String STYLE = """
                <style>
                    body { font-family: -apple-system, "Segoe UI", Roboto, sans-serif; margin: 0; background: #f5f7fa; color: #333; }
                    .container { max-width: 1200px; margin: 0 auto; padding: 20px; }
                    .header { background: #34495e; color: #fff; padding: 24px; border-radius: 8px; margin-bottom: 20px; }
                    .section { background: #fff; padding: 20px; border-radius: 8px; margin-bottom: 20px; box-shadow: 0 1px 3px rgba(0,0,0,0.1); }
                    .summary-stats { display: flex; flex-wrap: wrap; gap: 16px; }
                    .stat-item { flex: 1; min-width: 140px; text-align: center; }
                    .stat-value { font-size: 1.8em; font-weight: bold; }
                    .stat-label { color: #777; }
                    .metrics-grid { display: grid; grid-template-columns: repeat(auto-fit, minmax(220px, 1fr)); gap: 16px; }
                    .metric-card { border: 1px solid #ddd; border-left: 5px solid #95a5a6; border-radius: 6px; padding: 16px; }
                    .metric-card.success { border-left-color: #27ae60; }
                    .metric-card.warning { border-left-color: #f39c12; }
                    .metric-card.critical { border-left-color: #e74c3c; }
                    .metric-value { font-size: 2em; font-weight: bold; }
                    .metric-trend { color: #777; font-size: 0.9em; }
                    table { width: 100%; border-collapse: collapse; }
                    th, td { padding: 8px; border-bottom: 1px solid #eee; text-align: left; }
                    th { background: #f0f0f0; }
                    .severity-critical, .priority-high { color: #fff; background: #e74c3c; padding: 2px 6px; border-radius: 3px; }
                    .severity-high { color: #fff; background: #e67e22; padding: 2px 6px; border-radius: 3px; }
                    .severity-medium, .priority-medium { color: #fff; background: #f39c12; padding: 2px 6px; border-radius: 3px; }
                    .severity-low, .priority-low { color: #fff; background: #7f8c8d; padding: 2px 6px; border-radius: 3px; }
                    .chart-container img { max-width: 100%; margin-top: 12px; }
                </style>
            """;
}

package com.codelogickeep.coverage.report;

/**
 * Optional features available to {@link CoverageReporter}, decided once at construction.
 *
 * @param chartsEnabled whether PNG trend charts may be rendered
 */
public record ReporterCapabilities(boolean chartsEnabled) {

    private static final String CHART_CLASS = "org.jfree.chart.JFreeChart";

    public static ReporterCapabilities detect() {
        return new ReporterCapabilities(isChartLibraryPresent());
    }

    public static ReporterCapabilities withoutCharts() {
        return new ReporterCapabilities(false);
    }

    public ReporterCapabilities withCharts(boolean enabled) {
        return new ReporterCapabilities(enabled && chartsEnabled);
    }

    private static boolean isChartLibraryPresent() {
        try {
            Class.forName(CHART_CLASS, false, ReporterCapabilities.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }
}

package com.codelogickeep.coverage.report;

import com.codelogickeep.coverage.model.CoverageTrend;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.DateAxis;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.XYPlot;
import org.jfree.data.time.Millisecond;
import org.jfree.data.time.TimeSeries;
import org.jfree.data.time.TimeSeriesCollection;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Renders the trend PNGs embedded by the HTML report.
 */
class TrendChartWriter {

    static final String COVERAGE_TRENDS = "coverage_trends";
    static final String QUALITY_SCORE = "quality_score";

    private static final int WIDTH = 1200;
    private static final int HEIGHT = 600;

    /**
     * Writes both charts under {@code chartsDir}; returns artifact kind to file.
     */
    Map<String, Path> write(Path chartsDir, List<CoverageTrend> trends) throws IOException {
        Files.createDirectories(chartsDir);
        Map<String, Path> written = new LinkedHashMap<>();

        TimeSeriesCollection coverage = new TimeSeriesCollection();
        coverage.addSeries(series("Line Coverage", trends, CoverageTrend::lineCoverage));
        coverage.addSeries(series("Branch Coverage", trends, CoverageTrend::branchCoverage));
        coverage.addSeries(series("Function Coverage", trends, CoverageTrend::functionCoverage));
        Path coverageFile = chartsDir.resolve(COVERAGE_TRENDS + ".png");
        save(chart("Coverage Trends Over Time", "Coverage %", coverage), coverageFile);
        written.put(COVERAGE_TRENDS, coverageFile);

        TimeSeriesCollection quality = new TimeSeriesCollection();
        quality.addSeries(series("Overall Quality Score", trends, CoverageTrend::overallScore));
        Path qualityFile = chartsDir.resolve(QUALITY_SCORE + ".png");
        save(chart("Overall Quality Score Trend", "Quality Score", quality), qualityFile);
        written.put(QUALITY_SCORE, qualityFile);

        return written;
    }

    private static TimeSeries series(String name, List<CoverageTrend> trends, ToDoubleFunction<CoverageTrend> value) {
        TimeSeries series = new TimeSeries(name);
        for (CoverageTrend trend : trends) {
            series.addOrUpdate(new Millisecond(Date.from(trend.instant())), value.applyAsDouble(trend));
        }
        return series;
    }

    private static JFreeChart chart(String title, String valueLabel, TimeSeriesCollection dataset) {
        JFreeChart chart = ChartFactory.createTimeSeriesChart(title, "Date", valueLabel, dataset, true, false, false);
        XYPlot plot = chart.getXYPlot();
        ((DateAxis) plot.getDomainAxis()).setDateFormatOverride(new SimpleDateFormat("yyyy-MM-dd"));
        NumberAxis range = (NumberAxis) plot.getRangeAxis();
        range.setRange(0.0, 100.0);
        return chart;
    }

    private static void save(JFreeChart chart, Path file) throws IOException {
        ChartUtils.saveChartAsPNG(file.toFile(), chart, WIDTH, HEIGHT);
    }
}

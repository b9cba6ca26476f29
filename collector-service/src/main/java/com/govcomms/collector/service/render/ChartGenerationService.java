package com.govcomms.collector.service.render;

import com.govcomms.collector.dto.DailyAverage;
import com.govcomms.collector.dto.MonthlyCount;
import lombok.extern.slf4j.Slf4j;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.CategoryPlot;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.category.BarRenderer;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.category.DefaultCategoryDataset;
import org.jfree.data.time.Day;
import org.jfree.data.time.TimeSeries;
import org.jfree.data.time.TimeSeriesCollection;
import org.springframework.stereotype.Service;

import java.awt.*;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * PNG charts for the time-series artifacts, drawn with JFreeChart.
 */
@Service
@Slf4j
public class ChartGenerationService {

    private static final Color SERIES_COLOR = new Color(59, 130, 246);
    private static final Color BACKGROUND_COLOR = Color.WHITE;
    private static final Color TEXT_COLOR = new Color(30, 41, 59);
    private static final Color GRID_COLOR = new Color(226, 232, 240);

    private static final int WIDTH = 1200;
    private static final int HEIGHT = 500;
    private static final String NO_DATA = "No dated items";

    /**
     * Bar chart of items per month.
     */
    public byte[] generateMonthlyChart(String title, List<MonthlyCount> counts) throws IOException {
        DefaultCategoryDataset dataset = new DefaultCategoryDataset();
        for (MonthlyCount count : counts) {
            dataset.addValue(count.count(), "Items", count.month().toString());
        }

        JFreeChart chart = ChartFactory.createBarChart(
                title,
                "Month",
                "Items",
                dataset,
                PlotOrientation.VERTICAL,
                false,  // legend
                false,  // tooltips
                false   // urls
        );
        applyTitleStyle(chart);

        CategoryPlot plot = chart.getCategoryPlot();
        plot.setBackgroundPaint(BACKGROUND_COLOR);
        plot.setRangeGridlinePaint(GRID_COLOR);
        plot.setOutlineVisible(false);
        plot.setNoDataMessage(NO_DATA);
        plot.getDomainAxis().setTickLabelsVisible(counts.size() <= 48);

        BarRenderer renderer = (BarRenderer) plot.getRenderer();
        renderer.setSeriesPaint(0, SERIES_COLOR);
        renderer.setDrawBarOutline(false);
        renderer.setShadowVisible(false);

        return chartToBytes(chart, WIDTH, HEIGHT);
    }

    /**
     * Line chart of the rolling average.
     */
    public byte[] generateRollingChart(String title, List<DailyAverage> averages) throws IOException {
        TimeSeries series = new TimeSeries("Average items/day");
        for (DailyAverage average : averages) {
            series.add(new Day(average.date().getDayOfMonth(), average.date().getMonthValue(),
                    average.date().getYear()), average.value());
        }

        JFreeChart chart = ChartFactory.createTimeSeriesChart(
                title,
                "Date",
                "Items/day",
                new TimeSeriesCollection(series),
                false,  // legend
                false,  // tooltips
                false   // urls
        );
        applyTitleStyle(chart);

        XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(BACKGROUND_COLOR);
        plot.setDomainGridlinePaint(GRID_COLOR);
        plot.setRangeGridlinePaint(GRID_COLOR);
        plot.setOutlineVisible(false);
        plot.setNoDataMessage(NO_DATA);

        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, false);
        renderer.setSeriesPaint(0, SERIES_COLOR);
        renderer.setSeriesStroke(0, new BasicStroke(2.0f));
        plot.setRenderer(renderer);

        return chartToBytes(chart, WIDTH, HEIGHT);
    }

    private void applyTitleStyle(JFreeChart chart) {
        chart.setBackgroundPaint(BACKGROUND_COLOR);
        if (chart.getTitle() != null) {
            chart.getTitle().setPaint(TEXT_COLOR);
            chart.getTitle().setFont(new Font("SansSerif", Font.BOLD, 16));
        }
    }

    private byte[] chartToBytes(JFreeChart chart, int width, int height) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        ChartUtils.writeChartAsPNG(baos, chart, width, height);
        return baos.toByteArray();
    }
}

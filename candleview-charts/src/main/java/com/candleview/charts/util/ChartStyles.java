package com.candleview.charts.util;

import com.candleview.charts.engine.SeriesOptions;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.DateAxis;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.axis.ValueAxis;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.ui.RectangleInsets;

import java.awt.BasicStroke;
import java.awt.Font;
import java.text.DecimalFormat;

/**
 * Central styling constants and methods for charts.
 */
public final class ChartStyles {

    private ChartStyles() {} // Prevent instantiation

    // ===== Line Strokes =====
    public static final float LINE_WIDTH = 0.6f;
    public static final BasicStroke LINE_STROKE = new BasicStroke(
        LINE_WIDTH, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND);
    public static final BasicStroke DASHED_STROKE = new BasicStroke(
        LINE_WIDTH, BasicStroke.CAP_BUTT, BasicStroke.JOIN_ROUND, 10.0f, new float[]{4.0f, 4.0f}, 0.0f);

    // Consistent axis tick label font
    private static final Font AXIS_TICK_FONT = new Font(Font.SANS_SERIF, Font.PLAIN, 10);

    /**
     * Candlestick series styling for a theme: themed up/down colors, no borders.
     */
    public static SeriesOptions candlestickSeries(ChartTheme theme) {
        return new SeriesOptions(
            theme.getCandleUpColor(),
            theme.getCandleDownColor(),
            theme.getCandleUpColor(),
            theme.getCandleDownColor(),
            false);
    }

    /**
     * Apply theme styling to a chart.
     */
    public static void stylizeChart(JFreeChart chart, ChartTheme theme) {
        chart.setBackgroundPaint(theme.getBackgroundColor());
        chart.setPadding(new RectangleInsets(0, 0, 0, 0));

        XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(theme.getPlotBackgroundColor());
        plot.setDomainGridlinePaint(theme.getGridlineColor());
        plot.setRangeGridlinePaint(theme.getGridlineColor());
        plot.setDomainGridlineStroke(LINE_STROKE);
        plot.setRangeGridlineStroke(LINE_STROKE);
        plot.setOutlineVisible(false);
        plot.setInsets(new RectangleInsets(0, 0, 0, 0));

        if (plot.getDomainAxis() instanceof DateAxis dateAxis) {
            styleAxis(dateAxis, theme);
        }
        if (plot.getRangeAxis() instanceof NumberAxis rangeAxis) {
            styleNumberAxis(rangeAxis, theme);
        }
    }

    /**
     * Apply consistent styling to a NumberAxis.
     */
    public static void styleNumberAxis(NumberAxis axis, ChartTheme theme) {
        styleAxis(axis, theme);
        axis.setFixedDimension(60);
        axis.setNumberFormatOverride(new DecimalFormat("#,##0.####"));
        axis.setTickMarksVisible(false);
    }

    private static void styleAxis(ValueAxis axis, ChartTheme theme) {
        axis.setTickLabelPaint(theme.getAxisLabelColor());
        axis.setTickLabelFont(AXIS_TICK_FONT);
        axis.setAxisLinePaint(theme.getBorderColor());
        axis.setAxisLineVisible(true);
    }
}

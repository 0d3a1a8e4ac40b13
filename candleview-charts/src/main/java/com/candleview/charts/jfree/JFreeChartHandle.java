package com.candleview.charts.jfree;

import com.candleview.charts.engine.CandleSeries;
import com.candleview.charts.engine.ChartHandle;
import com.candleview.charts.engine.ChartOptions;
import com.candleview.charts.engine.PointerMoveEvent;
import com.candleview.charts.engine.PointerMoveListener;
import com.candleview.charts.engine.PriceScale;
import com.candleview.charts.engine.SeriesOptions;
import com.candleview.charts.engine.Subscription;
import com.candleview.charts.engine.TimeScale;
import com.candleview.charts.util.ChartStyles;
import org.jfree.chart.ChartMouseEvent;
import org.jfree.chart.ChartMouseListener;
import org.jfree.chart.ChartPanel;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.AxisLocation;
import org.jfree.chart.axis.DateAxis;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.labels.StandardCrosshairLabelGenerator;
import org.jfree.chart.panel.CrosshairOverlay;
import org.jfree.chart.plot.Crosshair;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.ui.RectangleAnchor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.JComponent;
import java.awt.BorderLayout;
import java.awt.Dimension;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;

/**
 * A JFreeChart candlestick chart hosted in a Swing component.
 *
 * <p>Layout: a {@link DateAxis} for time, a {@link NumberAxis} for price on
 * the configured side, and one dataset per candlestick series. Pointer moves
 * come from a {@link ChartMouseListener} and are reported relative to the
 * chart panel.</p>
 */
class JFreeChartHandle implements ChartHandle {

    private static final Logger log = LoggerFactory.getLogger(JFreeChartHandle.class);

    private final JComponent host;
    private final ChartOptions options;

    private final DateAxis domainAxis;
    private final NumberAxis rangeAxis;
    private final XYPlot plot;
    private final JFreeChart chart;
    private final ChartPanel chartPanel;
    private final Crosshair crosshair;
    private final Crosshair priceCrosshair;

    private final List<JFreeCandleSeries> series = new ArrayList<>();
    private final List<PointerMoveListener> pointerListeners = new ArrayList<>();

    private final TimeScale timeScale;
    private final PriceScale priceScale;

    private int width;
    private boolean removed;

    private final ChartMouseListener mouseListener = new ChartMouseListener() {
        @Override
        public void chartMouseMoved(ChartMouseEvent event) {
            MouseEvent trigger = event.getTrigger();
            pointerMoved(trigger.getX(), trigger.getY(), chartPanel.getScreenDataArea());
        }

        @Override
        public void chartMouseClicked(ChartMouseEvent event) {
            // Clicks carry no crosshair information
        }
    };

    private final MouseAdapter exitListener = new MouseAdapter() {
        @Override
        public void mouseExited(MouseEvent e) {
            pointerMoved(e.getX(), e.getY(), null);
        }
    };

    JFreeChartHandle(JComponent host, ChartOptions options) {
        this.host = host;
        this.options = options;
        this.width = options.width();

        domainAxis = new DateAxis("");
        domainAxis.setDateFormatOverride(new TickLabelDateFormat(options.tickLabelFormatter(), this::snapToBar));

        rangeAxis = new NumberAxis(null);
        rangeAxis.setAutoRangeIncludesZero(false);
        rangeAxis.setUpperMargin(options.scaleMarginTop());
        rangeAxis.setLowerMargin(options.scaleMarginBottom());

        plot = new XYPlot(null, domainAxis, rangeAxis, null);
        plot.setRangeAxisLocation("left".equals(options.priceScaleId())
            ? AxisLocation.TOP_OR_LEFT
            : AxisLocation.TOP_OR_RIGHT);
        plot.setDomainPannable(true);

        chart = new JFreeChart(null, null, plot, false);
        ChartStyles.stylizeChart(chart, options.theme());

        chartPanel = ChartPanelFactory.create(chart, options.width(), options.height());

        if (options.crosshairEnabled()) {
            crosshair = new Crosshair(Double.NaN);
            crosshair.setPaint(options.theme().getCrosshairColor());
            crosshair.setStroke(ChartStyles.DASHED_STROKE);

            // Horizontal line carries the price label on the price axis side
            priceCrosshair = new Crosshair(Double.NaN);
            priceCrosshair.setPaint(options.theme().getCrosshairColor());
            priceCrosshair.setStroke(ChartStyles.DASHED_STROKE);
            priceCrosshair.setLabelVisible(true);
            priceCrosshair.setLabelGenerator(new StandardCrosshairLabelGenerator("{0}", new DecimalFormat("#,##0.00")));
            priceCrosshair.setLabelAnchor("left".equals(options.priceScaleId())
                ? RectangleAnchor.LEFT
                : RectangleAnchor.RIGHT);
            priceCrosshair.setLabelPaint(options.theme().getTextColor());
            priceCrosshair.setLabelBackgroundPaint(options.theme().getBackgroundColor());
            priceCrosshair.setLabelOutlinePaint(options.theme().getBorderColor());

            CrosshairOverlay overlay = new CrosshairOverlay();
            overlay.addDomainCrosshair(crosshair);
            overlay.addRangeCrosshair(priceCrosshair);
            chartPanel.addOverlay(overlay);
        } else {
            crosshair = null;
            priceCrosshair = null;
        }

        chartPanel.addChartMouseListener(mouseListener);
        chartPanel.addMouseListener(exitListener);

        timeScale = () -> {
            checkAlive();
            domainAxis.setAutoRange(true);
        };
        priceScale = new AxisPriceScale();

        // NORTH keeps the configured height and stretches the width
        if (host.getLayout() instanceof BorderLayout) {
            host.add(chartPanel, BorderLayout.NORTH);
        } else {
            host.add(chartPanel);
        }
        host.revalidate();
        log.debug("Created chart {}x{}", options.width(), options.height());
    }

    @Override
    public CandleSeries addCandlestickSeries(SeriesOptions seriesOptions) {
        checkAlive();
        JFreeCandleSeries s = new JFreeCandleSeries(this, plot, series.size(), seriesOptions);
        series.add(s);
        return s;
    }

    @Override
    public Subscription subscribePointerMove(PointerMoveListener listener) {
        checkAlive();
        pointerListeners.add(listener);
        return () -> pointerListeners.remove(listener);
    }

    @Override
    public void setWidth(int width) {
        checkAlive();
        this.width = width;
        chartPanel.setPreferredSize(new Dimension(width, options.height()));
        chartPanel.revalidate();
    }

    @Override
    public TimeScale timeScale() {
        checkAlive();
        return timeScale;
    }

    @Override
    public PriceScale priceScale(String id) {
        checkAlive();
        if (!options.priceScaleId().equals(id)) {
            throw new IllegalArgumentException("Unknown price scale: " + id);
        }
        return priceScale;
    }

    @Override
    public void remove() {
        if (removed) return;
        removed = true;

        chartPanel.removeChartMouseListener(mouseListener);
        chartPanel.removeMouseListener(exitListener);
        pointerListeners.clear();

        host.remove(chartPanel);
        host.revalidate();
        host.repaint();
        log.debug("Removed chart");
    }

    @Override
    public boolean isRemoved() {
        return removed;
    }

    /**
     * Handle a pointer position in chart panel coordinates.
     *
     * @param dataArea screen data area, null if the pointer left the panel
     */
    void pointerMoved(double x, double y, Rectangle2D dataArea) {
        if (removed) return;

        if (dataArea == null || !dataArea.contains(x, y)) {
            setCrosshairValue(Double.NaN, Double.NaN);
            dispatch(PointerMoveEvent.outside());
            return;
        }

        Long time = null;
        JFreeCandleSeries primary = series.isEmpty() ? null : series.get(0);
        if (primary != null) {
            double millis = domainAxis.java2DToValue(x, dataArea, plot.getDomainAxisEdge());
            time = primary.barAt(Math.floorDiv((long) millis, 1000L));
        }

        double price = rangeAxis.java2DToValue(y, dataArea, plot.getRangeAxisEdge());
        setCrosshairValue(time != null ? time * 1000.0 : Double.NaN, price);
        dispatch(new PointerMoveEvent(new Point2D.Double(x, y), time));
    }

    long snapToBar(long seconds) {
        return series.isEmpty() ? seconds : series.get(0).snapToBar(seconds);
    }

    void checkAlive() {
        if (removed) {
            throw new IllegalStateException("Chart has been removed");
        }
    }

    private void dispatch(PointerMoveEvent event) {
        for (PointerMoveListener listener : List.copyOf(pointerListeners)) {
            listener.onPointerMove(event);
        }
    }

    private void setCrosshairValue(double timeMillis, double price) {
        if (crosshair != null) {
            crosshair.setValue(timeMillis);
            priceCrosshair.setValue(price);
        }
    }

    // ===== Accessors =====

    ChartPanel getChartPanel() {
        return chartPanel;
    }

    JFreeChart getChart() {
        return chart;
    }

    DateAxis getDomainAxis() {
        return domainAxis;
    }

    NumberAxis getRangeAxis() {
        return rangeAxis;
    }

    Crosshair getCrosshair() {
        return crosshair;
    }

    Crosshair getPriceCrosshair() {
        return priceCrosshair;
    }

    int getWidth() {
        return width;
    }

    int getPointerListenerCount() {
        return pointerListeners.size();
    }

    private class AxisPriceScale implements PriceScale {

        @Override
        public void setAutoScale(boolean autoScale) {
            checkAlive();
            rangeAxis.setAutoRange(autoScale);
        }

        @Override
        public boolean isAutoScale() {
            return rangeAxis.isAutoRange();
        }
    }
}

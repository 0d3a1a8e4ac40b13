package com.candleview.charts.jfree;

import com.candleview.charts.engine.ChartContainer;
import com.candleview.charts.engine.ChartEngine;
import com.candleview.charts.engine.ChartHandle;
import com.candleview.charts.engine.ChartOptions;
import org.jfree.chart.ChartPanel;

import java.util.function.Consumer;

/**
 * Chart engine rendering with JFreeChart into Swing containers.
 * Only {@link SwingChartContainer} is supported.
 */
public class JFreeChartEngine implements ChartEngine {

    private final Consumer<ChartPanel> panelCustomizer;

    public JFreeChartEngine() {
        this(panel -> { });
    }

    /**
     * @param panelCustomizer applied to every chart panel after creation (popup menus, tooltips)
     */
    public JFreeChartEngine(Consumer<ChartPanel> panelCustomizer) {
        this.panelCustomizer = panelCustomizer;
    }

    @Override
    public ChartHandle create(ChartContainer container, ChartOptions options) {
        if (!(container instanceof SwingChartContainer swing)) {
            throw new IllegalArgumentException("JFreeChartEngine needs a SwingChartContainer, got "
                + (container == null ? "null" : container.getClass().getName()));
        }

        JFreeChartHandle handle = new JFreeChartHandle(swing.getHost(), options);
        panelCustomizer.accept(handle.getChartPanel());
        return handle;
    }
}

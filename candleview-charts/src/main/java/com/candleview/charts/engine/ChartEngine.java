package com.candleview.charts.engine;

/**
 * Rendering engine capability: creates charts inside containers.
 *
 * <p>The synchronization logic only talks to this interface, so any
 * implementation can be plugged in. {@code JFreeChartEngine} renders with
 * JFreeChart on Swing.</p>
 */
public interface ChartEngine {

    /**
     * Create a chart in the given container.
     * Failures are reported by the implementation's own exceptions.
     */
    ChartHandle create(ChartContainer container, ChartOptions options);
}

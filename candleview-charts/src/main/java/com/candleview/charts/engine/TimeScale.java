package com.candleview.charts.engine;

/**
 * Horizontal (time) scale of a chart.
 */
public interface TimeScale {

    /**
     * Fit the visible range to all loaded data.
     */
    void fitContent();
}

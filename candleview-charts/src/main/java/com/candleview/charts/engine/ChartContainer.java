package com.candleview.charts.engine;

/**
 * A display region a chart can be mounted into.
 */
public interface ChartContainer {

    /**
     * Current width in pixels.
     */
    int getWidth();

    /**
     * Whether the region is attached to a live view and can host a chart.
     */
    boolean isAttached();

    /**
     * Observe box-size changes.
     * The listener runs on the UI thread after each change.
     */
    Subscription addResizeListener(Runnable onResize);
}

package com.candleview.charts.engine;

/**
 * A live chart instance created by a {@link ChartEngine}.
 *
 * <p>After {@link #remove()} the handle and everything obtained from it
 * (series, scales, subscriptions) are dead.</p>
 */
public interface ChartHandle {

    /**
     * Add a candlestick series to the chart.
     */
    CandleSeries addCandlestickSeries(SeriesOptions options);

    /**
     * Subscribe to pointer moves over the chart.
     */
    Subscription subscribePointerMove(PointerMoveListener listener);

    /**
     * Apply a new width. Height is left as is.
     */
    void setWidth(int width);

    TimeScale timeScale();

    /**
     * Get a price scale by id (e.g. "right").
     */
    PriceScale priceScale(String id);

    /**
     * Dispose the chart and release its resources.
     */
    void remove();

    boolean isRemoved();
}

package com.candleview.charts.engine;

/**
 * One bar as accepted by {@link CandleSeries#setData}.
 * Time is in epoch seconds.
 */
public record SeriesBar(long time, double open, double high, double low, double close) {
}

package com.candleview.charts.engine;

import java.awt.Color;

/**
 * Styling for a candlestick series.
 */
public record SeriesOptions(
    Color upColor,
    Color downColor,
    Color wickUpColor,
    Color wickDownColor,
    boolean borderVisible
) {
}

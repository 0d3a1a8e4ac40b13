package com.candleview.charts.engine;

import com.candleview.charts.util.ChartTheme;

/**
 * Options for creating a chart.
 *
 * @param width              initial width in pixels
 * @param height             fixed height in pixels
 * @param theme              colors for background, grid, text and borders
 * @param crosshairEnabled   whether the chart tracks the pointer with a crosshair
 * @param priceScaleId       id of the visible price scale ("right" or "left")
 * @param scaleMarginTop     fraction of the price range kept free above the data
 * @param scaleMarginBottom  fraction of the price range kept free below the data
 * @param tickLabelFormatter labels for the time axis ticks
 */
public record ChartOptions(
    int width,
    int height,
    ChartTheme theme,
    boolean crosshairEnabled,
    String priceScaleId,
    double scaleMarginTop,
    double scaleMarginBottom,
    TickLabelFormatter tickLabelFormatter
) {
}

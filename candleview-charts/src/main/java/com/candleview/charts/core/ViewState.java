package com.candleview.charts.core;

/**
 * What the caller can observe about a bound chart.
 *
 * @param hasData        true iff the last candle snapshot was non-empty and a chart is alive
 * @param crosshairTime  formatted time of the hovered bar, null when not over a bar
 * @param crosshairX     pointer x offset in pixels, null when not over a bar
 */
public record ViewState(boolean hasData, String crosshairTime, Double crosshairX) {

    public static final ViewState EMPTY = new ViewState(false, null, null);
}

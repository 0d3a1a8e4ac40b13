package com.candleview.charts.util;

import java.awt.Color;

/**
 * Theme interface for chart styling.
 * Applications implement this to provide custom color schemes.
 */
public interface ChartTheme {

    // ===== Background Colors =====
    Color getBackgroundColor();
    Color getGridlineColor();
    Color getTextColor();
    Color getBorderColor();
    Color getCrosshairColor();

    default Color getPlotBackgroundColor() { return getBackgroundColor(); }
    default Color getAxisLabelColor() { return getTextColor(); }

    // ===== Price Chart Colors =====
    default Color getCandleUpColor() { return new Color(16, 185, 129); }
    default Color getCandleDownColor() { return new Color(239, 68, 68); }
}

package com.candleview.charts.util;

import java.awt.Color;

/**
 * Dark slate theme: gray-800 background, gray-700 grid, gray-300 text.
 */
public class DarkChartTheme implements ChartTheme {

    public static final DarkChartTheme INSTANCE = new DarkChartTheme();

    private static final Color BACKGROUND = new Color(0x1f2937);
    private static final Color GRID = new Color(0x374151);
    private static final Color TEXT = new Color(0xd1d5db);
    private static final Color BORDER = new Color(0x9ca3af);
    private static final Color CROSSHAIR = new Color(156, 163, 175, 160);

    private DarkChartTheme() {}

    @Override
    public Color getBackgroundColor() {
        return BACKGROUND;
    }

    @Override
    public Color getGridlineColor() {
        return GRID;
    }

    @Override
    public Color getTextColor() {
        return TEXT;
    }

    @Override
    public Color getBorderColor() {
        return BORDER;
    }

    @Override
    public Color getCrosshairColor() {
        return CROSSHAIR;
    }
}

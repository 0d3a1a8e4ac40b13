package com.candleview.charts.engine;

/**
 * Vertical (price) scale of a chart.
 */
public interface PriceScale {

    void setAutoScale(boolean autoScale);

    boolean isAutoScale();
}

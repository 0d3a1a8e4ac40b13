package com.candleview.charts.engine;

import java.util.List;

/**
 * A candlestick series living in a chart.
 */
public interface CandleSeries {

    /**
     * Replace the whole series content.
     */
    void setData(List<SeriesBar> bars);
}

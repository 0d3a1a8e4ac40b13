package com.candleview.charts.engine;

/**
 * Produces the time axis label for a tick.
 */
@FunctionalInterface
public interface TickLabelFormatter {

    /**
     * @param time epoch seconds of the bar the tick sits on
     */
    String format(long time);
}

package com.candleview.charts.engine;

import java.awt.geom.Point2D;

/**
 * Pointer position reported by the chart.
 *
 * @param point pixel position within the chart, null when outside the plot area
 * @param time  epoch seconds of the bar under the pointer, null when there is none
 */
public record PointerMoveEvent(Point2D point, Long time) {

    /**
     * Event for a pointer that left the plot area.
     */
    public static PointerMoveEvent outside() {
        return new PointerMoveEvent(null, null);
    }

    public boolean hasPoint() {
        return point != null;
    }

    public boolean hasTime() {
        return time != null;
    }
}

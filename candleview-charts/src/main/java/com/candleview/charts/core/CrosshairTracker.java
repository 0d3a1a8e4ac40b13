package com.candleview.charts.core;

import com.candleview.charts.engine.PointerMoveEvent;
import com.candleview.charts.engine.PointerMoveListener;
import com.candleview.core.time.TimeFormatter;

/**
 * Tracks the hovered bar time and pointer x offset.
 *
 * <p>Both values are null whenever the pointer is not over a bar. Events
 * arriving after the session was torn down are dropped.</p>
 */
public class CrosshairTracker implements PointerMoveListener {

    private final TimeFormatter timeFormatter;
    private final Runnable onChange;

    private ChartSession session;
    private String crosshairTime;
    private Double crosshairX;

    public CrosshairTracker(TimeFormatter timeFormatter, Runnable onChange) {
        this.timeFormatter = timeFormatter;
        this.onChange = onChange;
    }

    /**
     * Start accepting events for a session.
     */
    void track(ChartSession session) {
        this.session = session;
    }

    /**
     * Stop tracking and clear the readout.
     */
    void clear() {
        this.session = null;
        crosshairTime = null;
        crosshairX = null;
    }

    @Override
    public void onPointerMove(PointerMoveEvent event) {
        if (session == null || !session.isLive()) return;

        if (event == null || !event.hasPoint() || !event.hasTime()) {
            crosshairTime = null;
            crosshairX = null;
        } else {
            crosshairTime = timeFormatter.crosshairLabel(event.time());
            crosshairX = event.point().getX();
        }

        if (onChange != null) {
            onChange.run();
        }
    }

    public String getCrosshairTime() {
        return crosshairTime;
    }

    public Double getCrosshairX() {
        return crosshairX;
    }
}

package com.candleview.charts.core;

import com.candleview.charts.engine.ChartHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resets the viewport: fit the time range to all data and re-enable price autoscale.
 */
public class ViewResetPolicy {

    private static final Logger log = LoggerFactory.getLogger(ViewResetPolicy.class);

    private final String priceScaleId;

    public ViewResetPolicy(String priceScaleId) {
        this.priceScaleId = priceScaleId;
    }

    /**
     * Reset the view of a session.
     *
     * @return false if there was no live chart to reset
     */
    public boolean reset(ChartSession session) {
        if (session == null || !session.isLive()) return false;

        ChartHandle handle = session.getHandle();
        handle.timeScale().fitContent();
        handle.priceScale(priceScaleId).setAutoScale(true);
        log.debug("View reset (fit content, autoscale '{}')", priceScaleId);
        return true;
    }

    public String getPriceScaleId() {
        return priceScaleId;
    }
}

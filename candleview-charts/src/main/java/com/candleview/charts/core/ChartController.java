package com.candleview.charts.core;

import com.candleview.charts.config.ChartViewConfig;
import com.candleview.charts.engine.ChartContainer;
import com.candleview.charts.engine.ChartEngine;
import com.candleview.charts.engine.ChartHandle;
import com.candleview.charts.engine.ChartOptions;
import com.candleview.charts.engine.PointerMoveListener;
import com.candleview.charts.engine.Subscription;
import com.candleview.charts.util.ChartStyles;
import com.candleview.charts.util.ChartTheme;
import com.candleview.core.time.TimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the chart instance bound to a container.
 *
 * <p>{@link #mount} allocates the chart, its candlestick series, the pointer
 * subscription and the container resize observer, in that order.
 * {@link #unmount} releases all of them. If setup fails halfway, whatever was
 * already acquired is released before the failure is rethrown, so no observer
 * or chart outlives a failed mount.</p>
 */
public class ChartController {

    private static final Logger log = LoggerFactory.getLogger(ChartController.class);

    private final ChartEngine engine;
    private final ChartViewConfig config;
    private final ChartTheme theme;
    private final TimeFormatter timeFormatter;

    public ChartController(ChartEngine engine, ChartViewConfig config, ChartTheme theme, TimeFormatter timeFormatter) {
        this.engine = engine;
        this.config = config;
        this.theme = theme;
        this.timeFormatter = timeFormatter;
    }

    /**
     * Create a chart in the container.
     *
     * @param container       target region; absent or detached containers are ignored
     * @param pointerListener receives pointer moves for the chart's lifetime
     * @return the new session, or null if the container was not ready
     */
    public ChartSession mount(ChartContainer container, PointerMoveListener pointerListener) {
        if (container == null || !container.isAttached()) {
            log.debug("Container not ready, skipping mount");
            return null;
        }

        ChartSession session = new ChartSession(container);
        ChartOptions options = new ChartOptions(
            container.getWidth(),
            config.getHeight(),
            theme,
            config.isCrosshairEnabled(),
            config.getPriceScaleId(),
            config.getScaleMarginTop(),
            config.getScaleMarginBottom(),
            time -> timeFormatter.tickLabel(time, session.isDayBoundary(time)));

        // Engine construction failures propagate as is, nothing is held yet
        ChartHandle handle = engine.create(container, options);
        session.setHandle(handle);

        try {
            session.setSeries(handle.addCandlestickSeries(ChartStyles.candlestickSeries(theme)));
            if (pointerListener != null) {
                session.setPointerSubscription(handle.subscribePointerMove(pointerListener));
            }
            session.setResizeSubscription(container.addResizeListener(() -> onResize(session)));
        } catch (RuntimeException e) {
            try {
                release(session);
            } catch (RuntimeException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        log.debug("Chart mounted ({}x{})", options.width(), options.height());
        return session;
    }

    /**
     * Tear down a session. Safe to call with null or more than once.
     */
    public void unmount(ChartSession session) {
        if (session == null || session.getHandle() == null) return;
        release(session);
        log.debug("Chart unmounted");
    }

    private void onResize(ChartSession session) {
        if (!session.isLive() || !session.getContainer().isAttached()) return;
        session.getHandle().setWidth(session.getContainer().getWidth());
    }

    private void release(ChartSession session) {
        Subscription resize = session.getResizeSubscription();
        Subscription pointer = session.getPointerSubscription();
        ChartHandle handle = session.getHandle();

        // Session is dead before any release step runs
        session.setResizeSubscription(null);
        session.setPointerSubscription(null);
        session.setSeries(null);
        session.setHandle(null);
        session.setDayBoundaries(null);

        try {
            if (resize != null) resize.unsubscribe();
        } finally {
            try {
                if (pointer != null) pointer.unsubscribe();
            } finally {
                if (handle != null) handle.remove();
            }
        }
    }
}

package com.candleview.charts.core;

import com.candleview.charts.config.ChartViewConfig;
import com.candleview.charts.engine.ChartContainer;
import com.candleview.charts.engine.ChartEngine;
import com.candleview.charts.util.ChartTheme;
import com.candleview.charts.util.DarkChartTheme;
import com.candleview.core.model.Candle;
import com.candleview.core.time.TimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

/**
 * Binds a candle sequence and a symbol to a chart in a container.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CandlestickChartBinding binding = new CandlestickChartBinding(new JFreeChartEngine(), config);
 * binding.setOnViewStateChange(state -> statusLabel.setText(state.crosshairTime()));
 *
 * binding.mount(new SwingChartContainer(chartHost));
 * binding.update(candles, "BTCUSDT");   // resets the view: new symbol
 * binding.update(moreCandles, "BTCUSDT"); // keeps the user's pan/zoom
 * binding.resetView();
 * binding.unmount();
 * }</pre>
 *
 * <p>All calls are expected on the UI thread.</p>
 */
public class CandlestickChartBinding {

    private static final Logger log = LoggerFactory.getLogger(CandlestickChartBinding.class);

    private final ChartController controller;
    private final DataSynchronizer synchronizer;
    private final ViewResetPolicy resetPolicy;
    private final CrosshairTracker crosshairTracker;

    private ChartSession session;
    private boolean hasData;
    private ViewState viewState = ViewState.EMPTY;
    private Consumer<ViewState> onViewStateChange;

    // Last snapshot received, replayed on remount
    private List<Candle> candles;
    private String symbol;

    public CandlestickChartBinding(ChartEngine engine, ChartViewConfig config) {
        this(engine, config, DarkChartTheme.INSTANCE, config.createTimeFormatter());
    }

    public CandlestickChartBinding(ChartEngine engine, ChartViewConfig config, ChartTheme theme, TimeFormatter timeFormatter) {
        this.controller = new ChartController(engine, config, theme, timeFormatter);
        this.resetPolicy = new ViewResetPolicy(config.getPriceScaleId());
        this.synchronizer = new DataSynchronizer(resetPolicy);
        this.crosshairTracker = new CrosshairTracker(timeFormatter, this::publishState);
    }

    /**
     * Mount the chart into a container.
     *
     * @return false if the container was not ready or a chart is already mounted
     */
    public boolean mount(ChartContainer container) {
        if (session != null) {
            log.warn("Chart already mounted, ignoring mount");
            return false;
        }

        ChartSession mounted = controller.mount(container, crosshairTracker);
        if (mounted == null) {
            return false;
        }
        session = mounted;
        crosshairTracker.track(mounted);

        if (candles != null) {
            hasData = synchronizer.synchronize(session, candles, symbol);
        }
        publishState();
        return true;
    }

    /**
     * Dispose the chart. No-op if nothing is mounted.
     */
    public void unmount() {
        ChartSession current = session;
        session = null;
        crosshairTracker.clear();
        hasData = false;
        controller.unmount(current);
        publishState();
    }

    /**
     * Push a new candle snapshot.
     *
     * @param candles full sequence in ascending time order (not an append)
     * @param symbol  instrument; a change resets the view
     */
    public void update(List<Candle> candles, String symbol) {
        this.candles = candles;
        this.symbol = symbol;
        hasData = synchronizer.synchronize(session, candles, symbol);
        publishState();
    }

    /**
     * Fit all data and re-enable price autoscale. No-op when not mounted.
     */
    public void resetView() {
        resetPolicy.reset(session);
    }

    /**
     * Set the callback invoked when the view state changes.
     */
    public void setOnViewStateChange(Consumer<ViewState> callback) {
        this.onViewStateChange = callback;
    }

    public ViewState getViewState() {
        return viewState;
    }

    public boolean hasData() {
        return viewState.hasData();
    }

    public String getCrosshairTime() {
        return viewState.crosshairTime();
    }

    public Double getCrosshairX() {
        return viewState.crosshairX();
    }

    public boolean isMounted() {
        return session != null && session.isLive();
    }

    private void publishState() {
        ViewState next = new ViewState(
            hasData && isMounted(),
            crosshairTracker.getCrosshairTime(),
            crosshairTracker.getCrosshairX());
        if (next.equals(viewState)) return;

        viewState = next;
        if (onViewStateChange != null) {
            onViewStateChange.accept(next);
        }
    }
}

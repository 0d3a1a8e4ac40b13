package com.candleview.charts.core;

import com.candleview.charts.engine.SeriesBar;
import com.candleview.core.model.Candle;
import com.candleview.core.time.DayBoundaryDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Pushes candle snapshots into a mounted chart.
 *
 * <p>Every pass treats the snapshot as a full replacement: day boundaries are
 * recomputed from scratch and the series content is swapped wholesale. The
 * viewport is reset only when the symbol changes, so live updates keep the
 * user's pan/zoom position.</p>
 */
public class DataSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(DataSynchronizer.class);

    private final ViewResetPolicy resetPolicy;

    public DataSynchronizer(ViewResetPolicy resetPolicy) {
        this.resetPolicy = resetPolicy;
    }

    /**
     * Run one reconciliation pass.
     *
     * @param session live session, or null if nothing is mounted
     * @param candles snapshot in ascending time order, may be null or empty
     * @param symbol  instrument the snapshot belongs to
     * @return whether the chart now shows data
     */
    public boolean synchronize(ChartSession session, List<Candle> candles, String symbol) {
        if (session == null || !session.isLive() || candles == null || candles.isEmpty()) {
            return false;
        }

        // Boundaries first, the tick formatter reads them while the new data renders
        session.setDayBoundaries(DayBoundaryDetector.detect(candles));

        session.getSeries().setData(toBars(candles));

        if (session.isSymbolChange(symbol)) {
            log.debug("Symbol changed {} -> {}, resetting view", session.getLastSymbol(), symbol);
            resetPolicy.reset(session);
        }
        session.recordSymbol(symbol);
        return true;
    }

    static List<SeriesBar> toBars(List<Candle> candles) {
        List<SeriesBar> bars = new ArrayList<>(candles.size());
        for (Candle c : candles) {
            bars.add(new SeriesBar(c.time(), c.open(), c.high(), c.low(), c.close()));
        }
        return bars;
    }
}

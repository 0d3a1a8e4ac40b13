package com.candleview.charts.jfree;

import com.candleview.charts.engine.CandleSeries;
import com.candleview.charts.engine.SeriesBar;
import com.candleview.charts.engine.SeriesOptions;
import org.jfree.chart.plot.XYPlot;
import org.jfree.data.xy.DefaultHighLowDataset;

import java.util.Arrays;
import java.util.Date;
import java.util.List;

/**
 * Candlestick series backed by a {@link DefaultHighLowDataset}.
 * Each {@link #setData} swaps in a new dataset.
 */
class JFreeCandleSeries implements CandleSeries {

    private static final long[] NO_TIMES = new long[0];

    private final JFreeChartHandle owner;
    private final XYPlot plot;
    private final int datasetIndex;

    // Bar times in epoch seconds, ascending as supplied
    private long[] times = NO_TIMES;

    JFreeCandleSeries(JFreeChartHandle owner, XYPlot plot, int datasetIndex, SeriesOptions options) {
        this.owner = owner;
        this.plot = plot;
        this.datasetIndex = datasetIndex;
        plot.setRenderer(datasetIndex, new SeriesCandlestickRenderer(options));
    }

    @Override
    public void setData(List<SeriesBar> bars) {
        owner.checkAlive();

        int size = bars.size();
        Date[] dates = new Date[size];
        double[] high = new double[size];
        double[] low = new double[size];
        double[] open = new double[size];
        double[] close = new double[size];
        double[] volume = new double[size];
        long[] newTimes = new long[size];

        for (int i = 0; i < size; i++) {
            SeriesBar b = bars.get(i);
            newTimes[i] = b.time();
            dates[i] = new Date(b.time() * 1000L);
            high[i] = b.high();
            low[i] = b.low();
            open[i] = b.open();
            close[i] = b.close();
        }

        // Times first: the dataset change triggers an axis refresh that formats ticks
        times = newTimes;
        plot.setDataset(datasetIndex, new DefaultHighLowDataset("Price", dates, high, low, open, close, volume));
    }

    /**
     * Time of the loaded bar closest to the given time, or the time itself if no bars are loaded.
     */
    long snapToBar(long seconds) {
        long[] t = times;
        if (t.length == 0) return seconds;

        int idx = Arrays.binarySearch(t, seconds);
        if (idx >= 0) return t[idx];

        int insert = -idx - 1;
        if (insert == 0) return t[0];
        if (insert >= t.length) return t[t.length - 1];
        long before = t[insert - 1];
        long after = t[insert];
        return seconds - before <= after - seconds ? before : after;
    }

    /**
     * Time of the bar under the given time, or null if it falls outside the loaded bars
     * by more than one bar spacing.
     */
    Long barAt(long seconds) {
        long[] t = times;
        if (t.length == 0) return null;

        long snapped = snapToBar(seconds);
        if (t.length == 1) return snapped;

        long spacing = Math.max(1L, (t[t.length - 1] - t[0]) / (t.length - 1));
        return Math.abs(snapped - seconds) <= spacing ? snapped : null;
    }

    boolean isEmpty() {
        return times.length == 0;
    }

    int size() {
        return times.length;
    }
}

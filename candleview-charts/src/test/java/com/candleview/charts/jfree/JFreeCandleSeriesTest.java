package com.candleview.charts.jfree;

import com.candleview.charts.engine.ChartOptions;
import com.candleview.charts.engine.SeriesBar;
import com.candleview.charts.util.ChartStyles;
import com.candleview.charts.util.DarkChartTheme;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.swing.JPanel;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JFreeCandleSeriesTest {

    private JFreeCandleSeries series;

    @BeforeEach
    void setUp() {
        JFreeChartHandle handle = (JFreeChartHandle) new JFreeChartEngine().create(
            new SwingChartContainer(new JPanel()),
            new ChartOptions(400, 200, DarkChartTheme.INSTANCE, true, "right", 0.1, 0.1,
                Long::toString));
        series = (JFreeCandleSeries) handle.addCandlestickSeries(ChartStyles.candlestickSeries(DarkChartTheme.INSTANCE));
    }

    @Test
    void snapToBarWithoutDataReturnsInput() {
        assertTrue(series.isEmpty());
        assertEquals(1234L, series.snapToBar(1234L));
        assertNull(series.barAt(1234L));
    }

    @Test
    void snapToBarPicksNearest() {
        series.setData(List.of(
            new SeriesBar(1000, 1, 1, 1, 1),
            new SeriesBar(2000, 1, 1, 1, 1),
            new SeriesBar(3000, 1, 1, 1, 1)));

        assertEquals(1000L, series.snapToBar(500));
        assertEquals(1000L, series.snapToBar(1400));
        assertEquals(2000L, series.snapToBar(1600));
        assertEquals(2000L, series.snapToBar(2000));
        assertEquals(3000L, series.snapToBar(9000));
    }

    @Test
    void barAtRejectsPointsFarOutsideTheData() {
        series.setData(List.of(
            new SeriesBar(1000, 1, 1, 1, 1),
            new SeriesBar(2000, 1, 1, 1, 1),
            new SeriesBar(3000, 1, 1, 1, 1)));

        assertEquals(3000L, series.barAt(3800));
        assertNull(series.barAt(4500));
        assertNull(series.barAt(-200));
        assertEquals(2000L, series.barAt(2200));
    }

    @Test
    void singleBarAlwaysMatches() {
        series.setData(List.of(new SeriesBar(1000, 1, 1, 1, 1)));

        assertEquals(1000L, series.barAt(50_000));
        assertEquals(1, series.size());
    }
}

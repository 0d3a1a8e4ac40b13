package com.candleview.charts.core;

import com.candleview.charts.config.ChartViewConfig;
import com.candleview.charts.core.RecordingChartEngine.RecordingHandle;
import com.candleview.charts.util.DarkChartTheme;
import com.candleview.core.model.Candle;
import com.candleview.core.time.TimeFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ViewResetPolicyTest {

    private RecordingChartEngine engine;
    private ChartController controller;
    private ViewResetPolicy policy;

    @BeforeEach
    void setUp() {
        engine = new RecordingChartEngine();
        controller = new ChartController(engine, new ChartViewConfig(), DarkChartTheme.INSTANCE, TimeFormatter.utc());
        policy = new ViewResetPolicy("right");
    }

    @Test
    void fitsContentAndEnablesAutoscale() {
        ChartSession session = controller.mount(new FakeChartContainer(600), null);
        RecordingHandle handle = engine.last();
        session.getSeries().setData(DataSynchronizer.toBars(List.of(
            new Candle(1700000000L, 1, 2, 0, 1),
            new Candle(1700086400L, 1, 2, 0, 1))));
        handle.userPan(1700040000L, 1700050000L);

        assertTrue(policy.reset(session));

        assertEquals(1700000000L, handle.visibleFrom);
        assertEquals(1700086400L, handle.visibleTo);
        assertTrue(handle.autoScale);
        assertEquals(List.of("right"), handle.priceScaleIds);
    }

    @Test
    void resetTwiceLeavesSameViewportAsOnce() {
        ChartSession session = controller.mount(new FakeChartContainer(600), null);
        RecordingHandle handle = engine.last();
        session.getSeries().setData(DataSynchronizer.toBars(List.of(
            new Candle(1700000000L, 1, 2, 0, 1),
            new Candle(1700003600L, 1, 2, 0, 1))));

        policy.reset(session);
        long from = handle.visibleFrom;
        long to = handle.visibleTo;
        boolean autoScale = handle.autoScale;

        policy.reset(session);

        assertEquals(from, handle.visibleFrom);
        assertEquals(to, handle.visibleTo);
        assertEquals(autoScale, handle.autoScale);
    }

    @Test
    void noOpWithoutLiveSession() {
        assertFalse(policy.reset(null));

        ChartSession session = controller.mount(new FakeChartContainer(600), null);
        controller.unmount(session);

        assertFalse(policy.reset(session));
        assertEquals(0, engine.last().fitContentCount);
    }

    @Test
    void usesConfiguredPriceScale() {
        ViewResetPolicy left = new ViewResetPolicy("left");
        ChartSession session = controller.mount(new FakeChartContainer(600), null);

        left.reset(session);

        assertEquals(List.of("left"), engine.last().priceScaleIds);
    }
}

package com.candleview.charts.core;

import com.candleview.charts.config.ChartViewConfig;
import com.candleview.charts.core.RecordingChartEngine.RecordingHandle;
import com.candleview.charts.engine.PointerMoveEvent;
import com.candleview.charts.engine.PointerMoveListener;
import com.candleview.charts.util.DarkChartTheme;
import com.candleview.core.model.Candle;
import com.candleview.core.time.TimeFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for CandlestickChartBinding against a recording engine.
 */
class CandlestickChartBindingTest {

    private static final List<Candle> SCENARIO_A = List.of(
        new Candle(1700000000L, 100, 105, 99, 104),
        new Candle(1700003600L, 104, 106, 101, 102),
        new Candle(1700086400L, 102, 103, 97, 98));

    private RecordingChartEngine engine;
    private CandlestickChartBinding binding;
    private FakeChartContainer container;
    private List<ViewState> published;

    @BeforeEach
    void setUp() {
        engine = new RecordingChartEngine();
        binding = new CandlestickChartBinding(engine, new ChartViewConfig(), DarkChartTheme.INSTANCE, TimeFormatter.utc());
        container = new FakeChartContainer(800);
        published = new ArrayList<>();
        binding.setOnViewStateChange(published::add);
    }

    private static List<Candle> hourly(long start, int count) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candles.add(new Candle(start + i * 3600L, 10, 11, 9, 10.5));
        }
        return candles;
    }

    @Nested
    @DisplayName("Scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("A: day boundaries label the first bar of each UTC day")
        void scenarioA() {
            binding.mount(container);

            binding.update(SCENARIO_A, "AAPL");

            RecordingHandle handle = engine.last();
            assertTrue(binding.hasData());
            assertEquals(3, handle.lastData().size());
            assertEquals("Nov 14", handle.tickLabel(1700000000L));
            assertEquals("11:13 PM", handle.tickLabel(1700003600L));
            assertEquals("Nov 15", handle.tickLabel(1700086400L));
        }

        @Test
        @DisplayName("B: empty candles report no data and skip the series update")
        void scenarioB() {
            binding.mount(container);

            binding.update(List.of(), "AAPL");

            assertFalse(binding.hasData());
            assertTrue(engine.last().setDataCalls.isEmpty());
        }

        @Test
        @DisplayName("C: pointer without a point clears the crosshair")
        void scenarioC() {
            binding.mount(container);
            binding.update(SCENARIO_A, "AAPL");
            RecordingHandle handle = engine.last();
            handle.firePointerAt(200, 1700003600L);
            assertEquals("Nov 14, 2023 23:13", binding.getCrosshairTime());
            assertEquals(200.0, binding.getCrosshairX());

            handle.firePointerMove(new PointerMoveEvent(null, 1700003600L));

            assertNull(binding.getCrosshairTime());
            assertNull(binding.getCrosshairX());
        }

        @Test
        @DisplayName("D: AAPL to MSFT resets the view exactly once")
        void scenarioD() {
            binding.mount(container);
            binding.update(hourly(1700000000L, 24), "AAPL");
            RecordingHandle handle = engine.last();
            handle.fitContentCount = 0;
            handle.autoScaleCount = 0;

            binding.update(hourly(1700100000L, 48), "MSFT");

            assertEquals(1, handle.fitContentCount);
            assertEquals(1, handle.autoScaleCount);
            assertEquals(1700100000L, handle.visibleFrom);
            assertEquals(1700100000L + 47 * 3600L, handle.visibleTo);
        }
    }

    @Nested
    @DisplayName("Updates")
    class UpdateTests {

        @Test
        @DisplayName("Unchanged symbol with new data triggers no automatic reset")
        void noResetForSameSymbol() {
            binding.mount(container);
            binding.update(hourly(1700000000L, 24), "AAPL");
            RecordingHandle handle = engine.last();
            handle.fitContentCount = 0;

            binding.update(hourly(1700000000L, 25), "AAPL");
            binding.update(hourly(1700000000L, 26), "AAPL");

            assertEquals(0, handle.fitContentCount);
            assertEquals(3, handle.setDataCalls.size());
        }

        @Test
        @DisplayName("Update before mount reports no data")
        void updateBeforeMount() {
            binding.update(hourly(1700000000L, 5), "AAPL");

            assertFalse(binding.hasData());
            assertTrue(engine.created.isEmpty());
        }

        @Test
        @DisplayName("Mount replays the last snapshot")
        void mountReplaysSnapshot() {
            binding.update(hourly(1700000000L, 5), "AAPL");

            binding.mount(container);

            RecordingHandle handle = engine.last();
            assertTrue(binding.hasData());
            assertEquals(5, handle.lastData().size());
            assertEquals(1, handle.fitContentCount);
        }

        @Test
        @DisplayName("Data going empty drops hasData")
        void dataGoingEmpty() {
            binding.mount(container);
            binding.update(hourly(1700000000L, 5), "AAPL");

            binding.update(List.of(), "AAPL");

            assertFalse(binding.hasData());
        }
    }

    @Nested
    @DisplayName("Manual Reset")
    class ManualResetTests {

        @Test
        @DisplayName("resetView fits content and autoscales")
        void resetView() {
            binding.mount(container);
            binding.update(hourly(1700000000L, 10), "AAPL");
            RecordingHandle handle = engine.last();
            handle.userPan(1700003600L, 1700010800L);

            binding.resetView();

            assertEquals(1700000000L, handle.visibleFrom);
            assertEquals(1700000000L + 9 * 3600L, handle.visibleTo);
            assertTrue(handle.autoScale);
        }

        @Test
        @DisplayName("resetView twice equals once")
        void resetViewIdempotent() {
            binding.mount(container);
            binding.update(hourly(1700000000L, 10), "AAPL");
            RecordingHandle handle = engine.last();

            binding.resetView();
            long from = handle.visibleFrom;
            long to = handle.visibleTo;
            binding.resetView();

            assertEquals(from, handle.visibleFrom);
            assertEquals(to, handle.visibleTo);
            assertTrue(handle.autoScale);
        }

        @Test
        @DisplayName("resetView without a chart is a no-op")
        void resetViewWithoutChart() {
            assertDoesNotThrow(() -> binding.resetView());

            binding.mount(container);
            binding.unmount();

            assertDoesNotThrow(() -> binding.resetView());
            assertEquals(0, engine.last().fitContentCount);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Mount into a detached container does nothing")
        void detachedContainer() {
            container.setAttached(false);

            assertFalse(binding.mount(container));
            binding.update(hourly(1700000000L, 5), "AAPL");

            assertFalse(binding.isMounted());
            assertFalse(binding.hasData());
            assertTrue(engine.created.isEmpty());
        }

        @Test
        @DisplayName("Mount into a null container does nothing")
        void nullContainer() {
            assertFalse(binding.mount(null));
            assertFalse(binding.isMounted());
        }

        @Test
        @DisplayName("Second mount is ignored")
        void secondMountIgnored() {
            assertTrue(binding.mount(container));
            assertFalse(binding.mount(new FakeChartContainer(400)));

            assertEquals(1, engine.created.size());
        }

        @Test
        @DisplayName("Unmount clears state and releases the chart")
        void unmountClears() {
            binding.mount(container);
            binding.update(hourly(1700000000L, 5), "AAPL");
            RecordingHandle handle = engine.last();
            handle.firePointerAt(100, 1700000000L);

            binding.unmount();

            assertEquals(ViewState.EMPTY, binding.getViewState());
            assertTrue(handle.removed);
            assertTrue(handle.pointerListeners.isEmpty());
            assertEquals(0, container.resizeListenerCount());
        }

        @Test
        @DisplayName("Unmount without mount is a no-op")
        void unmountWithoutMount() {
            assertDoesNotThrow(() -> binding.unmount());
            assertDoesNotThrow(() -> binding.unmount());
        }

        @Test
        @DisplayName("Late pointer events after unmount are ignored")
        void latePointerIgnored() {
            binding.mount(container);
            binding.update(hourly(1700000000L, 5), "AAPL");
            RecordingHandle handle = engine.last();
            List<PointerMoveListener> captured = List.copyOf(handle.pointerListeners);

            binding.unmount();
            captured.forEach(l -> l.onPointerMove(new PointerMoveEvent(new Point2D.Double(5, 5), 1700000000L)));

            assertNull(binding.getCrosshairTime());
            assertNull(binding.getCrosshairX());
        }

        @Test
        @DisplayName("Remount starts a fresh chart and resets the view")
        void remount() {
            binding.mount(container);
            binding.update(hourly(1700000000L, 5), "AAPL");
            binding.unmount();

            assertTrue(binding.mount(container));

            RecordingHandle second = engine.last();
            assertEquals(2, engine.created.size());
            assertTrue(engine.created.get(0).removed);
            assertFalse(second.removed);
            assertEquals(5, second.lastData().size());
            assertEquals(1, second.fitContentCount);
            assertTrue(binding.hasData());
        }

        @Test
        @DisplayName("Many mount/unmount cycles leak no subscriptions")
        void manyCycles() {
            for (int i = 0; i < 10; i++) {
                binding.mount(container);
                binding.update(hourly(1700000000L, 3 + i), "SYM" + (i % 2));
                container.resize(600 + i);
                binding.unmount();
            }

            assertEquals(0, container.resizeListenerCount());
            assertTrue(engine.created.stream().allMatch(h -> h.removed && h.pointerListeners.isEmpty()));
        }
    }

    @Nested
    @DisplayName("View State")
    class ViewStateTests {

        @Test
        @DisplayName("Publishes only actual changes")
        void publishesChanges() {
            binding.mount(container);
            binding.update(hourly(1700000000L, 5), "AAPL");
            binding.update(hourly(1700000000L, 6), "AAPL");
            engine.last().firePointerAt(42, 1700000000L);
            engine.last().firePointerMove(PointerMoveEvent.outside());
            engine.last().firePointerMove(PointerMoveEvent.outside());

            assertEquals(List.of(
                new ViewState(true, null, null),
                new ViewState(true, "Nov 14, 2023 22:13", 42.0),
                new ViewState(true, null, null)), published);
        }

        @Test
        @DisplayName("hasData is false while no chart is alive")
        void hasDataNeedsChart() {
            binding.mount(container);
            binding.update(hourly(1700000000L, 5), "AAPL");
            assertTrue(binding.getViewState().hasData());

            binding.unmount();

            assertFalse(binding.getViewState().hasData());
        }
    }
}

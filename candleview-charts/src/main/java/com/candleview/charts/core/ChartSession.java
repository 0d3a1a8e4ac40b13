package com.candleview.charts.core;

import com.candleview.charts.engine.CandleSeries;
import com.candleview.charts.engine.ChartContainer;
import com.candleview.charts.engine.ChartHandle;
import com.candleview.charts.engine.Subscription;

import java.util.Objects;
import java.util.Set;

/**
 * State of one mounted chart lifetime.
 *
 * <p>Created by {@link ChartController#mount} and released by
 * {@link ChartController#unmount}. Once released the handle and series are
 * nulled and {@link #isLive()} stays false for good.</p>
 */
public final class ChartSession {

    private final ChartContainer container;
    private ChartHandle handle;
    private CandleSeries series;
    private Subscription resizeSubscription;
    private Subscription pointerSubscription;

    // Tick labels read this while the engine renders
    private Set<Long> dayBoundaries = Set.of();

    private String lastSymbol;
    private boolean symbolRecorded;

    ChartSession(ChartContainer container) {
        this.container = container;
    }

    public boolean isLive() {
        return handle != null && series != null;
    }

    public ChartContainer getContainer() {
        return container;
    }

    public ChartHandle getHandle() {
        return handle;
    }

    public CandleSeries getSeries() {
        return series;
    }

    public Set<Long> getDayBoundaries() {
        return dayBoundaries;
    }

    public boolean isDayBoundary(long time) {
        return dayBoundaries.contains(time);
    }

    /**
     * True if the symbol differs from the one recorded last, or none was recorded yet.
     */
    public boolean isSymbolChange(String symbol) {
        return !symbolRecorded || !Objects.equals(lastSymbol, symbol);
    }

    public String getLastSymbol() {
        return lastSymbol;
    }

    // ===== Mutators for the controller and synchronizer =====

    void setHandle(ChartHandle handle) {
        this.handle = handle;
    }

    void setSeries(CandleSeries series) {
        this.series = series;
    }

    void setDayBoundaries(Set<Long> dayBoundaries) {
        this.dayBoundaries = dayBoundaries != null ? dayBoundaries : Set.of();
    }

    void recordSymbol(String symbol) {
        this.lastSymbol = symbol;
        this.symbolRecorded = true;
    }

    Subscription getResizeSubscription() {
        return resizeSubscription;
    }

    void setResizeSubscription(Subscription resizeSubscription) {
        this.resizeSubscription = resizeSubscription;
    }

    Subscription getPointerSubscription() {
        return pointerSubscription;
    }

    void setPointerSubscription(Subscription pointerSubscription) {
        this.pointerSubscription = pointerSubscription;
    }
}

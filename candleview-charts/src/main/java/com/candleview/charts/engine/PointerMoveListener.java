package com.candleview.charts.engine;

@FunctionalInterface
public interface PointerMoveListener {

    void onPointerMove(PointerMoveEvent event);
}

package com.candleview.charts.engine;

/**
 * Handle for a registered listener or observer.
 * Unsubscribing more than once has no further effect.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}

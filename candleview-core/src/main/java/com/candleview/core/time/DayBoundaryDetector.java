package com.candleview.core.time;

import com.candleview.core.model.Candle;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the candles that open a new calendar day.
 *
 * <p>Days are keyed in UTC, independent of the display zone used for labels.
 * The scan compares each candle with the one right before it, so the input is
 * expected in ascending time order. It is never re-sorted: an unsorted sequence
 * still yields a set, it just may mark the same day more than once.</p>
 */
public final class DayBoundaryDetector {

    private DayBoundaryDetector() {} // Prevent instantiation

    /**
     * Detect day boundaries in a candle sequence.
     *
     * @param candles candles in ascending time order, may be null or empty
     * @return times of the first candle of each day, in encounter order (unmodifiable)
     */
    public static Set<Long> detect(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return Set.of();
        }

        Set<Long> boundaries = new LinkedHashSet<>();
        LocalDate lastDay = null;

        for (Candle c : candles) {
            LocalDate day = utcDay(c.time());
            if (!day.equals(lastDay)) {
                boundaries.add(c.time());
                lastDay = day;
            }
        }
        return Collections.unmodifiableSet(boundaries);
    }

    /**
     * UTC calendar day (the YYYY-MM-DD key) of an epoch-second timestamp.
     */
    public static LocalDate utcDay(long epochSeconds) {
        return LocalDate.ofInstant(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC);
    }
}

package com.candleview.core.time;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Formats epoch-second timestamps for the time axis and the crosshair readout.
 *
 * <ul>
 *   <li>Day boundary tick: short month and day, e.g. "Nov 14"</li>
 *   <li>Intraday tick: 12-hour clock, e.g. "9:05 AM", "12:30 PM"</li>
 *   <li>Crosshair: "Nov 14, 2023 22:13"</li>
 * </ul>
 *
 * <p>Zone and locale are fixed at construction so output is reproducible.</p>
 */
public final class TimeFormatter {

    public static final String CROSSHAIR_PATTERN = "MMM d, yyyy HH:mm";
    public static final String DAY_PATTERN = "MMM d";

    private final ZoneId zone;
    private final Locale locale;
    private final DateTimeFormatter dayFormat;
    private final DateTimeFormatter crosshairFormat;

    public TimeFormatter(ZoneId zone, Locale locale) {
        this.zone = Objects.requireNonNull(zone, "zone");
        this.locale = Objects.requireNonNull(locale, "locale");
        this.dayFormat = DateTimeFormatter.ofPattern(DAY_PATTERN, locale);
        this.crosshairFormat = DateTimeFormatter.ofPattern(CROSSHAIR_PATTERN, locale);
    }

    /**
     * Formatter that renders in UTC with US month names.
     */
    public static TimeFormatter utc() {
        return new TimeFormatter(ZoneOffset.UTC, Locale.US);
    }

    /**
     * Label for a time axis tick.
     *
     * @param time          epoch seconds
     * @param isDayBoundary true if the tick is the first bar of its day
     */
    public String tickLabel(long time, boolean isDayBoundary) {
        ZonedDateTime dt = at(time);

        if (isDayBoundary) {
            return dayFormat.format(dt);
        }

        int hours = dt.getHour();
        int minutes = dt.getMinute();
        String ampm = hours >= 12 ? "PM" : "AM";
        int displayHour = hours % 12 == 0 ? 12 : hours % 12;
        return displayHour + ":" + (minutes < 10 ? "0" : "") + minutes + " " + ampm;
    }

    /**
     * Label for the hovered bar under the crosshair.
     */
    public String crosshairLabel(long time) {
        return crosshairFormat.format(at(time));
    }

    public ZoneId getZone() {
        return zone;
    }

    public Locale getLocale() {
        return locale;
    }

    private ZonedDateTime at(long time) {
        return Instant.ofEpochSecond(time).atZone(zone);
    }
}

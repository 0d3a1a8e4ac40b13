package com.candleview.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Locale;

/**
 * OHLC candle for one time bucket.
 * Time is in seconds since the epoch (not milliseconds).
 *
 * Within one sequence, times are expected to be unique and ascending.
 * Nothing here enforces that, and OHLC consistency (low <= open/close <= high)
 * is not validated either.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Candle(
    long time,
    double open,
    double high,
    double low,
    double close
) {
    /**
     * Parse a CSV line into a Candle.
     * Format: time,open,high,low,close[,volume,...]
     * Columns after close are ignored.
     */
    public static Candle fromCsv(String line) {
        String[] parts = line.split(",");
        if (parts.length < 5) {
            throw new IllegalArgumentException("Invalid CSV line: " + line);
        }

        long time = Long.parseLong(parts[0].trim());
        double open = Double.parseDouble(parts[1].trim());
        double high = Double.parseDouble(parts[2].trim());
        double low = Double.parseDouble(parts[3].trim());
        double close = Double.parseDouble(parts[4].trim());

        return new Candle(time, open, high, low, close);
    }

    /**
     * Convert to CSV format.
     */
    public String toCsv() {
        return String.format(Locale.ROOT, "%d,%.8f,%.8f,%.8f,%.8f",
            time, open, high, low, close);
    }
}

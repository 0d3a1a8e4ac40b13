package com.candleview.charts.config;

import com.candleview.core.time.TimeFormatter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Chart view settings.
 * Embedded in the application config under the "chart" key.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChartViewConfig {

    private static final Logger log = LoggerFactory.getLogger(ChartViewConfig.class);

    public static final int DEFAULT_HEIGHT = 300;
    public static final String RIGHT_PRICE_SCALE = "right";

    // Fixed chart height, width follows the container
    private int height = DEFAULT_HEIGHT;

    // Display zone for axis and crosshair labels; empty means system default
    private String timeZone = "";

    // Locale for month names
    private String locale = "en-US";

    // Price scale shown and reset by the view
    private String priceScaleId = RIGHT_PRICE_SCALE;

    // Free space above/below the data, as a fraction of the price range
    private double scaleMarginTop = 0.1;
    private double scaleMarginBottom = 0.1;

    private boolean crosshairEnabled = true;

    public ChartViewConfig() {
    }

    public int getHeight() {
        return height;
    }

    public void setHeight(int height) {
        this.height = height;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public String getLocale() {
        return locale;
    }

    public void setLocale(String locale) {
        this.locale = locale;
    }

    public String getPriceScaleId() {
        return priceScaleId;
    }

    public void setPriceScaleId(String priceScaleId) {
        this.priceScaleId = priceScaleId;
    }

    public double getScaleMarginTop() {
        return scaleMarginTop;
    }

    public void setScaleMarginTop(double scaleMarginTop) {
        this.scaleMarginTop = scaleMarginTop;
    }

    public double getScaleMarginBottom() {
        return scaleMarginBottom;
    }

    public void setScaleMarginBottom(double scaleMarginBottom) {
        this.scaleMarginBottom = scaleMarginBottom;
    }

    public boolean isCrosshairEnabled() {
        return crosshairEnabled;
    }

    public void setCrosshairEnabled(boolean crosshairEnabled) {
        this.crosshairEnabled = crosshairEnabled;
    }

    /**
     * Resolve the display zone. Blank or unknown ids fall back to the system default.
     */
    @JsonIgnore
    public ZoneId getZoneId() {
        if (timeZone == null || timeZone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timeZone.trim());
        } catch (DateTimeException e) {
            log.warn("Invalid time zone '{}', using system default: {}", timeZone, e.getMessage());
            return ZoneId.systemDefault();
        }
    }

    @JsonIgnore
    public Locale getDisplayLocale() {
        if (locale == null || locale.isBlank()) {
            return Locale.US;
        }
        return Locale.forLanguageTag(locale.trim());
    }

    /**
     * Formatter for this config's zone and locale.
     */
    public TimeFormatter createTimeFormatter() {
        return new TimeFormatter(getZoneId(), getDisplayLocale());
    }
}

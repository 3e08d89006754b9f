package io.recur4j.config;

import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for series generation and expansion.
 */
@ConfigurationProperties(prefix = "recur4j")
public class SeriesProperties {
    private int windowSafetyCap = 200; // per expansion
    private int ordinalSafetyCap = 502;
    private int feedSafetyCap = 100; // per parent per feed request
    private int defaultMaxCount = 50;
    private int maxCount = 500;
    private int previewMaxCount = 20;
    private int maxSpanDays = 365;
    private int minValidYear = 2000;
    private int maxValidYear = 2100;
    private String defaultTimezone;
    private boolean callReminders = true;
    private boolean ensureIndexesOnStartup = false;

    public int getWindowSafetyCap() {
        return windowSafetyCap;
    }

    public void setWindowSafetyCap(int windowSafetyCap) {
        this.windowSafetyCap = windowSafetyCap;
    }

    public int getOrdinalSafetyCap() {
        return ordinalSafetyCap;
    }

    public void setOrdinalSafetyCap(int ordinalSafetyCap) {
        this.ordinalSafetyCap = ordinalSafetyCap;
    }

    public int getFeedSafetyCap() {
        return feedSafetyCap;
    }

    public void setFeedSafetyCap(int feedSafetyCap) {
        this.feedSafetyCap = feedSafetyCap;
    }

    public int getDefaultMaxCount() {
        return defaultMaxCount;
    }

    public void setDefaultMaxCount(int defaultMaxCount) {
        this.defaultMaxCount = defaultMaxCount;
    }

    public int getMaxCount() {
        return maxCount;
    }

    public void setMaxCount(int maxCount) {
        this.maxCount = maxCount;
    }

    public int getPreviewMaxCount() {
        return previewMaxCount;
    }

    public void setPreviewMaxCount(int previewMaxCount) {
        this.previewMaxCount = previewMaxCount;
    }

    public int getMaxSpanDays() {
        return maxSpanDays;
    }

    public void setMaxSpanDays(int maxSpanDays) {
        this.maxSpanDays = maxSpanDays;
    }

    public int getMinValidYear() {
        return minValidYear;
    }

    public void setMinValidYear(int minValidYear) {
        this.minValidYear = minValidYear;
    }

    public int getMaxValidYear() {
        return maxValidYear;
    }

    public void setMaxValidYear(int maxValidYear) {
        this.maxValidYear = maxValidYear;
    }

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public void setDefaultTimezone(String defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    /**
     * Resolved {@link #getDefaultTimezone()}; the system zone when unset or invalid.
     */
    public ZoneId resolveZone() {
        if (defaultTimezone == null || defaultTimezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(defaultTimezone.trim());
        } catch (Exception e) {
            return ZoneId.systemDefault();
        }
    }

    public boolean isCallReminders() {
        return callReminders;
    }

    public void setCallReminders(boolean callReminders) {
        this.callReminders = callReminders;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}

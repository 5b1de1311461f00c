package com.powerguard.anomaly.engine.features;

/**
 * The fixed feature schema. Declaration order is the vector layout and the explanation tie-break order.
 */
public enum Feature {
    HOURLY_AVG("hourly_avg", "average consumption"),
    DAILY_VARIANCE("daily_variance", "day-to-day consumption variability"),
    NIGHT_RATIO("night_ratio", "night-time usage"),
    PEAK_RATIO("peak_ratio", "peak-hour usage"),
    WEEKEND_RATIO("weekend_ratio", "weekend usage");

    public static final int COUNT = values().length;

    private final String key;
    private final String description;

    Feature(String key, String description) {
        this.key = key;
        this.description = description;
    }

    public String getKey() {
        return key;
    }

    public String getDescription() {
        return description;
    }
}

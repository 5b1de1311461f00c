package com.powerguard.anomaly.engine.features;

import com.powerguard.anomaly.config.DetectionConfig;
import com.powerguard.anomaly.engine.MeterExtraction;
import com.powerguard.anomaly.exception.InsufficientDataException;
import com.powerguard.anomaly.model.Reading;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns one meter's readings into a {@link FeatureVector}.
 *
 * Features:
 *   hourly_avg:     mean consumption over all readings
 *   daily_variance: population variance of per-calendar-day totals
 *   night_ratio:    share of total consumption inside the night window (default 00:00-06:00)
 *   peak_ratio:     share of total consumption inside the configured peak hours
 *   weekend_ratio:  share of total consumption on Saturday and Sunday
 *
 * Timestamps are naive local date-times and are bucketed exactly as recorded.
 * The input is sorted here, so the result depends only on the set of readings.
 * All ratios are 0.0 when total consumption is 0.
 */
@Component
public class FeatureExtractor {

    private static final Comparator<Reading> READING_ORDER = Comparator
            .comparing(Reading::getTimestamp)
            .thenComparingDouble(Reading::getConsumptionKwh);

    private final int minReadings;
    private final int nightStartHour;
    private final int nightEndHour;
    private final Set<Integer> peakHours;

    public FeatureExtractor(DetectionConfig config) {
        this.minReadings = config.getMinReadings();
        this.nightStartHour = config.getNightStartHour();
        this.nightEndHour = config.getNightEndHour();
        this.peakHours = Set.copyOf(config.getPeakHours());
        validateHour(nightStartHour, "night-start-hour");
        validateHour(nightEndHour, "night-end-hour");
        peakHours.forEach(h -> validateHour(h, "peak-hours"));
    }

    /**
     * @throws InsufficientDataException if the meter has fewer than the minimum number of readings
     */
    public FeatureVector extract(String meterId, Collection<Reading> readings) {
        int count = readings == null ? 0 : readings.size();
        if (count < minReadings) {
            throw new InsufficientDataException(meterId, count, minReadings);
        }
        return compute(readings);
    }

    /**
     * Same as {@link #extract} but reports a short history as a skip instead of throwing.
     */
    public MeterExtraction tryExtract(String meterId, Collection<Reading> readings) {
        int count = readings == null ? 0 : readings.size();
        if (count < minReadings) {
            return MeterExtraction.skipped(meterId, count,
                    "insufficient data: " + count + " readings, at least " + minReadings + " required");
        }
        return MeterExtraction.extracted(meterId, count, compute(readings));
    }

    public int getMinReadings() {
        return minReadings;
    }

    public boolean isNightHour(int hour) {
        if (nightStartHour == nightEndHour) return false;
        if (nightStartHour < nightEndHour) {
            return hour >= nightStartHour && hour < nightEndHour;
        }
        return hour >= nightStartHour || hour < nightEndHour;
    }

    public boolean isPeakHour(int hour) {
        return peakHours.contains(hour);
    }

    public int nightHourCount() {
        int n = 0;
        for (int h = 0; h < 24; h++) {
            if (isNightHour(h)) n++;
        }
        return n;
    }

    public int peakHourCount() {
        return peakHours.size();
    }

    private FeatureVector compute(Collection<Reading> readings) {
        List<Reading> sorted = new ArrayList<>(readings);
        sorted.sort(READING_ORDER);

        double total = 0.0;
        double night = 0.0;
        double peak = 0.0;
        double weekend = 0.0;
        Map<LocalDate, Double> dailyTotals = new TreeMap<>();

        for (Reading reading : sorted) {
            double kwh = reading.getConsumptionKwh();
            LocalDateTime ts = reading.getTimestamp();
            int hour = ts.getHour();

            total += kwh;
            if (isNightHour(hour)) night += kwh;
            if (isPeakHour(hour)) peak += kwh;
            DayOfWeek day = ts.getDayOfWeek();
            if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) weekend += kwh;
            dailyTotals.merge(ts.toLocalDate(), kwh, Double::sum);
        }

        return FeatureVector.builder()
                .hourlyAvg(total / sorted.size())
                .dailyVariance(variance(dailyTotals.values()))
                .nightRatio(share(night, total))
                .peakRatio(share(peak, total))
                .weekendRatio(share(weekend, total))
                .build();
    }

    private static double share(double part, double total) {
        if (total <= 0.0) return 0.0;
        return Math.min(1.0, part / total);
    }

    private static double variance(Collection<Double> values) {
        if (values.size() < 2) return 0.0;
        double mean = 0.0;
        for (double v : values) mean += v;
        mean /= values.size();
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return sumSq / values.size();
    }

    private static void validateHour(int hour, String property) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("detection." + property + " must be within 0-23, got " + hour);
        }
    }
}

package com.powerguard.anomaly.seeder;

import com.powerguard.anomaly.model.Reading;
import com.powerguard.anomaly.repository.ReadingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeds Aerospike with hourly meter readings for local testing.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Generates 50 meters x 30 days of hourly readings. About 15% of meters carry an injected pattern:
 *   - theft:       consumption cut to 5-15% of the household's base (meter bypass)
 *   - night_spike: 1.5-3x base between 22:00 and 05:59
 *   - constant:    flat consumption regardless of hour (illegal connection)
 *   - extreme:     random 3-8x spikes on 30% of hours
 */
@Component
@Profile("seed")
@Order(1)
public class DataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    static final int NUM_METERS = 50;
    static final int NUM_DAYS = 30;
    static final double ANOMALY_RATE = 0.15;
    static final LocalDate START_DATE = LocalDate.of(2025, 1, 6);

    private static final double[] HOURLY_PATTERN = {
            0.3, 0.2, 0.2, 0.2, 0.2, 0.3,
            0.6, 0.8, 0.9, 0.7,
            0.5, 0.5, 0.6, 0.5, 0.4, 0.4,
            0.5, 0.7, 0.9, 1.0, 0.9, 0.8,
            0.6, 0.4
    };

    enum Pattern { NORMAL, THEFT, NIGHT_SPIKE, CONSTANT, EXTREME }

    private final ReadingRepository readingRepository;
    private final Random random = new Random(42); // fixed seed for reproducibility

    public DataSeeder(ReadingRepository readingRepository) {
        this.readingRepository = readingRepository;
    }

    @Override
    public void run(String... args) {
        log.info("=== Starting data seeding ===");

        int anomalous = (int) Math.round(NUM_METERS * ANOMALY_RATE);
        Pattern[] injected = {Pattern.THEFT, Pattern.NIGHT_SPIKE, Pattern.CONSTANT, Pattern.EXTREME};
        int total = 0;

        for (int m = 1; m <= NUM_METERS; m++) {
            String meterId = String.format("MTR-%04d", m);
            // Last meters carry the injected patterns, cycling through the types
            Pattern pattern = m > NUM_METERS - anomalous
                    ? injected[(m - 1) % injected.length]
                    : Pattern.NORMAL;
            List<Reading> readings = generateMeter(meterId, pattern);
            readingRepository.saveAll(readings);
            total += readings.size();
            if (pattern != Pattern.NORMAL) {
                log.info("Seeded {} with pattern {}", meterId, pattern);
            }
        }

        log.info("=== Seeding complete: {} meters, {} readings, {} anomalous ===", NUM_METERS, total, anomalous);
    }

    List<Reading> generateMeter(String meterId, Pattern pattern) {
        double base = uniform(1.0, 5.0);
        double weekendFactor = uniform(1.1, 1.3);
        List<Reading> readings = new ArrayList<>(NUM_DAYS * 24);

        for (int day = 0; day < NUM_DAYS; day++) {
            LocalDate date = START_DATE.plusDays(day);
            boolean weekend = date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY;
            double dayBase = weekend ? base * weekendFactor : base;

            for (int hour = 0; hour < 24; hour++) {
                double kwh = Math.max(0.0, consumption(pattern, hour, dayBase));
                readings.add(Reading.builder()
                        .meterId(meterId)
                        .timestamp(date.atTime(hour, 0))
                        .consumptionKwh(Math.round(kwh * 1000.0) / 1000.0)
                        .build());
            }
        }
        return readings;
    }

    private double consumption(Pattern pattern, int hour, double base) {
        switch (pattern) {
            case THEFT:
                return base * uniform(0.05, 0.15);
            case NIGHT_SPIKE:
                if (hour >= 22 || hour <= 5) return base * uniform(1.5, 3.0);
                return normal(hour, base);
            case CONSTANT:
                return base * uniform(0.8, 1.2);
            case EXTREME:
                if (random.nextDouble() < 0.3) return base * uniform(3.0, 8.0);
                return normal(hour, base);
            default:
                return normal(hour, base);
        }
    }

    private double normal(int hour, double base) {
        return base * HOURLY_PATTERN[hour] * uniform(0.8, 1.2);
    }

    private double uniform(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }
}

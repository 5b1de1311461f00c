package com.powerguard.anomaly.config;

import com.powerguard.anomaly.model.DetectionRun;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(DetectionRun run) {
        String model = run.getModel().getId();

        Counter.builder("detection.run.count")
                .tag("model", model)
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.run.meters_analyzed")
                .tag("model", model)
                .register(registry)
                .record(run.getMetersAnalyzed());

        DistributionSummary.builder("detection.run.suspicious")
                .tag("model", model)
                .register(registry)
                .record(run.getSuspiciousCount());

        Timer.builder("detection.run.duration")
                .tag("model", model)
                .register(registry)
                .record(Duration.between(run.getStartedAt(), run.getCompletedAt()));
    }

    public void recordRunFailed(String reason) {
        Counter.builder("detection.run.failed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordMeterSkipped() {
        Counter.builder("detection.meter.skipped")
                .register(registry)
                .increment();
    }

    public void recordWriteFailure() {
        Counter.builder("detection.result.write_failed")
                .register(registry)
                .increment();
    }
}

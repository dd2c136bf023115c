package com.ontask.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for scanning and ranking.
 */
@Service
public class OnTaskMetrics {

    private final MeterRegistry registry;

    public OnTaskMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBatch(int size, long ms) {
        Timer.builder("ontask.scan.batch.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("ontask.scan.batch.size")
                .register(registry)
                .record(size);
    }

    public void incrementReadFailures(String reason) {
        Counter.builder("ontask.scan.read.failures")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordStatusUpdate(String result) {
        Counter.builder("ontask.task.updates")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordTopTask(boolean found) {
        Counter.builder("ontask.rank.top")
                .tag("result", found ? "found" : "cleared")
                .register(registry)
                .increment();
    }
}

package com.pushit.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/** Counters for verification outcomes and queue drains. */
@Component
public class VerificationMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter drainRunCounter;
    private final Timer drainTimer;

    public VerificationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.drainRunCounter =
                Counter.builder("verification.queue.drain.runs")
                        .description("Number of verification queue drain passes")
                        .register(meterRegistry);

        this.drainTimer =
                Timer.builder("verification.queue.drain.duration")
                        .description("Time taken by one verification queue drain pass")
                        .register(meterRegistry);
    }

    /**
     * @param subject "brand" or "connection"
     * @param outcome "approved", "pending" or "rejected"
     */
    public void recordOutcome(String subject, String outcome) {
        Counter.builder("verification.outcome")
                .description("Automatic verification outcomes")
                .tag("subject", subject)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordQueueItem(String result) {
        Counter.builder("verification.queue.items")
                .description("Verification queue items by drain result")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    public Timer.Sample startDrain() {
        drainRunCounter.increment();
        return Timer.start(meterRegistry);
    }

    public void stopDrain(Timer.Sample sample) {
        sample.stop(drainTimer);
    }
}
